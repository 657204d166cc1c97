package com.example.crazyeights.support;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.snapshot.GameSnapshot;
import com.example.crazyeights.application.port.GameSnapshotRepositoryPort;
import com.example.crazyeights.application.shared.exception.GameStorageException;

/**
 * 測試用的記憶體快照儲存，可切換為失敗模式
 */
public class InMemoryGameSnapshotRepository implements GameSnapshotRepositoryPort {

	private final Map<GameId, GameSnapshot> latest = new HashMap<>();
	private final List<GameSnapshot> saved = new ArrayList<>();
	private boolean failing;

	@Override
	public synchronized void save(GameSnapshot snapshot) {
		if (failing) {
			throw new GameStorageException("snapshot store down", null);
		}
		saved.add(snapshot);
		latest.put(snapshot.getGameId(), snapshot);
	}

	@Override
	public synchronized Optional<GameSnapshot> findLatest(GameId gameId) {
		if (failing) {
			throw new GameStorageException("snapshot store down", null);
		}
		return Optional.ofNullable(latest.get(gameId));
	}

	public synchronized void setFailing(boolean failing) {
		this.failing = failing;
	}

	public synchronized List<GameSnapshot> getSaved() {
		return List.copyOf(saved);
	}
}
