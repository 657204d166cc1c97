package com.example.crazyeights.application.service;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.snapshot.GameSnapshot;
import com.example.crazyeights.application.port.GameSnapshotRepositoryPort;
import com.example.crazyeights.application.shared.dto.LoadedGame;

import lombok.extern.slf4j.Slf4j;

/**
 * 快照快取 (Snapshot Cache)
 * <p>
 * 在底層儲存之上加入 Guard 判斷：Guard 與執行期設定不符的快照一律視為不存在， 讓狀態編碼升級後自動退回完整重播。 讀取失敗同樣視為不存在。
 * </p>
 */
@Slf4j
@Component
public class GameSnapshotCache {

	private final GameSnapshotRepositoryPort repository;
	private final String guard;

	public GameSnapshotCache(GameSnapshotRepositoryPort repository,
			@Value("${crazyeights.snapshot.guard:v2}") String guard) {
		this.repository = repository;
		this.guard = guard;
	}

	/**
	 * @return 相容的最新快照，沒有或 Guard 不符時為空
	 */
	public Optional<LoadedGame> tryLoad(GameId gameId) {
		Optional<GameSnapshot> latest;
		try {
			latest = repository.findLatest(gameId);
		} catch (RuntimeException e) {
			// 快照只是加速手段，讀不到就退回完整重播
			log.warn(">>> [Snapshot] 牌局 {} 快照讀取失敗，改為完整重播: {}", gameId, e.getMessage());
			return Optional.empty();
		}
		if (latest.isEmpty()) {
			return Optional.empty();
		}
		GameSnapshot snapshot = latest.get();
		if (!guard.equals(snapshot.getGuard())) {
			log.info(">>> [Snapshot] 牌局 {} 的快照 Guard 為 {}，目前為 {}，略過此快照", gameId, snapshot.getGuard(), guard);
			return Optional.empty();
		}
		return Optional.of(new LoadedGame(snapshot.getState(), snapshot.getLastEventVersion()));
	}

	public void save(GameId gameId, LoadedGame game) {
		repository.save(GameSnapshot.builder().gameId(gameId).state(game.getState())
				.lastEventVersion(game.getVersion()).guard(guard).createdAt(LocalDateTime.now()).build());
	}

	public String getGuard() {
		return guard;
	}
}
