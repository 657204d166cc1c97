package com.example.crazyeights.application.port;

import java.util.Optional;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.snapshot.GameSnapshot;

/**
 * 牌局快照儲存埠 (Game Snapshot Repository Port)
 * <p>
 * 負責快照的持久化與檢索，不判斷 Guard 是否相容。
 * </p>
 */
public interface GameSnapshotRepositoryPort {

	/**
	 * 儲存一個新的快照
	 *
	 * @param snapshot 牌局快照
	 */
	void save(GameSnapshot snapshot);

	/**
	 * 取得該牌局最新的快照
	 *
	 * @param gameId 牌局識別碼
	 * @return 最新的快照，若無快照則回傳 Optional.empty()
	 */
	Optional<GameSnapshot> findLatest(GameId gameId);
}
