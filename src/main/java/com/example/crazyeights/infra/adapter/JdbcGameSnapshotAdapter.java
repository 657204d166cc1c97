package com.example.crazyeights.infra.adapter;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.snapshot.GameSnapshot;
import com.example.crazyeights.application.port.GameSnapshotRepositoryPort;
import com.example.crazyeights.application.shared.exception.GameStorageException;
import com.example.crazyeights.infra.event.codec.GameStateCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 快照存於關聯式資料庫 {@code game_snapshots}
 * <p>
 * 每次寫入新增一筆，並只保留最新的 {@link #RETAIN_COUNT} 筆以節省空間。
 * </p>
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "crazyeights.snapshot.store", havingValue = "jdbc")
public class JdbcGameSnapshotAdapter implements GameSnapshotRepositoryPort {

	static final int RETAIN_COUNT = 2;

	private final JdbcTemplate jdbcTemplate;
	private final GameStateCodec stateCodec;

	@Override
	public void save(GameSnapshot snapshot) {
		String sql = """
				INSERT INTO game_snapshots (game_id, last_event_version, guard, state_json, created_at)
				VALUES (?, ?, ?, ?, ?)
				""";
		int gameId = snapshot.getGameId().getValue();
		try {
			jdbcTemplate.update(sql, gameId, snapshot.getLastEventVersion(), snapshot.getGuard(),
					stateCodec.encodeAsString(snapshot.getState()), Timestamp.valueOf(snapshot.getCreatedAt()));
			deleteOlderSnapshots(gameId);
			log.debug(">>> [Snapshot] 快照已存入資料庫: Game={}, Version={}", gameId, snapshot.getLastEventVersion());
		} catch (DataAccessException e) {
			throw new GameStorageException("Snapshot write for game " + gameId + " failed", e);
		}
	}

	@Override
	public Optional<GameSnapshot> findLatest(GameId gameId) {
		String sql = """
				SELECT game_id, last_event_version, guard, state_json, created_at FROM game_snapshots
				WHERE game_id = ?
				ORDER BY last_event_version DESC
				LIMIT 1
				""";
		try {
			GameSnapshot snapshot = jdbcTemplate.<GameSnapshot>queryForObject(sql, (rs, rowNum) -> {
				try {
					return GameSnapshot.builder().gameId(GameId.of(rs.getInt("game_id")))
							.lastEventVersion(rs.getLong("last_event_version")).guard(rs.getString("guard"))
							.state(stateCodec.decode(rs.getString("state_json")))
							.createdAt(rs.getTimestamp("created_at").toLocalDateTime()).build();
				} catch (RuntimeException e) {
					throw new SQLException("快照反序列化錯誤", e);
				}
			}, gameId.getValue());
			return Optional.ofNullable(snapshot);
		} catch (EmptyResultDataAccessException e) {
			return Optional.empty();
		} catch (DataAccessException e) {
			throw new GameStorageException("Snapshot read for game " + gameId + " failed", e);
		}
	}

	private void deleteOlderSnapshots(int gameId) {
		List<Long> versions = jdbcTemplate.queryForList(
				"SELECT last_event_version FROM game_snapshots WHERE game_id = ? ORDER BY last_event_version DESC",
				Long.class, gameId);
		if (versions.size() <= RETAIN_COUNT) {
			return;
		}
		long oldestKept = versions.get(RETAIN_COUNT - 1);
		int deleted = jdbcTemplate.update("DELETE FROM game_snapshots WHERE game_id = ? AND last_event_version < ?",
				gameId, oldestKept);
		log.debug(">>> [Snapshot] 牌局 {} 清除 {} 筆舊快照", gameId, deleted);
	}
}
