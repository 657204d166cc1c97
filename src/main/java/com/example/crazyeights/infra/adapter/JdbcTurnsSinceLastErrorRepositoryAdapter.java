package com.example.crazyeights.infra.adapter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;
import com.example.crazyeights.application.port.TurnsSinceLastErrorRepositoryPort;
import com.example.crazyeights.application.projection.GamePlayerKey;

import lombok.RequiredArgsConstructor;

/**
 * {@code turns_since_last_error} 讀取模型，主鍵 (game_id, player_id)
 */
@Repository
@RequiredArgsConstructor
public class JdbcTurnsSinceLastErrorRepositoryAdapter implements TurnsSinceLastErrorRepositoryPort {

	private final JdbcTemplate jdbcTemplate;

	@Override
	public void increment(GamePlayerKey key) {
		int updated = jdbcTemplate.update(
				"UPDATE turns_since_last_error SET turns = turns + 1 WHERE game_id = ? AND player_id = ?",
				key.getGameId().getValue(), key.getPlayer().getValue());
		if (updated == 0) {
			insert(key, 1);
		}
	}

	@Override
	public void reset(GamePlayerKey key) {
		int updated = jdbcTemplate.update("UPDATE turns_since_last_error SET turns = 0 WHERE game_id = ? AND player_id = ?",
				key.getGameId().getValue(), key.getPlayer().getValue());
		if (updated == 0) {
			insert(key, 0);
		}
	}

	@Override
	public Map<GamePlayerKey, Integer> loadAll() {
		Map<GamePlayerKey, Integer> counts = new HashMap<>();
		jdbcTemplate.query("SELECT game_id, player_id, turns FROM turns_since_last_error", rs -> {
			counts.put(GamePlayerKey.of(GameId.of(rs.getInt("game_id")), PlayerId.of(rs.getInt("player_id"))),
					rs.getInt("turns"));
		});
		return counts;
	}

	@Override
	public void replaceAll(Map<GamePlayerKey, Integer> counts) {
		jdbcTemplate.update("DELETE FROM turns_since_last_error");
		List<Object[]> rows = new ArrayList<>();
		counts.forEach((key, turns) -> rows
				.add(new Object[] { key.getGameId().getValue(), key.getPlayer().getValue(), turns }));
		if (!rows.isEmpty()) {
			jdbcTemplate.batchUpdate("INSERT INTO turns_since_last_error (game_id, player_id, turns) VALUES (?, ?, ?)",
					rows);
		}
	}

	@Override
	public Map<PlayerId, Integer> findByGame(GameId gameId) {
		Map<PlayerId, Integer> turns = new TreeMap<>((a, b) -> Integer.compare(a.getValue(), b.getValue()));
		jdbcTemplate.query("SELECT player_id, turns FROM turns_since_last_error WHERE game_id = ? ORDER BY player_id",
				rs -> {
					turns.put(PlayerId.of(rs.getInt("player_id")), rs.getInt("turns"));
				}, gameId.getValue());
		return turns;
	}

	private void insert(GamePlayerKey key, int turns) {
		jdbcTemplate.update("INSERT INTO turns_since_last_error (game_id, player_id, turns) VALUES (?, ?, ?)",
				key.getGameId().getValue(), key.getPlayer().getValue(), turns);
	}
}
