package com.example.crazyeights.infra.adapter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.port.CardCountRepositoryPort;

import lombok.RequiredArgsConstructor;

/**
 * {@code card_count} 讀取模型
 * <p>
 * 先 UPDATE，影響 0 筆時再 INSERT，同一段 SQL 可同時在 MySQL 與 H2 上執行。 呼叫端保證單一寫入者。
 * </p>
 */
@Repository
@RequiredArgsConstructor
public class JdbcCardCountRepositoryAdapter implements CardCountRepositoryPort {

	private final JdbcTemplate jdbcTemplate;

	@Override
	public void increment(GameId key) {
		int updated = jdbcTemplate.update("UPDATE card_count SET played_cards = played_cards + 1 WHERE game_id = ?",
				key.getValue());
		if (updated == 0) {
			jdbcTemplate.update("INSERT INTO card_count (game_id, played_cards) VALUES (?, 1)", key.getValue());
		}
	}

	@Override
	public void reset(GameId key) {
		int updated = jdbcTemplate.update("UPDATE card_count SET played_cards = 0 WHERE game_id = ?", key.getValue());
		if (updated == 0) {
			jdbcTemplate.update("INSERT INTO card_count (game_id, played_cards) VALUES (?, 0)", key.getValue());
		}
	}

	@Override
	public Map<GameId, Integer> loadAll() {
		Map<GameId, Integer> counts = new HashMap<>();
		jdbcTemplate.query("SELECT game_id, played_cards FROM card_count",
				rs -> {
					counts.put(GameId.of(rs.getInt("game_id")), rs.getInt("played_cards"));
				});
		return counts;
	}

	@Override
	public void replaceAll(Map<GameId, Integer> counts) {
		jdbcTemplate.update("DELETE FROM card_count");
		List<Object[]> rows = new ArrayList<>();
		counts.forEach((gameId, count) -> rows.add(new Object[] { gameId.getValue(), count }));
		if (!rows.isEmpty()) {
			jdbcTemplate.batchUpdate("INSERT INTO card_count (game_id, played_cards) VALUES (?, ?)", rows);
		}
	}

	@Override
	public Optional<Integer> findCount(GameId gameId) {
		try {
			return Optional.ofNullable(jdbcTemplate.queryForObject(
					"SELECT played_cards FROM card_count WHERE game_id = ?", Integer.class, gameId.getValue()));
		} catch (EmptyResultDataAccessException e) {
			return Optional.empty();
		}
	}
}
