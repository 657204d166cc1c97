package com.example.crazyeights.infra.adapter;

import static com.example.crazyeights.support.GameFixtures.card;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.aggregate.vo.Pile;
import com.example.crazyeights.application.domain.game.aggregate.vo.Players;
import com.example.crazyeights.application.domain.game.aggregate.vo.Table;
import com.example.crazyeights.application.domain.game.snapshot.GameSnapshot;
import com.example.crazyeights.application.domain.game.state.Started;
import com.example.crazyeights.infra.event.codec.EventJsonCodec;
import com.example.crazyeights.infra.event.codec.GameStateCodec;
import com.example.crazyeights.infra.event.payload.GameStatePayload;
import com.example.crazyeights.support.H2TestDatabase;

import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.json.JsonMapper;

/**
 * <h1>牌局快照 JDBC 轉接器測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 驗證快照的存取、最新檢索以及舊快照清理功能。
 * <b>Given</b> 一個特定的牌局 ID。
 * <b>When</b>  存入多個不同版本的快照。
 * <b>Then</b>  findLatest 應能回傳版本最大的那一份。
 * <b>And</b>   每次寫入後，資料庫僅保留最新的兩筆。
 * </pre>
 */
@Slf4j
class JdbcGameSnapshotAdapterTest {

	private final GameId gameId = GameId.of(42);

	private H2TestDatabase db;
	private JdbcGameSnapshotAdapter adapter;

	@BeforeEach
	void setUp() {
		db = new H2TestDatabase();
		GameStateCodec codec = new GameStateCodec(
				new EventJsonCodec<>(JsonMapper.builder().build(), GameStatePayload.class));
		adapter = new JdbcGameSnapshotAdapter(db.getJdbcTemplate(), codec);
	}

	@Test
	@DisplayName("驗證快照生命週期：存儲、檢索最新、以及舊快照清理")
	void snapshotLifecycleAndCleanup() {
		log.info(">>> [Given] 準備三份不同版本的快照 (Version: 1, 5, 9)");
		save(1, "6C");
		save(5, "8D");
		save(9, "KH");

		log.info(">>> [When] 檢索最新快照");
		Optional<GameSnapshot> latest = adapter.findLatest(gameId);

		assertThat(latest).hasValueSatisfying(s -> {
			assertThat(s.getLastEventVersion()).isEqualTo(9);
			assertThat(s.getGuard()).isEqualTo("v2");
			assertThat(((Started) s.getState()).getPile().getTopCard()).isEqualTo(card("KH"));
		});
		List<Long> remaining = db.getJdbcTemplate().queryForList(
				"SELECT last_event_version FROM game_snapshots WHERE game_id = ? ORDER BY last_event_version",
				Long.class, gameId.getValue());
		assertThat(remaining).containsExactly(5L, 9L);
	}

	@Test
	@DisplayName("清理只影響同一牌局")
	void cleanupIsPerGame() {
		save(1, "6C");
		save(2, "6H");
		adapter.save(GameSnapshot.builder().gameId(GameId.of(7)).state(state("2S")).lastEventVersion(0).guard("v2")
				.createdAt(LocalDateTime.now()).build());
		save(3, "9H");

		assertThat(db.count("game_snapshots")).isEqualTo(3);
		assertThat(adapter.findLatest(GameId.of(7))).isPresent();
	}

	@Test
	@DisplayName("沒有快照時回傳空值")
	void noSnapshot() {
		assertThat(adapter.findLatest(gameId)).isEmpty();
	}

	private void save(long version, String topCard) {
		adapter.save(GameSnapshot.builder().gameId(gameId).state(state(topCard)).lastEventVersion(version).guard("v2")
				.createdAt(LocalDateTime.now()).build());
	}

	private static Started state(String topCard) {
		return new Started(Pile.start(card(topCard)), Table.start(Players.of(3)));
	}
}
