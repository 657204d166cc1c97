package com.example.crazyeights.application.service;

import static com.example.crazyeights.support.GameFixtures.card;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.aggregate.vo.Pile;
import com.example.crazyeights.application.domain.game.aggregate.vo.Players;
import com.example.crazyeights.application.domain.game.aggregate.vo.Table;
import com.example.crazyeights.application.domain.game.snapshot.GameSnapshot;
import com.example.crazyeights.application.domain.game.state.Started;
import com.example.crazyeights.application.shared.dto.LoadedGame;
import com.example.crazyeights.support.InMemoryGameSnapshotRepository;

class GameSnapshotCacheTest {

	private final GameId gameId = GameId.of(7);
	private final Started state = new Started(Pile.start(card("6C")), Table.start(Players.of(3)));
	private final InMemoryGameSnapshotRepository repository = new InMemoryGameSnapshotRepository();

	@Test
	@DisplayName("寫入時帶上目前的 Guard，讀回相同狀態與版本")
	void savesWithRuntimeGuard() {
		GameSnapshotCache cache = new GameSnapshotCache(repository, "v2");

		cache.save(gameId, new LoadedGame(state, 4));

		assertThat(repository.getSaved()).singleElement().satisfies(s -> {
			assertThat(s.getGuard()).isEqualTo("v2");
			assertThat(s.getLastEventVersion()).isEqualTo(4);
		});
		assertThat(cache.tryLoad(gameId)).contains(new LoadedGame(state, 4));
	}

	@Test
	@DisplayName("Guard 不符的快照一律視為不存在")
	void guardMismatchIsAbsent() {
		repository.save(GameSnapshot.builder().gameId(gameId).state(state).lastEventVersion(9).guard("v1")
				.createdAt(LocalDateTime.now()).build());

		assertThat(new GameSnapshotCache(repository, "v2").tryLoad(gameId)).isEmpty();
		assertThat(new GameSnapshotCache(repository, "v1").tryLoad(gameId)).isPresent();
	}

	@Test
	@DisplayName("快照儲存無法讀取時視為不存在")
	void readFailureIsAbsent() {
		GameSnapshotCache cache = new GameSnapshotCache(repository, "v2");
		cache.save(gameId, new LoadedGame(state, 1));
		repository.setFailing(true);

		assertThat(cache.tryLoad(gameId)).isEmpty();
	}
}
