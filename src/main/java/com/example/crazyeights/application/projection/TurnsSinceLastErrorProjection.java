package com.example.crazyeights.application.projection;

import java.util.List;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.domain.game.event.PlayedCardEvent;
import com.example.crazyeights.application.port.ProjectionCheckpointRepositoryPort;
import com.example.crazyeights.application.port.TurnsSinceLastErrorRepositoryPort;

/**
 * 每位玩家距離上次犯規的回合數
 * <p>
 * {@code CardPlayed} 加一；{@code WrongCardPlayed} 與 {@code WrongPlayerPlayed} 歸零；錯過搶牌不計。
 * </p>
 */
public class TurnsSinceLastErrorProjection extends AbstractCounterProjection<GamePlayerKey> {

	public static final String NAME = "turns_since_last_error";

	public TurnsSinceLastErrorProjection(String guard, TurnsSinceLastErrorRepositoryPort store,
			ProjectionCheckpointRepositoryPort checkpoints) {
		super(NAME, guard, store, checkpoints);
	}

	@Override
	protected List<CounterOperation<GamePlayerKey>> operationsFor(GameId gameId, GameEvent event) {
		return switch (event.getType()) {
		case CARD_PLAYED -> List.of(CounterOperation.increment(keyOf(gameId, event)));
		case WRONG_CARD_PLAYED, WRONG_PLAYER_PLAYED -> List.of(CounterOperation.reset(keyOf(gameId, event)));
		case GAME_STARTED, INTERRUPT_MISSED -> List.of();
		};
	}

	private static GamePlayerKey keyOf(GameId gameId, GameEvent event) {
		return GamePlayerKey.of(gameId, ((PlayedCardEvent) event).getPlayer());
	}
}
