package com.example.crazyeights.application.projection;

import java.util.List;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.domain.game.event.GameEventType;
import com.example.crazyeights.application.port.CardCountRepositoryPort;
import com.example.crazyeights.application.port.ProjectionCheckpointRepositoryPort;

/**
 * 每局 {@code CardPlayed} 事件數 (含搶牌)
 */
public class CardCountProjection extends AbstractCounterProjection<GameId> {

	public static final String NAME = "card_count";

	public CardCountProjection(String guard, CardCountRepositoryPort store,
			ProjectionCheckpointRepositoryPort checkpoints) {
		super(NAME, guard, store, checkpoints);
	}

	@Override
	protected List<CounterOperation<GameId>> operationsFor(GameId gameId, GameEvent event) {
		if (event.getType() == GameEventType.CARD_PLAYED) {
			return List.of(CounterOperation.increment(gameId));
		}
		return List.of();
	}
}
