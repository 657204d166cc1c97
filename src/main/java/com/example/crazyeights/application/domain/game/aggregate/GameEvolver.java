package com.example.crazyeights.application.domain.game.aggregate;

import java.util.List;

import com.example.crazyeights.application.domain.game.aggregate.vo.Pile;
import com.example.crazyeights.application.domain.game.aggregate.vo.Table;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.domain.game.event.GameStarted;
import com.example.crazyeights.application.domain.game.event.PlayedCardEvent;
import com.example.crazyeights.application.domain.game.state.GameState;
import com.example.crazyeights.application.domain.game.state.Started;

/**
 * 牌局演進函數 (Evolver)
 * <p>
 * {@code (state, event) -> state}，完全無副作用。 不適用的 (狀態, 事件) 組合直接回傳原狀態，重播時遇到也不會中斷。
 * </p>
 */
public final class GameEvolver {

	private GameEvolver() {
	}

	public static GameState evolve(GameState state, GameEvent event) {
		return switch (event.getType()) {
		case GAME_STARTED -> state.isStarted() ? state : start((GameStarted) event);
		case CARD_PLAYED, WRONG_CARD_PLAYED, WRONG_PLAYER_PLAYED, INTERRUPT_MISSED ->
			state.isStarted() ? play((Started) state, (PlayedCardEvent) event) : state;
		};
	}

	/**
	 * 依序套用多個事件
	 */
	public static GameState fold(GameState state, List<? extends GameEvent> events) {
		GameState current = state;
		for (GameEvent event : events) {
			current = evolve(current, event);
		}
		return current;
	}

	private static Started start(GameStarted event) {
		return new Started(Pile.start(event.getFirstCard()), Table.start(event.getPlayers()).advance(event.getEffect()));
	}

	private static Started play(Started state, PlayedCardEvent event) {
		return new Started(state.getPile().put(event.getCard()), state.getTable().advance(event.getEffect()));
	}
}
