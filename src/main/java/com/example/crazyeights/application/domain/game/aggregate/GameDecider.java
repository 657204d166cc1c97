package com.example.crazyeights.application.domain.game.aggregate;

import java.util.List;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;
import com.example.crazyeights.application.domain.game.command.GameCommand;
import com.example.crazyeights.application.domain.game.command.PlayCard;
import com.example.crazyeights.application.domain.game.command.StartGame;
import com.example.crazyeights.application.domain.game.event.CardPlayed;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.domain.game.event.GameStarted;
import com.example.crazyeights.application.domain.game.event.InterruptMissed;
import com.example.crazyeights.application.domain.game.event.WrongCardPlayed;
import com.example.crazyeights.application.domain.game.event.WrongPlayerPlayed;
import com.example.crazyeights.application.domain.game.exception.GameDecisionException;
import com.example.crazyeights.application.domain.game.state.GameState;
import com.example.crazyeights.application.domain.game.state.Started;

/**
 * <h1>牌局決策器 (Decider)</h1>
 * <p>
 * <b>職責：</b> 純函數 {@code (state, command) -> events}，不做任何 I/O。 每個被接受的指令恰好產生一個事件。
 * </p>
 *
 * <h2>出牌判定順序 (先符合者勝出)：</h2>
 * <ol>
 * <li>與頂牌完全相同 (點數與花色)：搶牌，{@link CardPlayed} 效果為 Interrupt。</li>
 * <li>不是目前玩家：若與第二張牌相同為 {@link InterruptMissed}，否則 {@link WrongPlayerPlayed}。</li>
 * <li>點數與花色皆不符：{@link WrongCardPlayed}。</li>
 * <li>其餘：合法出牌 {@link CardPlayed}。</li>
 * </ol>
 * 第 2 到 4 種的效果都由打出的牌點數決定。
 */
public final class GameDecider {

	private GameDecider() {
	}

	/**
	 * @param state   目前狀態
	 * @param command 外部指令
	 * @return 恰好一個事件
	 * @throws GameDecisionException 已開局又開局，或未開局就出牌
	 */
	public static List<GameEvent> decide(GameState state, GameCommand command) {
		return switch (command.getType()) {
		case START_GAME -> decideStart(state, (StartGame) command);
		case PLAY_CARD -> decidePlay(state, (PlayCard) command);
		};
	}

	private static List<GameEvent> decideStart(GameState state, StartGame command) {
		if (state.isStarted()) {
			throw GameDecisionException.alreadyStarted();
		}
		Card first = command.getFirstCard();
		return List.of(new GameStarted(command.getPlayers(), first, Effect.of(first)));
	}

	private static List<GameEvent> decidePlay(GameState state, PlayCard command) {
		if (!state.isStarted()) {
			throw GameDecisionException.notYetStarted();
		}
		Started started = (Started) state;
		Card top = started.getPile().getTopCard();
		Card card = command.getCard();

		if (card.equals(top)) {
			return List.of(new CardPlayed(command.getPlayer(), card, Effect.INTERRUPT));
		}
		if (!started.getTable().getPlayer().equals(command.getPlayer())) {
			boolean missedInterrupt = started.getPile().getSecondCard().map(card::equals).orElse(false);
			return missedInterrupt ? List.of(new InterruptMissed(command.getPlayer(), card, Effect.of(card)))
					: List.of(new WrongPlayerPlayed(command.getPlayer(), card, Effect.of(card)));
		}
		if (!card.matches(top)) {
			return List.of(new WrongCardPlayed(command.getPlayer(), card, Effect.of(card)));
		}
		return List.of(new CardPlayed(command.getPlayer(), card, Effect.of(card)));
	}
}
