package com.example.crazyeights.application.shared.notation;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.domain.game.event.GameStarted;
import com.example.crazyeights.application.domain.game.event.PlayedCardEvent;

/**
 * 事件轉為可讀文字，用於日誌輸出
 */
public final class GameEventPrinter {

	private GameEventPrinter() {
	}

	public static String print(GameEvent event) {
		return switch (event.getType()) {
		case GAME_STARTED -> {
			GameStarted started = (GameStarted) event;
			yield String.format("%d Players game started with a %s", started.getPlayers().getCount(),
					printCard(started.getFirstCard()));
		}
		case CARD_PLAYED -> {
			PlayedCardEvent played = (PlayedCardEvent) event;
			yield String.format("Player %d %s a %s%s", played.getPlayer().getValue(), verb(played.getEffect()),
					printCard(played.getCard()), printEffect(played.getEffect()));
		}
		case WRONG_CARD_PLAYED -> String.format(
				"Player %d tried to play a %s, but it was neither same rank nor same suit. Penalty!",
				player(event), printCard(((PlayedCardEvent) event).getCard()));
		case WRONG_PLAYER_PLAYED -> String.format("Player %d tried to play a %s, but it was not their turn. Penalty!",
				player(event), printCard(((PlayedCardEvent) event).getCard()));
		case INTERRUPT_MISSED -> String.format("Player %d tried to play a %s, but it was not their turn", player(event),
				printCard(((PlayedCardEvent) event).getCard()));
		};
	}

	/**
	 * 點數記號 + 花色符號，例如 {@code 10♠}
	 */
	public static String printCard(Card card) {
		return card.getRank().getNotation() + card.getSuit().getSymbol();
	}

	private static int player(GameEvent event) {
		return ((PlayedCardEvent) event).getPlayer().getValue();
	}

	private static String verb(Effect effect) {
		return switch (effect.getType()) {
		case INTERRUPT, BREAKING_INTERRUPT -> "interrupted with";
		default -> "played";
		};
	}

	private static String printEffect(Effect effect) {
		return switch (effect.getType()) {
		case NEXT -> ".";
		case SKIP -> ". Skip next player!";
		case BACK -> ". Kickback!";
		case INTERRUPT -> ". Game continues as if nothing happened.";
		case BREAKING_INTERRUPT -> ". Game now resumes after player " + effect.getResumeAfter().getValue();
		};
	}
}
