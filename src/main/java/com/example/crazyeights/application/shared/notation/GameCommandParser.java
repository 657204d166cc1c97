package com.example.crazyeights.application.shared.notation;

import java.util.ArrayList;
import java.util.List;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;
import com.example.crazyeights.application.domain.game.aggregate.vo.Players;
import com.example.crazyeights.application.domain.game.command.GameCommand;
import com.example.crazyeights.application.domain.game.command.PlayCard;
import com.example.crazyeights.application.domain.game.command.StartGame;
import com.example.crazyeights.application.domain.game.exception.TooFewPlayersException;
import com.example.crazyeights.application.shared.exception.InvalidCommandException;

/**
 * 文字指令解析器
 *
 * <pre>
 * start &lt;players&gt; &lt;firstCard&gt;   開局
 * p &lt;player&gt; &lt;card&gt;              出牌
 * </pre>
 * <p>
 * 格式錯誤一律拋出 {@link InvalidCommandException}，同一指令中的多個錯誤以 {@code ", "} 串接。
 * </p>
 */
public final class GameCommandParser {

	private GameCommandParser() {
	}

	public static GameCommand parse(String text) {
		String[] args = text == null ? new String[0] : text.trim().split("\\s+");
		if (args.length != 3) {
			throw new InvalidCommandException("Unknown command");
		}
		List<String> errors = new ArrayList<>();
		switch (args[0]) {
		case "start" -> {
			Players players = parsePlayers(args[1], errors);
			Card card = parseCard(args[2], errors);
			failOnErrors(errors);
			return new StartGame(players, card);
		}
		case "p" -> {
			PlayerId player = parsePlayer(args[1], errors);
			Card card = parseCard(args[2], errors);
			failOnErrors(errors);
			return new PlayCard(player, card);
		}
		default -> throw new InvalidCommandException("Unknown command");
		}
	}

	/**
	 * 指令轉回文字，與 {@link #parse(String)} 互為反函數
	 */
	public static String format(GameCommand command) {
		return switch (command.getType()) {
		case START_GAME -> {
			StartGame start = (StartGame) command;
			yield "start " + start.getPlayers().getCount() + " " + start.getFirstCard().toNotation();
		}
		case PLAY_CARD -> {
			PlayCard play = (PlayCard) command;
			yield "p " + play.getPlayer().getValue() + " " + play.getCard().toNotation();
		}
		};
	}

	/**
	 * 解析單張牌，供 REST 請求欄位使用
	 */
	public static Card parseCard(String notation) {
		List<String> errors = new ArrayList<>();
		Card card = parseCard(notation, errors);
		failOnErrors(errors);
		return card;
	}

	private static Players parsePlayers(String text, List<String> errors) {
		try {
			return Players.of(Integer.parseInt(text));
		} catch (TooFewPlayersException e) {
			errors.add("Invalid player count");
		} catch (NumberFormatException e) {
			errors.add("Players should be an int");
		}
		return null;
	}

	private static PlayerId parsePlayer(String text, List<String> errors) {
		try {
			return PlayerId.of(Integer.parseInt(text));
		} catch (NumberFormatException e) {
			errors.add("Player should be an int");
			return null;
		}
	}

	private static Card parseCard(String text, List<String> errors) {
		try {
			return Card.parse(text);
		} catch (IllegalArgumentException e) {
			errors.add(e.getMessage());
			return null;
		}
	}

	private static void failOnErrors(List<String> errors) {
		if (!errors.isEmpty()) {
			throw new InvalidCommandException(String.join(", ", errors));
		}
	}
}
