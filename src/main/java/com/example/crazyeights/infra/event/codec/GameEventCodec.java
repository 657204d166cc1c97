package com.example.crazyeights.infra.event.codec;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;
import com.example.crazyeights.application.domain.game.aggregate.vo.Players;
import com.example.crazyeights.application.domain.game.event.CardPlayed;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.domain.game.event.GameEventType;
import com.example.crazyeights.application.domain.game.event.GameStarted;
import com.example.crazyeights.application.domain.game.event.InterruptMissed;
import com.example.crazyeights.application.domain.game.event.PlayedCardEvent;
import com.example.crazyeights.application.domain.game.event.WrongCardPlayed;
import com.example.crazyeights.application.domain.game.event.WrongPlayerPlayed;
import com.example.crazyeights.infra.event.payload.GameStartedPayload;
import com.example.crazyeights.infra.event.payload.PlayedCardPayload;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 牌局事件編解碼器
 * <p>
 * 型別標籤即事件名稱 ({@link GameEventType#getTag()})，Payload 為 JSON， 牌面與效果以文字記號表示。
 * </p>
 * <p>
 * 解碼採「容錯」策略：未知的型別標籤或損毀的 Payload 一律解碼為空清單並記錄日誌，從不拋出例外， 讓重播與投影可以略過無法辨識的紀錄繼續前進。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameEventCodec {

	private final EventJsonCodec<GameStartedPayload> gameStartedCodec;
	private final EventJsonCodec<PlayedCardPayload> playedCardCodec;

	public String typeOf(GameEvent event) {
		return event.getType().getTag();
	}

	/**
	 * @throws IllegalStateException 序列化失敗
	 */
	public byte[] encode(GameEvent event) {
		if (event.getType() == GameEventType.GAME_STARTED) {
			GameStarted started = (GameStarted) event;
			return gameStartedCodec.serialize(new GameStartedPayload(started.getPlayers().getCount(),
					started.getFirstCard().toNotation(), started.getEffect().toNotation()));
		}
		PlayedCardEvent played = (PlayedCardEvent) event;
		return playedCardCodec.serialize(new PlayedCardPayload(played.getPlayer().getValue(),
				played.getCard().toNotation(), played.getEffect().toNotation()));
	}

	/**
	 * @param eventType 型別標籤
	 * @param data      JSON Payload
	 * @return 零或一個事件
	 */
	public List<GameEvent> decode(String eventType, byte[] data) {
		Optional<GameEventType> type = GameEventType.fromTag(eventType);
		if (type.isEmpty()) {
			log.debug(">>> [Codec] 略過無法辨識的事件型別: {}", eventType);
			return List.of();
		}
		try {
			return List.of(decode(type.get(), data));
		} catch (RuntimeException e) {
			log.warn(">>> [Codec] {} 事件 Payload 無法解碼，已略過: {}", eventType, e.getMessage());
			return List.of();
		}
	}

	private GameEvent decode(GameEventType type, byte[] data) {
		if (type == GameEventType.GAME_STARTED) {
			GameStartedPayload payload = gameStartedCodec.deserialize(data);
			return new GameStarted(Players.of(required(payload.getPlayers(), "Players")),
					Card.parse(required(payload.getFirstCard(), "FirstCard")),
					Effect.parse(required(payload.getEffect(), "Effect")));
		}
		PlayedCardPayload payload = playedCardCodec.deserialize(data);
		PlayerId player = PlayerId.of(required(payload.getPlayer(), "Player"));
		Card card = Card.parse(required(payload.getCard(), "Card"));
		Effect effect = Effect.parse(required(payload.getEffect(), "Effect"));
		return switch (type) {
		case CARD_PLAYED -> new CardPlayed(player, card, effect);
		case WRONG_CARD_PLAYED -> new WrongCardPlayed(player, card, effect);
		case WRONG_PLAYER_PLAYED -> new WrongPlayerPlayed(player, card, effect);
		case INTERRUPT_MISSED -> new InterruptMissed(player, card, effect);
		case GAME_STARTED -> throw new IllegalStateException("unreachable");
		};
	}

	private static <V> V required(V value, String field) {
		if (value == null) {
			throw new IllegalArgumentException("Missing field " + field);
		}
		return value;
	}
}
