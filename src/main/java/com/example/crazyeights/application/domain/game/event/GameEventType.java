package com.example.crazyeights.application.domain.game.event;

import java.util.Optional;

/**
 * 事件類型與其在 EventStoreDB 中的型別標籤 (event type)。
 * <p>
 * 標籤一經寫入即不可更改，否則歷史事件將無法解碼。
 * </p>
 */
public enum GameEventType {
	GAME_STARTED("GameStarted"), //
	CARD_PLAYED("CardPlayed"), //
	WRONG_CARD_PLAYED("WrongCardPlayed"), //
	WRONG_PLAYER_PLAYED("WrongPlayerPlayed"), //
	INTERRUPT_MISSED("InterruptMissed");

	private final String tag;

	GameEventType(String tag) {
		this.tag = tag;
	}

	public String getTag() {
		return tag;
	}

	public static Optional<GameEventType> fromTag(String tag) {
		for (GameEventType type : values()) {
			if (type.tag.equals(tag)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
