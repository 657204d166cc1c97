package com.example.crazyeights.application.shared.exception;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;

import lombok.Getter;

/**
 * 重試次數用盡仍發生版本衝突，交由呼叫端回報使用者。
 */
@Getter
public class GameConcurrencyException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient GameId gameId;

	private final int attempts;

	public GameConcurrencyException(GameId gameId, int attempts, Throwable cause) {
		super("Concurrent modification of game " + gameId + " after " + attempts + " attempts", cause);
		this.gameId = gameId;
		this.attempts = attempts;
	}
}
