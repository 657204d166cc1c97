package com.example.crazyeights.application.domain.game.exception;

/**
 * 開局人數不足
 */
public class TooFewPlayersException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public TooFewPlayersException(int count) {
		super("Invalid player count " + count + ", at least 2 players are required");
	}
}
