package com.example.crazyeights.application.domain.game.state;

/**
 * 尚未開局
 */
public final class NotStarted implements GameState {

	public static final NotStarted INSTANCE = new NotStarted();

	private NotStarted() {
	}

	@Override
	public boolean isStarted() {
		return false;
	}

	@Override
	public String toString() {
		return "NotStarted";
	}
}
