package com.example.crazyeights.application.domain.game.state;

/**
 * 牌局狀態 (封閉集合)：{@link NotStarted} 或 {@link Started}。
 */
public sealed interface GameState permits NotStarted, Started {

	/**
	 * 唯一的初始狀態
	 */
	static GameState initial() {
		return NotStarted.INSTANCE;
	}

	boolean isStarted();
}
