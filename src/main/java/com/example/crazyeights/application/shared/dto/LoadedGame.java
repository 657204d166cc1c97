package com.example.crazyeights.application.shared.dto;

import com.example.crazyeights.application.domain.game.state.GameState;

import lombok.Value;

/**
 * 已重建的牌局狀態與其對應的 Stream 版本 (作為追加時的預期版本)。
 */
@Value
public class LoadedGame {

	/**
	 * Stream 尚不存在時的版本
	 */
	public static final long NO_STREAM = -1L;

	GameState state;

	long version;

	public static LoadedGame initial() {
		return new LoadedGame(GameState.initial(), NO_STREAM);
	}
}
