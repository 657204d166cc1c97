package com.example.crazyeights.application.domain.game.aggregate.vo;

/**
 * 出牌方向
 */
public enum Direction {
	CLOCKWISE, COUNTER_CLOCKWISE;

	public Direction flip() {
		return this == CLOCKWISE ? COUNTER_CLOCKWISE : CLOCKWISE;
	}
}
