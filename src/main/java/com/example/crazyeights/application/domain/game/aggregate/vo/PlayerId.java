package com.example.crazyeights.application.domain.game.aggregate.vo;

import lombok.Value;

/**
 * 玩家編號 (座位序號，從 0 開始)
 */
@Value(staticConstructor = "of")
public class PlayerId {

	int value;

	@Override
	public String toString() {
		return String.valueOf(value);
	}
}
