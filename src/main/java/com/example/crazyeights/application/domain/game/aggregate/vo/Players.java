package com.example.crazyeights.application.domain.game.aggregate.vo;

import com.example.crazyeights.application.domain.game.exception.TooFewPlayersException;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 牌局人數，至少兩人。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Players {

	public static final int MINIMUM = 2;

	int count;

	/**
	 * @throws TooFewPlayersException 人數少於 {@link #MINIMUM}
	 */
	public static Players of(int count) {
		if (count < MINIMUM) {
			throw new TooFewPlayersException(count);
		}
		return new Players(count);
	}
}
