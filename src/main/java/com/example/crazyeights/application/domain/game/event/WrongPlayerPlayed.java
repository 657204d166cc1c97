package com.example.crazyeights.application.domain.game.event;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 不是自己的回合卻出牌 (罰則)
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class WrongPlayerPlayed extends PlayedCardEvent {

	public WrongPlayerPlayed(PlayerId player, Card card, Effect effect) {
		super(player, card, effect);
	}

	@Override
	public GameEventType getType() {
		return GameEventType.WRONG_PLAYER_PLAYED;
	}
}
