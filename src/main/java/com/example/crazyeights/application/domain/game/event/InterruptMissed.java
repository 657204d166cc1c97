package com.example.crazyeights.application.domain.game.event;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 想搶第二張牌但時機已過
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class InterruptMissed extends PlayedCardEvent {

	public InterruptMissed(PlayerId player, Card card, Effect effect) {
		super(player, card, effect);
	}

	@Override
	public GameEventType getType() {
		return GameEventType.INTERRUPT_MISSED;
	}
}
