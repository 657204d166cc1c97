package com.example.crazyeights.application.domain.game.event;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 出了點數與花色皆不符的牌 (罰則)
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class WrongCardPlayed extends PlayedCardEvent {

	public WrongCardPlayed(PlayerId player, Card card, Effect effect) {
		super(player, card, effect);
	}

	@Override
	public GameEventType getType() {
		return GameEventType.WRONG_CARD_PLAYED;
	}
}
