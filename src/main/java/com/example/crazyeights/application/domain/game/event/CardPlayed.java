package com.example.crazyeights.application.domain.game.event;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 合法出牌或搶牌成功
 */
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class CardPlayed extends PlayedCardEvent {

	public CardPlayed(PlayerId player, Card card, Effect effect) {
		super(player, card, effect);
	}

	@Override
	public GameEventType getType() {
		return GameEventType.CARD_PLAYED;
	}
}
