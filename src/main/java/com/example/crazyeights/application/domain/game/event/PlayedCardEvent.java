package com.example.crazyeights.application.domain.game.event;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 所有「某位玩家打出一張牌」的事件共用的欄位。
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract sealed class PlayedCardEvent implements GameEvent
		permits CardPlayed, WrongCardPlayed, WrongPlayerPlayed, InterruptMissed {

	private final PlayerId player;

	private final Card card;

	private final Effect effect;

	protected PlayedCardEvent(PlayerId player, Card card, Effect effect) {
		this.player = player;
		this.card = card;
		this.effect = effect;
	}
}
