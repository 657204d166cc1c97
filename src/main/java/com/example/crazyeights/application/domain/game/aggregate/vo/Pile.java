package com.example.crazyeights.application.domain.game.aggregate.vo;

import java.util.Optional;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 棄牌堆：只保留頂牌與其下一張 (用來判斷錯過的搶牌時機)。
 */
@Value
@AllArgsConstructor
public class Pile {

	Card topCard;

	Card secondCard;

	public static Pile start(Card card) {
		return new Pile(card, null);
	}

	public Pile put(Card card) {
		return new Pile(card, topCard);
	}

	public Optional<Card> getSecondCard() {
		return Optional.ofNullable(secondCard);
	}
}
