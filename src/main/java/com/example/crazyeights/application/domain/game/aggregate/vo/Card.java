package com.example.crazyeights.application.domain.game.aggregate.vo;

import java.util.Optional;

import lombok.Value;

/**
 * 一張撲克牌 (點數 + 花色)
 * <p>
 * 文字記號為「點數記號 + 花色記號」，例如 {@code 6C}、{@code 10S}、{@code JH}。
 * </p>
 */
@Value(staticConstructor = "of")
public class Card {

	Rank rank;

	Suit suit;

	/**
	 * 同點數或同花色即可接續出牌
	 */
	public boolean matches(Card other) {
		return this.rank == other.rank || this.suit == other.suit;
	}

	public String toNotation() {
		return rank.getNotation() + suit.getNotation();
	}

	/**
	 * 解析牌面文字。
	 *
	 * @param input 牌面文字
	 * @return 解析後的 {@link Card}
	 * @throws IllegalArgumentException 點數或花色無法辨識時拋出，訊息會同時列出兩者的錯誤
	 */
	public static Card parse(String input) {
		Optional<Rank> rank = Rank.fromPrefix(input);
		Optional<Suit> suit = Suit.fromSuffix(input);
		if (rank.isPresent() && suit.isPresent()) {
			return new Card(rank.get(), suit.get());
		}
		StringBuilder error = new StringBuilder();
		if (rank.isEmpty()) {
			error.append("Unknown rank in ").append(input);
		}
		if (suit.isEmpty()) {
			if (error.length() > 0) {
				error.append(' ');
			}
			error.append("Unknown suit in ").append(input);
		}
		throw new IllegalArgumentException(error.toString());
	}

	@Override
	public String toString() {
		return toNotation();
	}
}
