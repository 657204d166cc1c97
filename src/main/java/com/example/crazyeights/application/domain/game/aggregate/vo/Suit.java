package com.example.crazyeights.application.domain.game.aggregate.vo;

import java.util.Optional;

/**
 * 撲克牌花色
 */
public enum Suit {
	CLUB("C", "♣"), //
	SPADE("S", "♠"), //
	DIAMOND("D", "♦"), //
	HEART("H", "♥");

	private final String notation;
	private final String symbol;

	Suit(String notation, String symbol) {
		this.notation = notation;
		this.symbol = symbol;
	}

	public String getNotation() {
		return notation;
	}

	public String getSymbol() {
		return symbol;
	}

	/**
	 * 從牌面字串的結尾解析花色。
	 *
	 * @param input 例如 {@code "6C"}
	 * @return 解析結果，無法辨識時為空
	 */
	public static Optional<Suit> fromSuffix(String input) {
		if (input == null) {
			return Optional.empty();
		}
		for (Suit suit : values()) {
			if (input.endsWith(suit.notation)) {
				return Optional.of(suit);
			}
		}
		return Optional.empty();
	}
}
