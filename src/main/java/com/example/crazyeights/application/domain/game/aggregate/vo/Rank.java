package com.example.crazyeights.application.domain.game.aggregate.vo;

import java.util.Optional;

/**
 * 撲克牌點數
 * <p>
 * 每個點數帶有一個文字記號 (notation)，例如 {@code 1}、{@code 10}、{@code J}，用於事件 Payload 與指令文字。
 * </p>
 */
public enum Rank {
	ACE("1"), //
	TWO("2"), //
	THREE("3"), //
	FOUR("4"), //
	FIVE("5"), //
	SIX("6"), //
	SEVEN("7"), //
	EIGHT("8"), //
	NINE("9"), //
	TEN("10"), //
	JACK("J"), //
	QUEEN("Q"), //
	KING("K");

	private final String notation;

	Rank(String notation) {
		this.notation = notation;
	}

	public String getNotation() {
		return notation;
	}

	/**
	 * 從牌面字串的開頭解析點數。
	 * <p>
	 * 比對順序有意義：{@code 10} 必須在 {@code 1} 之前判斷；{@code A} 與 {@code 1} 皆視為 Ace。
	 * </p>
	 *
	 * @param input 例如 {@code "10S"}、{@code "JH"}
	 * @return 解析結果，無法辨識時為空
	 */
	public static Optional<Rank> fromPrefix(String input) {
		if (input == null) {
			return Optional.empty();
		}
		if (input.startsWith("K"))
			return Optional.of(KING);
		if (input.startsWith("Q"))
			return Optional.of(QUEEN);
		if (input.startsWith("J"))
			return Optional.of(JACK);
		if (input.startsWith("10"))
			return Optional.of(TEN);
		if (input.startsWith("9"))
			return Optional.of(NINE);
		if (input.startsWith("8"))
			return Optional.of(EIGHT);
		if (input.startsWith("7"))
			return Optional.of(SEVEN);
		if (input.startsWith("6"))
			return Optional.of(SIX);
		if (input.startsWith("5"))
			return Optional.of(FIVE);
		if (input.startsWith("4"))
			return Optional.of(FOUR);
		if (input.startsWith("3"))
			return Optional.of(THREE);
		if (input.startsWith("2"))
			return Optional.of(TWO);
		if (input.startsWith("1") || input.startsWith("A"))
			return Optional.of(ACE);
		return Optional.empty();
	}
}
