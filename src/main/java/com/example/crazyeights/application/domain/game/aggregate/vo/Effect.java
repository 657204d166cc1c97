package com.example.crazyeights.application.domain.game.aggregate.vo;

import java.util.Objects;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 事件效果 (Effect)
 * <p>
 * 在決策當下計算一次並寫入事件，重播時直接套用，不再依點數重新推導。 因此事後調整規則不會改變歷史事件的重播結果。
 * </p>
 *
 * <pre>
 * 記號：next | skip | back | int | int&lt;player&gt;
 * </pre>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Effect {

	public static final Effect NEXT = new Effect(EffectType.NEXT, null);
	public static final Effect SKIP = new Effect(EffectType.SKIP, null);
	public static final Effect BACK = new Effect(EffectType.BACK, null);
	public static final Effect INTERRUPT = new Effect(EffectType.INTERRUPT, null);

	EffectType type;

	/**
	 * 僅 {@link EffectType#BREAKING_INTERRUPT} 有值
	 */
	PlayerId resumeAfter;

	public static Effect breakingInterrupt(PlayerId player) {
		return new Effect(EffectType.BREAKING_INTERRUPT, Objects.requireNonNull(player, "player"));
	}

	/**
	 * 依牌面點數決定效果：7 跳過、J 反轉，其餘輪到下一位。
	 */
	public static Effect of(Card card) {
		return switch (card.getRank()) {
		case SEVEN -> SKIP;
		case JACK -> BACK;
		default -> NEXT;
		};
	}

	public String toNotation() {
		return switch (type) {
		case NEXT -> "next";
		case SKIP -> "skip";
		case BACK -> "back";
		case INTERRUPT -> "int";
		case BREAKING_INTERRUPT -> "int" + resumeAfter.getValue();
		};
	}

	/**
	 * @throws IllegalArgumentException 無法辨識的記號
	 */
	public static Effect parse(String notation) {
		if ("next".equals(notation))
			return NEXT;
		if ("skip".equals(notation))
			return SKIP;
		if ("back".equals(notation))
			return BACK;
		if (notation != null && notation.startsWith("int")) {
			try {
				return breakingInterrupt(PlayerId.of(Integer.parseInt(notation.substring(3))));
			} catch (NumberFormatException e) {
				return INTERRUPT;
			}
		}
		throw new IllegalArgumentException("Unknown effect " + notation);
	}

	@Override
	public String toString() {
		return toNotation();
	}
}
