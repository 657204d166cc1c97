package com.example.crazyeights.application.domain.game.aggregate.vo;

import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;

/**
 * 牌桌 (出牌順序游標)
 * <p>
 * 不變量：{@code player} 永遠落在 {@code [0, players.count)} 之內。所有推進操作皆回傳新的實例。
 * </p>
 */
@Value
@With
@AllArgsConstructor
public class Table {

	Players players;

	PlayerId player;

	Direction direction;

	/**
	 * 開局位置：玩家 0，順時針
	 */
	public static Table start(Players players) {
		return new Table(players, PlayerId.of(0), Direction.CLOCKWISE);
	}

	public Table nextPlayer() {
		int n = players.getCount();
		int p = player.getValue();
		int next = direction == Direction.CLOCKWISE ? (p + 1) % n : (p - 1 + n) % n;
		return withPlayer(PlayerId.of(next));
	}

	public Table skip() {
		return nextPlayer().nextPlayer();
	}

	public Table flip() {
		return withDirection(direction.flip());
	}

	public Table back() {
		return flip().nextPlayer();
	}

	/**
	 * 從 {@code resumeAfter} 的下一位繼續。編號超出範圍時先取模，游標不會離開 {@code [0, n)}。
	 */
	public Table breakingInterrupt(PlayerId resumeAfter) {
		return withPlayer(PlayerId.of(Math.floorMod(resumeAfter.getValue(), players.getCount()))).nextPlayer();
	}

	/**
	 * 依事件效果推進出牌順序
	 */
	public Table advance(Effect effect) {
		return switch (effect.getType()) {
		case NEXT -> nextPlayer();
		case SKIP -> skip();
		case BACK -> back();
		case INTERRUPT -> this;
		case BREAKING_INTERRUPT -> breakingInterrupt(effect.getResumeAfter());
		};
	}
}
