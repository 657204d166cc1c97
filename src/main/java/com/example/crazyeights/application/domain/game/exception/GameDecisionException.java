package com.example.crazyeights.application.domain.game.exception;

import lombok.Getter;

/**
 * 協議違規 (Protocol Violation)
 * <p>
 * 指令在目前狀態下結構上不可套用。不產生任何事件，也不會重試。 與違規出牌不同，違規出牌是事件而非例外。
 * </p>
 */
@Getter
public class GameDecisionException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public enum Reason {
		ALREADY_STARTED, // 已開局又收到開局指令
		NOT_YET_STARTED // 尚未開局就收到其他指令
	}

	private final Reason reason;

	public GameDecisionException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public static GameDecisionException alreadyStarted() {
		return new GameDecisionException(Reason.ALREADY_STARTED, "Game already started");
	}

	public static GameDecisionException notYetStarted() {
		return new GameDecisionException(Reason.NOT_YET_STARTED, "Game not yet started");
	}
}
