package com.example.crazyeights.application.shared.exception;

/**
 * 指令格式錯誤。邊界層必須明確拒絕，絕不能當成無效操作默默接受。
 */
public class InvalidCommandException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public InvalidCommandException(String message) {
		super(message);
	}

	public InvalidCommandException(String message, Throwable cause) {
		super(message, cause);
	}
}
