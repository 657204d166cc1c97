package com.example.crazyeights.application.shared.exception;

/**
 * 事件日誌或資料庫無法存取。進行中的操作視為失敗，不留下部分狀態。
 */
public class GameStorageException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public GameStorageException(String message, Throwable cause) {
		super(message, cause);
	}
}
