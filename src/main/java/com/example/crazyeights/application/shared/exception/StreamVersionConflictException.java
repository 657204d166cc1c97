package com.example.crazyeights.application.shared.exception;

import lombok.Getter;

/**
 * 樂觀並行控制衝突：追加時的預期版本與 Stream 實際版本不一致。
 * <p>
 * 可恢復，由 Gateway 重新載入差量後重新決策。
 * </p>
 */
@Getter
public class StreamVersionConflictException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String streamName;

	private final long expectedVersion;

	public StreamVersionConflictException(String streamName, long expectedVersion, Throwable cause) {
		super("Wrong expected version " + expectedVersion + " on stream " + streamName, cause);
		this.streamName = streamName;
		this.expectedVersion = expectedVersion;
	}
}
