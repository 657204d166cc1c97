package com.example.crazyeights.application.domain.game.aggregate.vo;

import java.util.Optional;

import lombok.Value;

/**
 * 牌局識別碼
 * <p>
 * 與 EventStoreDB 的 Stream 名稱一一對應：{@code game-<id>}；快照存於 {@code game-<id>-snap}。
 * </p>
 */
@Value(staticConstructor = "of")
public class GameId {

	public static final String STREAM_PREFIX = "game-";

	int value;

	public String streamName() {
		return STREAM_PREFIX + value;
	}

	public String snapshotStreamName() {
		return streamName() + "-snap";
	}

	/**
	 * 從 Stream 名稱還原牌局識別碼，只認得 {@code game-} 開頭且以數字結尾的 Stream。
	 *
	 * @param stream Stream 名稱
	 * @return 非牌局 Stream (系統流、快照流等) 回傳空值
	 */
	public static Optional<GameId> tryParseFromStream(String stream) {
		if (stream == null || !stream.startsWith(STREAM_PREFIX)) {
			return Optional.empty();
		}
		String suffix = stream.substring(STREAM_PREFIX.length());
		try {
			return Optional.of(GameId.of(Integer.parseInt(suffix)));
		} catch (NumberFormatException e) {
			return Optional.empty();
		}
	}

	@Override
	public String toString() {
		return String.valueOf(value);
	}
}
