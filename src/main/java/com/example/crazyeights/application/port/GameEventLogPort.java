package com.example.crazyeights.application.port;

import java.util.List;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.shared.eventlog.GameStreamSlice;
import com.example.crazyeights.application.shared.eventlog.GlobalLogSlice;
import com.example.crazyeights.application.shared.eventlog.GlobalPosition;
import com.example.crazyeights.application.shared.exception.GameStorageException;
import com.example.crazyeights.application.shared.exception.StreamVersionConflictException;

/**
 * 事件日誌 Port (Append-only Log)
 * <p>
 * 日誌服務本身是順序的仲裁者：單一 Stream 內有序，跨 Stream 在 $all 上全域有序。
 * </p>
 */
public interface GameEventLogPort {

	/**
	 * 以預期版本為前提追加事件。
	 *
	 * @param gameId          牌局
	 * @param expectedVersion 預期的 Stream 版本，{@code -1} 代表 Stream 必須不存在
	 * @param events          待追加事件
	 * @return 追加後的 Stream 版本
	 * @throws StreamVersionConflictException 版本不符
	 * @throws GameStorageException           日誌無法存取
	 */
	long append(GameId gameId, long expectedVersion, List<GameEvent> events);

	/**
	 * 讀取指定版本之後的所有事件 (不含 {@code afterVersion} 本身)。Stream 不存在時回傳空結果。
	 */
	GameStreamSlice readStream(GameId gameId, long afterVersion);

	/**
	 * 從全域位置 (含) 往後讀取一頁。
	 *
	 * @param from     起始位置，{@link GlobalPosition#START} 代表日誌開頭
	 * @param maxCount 單頁上限
	 */
	GlobalLogSlice readAll(GlobalPosition from, int maxCount);
}
