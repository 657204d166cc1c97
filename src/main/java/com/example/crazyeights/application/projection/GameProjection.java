package com.example.crazyeights.application.projection;

import java.util.List;
import java.util.Optional;

import com.example.crazyeights.application.shared.eventlog.GlobalPosition;

/**
 * 具名投影 (Projection)
 * <p>
 * 讀取模型是可隨時從日誌重建的快取，而非真相來源。 每個方法都假設呼叫端已開啟交易，讀取模型與 Checkpoint 會一起提交或一起回滾。
 * </p>
 */
public interface GameProjection {

	String getName();

	/**
	 * 讀取模型的格式版本
	 */
	String getGuard();

	/**
	 * 讀取已持久化的進度；沒有紀錄或 Guard 不符時回傳 {@link GlobalPosition#START}。
	 */
	GlobalPosition loadCheckpoint();

	/**
	 * 增量模式：套用單一事件並寫入新的 Checkpoint。呼叫端負責判斷位置是否大於目前進度。
	 */
	void apply(RoutedGameEvent event);

	/**
	 * 重建 / 批次模式：在記憶體中折疊所有比進度新的事件，至少有一筆時才整份寫回。
	 *
	 * @param events 從進度之後的日誌後綴 (可包含已套用過的事件，會被略過)
	 * @return 有寫入時回傳新的進度
	 */
	Optional<GlobalPosition> rebuild(List<RoutedGameEvent> events);
}
