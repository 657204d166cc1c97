package com.example.crazyeights.infra.event.mapper;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Component;

import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.infra.event.codec.GameEventCodec;

import lombok.RequiredArgsConstructor;

/**
 * EventStore 專用的牌局事件映射器 (Event Mapper)
 *
 * <p>
 * 負責 Domain Event 與 EventStoreDB 資料格式之間的轉換，封裝 EventStoreDB 專屬結構， 避免上層直接依賴
 * EventStore。
 * </p>
 *
 * <p>
 * 設計原則：
 * <ul>
 * <li>專責序列化/反序列化，不包含業務邏輯</li>
 * <li>事件型別標籤取自 {@link GameEventCodec}，而非類別名稱，重新命名類別不影響歷史事件</li>
 * <li>讀取時無法辨識的紀錄回傳空清單</li>
 * </ul>
 * </p>
 */
@Component
@RequiredArgsConstructor
public class GameEventMapper {

	private final GameEventCodec codec;

	/**
	 * 將 Domain Event 封裝為 EventStoreDB 可寫入的 {@link EventData}，每筆事件產生唯一 ID。
	 *
	 * @throws IllegalStateException 序列化失敗
	 */
	public EventData toEventData(GameEvent event) {
		return EventData.builderAsJson(UUID.randomUUID(), codec.typeOf(event), codec.encode(event)).build();
	}

	/**
	 * 將 EventStore {@link ResolvedEvent} 還原為 Domain Event。
	 *
	 * @return 零或一個事件
	 */
	public List<GameEvent> toDomainEvents(ResolvedEvent resolvedEvent) {
		RecordedEvent recorded = resolvedEvent.getEvent();
		return codec.decode(recorded.getEventType(), recorded.getEventData());
	}
}
