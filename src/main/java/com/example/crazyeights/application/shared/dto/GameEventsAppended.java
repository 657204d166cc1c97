package com.example.crazyeights.application.shared.dto;

import java.util.List;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.event.GameEvent;

import lombok.Value;

/**
 * 應用程式內部通知：事件已成功追加至日誌，投影器可立即追趕。
 */
@Value
public class GameEventsAppended {

	GameId gameId;

	List<GameEvent> events;

	long version;
}
