package com.example.crazyeights.application.shared.eventlog;

import com.example.crazyeights.application.domain.game.event.GameEvent;

import lombok.Value;

/**
 * 從全域日誌讀到的一筆已解碼事件，保留原始 Stream 名稱供投影路由判斷。
 */
@Value
public class PositionedGameEvent {

	GlobalPosition position;

	String streamId;

	GameEvent event;
}
