package com.example.crazyeights.application.projection;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.shared.eventlog.GlobalPosition;

import lombok.Value;

/**
 * 已確認屬於某個牌局 Stream 的事件
 */
@Value
public class RoutedGameEvent {

	GlobalPosition position;

	GameId gameId;

	GameEvent event;
}
