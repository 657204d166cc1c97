package com.example.crazyeights.application.shared.eventlog;

import java.util.List;

import com.example.crazyeights.application.domain.game.event.GameEvent;

import lombok.Value;

/**
 * 單一牌局 Stream 的讀取結果
 */
@Value
public class GameStreamSlice {

	List<GameEvent> events;

	/**
	 * 讀到的最後一筆 Revision (含無法解碼而略過的事件)；未讀到新事件時等於起始版本
	 */
	long lastVersion;
}
