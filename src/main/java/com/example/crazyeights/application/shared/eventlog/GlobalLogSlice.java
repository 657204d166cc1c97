package com.example.crazyeights.application.shared.eventlog;

import java.util.List;

import lombok.Value;

/**
 * 一頁全域日誌讀取結果
 */
@Value
public class GlobalLogSlice {

	/**
	 * 可解碼的事件 (無法辨識的型別已略過)
	 */
	List<PositionedGameEvent> events;

	/**
	 * 本頁讀到的最後一筆紀錄位置，包含被略過的紀錄；未讀到任何紀錄時等於起始位置
	 */
	GlobalPosition lastPosition;

	/**
	 * 已讀到日誌尾端
	 */
	boolean endOfLog;
}
