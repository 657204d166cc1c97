package com.example.crazyeights.application.domain.game.snapshot;

import java.time.LocalDateTime;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.state.GameState;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class GameSnapshot {
	/**
	 * 牌局識別碼
	 */
	private GameId gameId;

	/**
	 * 該時間點的牌局狀態
	 */
	private GameState state;

	/**
	 * 快照建立時最後一個事件的 Stream Revision，重播時從 version + 1 開始讀取
	 */
	private long lastEventVersion;

	/**
	 * 狀態編碼的版本標籤 (Guard)，與執行期設定不符時此快照一律視為不存在
	 */
	private String guard;

	/**
	 * 快照建立時間
	 */
	private LocalDateTime createdAt;
}
