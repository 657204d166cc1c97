package com.example.crazyeights.application.domain.game.state;

import com.example.crazyeights.application.domain.game.aggregate.vo.Pile;
import com.example.crazyeights.application.domain.game.aggregate.vo.Table;

import lombok.Value;

/**
 * 進行中的牌局：棄牌堆 + 牌桌順序。只能由 GameStarted 事件進入。
 */
@Value
public class Started implements GameState {

	Pile pile;

	Table table;

	@Override
	public boolean isStarted() {
		return true;
	}
}
