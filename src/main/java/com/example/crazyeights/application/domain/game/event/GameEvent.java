package com.example.crazyeights.application.domain.game.event;

import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;

/**
 * 牌局領域事件 (封閉集合)
 * <p>
 * 事件是不可變的事實，寫入後不會被修改或刪除。違規出牌 (出錯牌、不是你的回合、錯過搶牌) 同樣是事件，而不是例外。
 * </p>
 */
public sealed interface GameEvent permits GameStarted, PlayedCardEvent {

	GameEventType getType();

	/**
	 * 決策當下計算好的順序效果
	 */
	Effect getEffect();
}
