package com.example.crazyeights.application.domain.game.aggregate.vo;

/**
 * 事件對出牌順序的影響類型
 */
public enum EffectType {
	NEXT, // 輪到下一位
	SKIP, // 跳過下一位
	BACK, // 反轉方向
	INTERRUPT, // 搶牌，順序不變
	BREAKING_INTERRUPT // 搶牌結束，由指定玩家之後繼續
}
