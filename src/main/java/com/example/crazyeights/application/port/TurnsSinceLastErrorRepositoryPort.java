package com.example.crazyeights.application.port;

import java.util.Map;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;
import com.example.crazyeights.application.projection.GamePlayerKey;

/**
 * 每位玩家「距上次犯規的回合數」讀取模型
 */
public interface TurnsSinceLastErrorRepositoryPort extends CounterStorePort<GamePlayerKey> {

	/**
	 * @return 以玩家為鍵的計數，牌局不存在時為空 Map
	 */
	Map<PlayerId, Integer> findByGame(GameId gameId);
}
