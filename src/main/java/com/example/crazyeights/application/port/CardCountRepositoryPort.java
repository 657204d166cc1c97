package com.example.crazyeights.application.port;

import java.util.Optional;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;

/**
 * 每局合法出牌數的讀取模型
 */
public interface CardCountRepositoryPort extends CounterStorePort<GameId> {

	Optional<Integer> findCount(GameId gameId);
}
