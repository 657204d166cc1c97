package com.example.crazyeights.application.service;

import java.util.Map;

import org.springframework.stereotype.Service;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;
import com.example.crazyeights.application.port.CardCountRepositoryPort;
import com.example.crazyeights.application.port.TurnsSinceLastErrorRepositoryPort;

import lombok.RequiredArgsConstructor;

/**
 * 讀取模型查詢服務，資料可能落後於日誌 (最終一致)。
 */
@Service
@RequiredArgsConstructor
public class GameQueryService {

	private final CardCountRepositoryPort cardCountRepository;
	private final TurnsSinceLastErrorRepositoryPort turnsSinceLastErrorRepository;

	/**
	 * @return 合法出牌數，投影尚未看到此牌局時為 0
	 */
	public int getCardCount(GameId gameId) {
		return cardCountRepository.findCount(gameId).orElse(0);
	}

	public Map<PlayerId, Integer> getTurnsSinceLastError(GameId gameId) {
		return turnsSinceLastErrorRepository.findByGame(gameId);
	}
}
