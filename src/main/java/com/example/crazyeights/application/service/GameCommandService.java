package com.example.crazyeights.application.service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.example.crazyeights.application.domain.game.aggregate.GameDecider;
import com.example.crazyeights.application.domain.game.aggregate.GameEvolver;
import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.command.GameCommand;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.domain.game.exception.GameDecisionException;
import com.example.crazyeights.application.domain.game.state.GameState;
import com.example.crazyeights.application.port.GameEventLogPort;
import com.example.crazyeights.application.shared.dto.CommandResult;
import com.example.crazyeights.application.shared.dto.GameEventsAppended;
import com.example.crazyeights.application.shared.dto.LoadedGame;
import com.example.crazyeights.application.shared.eventlog.GameStreamSlice;
import com.example.crazyeights.application.shared.exception.GameConcurrencyException;
import com.example.crazyeights.application.shared.exception.GameStorageException;
import com.example.crazyeights.application.shared.exception.StreamVersionConflictException;
import com.example.crazyeights.application.shared.notation.GameEventPrinter;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>牌局指令閘道 (Aggregate Gateway)</h1>
 * <p>
 * <b>職責：</b> 每個牌局對應一條 Stream。以「快照 + 差量重播」重建狀態，交給 {@link GameDecider} 決策， 再以預期版本追加事件。
 * </p>
 *
 * <h2>樂觀並行控制：</h2>
 * <ol>
 * <li>以載入時的版本作為預期版本追加。</li>
 * <li>版本衝突時只重新讀取自身版本之後的差量，以最新狀態重新決策，絕不重送舊的事件。</li>
 * <li>超過重試上限後拋出 {@link GameConcurrencyException}。</li>
 * </ol>
 * <p>
 * 閘道本身不持有任何鎖；衝突完全由日誌的預期版本檢查仲裁。
 * </p>
 */
@Slf4j
@Service
public class GameCommandService {

	/**
	 * L1 Cache：最後一次載入或寫入的 (狀態, 版本)，只作為差量重播的起點
	 */
	private final Map<GameId, LoadedGame> l1Cache = new ConcurrentHashMap<>();

	private final GameEventLogPort eventLog;
	private final GameSnapshotCache snapshotCache;
	private final ApplicationEventPublisher publisher;
	private final int maxAttempts;
	private final long retryBackoffMs;

	public GameCommandService(GameEventLogPort eventLog, GameSnapshotCache snapshotCache,
			ApplicationEventPublisher publisher, @Value("${crazyeights.command.max-attempts:3}") int maxAttempts,
			@Value("${crazyeights.command.retry-backoff-ms:50}") long retryBackoffMs) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("max-attempts must be at least 1");
		}
		this.eventLog = eventLog;
		this.snapshotCache = snapshotCache;
		this.publisher = publisher;
		this.maxAttempts = maxAttempts;
		this.retryBackoffMs = retryBackoffMs;
	}

	/**
	 * 重建牌局目前的狀態與版本
	 *
	 * <pre>
	 * 1. 起點：L1 Cache → 相容快照 → 初始狀態 (NotStarted, -1)
	 * 2. 從起點版本之後讀取差量事件並折疊
	 * </pre>
	 *
	 * @param gameId 牌局識別碼
	 * @return 狀態與其版本
	 * @throws GameStorageException 日誌無法存取
	 */
	public LoadedGame loadState(GameId gameId) {
		LoadedGame base = l1Cache.get(gameId);
		if (base == null) {
			base = snapshotCache.tryLoad(gameId).orElse(null);
			if (base != null) {
				log.info(">>> [Recovery] 牌局 {} 發現快照 (版本 {})，補齊後續事件", gameId, base.getVersion());
			} else {
				base = LoadedGame.initial();
				log.debug(">>> [Recovery] 牌局 {} 沒有可用快照，從頭重播", gameId);
			}
		}
		LoadedGame loaded = replayDelta(gameId, base);
		l1Cache.put(gameId, loaded);
		return loaded;
	}

	/**
	 * 處理一個指令
	 *
	 * @param gameId  牌局識別碼
	 * @param command 指令
	 * @return 寫入的事件與新版本
	 * @throws GameDecisionException    指令在目前狀態下不可套用，不重試
	 * @throws GameConcurrencyException 重試上限內皆發生版本衝突
	 * @throws GameStorageException     日誌無法存取
	 */
	public CommandResult submit(GameId gameId, GameCommand command) {
		LoadedGame loaded = loadState(gameId);
		StreamVersionConflictException lastConflict = null;

		for (int attempt = 1; attempt <= maxAttempts; attempt++) {
			List<GameEvent> events = GameDecider.decide(loaded.getState(), command);
			try {
				long newVersion = eventLog.append(gameId, loaded.getVersion(), events);
				return committed(gameId, events, new LoadedGame(GameEvolver.fold(loaded.getState(), events), newVersion));
			} catch (StreamVersionConflictException e) {
				lastConflict = e;
				log.warn(">>> [Concurrency] 牌局 {} 版本衝突 (預期 {})，第 {}/{} 次嘗試", gameId, loaded.getVersion(), attempt,
						maxAttempts);
				if (attempt < maxAttempts) {
					backoff();
					loaded = replayDelta(gameId, loaded);
					l1Cache.put(gameId, loaded);
				}
			}
		}
		l1Cache.remove(gameId);
		throw new GameConcurrencyException(gameId, maxAttempts, lastConflict);
	}

	private CommandResult committed(GameId gameId, List<GameEvent> events, LoadedGame updated) {
		l1Cache.put(gameId, updated);
		for (GameEvent event : events) {
			log.info(">>> [Game {}] {}", gameId, GameEventPrinter.print(event));
		}

		// 日誌已是真相來源，快照寫入失敗只影響下次載入速度
		try {
			snapshotCache.save(gameId, updated);
		} catch (RuntimeException e) {
			log.warn(">>> [Snapshot] 牌局 {} 版本 {} 快照寫入失敗: {}", gameId, updated.getVersion(), e.getMessage());
		}

		publisher.publishEvent(new GameEventsAppended(gameId, events, updated.getVersion()));
		return new CommandResult(gameId, events, updated.getVersion(), updated.getState());
	}

	private LoadedGame replayDelta(GameId gameId, LoadedGame base) {
		GameStreamSlice slice = eventLog.readStream(gameId, base.getVersion());
		if (slice.getEvents().isEmpty() && slice.getLastVersion() == base.getVersion()) {
			return base;
		}
		GameState state = GameEvolver.fold(base.getState(), slice.getEvents());
		log.debug(">>> [EventStore] 牌局 {} 從版本 {} 重播 {} 筆事件至版本 {}", gameId, base.getVersion(),
				slice.getEvents().size(), slice.getLastVersion());
		return new LoadedGame(state, slice.getLastVersion());
	}

	private void backoff() {
		if (retryBackoffMs <= 0) {
			return;
		}
		try {
			Thread.sleep(retryBackoffMs);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GameStorageException("Interrupted while retrying command", e);
		}
	}
}
