package com.example.crazyeights.application.projection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.port.GameEventLogPort;
import com.example.crazyeights.application.shared.eventlog.GlobalLogSlice;
import com.example.crazyeights.application.shared.eventlog.GlobalPosition;
import com.example.crazyeights.application.shared.eventlog.PositionedGameEvent;
import com.example.crazyeights.application.shared.exception.GameStorageException;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>投影追趕器 (Projection Runner)</h1>
 * <p>
 * <b>職責：</b> 作為全域日誌 ($all) 的單一循序消費者，將牌局事件路由至各個具名投影， 並讓每個投影在同一交易中更新讀取模型與 Checkpoint。
 * </p>
 *
 * <h2>設計重點：</h2>
 * <ul>
 * <li><b>位置閘門 (Position Gate)</b>：只有位置嚴格大於該投影 Checkpoint 的事件才會被套用， 重複投遞的事件自動成為 no-op。</li>
 * <li><b>增量模式</b>：逐筆提交，中途中斷時已提交的進度全數保留。</li>
 * <li><b>重建模式</b>：最落後的投影進度為起點 (START) 時，整段日誌在記憶體中折疊後一次提交。</li>
 * <li><b>路由</b>：只處理能解析出牌局識別碼的 Stream，其他 Stream (系統流、快照流) 一律略過。</li>
 * </ul>
 * <p>
 * 進度由本物件獨佔的 {@link CatchUpState} 保存；所有公開方法皆為 synchronized， 排程輪詢與指令後的即時追趕不會交錯執行。
 * </p>
 */
@Slf4j
public class ProjectionRunner {

	private final GameEventLogPort eventLog;
	private final List<GameProjection> projections;
	private final TransactionOperations transactions;
	private final int pageSize;

	private CatchUpState state;

	public ProjectionRunner(GameEventLogPort eventLog, List<GameProjection> projections,
			TransactionOperations transactions, int pageSize) {
		if (pageSize < 2) {
			throw new IllegalArgumentException("pageSize must be at least 2");
		}
		this.eventLog = eventLog;
		this.projections = List.copyOf(projections);
		this.transactions = transactions;
		this.pageSize = pageSize;
	}

	/**
	 * 啟動：讀取各投影的 Checkpoint (Guard 不符者視為 START)，再決定以重建或增量模式追上日誌。
	 */
	public synchronized CatchUpState start() {
		state = new CatchUpState(loadCheckpoints());
		log.info(">>> [Projection] 投影服務啟動，各投影進度：{}", state.getCheckpoints());

		if (state.minimumCheckpoint().isStart()) {
			rebuild();
		} else {
			catchUp();
		}
		return state;
	}

	/**
	 * 增量追趕：從讀取位置往後逐頁讀取，逐筆套用並提交。
	 */
	public synchronized CatchUpState catchUp() {
		if (state == null) {
			return start();
		}
		int applied = 0;
		GlobalLogSlice slice;
		do {
			slice = eventLog.readAll(state.getReadPosition(), pageSize);
			for (PositionedGameEvent positioned : slice.getEvents()) {
				Optional<RoutedGameEvent> routed = route(positioned);
				if (routed.isPresent()) {
					applied += applyToProjections(routed.get());
				}
			}
			state.readUpTo(slice.getLastPosition());
		} while (!slice.isEndOfLog());

		if (applied > 0) {
			log.info(">>> [Projection] 增量追趕完成，套用 {} 次，讀取位置: {}", applied, state.getReadPosition());
		}
		return state;
	}

	/**
	 * 重建模式：從最落後的進度讀到日誌尾端，每個投影各自在一個交易中整份提交。
	 */
	public synchronized CatchUpState rebuild() {
		if (state == null) {
			state = new CatchUpState(loadCheckpoints());
		}
		GlobalPosition from = state.minimumCheckpoint();
		List<RoutedGameEvent> suffix = new ArrayList<>();
		GlobalPosition lastRead = from;
		GlobalLogSlice slice;
		do {
			slice = eventLog.readAll(lastRead, pageSize);
			slice.getEvents().forEach(e -> route(e).ifPresent(suffix::add));
			lastRead = slice.getLastPosition();
		} while (!slice.isEndOfLog());

		log.info(">>> [Projection] 重建模式：自 {} 起讀取 {} 筆牌局事件", from, suffix.size());

		for (GameProjection projection : projections) {
			Optional<GlobalPosition> committed = storageCall(projection,
					() -> transactions.execute(status -> projection.rebuild(suffix)));
			if (committed != null && committed.isPresent()) {
				state.committed(projection.getName(), committed.get());
			}
		}
		state.readUpTo(lastRead);
		return state;
	}

	public synchronized Optional<CatchUpState> currentState() {
		return Optional.ofNullable(state);
	}

	private int applyToProjections(RoutedGameEvent routed) {
		int applied = 0;
		for (GameProjection projection : projections) {
			if (!routed.getPosition().isAfter(state.checkpointOf(projection.getName()))) {
				continue;
			}
			storageCall(projection, () -> {
				transactions.executeWithoutResult(status -> projection.apply(routed));
				return null;
			});
			state.committed(projection.getName(), routed.getPosition());
			applied++;
		}
		return applied;
	}

	/**
	 * 資料庫失敗時讀取模型與 Checkpoint 一起回滾，進度維持不變，下一輪從同一位置重試
	 */
	private static <T> T storageCall(GameProjection projection, Supplier<T> work) {
		try {
			return work.get();
		} catch (DataAccessException | TransactionException e) {
			throw new GameStorageException("Projection " + projection.getName() + " failed to commit", e);
		}
	}

	private Map<String, GlobalPosition> loadCheckpoints() {
		Map<String, GlobalPosition> checkpoints = new LinkedHashMap<>();
		for (GameProjection projection : projections) {
			checkpoints.put(projection.getName(), storageCall(projection, projection::loadCheckpoint));
		}
		return checkpoints;
	}

	private static Optional<RoutedGameEvent> route(PositionedGameEvent positioned) {
		return GameId.tryParseFromStream(positioned.getStreamId())
				.map(gameId -> new RoutedGameEvent(positioned.getPosition(), gameId, positioned.getEvent()));
	}
}
