package com.example.crazyeights.application.projection;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.port.CounterStorePort;
import com.example.crazyeights.application.port.ProjectionCheckpointRepositoryPort;
import com.example.crazyeights.application.shared.eventlog.GlobalPosition;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>計數型投影基底</h1>
 * <p>
 * 子類別只需宣告「事件 → 計數操作」的對應規則 ({@link #operationsFor})， 增量套用、記憶體折疊與 Checkpoint 管理都由本類別處理。
 * </p>
 *
 * @param <K> 計數鍵
 */
@Slf4j
@Getter
public abstract class AbstractCounterProjection<K> implements GameProjection {

	private final String name;
	private final String guard;
	private final CounterStorePort<K> store;
	private final ProjectionCheckpointRepositoryPort checkpoints;

	protected AbstractCounterProjection(String name, String guard, CounterStorePort<K> store,
			ProjectionCheckpointRepositoryPort checkpoints) {
		this.name = name;
		this.guard = guard;
		this.store = store;
		this.checkpoints = checkpoints;
	}

	/**
	 * 投影規則：一個事件對應零或多個計數操作
	 */
	protected abstract List<CounterOperation<K>> operationsFor(GameId gameId, GameEvent event);

	@Override
	public GlobalPosition loadCheckpoint() {
		return checkpoints.find(name).filter(c -> guard.equals(c.getGuard())).map(ProjectionCheckpoint::getPosition)
				.orElse(GlobalPosition.START);
	}

	/**
	 * 在呼叫端的交易中先讀取已提交的 Checkpoint，位置不比它新的事件直接略過。 交易已提交但呼叫端收到失敗時，重送同一事件不會重複計數。
	 */
	@Override
	public void apply(RoutedGameEvent routed) {
		GlobalPosition committed = loadCheckpoint();
		if (!routed.getPosition().isAfter(committed)) {
			log.debug(">>> [Projection] {} 已套用至 {}，略過 {}", name, committed, routed.getPosition());
			return;
		}
		for (CounterOperation<K> operation : operationsFor(routed.getGameId(), routed.getEvent())) {
			store.apply(operation);
		}
		checkpoints.save(new ProjectionCheckpoint(name, guard, routed.getPosition()));
	}

	@Override
	public Optional<GlobalPosition> rebuild(List<RoutedGameEvent> events) {
		Optional<ProjectionCheckpoint> stored = checkpoints.find(name);
		boolean guardChanged = stored.isPresent() && !guard.equals(stored.get().getGuard());
		GlobalPosition position = loadCheckpoint();
		// Guard 不符或從未執行過：丟棄既有的部分資料，從空狀態開始
		Map<K, Integer> state = position.isStart() ? new HashMap<>() : new HashMap<>(store.loadAll());
		// Guard 不符時即使沒有新事件也要覆寫，舊格式的資料不能留給增量模式累加
		boolean changed = guardChanged;
		if (guardChanged) {
			log.info(">>> [Projection] {} 的 Guard 由 {} 變更為 {}，清除既有讀取模型", name, stored.get().getGuard(), guard);
		}

		for (RoutedGameEvent routed : events) {
			if (routed.getPosition().isAfter(position)) {
				operationsFor(routed.getGameId(), routed.getEvent()).forEach(op -> op.applyTo(state));
				position = routed.getPosition();
				changed = true;
			}
		}

		if (!changed) {
			log.debug(">>> [Projection] {} 沒有比進度更新的事件，略過寫入", name);
			return Optional.empty();
		}
		store.replaceAll(state);
		checkpoints.save(new ProjectionCheckpoint(name, guard, position));
		log.info(">>> [Projection] {} 重建完成，共 {} 筆鍵值，進度: {}", name, state.size(), position);
		return Optional.of(position);
	}
}
