package com.example.crazyeights.support;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.port.GameEventLogPort;
import com.example.crazyeights.application.shared.eventlog.GameStreamSlice;
import com.example.crazyeights.application.shared.eventlog.GlobalLogSlice;
import com.example.crazyeights.application.shared.eventlog.GlobalPosition;
import com.example.crazyeights.application.shared.eventlog.PositionedGameEvent;
import com.example.crazyeights.application.shared.exception.StreamVersionConflictException;

/**
 * 測試用的記憶體事件日誌，行為與 EventStoreDB 一致：Stream 內有序、$all 全域有序、 預期版本不符時拋出衝突、readAll 起點包含在內。
 */
public class InMemoryGameEventLog implements GameEventLogPort {

	private record Entry(GlobalPosition position, String streamId, GameEvent event) {
	}

	private final List<Entry> all = new ArrayList<>();
	private final Map<String, List<GameEvent>> streams = new HashMap<>();
	private Runnable beforeNextAppend;
	private int appendCalls;
	private int readStreamCalls;

	@Override
	public synchronized long append(GameId gameId, long expectedVersion, List<GameEvent> events) {
		appendCalls++;
		if (beforeNextAppend != null) {
			Runnable hook = beforeNextAppend;
			beforeNextAppend = null;
			hook.run();
		}
		return doAppend(gameId, expectedVersion, events);
	}

	private long doAppend(GameId gameId, long expectedVersion, List<GameEvent> events) {
		List<GameEvent> stream = streams.computeIfAbsent(gameId.streamName(), k -> new ArrayList<>());
		long current = stream.size() - 1L;
		if (current != expectedVersion) {
			throw new StreamVersionConflictException(gameId.streamName(), expectedVersion, null);
		}
		for (GameEvent event : events) {
			stream.add(event);
			record(gameId.streamName(), event);
		}
		return current + events.size();
	}

	@Override
	public synchronized GameStreamSlice readStream(GameId gameId, long afterVersion) {
		readStreamCalls++;
		List<GameEvent> stream = streams.getOrDefault(gameId.streamName(), List.of());
		int from = (int) (afterVersion + 1);
		if (from >= stream.size()) {
			return new GameStreamSlice(List.of(), afterVersion);
		}
		return new GameStreamSlice(List.copyOf(stream.subList(from, stream.size())), stream.size() - 1L);
	}

	@Override
	public synchronized GlobalLogSlice readAll(GlobalPosition from, int maxCount) {
		List<PositionedGameEvent> events = new ArrayList<>();
		GlobalPosition last = from;
		int read = 0;
		for (Entry entry : all) {
			if (read == maxCount) {
				break;
			}
			if (!from.isStart() && entry.position().compareTo(from) < 0) {
				continue;
			}
			read++;
			last = entry.position();
			if (entry.event() != null) {
				events.add(new PositionedGameEvent(entry.position(), entry.streamId(), entry.event()));
			}
		}
		return new GlobalLogSlice(events, last, read < maxCount);
	}

	/**
	 * 直接寫入牌局 Stream，不檢查版本 (模擬其他寫入者)
	 */
	public synchronized void appendDirect(GameId gameId, GameEvent... events) {
		doAppend(gameId, version(gameId), List.of(events));
	}

	/**
	 * 寫入一筆無法解碼或不屬於牌局的紀錄 (系統流、快照流)
	 */
	public synchronized void appendForeign(String streamId) {
		all.add(new Entry(nextPosition(), streamId, null));
	}

	/**
	 * 寫入一筆可解碼但位於非牌局 Stream 的事件
	 */
	public synchronized void appendToOtherStream(String streamId, GameEvent event) {
		all.add(new Entry(nextPosition(), streamId, event));
	}

	public synchronized long version(GameId gameId) {
		return streams.getOrDefault(gameId.streamName(), List.of()).size() - 1L;
	}

	public synchronized List<GameEvent> events(GameId gameId) {
		return List.copyOf(streams.getOrDefault(gameId.streamName(), List.of()));
	}

	/**
	 * 下一次 append 檢查版本之前先執行一次 (模擬並行寫入者搶先寫入)
	 */
	public synchronized void beforeNextAppend(Runnable hook) {
		this.beforeNextAppend = hook;
	}

	public synchronized int getAppendCalls() {
		return appendCalls;
	}

	public synchronized int getReadStreamCalls() {
		return readStreamCalls;
	}

	public synchronized GlobalPosition lastPosition() {
		return all.isEmpty() ? GlobalPosition.START : all.get(all.size() - 1).position();
	}

	private void record(String streamId, GameEvent event) {
		all.add(new Entry(nextPosition(), streamId, event));
	}

	private GlobalPosition nextPosition() {
		long p = (all.size() + 1) * 100L;
		return new GlobalPosition(p, p);
	}

}
