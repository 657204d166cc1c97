package com.example.crazyeights.infra.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.eventstore.dbclient.AppendToStreamOptions;
import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.ExpectedRevision;
import com.eventstore.dbclient.Position;
import com.eventstore.dbclient.ReadAllOptions;
import com.eventstore.dbclient.ReadResult;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.eventstore.dbclient.StreamNotFoundException;
import com.eventstore.dbclient.WrongExpectedVersionException;
import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.port.GameEventLogPort;
import com.example.crazyeights.application.shared.dto.LoadedGame;
import com.example.crazyeights.application.shared.eventlog.GameStreamSlice;
import com.example.crazyeights.application.shared.eventlog.GlobalLogSlice;
import com.example.crazyeights.application.shared.eventlog.GlobalPosition;
import com.example.crazyeights.application.shared.eventlog.PositionedGameEvent;
import com.example.crazyeights.application.shared.exception.GameStorageException;
import com.example.crazyeights.application.shared.exception.StreamVersionConflictException;
import com.example.crazyeights.infra.event.mapper.GameEventMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>EventStoreDB 事件日誌轉接器</h1>
 * <p>
 * 實作 {@link GameEventLogPort}：單一牌局 Stream 的追加與讀取，以及 $all 的分頁讀取。
 * </p>
 *
 * <h2>錯誤轉譯：</h2>
 * <ul>
 * <li>{@link WrongExpectedVersionException} → {@link StreamVersionConflictException} (可重試)</li>
 * <li>{@link StreamNotFoundException} → 空結果</li>
 * <li>其餘失敗與逾時 → {@link GameStorageException}</li>
 * </ul>
 */
@Slf4j
@Component
public class EventStoreGameEventLogAdapter implements GameEventLogPort {

	private final EventStoreDBClient client;
	private final GameEventMapper mapper;
	private final long timeoutMs;

	public EventStoreGameEventLogAdapter(EventStoreDBClient client, GameEventMapper mapper,
			@Value("${eventstoredb.timeout-ms:5000}") long timeoutMs) {
		this.client = client;
		this.mapper = mapper;
		this.timeoutMs = timeoutMs;
	}

	@Override
	public long append(GameId gameId, long expectedVersion, List<GameEvent> events) {
		String streamName = gameId.streamName();
		List<EventData> batch = events.stream().map(mapper::toEventData).toList();
		ExpectedRevision expected = expectedVersion == LoadedGame.NO_STREAM ? ExpectedRevision.noStream()
				: ExpectedRevision.expectedRevision(expectedVersion);
		AppendToStreamOptions options = AppendToStreamOptions.get().expectedRevision(expected);

		try {
			await(client.appendToStream(streamName, options, batch.iterator()));
		} catch (ExecutionException e) {
			if (e.getCause() instanceof WrongExpectedVersionException) {
				throw new StreamVersionConflictException(streamName, expectedVersion, e.getCause());
			}
			throw new GameStorageException("Append to " + streamName + " failed", e.getCause());
		}
		long newVersion = expectedVersion + events.size();
		log.debug(">>> [EventStore] 寫入成功: Stream={}, Version={}", streamName, newVersion);
		return newVersion;
	}

	@Override
	public GameStreamSlice readStream(GameId gameId, long afterVersion) {
		String streamName = gameId.streamName();
		ReadStreamOptions options = ReadStreamOptions.get().forwards().fromRevision(afterVersion + 1);

		ReadResult result;
		try {
			result = await(client.readStream(streamName, options));
		} catch (ExecutionException e) {
			if (e.getCause() instanceof StreamNotFoundException) {
				return new GameStreamSlice(List.of(), afterVersion);
			}
			throw new GameStorageException("Read of " + streamName + " failed", e.getCause());
		}

		List<GameEvent> events = new ArrayList<>();
		long lastVersion = afterVersion;
		for (ResolvedEvent resolved : result.getEvents()) {
			events.addAll(mapper.toDomainEvents(resolved));
			lastVersion = resolved.getEvent().getRevision();
		}
		return new GameStreamSlice(events, lastVersion);
	}

	@Override
	public GlobalLogSlice readAll(GlobalPosition from, int maxCount) {
		ReadAllOptions options = ReadAllOptions.get().forwards().maxCount(maxCount);
		if (from.isStart()) {
			options.fromStart();
		} else {
			options.fromPosition(new Position(from.getCommit(), from.getPrepare()));
		}

		ReadResult result;
		try {
			result = await(client.readAll(options));
		} catch (ExecutionException e) {
			throw new GameStorageException("Read of $all from " + from + " failed", e.getCause());
		}

		List<ResolvedEvent> raw = result.getEvents();
		List<PositionedGameEvent> events = new ArrayList<>();
		GlobalPosition last = from;
		for (ResolvedEvent resolved : raw) {
			RecordedEvent recorded = resolved.getEvent();
			Position position = recorded.getPosition();
			last = new GlobalPosition(position.getCommitUnsigned(), position.getPrepareUnsigned());
			for (GameEvent event : mapper.toDomainEvents(resolved)) {
				events.add(new PositionedGameEvent(last, recorded.getStreamId(), event));
			}
		}
		return new GlobalLogSlice(events, last, raw.size() < maxCount);
	}

	private <T> T await(CompletableFuture<T> future) throws ExecutionException {
		try {
			return future.get(timeoutMs, TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GameStorageException("Interrupted while waiting for EventStoreDB", e);
		} catch (TimeoutException e) {
			throw new GameStorageException("EventStoreDB did not answer within " + timeoutMs + " ms", e);
		}
	}
}
