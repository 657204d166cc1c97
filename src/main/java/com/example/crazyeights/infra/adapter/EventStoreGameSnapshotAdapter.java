package com.example.crazyeights.infra.adapter;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.ReadResult;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.eventstore.dbclient.StreamNotFoundException;
import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.snapshot.GameSnapshot;
import com.example.crazyeights.application.port.GameSnapshotRepositoryPort;
import com.example.crazyeights.application.shared.exception.GameStorageException;
import com.example.crazyeights.infra.event.codec.GameStateCodec;
import com.example.crazyeights.infra.event.codec.GameStateCodec.SnapshotTag;

import lombok.extern.slf4j.Slf4j;

/**
 * 快照存於 EventStoreDB 的 {@code game-<id>-snap} Stream
 * <p>
 * 型別標籤為 {@code <version>-<guard>}，讀取時只取最後一筆。 快照 Stream 不以數字結尾，投影路由會自動略過。
 * </p>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "crazyeights.snapshot.store", havingValue = "eventstore", matchIfMissing = true)
public class EventStoreGameSnapshotAdapter implements GameSnapshotRepositoryPort {

	private final EventStoreDBClient client;
	private final GameStateCodec stateCodec;
	private final long timeoutMs;

	public EventStoreGameSnapshotAdapter(EventStoreDBClient client, GameStateCodec stateCodec,
			@Value("${eventstoredb.timeout-ms:5000}") long timeoutMs) {
		this.client = client;
		this.stateCodec = stateCodec;
		this.timeoutMs = timeoutMs;
	}

	@Override
	public void save(GameSnapshot snapshot) {
		String streamName = snapshot.getGameId().snapshotStreamName();
		EventData data = EventData.builderAsJson(UUID.randomUUID(),
				GameStateCodec.snapshotType(snapshot.getLastEventVersion(), snapshot.getGuard()),
				stateCodec.encode(snapshot.getState())).build();
		try {
			client.appendToStream(streamName, data).get(timeoutMs, TimeUnit.MILLISECONDS);
			log.debug(">>> [Snapshot] 快照已寫入 {}: Version={}", streamName, snapshot.getLastEventVersion());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GameStorageException("Interrupted while writing snapshot to " + streamName, e);
		} catch (ExecutionException | TimeoutException e) {
			throw new GameStorageException("Snapshot write to " + streamName + " failed", e);
		}
	}

	@Override
	public Optional<GameSnapshot> findLatest(GameId gameId) {
		String streamName = gameId.snapshotStreamName();
		ReadStreamOptions options = ReadStreamOptions.get().backwards().fromEnd().maxCount(1);
		ReadResult result;
		try {
			result = client.readStream(streamName, options).get(timeoutMs, TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GameStorageException("Interrupted while reading " + streamName, e);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof StreamNotFoundException) {
				return Optional.empty();
			}
			throw new GameStorageException("Snapshot read from " + streamName + " failed", e.getCause());
		} catch (TimeoutException e) {
			throw new GameStorageException("Snapshot read from " + streamName + " timed out", e);
		}

		List<ResolvedEvent> events = result.getEvents();
		if (events.isEmpty()) {
			return Optional.empty();
		}
		RecordedEvent recorded = events.get(0).getEvent();
		SnapshotTag tag = GameStateCodec.parseSnapshotType(recorded.getEventType());
		if (tag == null) {
			log.warn(">>> [Snapshot] {} 的最新紀錄型別 {} 無法辨識，視為沒有快照", streamName, recorded.getEventType());
			return Optional.empty();
		}
		return Optional.of(GameSnapshot.builder().gameId(gameId).lastEventVersion(tag.version()).guard(tag.guard())
				.state(stateCodec.decode(recorded.getEventData()))
				.createdAt(LocalDateTime.ofInstant(recorded.getCreated(), ZoneId.systemDefault())).build());
	}
}
