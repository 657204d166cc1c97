package com.example.crazyeights.infra.adapter;

import static com.example.crazyeights.support.GameFixtures.card;
import static com.example.crazyeights.support.GameFixtures.player;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.eventstore.dbclient.AppendToStreamOptions;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.Position;
import com.eventstore.dbclient.ReadAllOptions;
import com.eventstore.dbclient.ReadResult;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.eventstore.dbclient.StreamNotFoundException;
import com.eventstore.dbclient.WriteResult;
import com.eventstore.dbclient.WrongExpectedVersionException;
import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;
import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.event.CardPlayed;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.shared.eventlog.GameStreamSlice;
import com.example.crazyeights.application.shared.eventlog.GlobalLogSlice;
import com.example.crazyeights.application.shared.eventlog.GlobalPosition;
import com.example.crazyeights.application.shared.exception.GameStorageException;
import com.example.crazyeights.application.shared.exception.StreamVersionConflictException;
import com.example.crazyeights.infra.event.codec.EventJsonCodec;
import com.example.crazyeights.infra.event.codec.GameEventCodec;
import com.example.crazyeights.infra.event.mapper.GameEventMapper;
import com.example.crazyeights.infra.event.payload.GameStartedPayload;
import com.example.crazyeights.infra.event.payload.PlayedCardPayload;

import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * EventStoreDB 轉接器的錯誤轉譯與分頁判斷，以 Mock Client 驗證
 */
@ExtendWith(MockitoExtension.class)
class EventStoreGameEventLogAdapterTest {

	private static final String CARD_PLAYED_JSON = "{\"Player\":1,\"Card\":\"6H\",\"Effect\":\"next\"}";

	@Mock
	private EventStoreDBClient client;

	private EventStoreGameEventLogAdapter adapter;
	private final GameId gameId = GameId.of(1);

	@BeforeEach
	void setUp() {
		ObjectMapper mapper = JsonMapper.builder().build();
		GameEventCodec codec = new GameEventCodec(new EventJsonCodec<>(mapper, GameStartedPayload.class),
				new EventJsonCodec<>(mapper, PlayedCardPayload.class));
		adapter = new EventStoreGameEventLogAdapter(client, new GameEventMapper(codec), 1000);
	}

	@Test
	@DisplayName("追加成功時新版本為預期版本加上事件數")
	@SuppressWarnings("unchecked")
	void appendReturnsNewVersion() {
		WriteResult written = mock(WriteResult.class);
		when(client.appendToStream(eq("game-1"), any(AppendToStreamOptions.class), any(Iterator.class)))
				.thenReturn(CompletableFuture.completedFuture(written));

		long version = adapter.append(gameId, 3, List.of(new CardPlayed(player(1), card("6H"), Effect.NEXT)));

		assertThat(version).isEqualTo(4);
	}

	@Test
	@DisplayName("WrongExpectedVersionException 轉為可重試的版本衝突")
	@SuppressWarnings("unchecked")
	void wrongExpectedVersionBecomesConflict() {
		WrongExpectedVersionException conflict = mock(WrongExpectedVersionException.class);
		when(client.appendToStream(eq("game-1"), any(AppendToStreamOptions.class), any(Iterator.class)))
				.thenReturn(CompletableFuture.failedFuture(conflict));

		assertThatThrownBy(() -> adapter.append(gameId, -1, List.of(new CardPlayed(player(1), card("6H"), Effect.NEXT))))
				.isInstanceOfSatisfying(StreamVersionConflictException.class,
						e -> assertThat(e.getExpectedVersion()).isEqualTo(-1));
	}

	@Test
	@DisplayName("其他寫入失敗轉為儲存層例外")
	@SuppressWarnings("unchecked")
	void otherFailuresBecomeStorageErrors() {
		when(client.appendToStream(eq("game-1"), any(AppendToStreamOptions.class), any(Iterator.class)))
				.thenReturn(CompletableFuture.failedFuture(new IllegalStateException("connection refused")));

		assertThatThrownBy(() -> adapter.append(gameId, 0, List.of(new CardPlayed(player(1), card("6H"), Effect.NEXT))))
				.isInstanceOf(GameStorageException.class);
	}

	@Test
	@DisplayName("Stream 不存在時回傳空差量，版本維持不變")
	void missingStreamIsEmpty() {
		StreamNotFoundException notFound = mock(StreamNotFoundException.class);
		when(client.readStream(eq("game-1"), any(ReadStreamOptions.class)))
				.thenReturn(CompletableFuture.failedFuture(notFound));

		GameStreamSlice slice = adapter.readStream(gameId, -1);

		assertThat(slice.getEvents()).isEmpty();
		assertThat(slice.getLastVersion()).isEqualTo(-1);
	}

	@Test
	@DisplayName("讀取差量時版本取自最後一筆紀錄的 Revision")
	void readStreamTracksRevision() {
		ReadResult result = result(resolved("game-1", "CardPlayed", CARD_PLAYED_JSON, 5, 500));
		when(client.readStream(eq("game-1"), any(ReadStreamOptions.class)))
				.thenReturn(CompletableFuture.completedFuture(result));

		GameStreamSlice slice = adapter.readStream(gameId, 4);

		assertThat(slice.getEvents()).containsExactly(new CardPlayed(player(1), card("6H"), Effect.NEXT));
		assertThat(slice.getLastVersion()).isEqualTo(5);
	}

	/**
	 * <pre>
	 * <b>Given</b> 一頁 2 筆的 $all，其中一筆是無法解碼的系統事件
	 * <b>Then</b>  只回傳牌局事件，但最後位置與頁面是否讀滿以原始紀錄數判斷
	 * </pre>
	 */
	@Test
	@DisplayName("readAll 以原始紀錄數判斷是否已到日誌尾端")
	void readAllUsesRawCountForEndOfLog() {
		ReadResult full = result(resolved("game-1", "CardPlayed", CARD_PLAYED_JSON, 0, 100),
				resolved("$settings", "$metadata", "{}", 0, 200));
		when(client.readAll(any(ReadAllOptions.class))).thenReturn(CompletableFuture.completedFuture(full));

		GlobalLogSlice slice = adapter.readAll(GlobalPosition.START, 2);

		List<GameEvent> events = slice.getEvents().stream().map(e -> e.getEvent()).toList();
		assertThat(events).containsExactly(new CardPlayed(player(1), card("6H"), Effect.NEXT));
		assertThat(slice.getEvents().get(0).getStreamId()).isEqualTo("game-1");
		assertThat(slice.getLastPosition()).isEqualTo(new GlobalPosition(200, 200));
		assertThat(slice.isEndOfLog()).isFalse();
	}

	@Test
	@DisplayName("readAll 空頁時位置維持在起點並標記為尾端")
	void readAllEmptyPage() {
		ReadResult empty = result();
		when(client.readAll(any(ReadAllOptions.class))).thenReturn(CompletableFuture.completedFuture(empty));
		GlobalPosition from = new GlobalPosition(300, 300);

		GlobalLogSlice slice = adapter.readAll(from, 10);

		assertThat(slice.getEvents()).isEmpty();
		assertThat(slice.getLastPosition()).isEqualTo(from);
		assertThat(slice.isEndOfLog()).isTrue();
	}

	private static ReadResult result(ResolvedEvent... events) {
		ReadResult result = mock(ReadResult.class);
		when(result.getEvents()).thenReturn(List.of(events));
		return result;
	}

	private static ResolvedEvent resolved(String stream, String type, String json, long revision, long position) {
		RecordedEvent recorded = mock(RecordedEvent.class);
		lenient().when(recorded.getStreamId()).thenReturn(stream);
		lenient().when(recorded.getEventType()).thenReturn(type);
		lenient().when(recorded.getEventData()).thenReturn(json.getBytes(StandardCharsets.UTF_8));
		lenient().when(recorded.getRevision()).thenReturn(revision);
		lenient().when(recorded.getPosition()).thenReturn(new Position(position, position));
		ResolvedEvent resolved = mock(ResolvedEvent.class);
		lenient().when(resolved.getEvent()).thenReturn(recorded);
		return resolved;
	}
}
