package com.example.crazyeights.infra.event.codec;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Direction;
import com.example.crazyeights.application.domain.game.aggregate.vo.Pile;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;
import com.example.crazyeights.application.domain.game.aggregate.vo.Players;
import com.example.crazyeights.application.domain.game.aggregate.vo.Table;
import com.example.crazyeights.application.domain.game.state.GameState;
import com.example.crazyeights.application.domain.game.state.Started;
import com.example.crazyeights.infra.event.payload.GameStatePayload;
import com.example.crazyeights.infra.event.payload.GameStatePayload.StartedPayload;

import lombok.RequiredArgsConstructor;

/**
 * 快照狀態編解碼器
 * <p>
 * 快照事件的型別標籤格式為 {@code <version>-<guard>}，Payload 為 {@link GameStatePayload} JSON。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class GameStateCodec {

	private static final Pattern SNAPSHOT_TYPE = Pattern.compile("^(\\d+?)-(.*)$");

	private final EventJsonCodec<GameStatePayload> stateCodec;

	/**
	 * 快照標籤中解析出的版本與 Guard
	 */
	public record SnapshotTag(long version, String guard) {
	}

	public static String snapshotType(long version, String guard) {
		return version + "-" + guard;
	}

	/**
	 * @return 格式不符時為 null
	 */
	public static SnapshotTag parseSnapshotType(String eventType) {
		Matcher m = SNAPSHOT_TYPE.matcher(eventType == null ? "" : eventType);
		if (!m.matches()) {
			return null;
		}
		return new SnapshotTag(Long.parseLong(m.group(1)), m.group(2));
	}

	public byte[] encode(GameState state) {
		return stateCodec.serialize(toPayload(state));
	}

	public String encodeAsString(GameState state) {
		return new String(encode(state), StandardCharsets.UTF_8);
	}

	/**
	 * @throws IllegalStateException JSON 損毀
	 * @throws IllegalArgumentException 牌面記號或人數不合法
	 */
	public GameState decode(byte[] data) {
		return fromPayload(stateCodec.deserialize(data));
	}

	public GameState decode(String json) {
		return decode(json.getBytes(StandardCharsets.UTF_8));
	}

	private static GameStatePayload toPayload(GameState state) {
		if (!state.isStarted()) {
			return new GameStatePayload(null);
		}
		Started started = (Started) state;
		Pile pile = started.getPile();
		Table table = started.getTable();
		return new GameStatePayload(new StartedPayload(pile.getTopCard().toNotation(),
				pile.getSecondCard().map(Card::toNotation).orElse(null), table.getPlayers().getCount(),
				table.getPlayer().getValue(), table.getDirection() == Direction.CLOCKWISE ? 1 : 0));
	}

	private static GameState fromPayload(GameStatePayload payload) {
		StartedPayload s = payload == null ? null : payload.getStarted();
		if (s == null) {
			return GameState.initial();
		}
		Pile pile = new Pile(Card.parse(s.getTopCard()), s.getSecondCard() == null ? null : Card.parse(s.getSecondCard()));
		Table table = new Table(Players.of(s.getPlayers()), PlayerId.of(s.getPlayer()),
				Integer.valueOf(1).equals(s.getDirection()) ? Direction.CLOCKWISE : Direction.COUNTER_CLOCKWISE);
		return new Started(pile, table);
	}
}
