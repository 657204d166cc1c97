package com.example.crazyeights.iface.rest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;
import com.example.crazyeights.application.domain.game.aggregate.vo.Players;
import com.example.crazyeights.application.domain.game.command.GameCommand;
import com.example.crazyeights.application.domain.game.command.PlayCard;
import com.example.crazyeights.application.domain.game.command.StartGame;
import com.example.crazyeights.application.domain.game.state.GameState;
import com.example.crazyeights.application.domain.game.state.Started;
import com.example.crazyeights.application.service.GameCommandService;
import com.example.crazyeights.application.service.GameQueryService;
import com.example.crazyeights.application.shared.dto.CommandResult;
import com.example.crazyeights.application.shared.dto.LoadedGame;
import com.example.crazyeights.application.shared.exception.InvalidCommandException;
import com.example.crazyeights.application.shared.notation.GameCommandParser;
import com.example.crazyeights.application.shared.notation.GameEventPrinter;
import com.example.crazyeights.iface.dto.req.PlayCardResource;
import com.example.crazyeights.iface.dto.req.StartGameResource;
import com.example.crazyeights.iface.dto.req.TextCommandResource;
import com.example.crazyeights.iface.dto.res.CardCountQueriedResource;
import com.example.crazyeights.iface.dto.res.GameCommandedResource;
import com.example.crazyeights.iface.dto.res.GameQueriedResource;
import com.example.crazyeights.iface.dto.res.GameStateView;
import com.example.crazyeights.iface.dto.res.TurnsSinceLastErrorQueriedResource;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;

/**
 * 牌局指令與查詢控制器
 *
 * <p>
 * <ul>
 * <li><b>Command Side</b>: POST 接口將請求轉為領域指令，同步交由 {@link GameCommandService} 決策並寫入日誌。</li>
 * <li><b>Query Side</b>: 牌局狀態由日誌重建；計數類查詢直接讀取投影後的讀取模型，可能略為落後。</li>
 * </ul>
 * </p>
 */
@RestController
@AllArgsConstructor
@RequestMapping("/games")
public class GameController {

	private final GameCommandService commandService;
	private final GameQueryService queryService;

	@PostMapping("/{id}/start")
	public ResponseEntity<GameCommandedResource> start(@PathVariable int id,
			@Valid @RequestBody StartGameResource request) {
		Card firstCard = GameCommandParser.parseCard(request.getFirstCard());
		return dispatch(id, new StartGame(Players.of(request.getPlayers()), firstCard));
	}

	@PostMapping("/{id}/play")
	public ResponseEntity<GameCommandedResource> play(@PathVariable int id,
			@Valid @RequestBody PlayCardResource request) {
		Card card = GameCommandParser.parseCard(request.getCard());
		return dispatch(id, new PlayCard(PlayerId.of(request.getPlayer()), card));
	}

	/**
	 * 文字指令接口，語法同 {@link GameCommandParser}：{@code start <players> <card>} 或 {@code p <player> <card>}
	 */
	@PostMapping("/{id}/commands")
	public ResponseEntity<GameCommandedResource> command(@PathVariable int id,
			@Valid @RequestBody TextCommandResource request) {
		return dispatch(id, GameCommandParser.parse(request.getCommand()));
	}

	@GetMapping("/{id}")
	public ResponseEntity<GameQueriedResource> getGame(@PathVariable int id) {
		LoadedGame loaded = commandService.loadState(toGameId(id));
		return ResponseEntity.ok(new GameQueriedResource("200", "查詢成功", toView(loaded)));
	}

	@GetMapping("/{id}/card-count")
	public ResponseEntity<CardCountQueriedResource> getCardCount(@PathVariable int id) {
		GameId gameId = toGameId(id);
		return ResponseEntity.ok(new CardCountQueriedResource("200", "查詢成功", id, queryService.getCardCount(gameId)));
	}

	@GetMapping("/{id}/turns-since-last-error")
	public ResponseEntity<TurnsSinceLastErrorQueriedResource> getTurnsSinceLastError(@PathVariable int id) {
		Map<Integer, Integer> turns = new LinkedHashMap<>();
		queryService.getTurnsSinceLastError(toGameId(id)).forEach((player, count) -> turns.put(player.getValue(), count));
		return ResponseEntity.ok(new TurnsSinceLastErrorQueriedResource("200", "查詢成功", id, turns));
	}

	private ResponseEntity<GameCommandedResource> dispatch(int id, GameCommand command) {
		CommandResult result = commandService.submit(toGameId(id), command);
		List<String> events = result.getEvents().stream().map(GameEventPrinter::print).toList();
		return ResponseEntity.ok(new GameCommandedResource("200", "指令已受理", id, result.getVersion(), events));
	}

	private static GameId toGameId(int id) {
		if (id < 1) {
			throw new InvalidCommandException("Game id must be a positive integer");
		}
		return GameId.of(id);
	}

	private static GameStateView toView(LoadedGame loaded) {
		GameState state = loaded.getState();
		if (!state.isStarted()) {
			return new GameStateView(false, null, null, null, null, null, loaded.getVersion());
		}
		Started started = (Started) state;
		return new GameStateView(true, started.getPile().getTopCard().toNotation(),
				started.getPile().getSecondCard().map(Card::toNotation).orElse(null),
				started.getTable().getPlayers().getCount(), started.getTable().getPlayer().getValue(),
				started.getTable().getDirection().name(), loaded.getVersion());
	}
}
