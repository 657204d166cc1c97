package com.example.crazyeights.application.shared.dto;

import java.util.List;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.domain.game.event.GameEvent;
import com.example.crazyeights.application.domain.game.state.GameState;

import lombok.Value;

/**
 * 指令成功寫入後的結果
 */
@Value
public class CommandResult {

	GameId gameId;

	List<GameEvent> events;

	long version;

	GameState state;
}
