package com.example.crazyeights.application.domain.game.event;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Effect;
import com.example.crazyeights.application.domain.game.aggregate.vo.Players;

import lombok.Value;

@Value
public class GameStarted implements GameEvent {

	Players players;

	Card firstCard;

	Effect effect;

	@Override
	public GameEventType getType() {
		return GameEventType.GAME_STARTED;
	}
}
