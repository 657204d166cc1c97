package com.example.crazyeights.application.domain.game.command;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.Players;

import lombok.Value;

/**
 * 開局指令：指定人數與第一張翻開的牌
 */
@Value
public class StartGame implements GameCommand {

	Players players;

	Card firstCard;

	@Override
	public CommandType getType() {
		return CommandType.START_GAME;
	}
}
