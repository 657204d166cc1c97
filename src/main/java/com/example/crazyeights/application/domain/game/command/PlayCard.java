package com.example.crazyeights.application.domain.game.command;

import com.example.crazyeights.application.domain.game.aggregate.vo.Card;
import com.example.crazyeights.application.domain.game.aggregate.vo.PlayerId;

import lombok.Value;

/**
 * 出牌指令
 */
@Value
public class PlayCard implements GameCommand {

	PlayerId player;

	Card card;

	@Override
	public CommandType getType() {
		return CommandType.PLAY_CARD;
	}
}
