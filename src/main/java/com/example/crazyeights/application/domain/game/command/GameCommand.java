package com.example.crazyeights.application.domain.game.command;

/**
 * 牌局指令 (封閉集合)
 */
public sealed interface GameCommand permits StartGame, PlayCard {

	CommandType getType();
}
