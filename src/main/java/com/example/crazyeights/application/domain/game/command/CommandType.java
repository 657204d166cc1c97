package com.example.crazyeights.application.domain.game.command;

/**
 * 指令類型
 */
public enum CommandType {
	START_GAME, PLAY_CARD
}
