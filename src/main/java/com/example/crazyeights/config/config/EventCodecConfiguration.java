package com.example.crazyeights.config.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.crazyeights.infra.event.codec.EventJsonCodec;
import com.example.crazyeights.infra.event.payload.GameStartedPayload;
import com.example.crazyeights.infra.event.payload.GameStatePayload;
import com.example.crazyeights.infra.event.payload.PlayedCardPayload;

import tools.jackson.databind.ObjectMapper;

/**
 * EventCodec 的配置類
 * <p>
 * 用來配置可轉換的 Payload 類型
 * </p>
 */
@Configuration
public class EventCodecConfiguration {

	@Bean
	public EventJsonCodec<GameStartedPayload> gameStartedJsonCodec(ObjectMapper objectMapper) {
		return new EventJsonCodec<>(objectMapper, GameStartedPayload.class);
	}

	/**
	 * CardPlayed / WrongCardPlayed / WrongPlayerPlayed / InterruptMissed 共用
	 */
	@Bean
	public EventJsonCodec<PlayedCardPayload> playedCardJsonCodec(ObjectMapper objectMapper) {
		return new EventJsonCodec<>(objectMapper, PlayedCardPayload.class);
	}

	/**
	 * 快照狀態
	 */
	@Bean
	public EventJsonCodec<GameStatePayload> gameStateJsonCodec(ObjectMapper objectMapper) {
		return new EventJsonCodec<>(objectMapper, GameStatePayload.class);
	}
}
