package com.example.crazyeights.infra.event.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 快照中的牌局狀態。{@code Started} 為 null 代表尚未開局。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameStatePayload {

	@JsonProperty("Started")
	private StartedPayload started;

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class StartedPayload {

		@JsonProperty("TopCard")
		private String topCard;

		/**
		 * 開局後尚未有人出牌時為 null
		 */
		@JsonProperty("SecondCard")
		private String secondCard;

		@JsonProperty("Players")
		private Integer players;

		@JsonProperty("Player")
		private Integer player;

		/**
		 * 1 = 順時針，0 = 逆時針
		 */
		@JsonProperty("Direction")
		private Integer direction;
	}
}
