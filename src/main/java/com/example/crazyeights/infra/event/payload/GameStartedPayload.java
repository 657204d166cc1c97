package com.example.crazyeights.infra.event.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code GameStarted} 事件的 JSON 格式。欄位名稱已寫入歷史事件，不可更改。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GameStartedPayload {

	@JsonProperty("Players")
	private Integer players;

	@JsonProperty("FirstCard")
	private String firstCard;

	@JsonProperty("Effect")
	private String effect;
}
