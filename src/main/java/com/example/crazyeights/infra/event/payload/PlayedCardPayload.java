package com.example.crazyeights.infra.event.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 四種出牌事件共用的 JSON 格式，由事件型別標籤區分語意
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayedCardPayload {

	@JsonProperty("Player")
	private Integer player;

	@JsonProperty("Card")
	private String card;

	@JsonProperty("Effect")
	private String effect;
}
