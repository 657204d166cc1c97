package com.example.crazyeights.iface.dto.req;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 出牌請求
 */
@Data
public class PlayCardResource {

	@NotNull(message = "必須指定玩家")
	@Min(value = 0, message = "玩家編號不可為負數")
	private Integer player;

	@NotBlank(message = "必須指定牌面")
	private String card;
}
