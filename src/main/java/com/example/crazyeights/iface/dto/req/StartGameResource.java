package com.example.crazyeights.iface.dto.req;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 開局請求
 */
@Data
public class StartGameResource {

	/**
	 * 人數下限由領域規則檢查，這裡只要求必填
	 */
	@NotNull(message = "必須指定人數")
	private Integer players;

	/**
	 * 牌面記號，例如 {@code 6C}
	 */
	@NotBlank(message = "必須指定第一張牌")
	private String firstCard;
}
