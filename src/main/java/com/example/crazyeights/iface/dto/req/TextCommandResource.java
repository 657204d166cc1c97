package com.example.crazyeights.iface.dto.req;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 文字指令請求，例如 {@code start 4 3C} 或 {@code p 1 3S}
 */
@Data
public class TextCommandResource {

	@NotBlank(message = "指令不可為空")
	private String command;
}
