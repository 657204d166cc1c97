package com.example.crazyeights.iface.rest;

import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.crazyeights.application.domain.game.exception.GameDecisionException;
import com.example.crazyeights.application.domain.game.exception.TooFewPlayersException;
import com.example.crazyeights.application.shared.exception.GameConcurrencyException;
import com.example.crazyeights.application.shared.exception.GameStorageException;
import com.example.crazyeights.application.shared.exception.InvalidCommandException;
import com.example.crazyeights.iface.dto.res.GameErrorResource;

import lombok.extern.slf4j.Slf4j;

/**
 * 例外與 HTTP 狀態碼的對應
 *
 * <pre>
 * 400 格式錯誤的指令、牌面或人數
 * 409 協議違規 (已開局 / 未開局)、重試用盡仍衝突
 * 503 日誌或資料庫無法存取
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GameExceptionHandler {

	@ExceptionHandler({ InvalidCommandException.class, TooFewPlayersException.class })
	public ResponseEntity<GameErrorResource> handleInvalidCommand(RuntimeException e) {
		return respond(HttpStatus.BAD_REQUEST, e.getMessage());
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ResponseEntity<GameErrorResource> handleValidation(MethodArgumentNotValidException e) {
		String message = e.getBindingResult().getFieldErrors().stream().map(f -> f.getField() + ": " + f.getDefaultMessage())
				.reduce((a, b) -> a + ", " + b).orElse("Invalid request");
		return respond(HttpStatus.BAD_REQUEST, message);
	}

	@ExceptionHandler(GameDecisionException.class)
	public ResponseEntity<GameErrorResource> handleDecision(GameDecisionException e) {
		return respond(HttpStatus.CONFLICT, e.getReason() + ": " + e.getMessage());
	}

	@ExceptionHandler(GameConcurrencyException.class)
	public ResponseEntity<GameErrorResource> handleConcurrency(GameConcurrencyException e) {
		log.warn(">>> [Concurrency] {}", e.getMessage());
		return respond(HttpStatus.CONFLICT, e.getMessage());
	}

	@ExceptionHandler({ GameStorageException.class, DataAccessException.class })
	public ResponseEntity<GameErrorResource> handleStorage(RuntimeException e) {
		log.error(">>> [Storage] 儲存層無法存取: {}", e.getMessage(), e);
		return respond(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable");
	}

	private static ResponseEntity<GameErrorResource> respond(HttpStatus status, String message) {
		return ResponseEntity.status(status).body(new GameErrorResource(String.valueOf(status.value()), message));
	}
}
