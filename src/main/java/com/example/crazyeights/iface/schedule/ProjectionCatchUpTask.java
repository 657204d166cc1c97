package com.example.crazyeights.iface.schedule;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.crazyeights.application.projection.ProjectionRunner;
import com.example.crazyeights.application.shared.dto.GameEventsAppended;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 投影追趕排程
 * <p>
 * 啟動完成後執行一次 (重建或增量)，之後定時輪詢，並在每次指令寫入成功後立即追趕。 失敗只記錄日誌，進度未提交的部分下一輪重試。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProjectionCatchUpTask {

	private final ProjectionRunner runner;

	@EventListener(ApplicationReadyEvent.class)
	public void start() {
		try {
			runner.start();
		} catch (Exception e) {
			log.error(">>> [Projection] 啟動追趕失敗，等待下一輪輪詢: {}", e.getMessage(), e);
		}
	}

	@Scheduled(fixedDelayString = "${crazyeights.projection.poll-interval-ms:1000}", initialDelayString = "${crazyeights.projection.poll-interval-ms:1000}")
	public void poll() {
		catchUp();
	}

	@EventListener
	public void onEventsAppended(GameEventsAppended appended) {
		log.debug(">>> [Projection] 牌局 {} 寫入至版本 {}，立即追趕", appended.getGameId(), appended.getVersion());
		catchUp();
	}

	private void catchUp() {
		try {
			runner.catchUp();
		} catch (Exception e) {
			log.error(">>> [Projection] 追趕過程發生異常: {}", e.getMessage(), e);
		}
	}
}
