package com.example.crazyeights.iface.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import com.example.crazyeights.application.domain.game.aggregate.vo.GameId;
import com.example.crazyeights.application.projection.ProjectionRunner;
import com.example.crazyeights.application.shared.dto.GameEventsAppended;
import com.example.crazyeights.application.shared.exception.GameStorageException;

@ExtendWith({ MockitoExtension.class, OutputCaptureExtension.class })
class ProjectionCatchUpTaskTest {

	@Mock
	private ProjectionRunner runner;
	@InjectMocks
	private ProjectionCatchUpTask task;

	@Test
	@DisplayName("啟動失敗只記錄日誌，不中斷應用程式啟動")
	void startFailureIsLogged() {
		when(runner.start()).thenThrow(new GameStorageException("MySQL down", null));

		assertThatCode(task::start).doesNotThrowAnyException();
	}

	@Test
	@DisplayName("寫入通知與輪詢都觸發增量追趕，失敗時下一輪重試")
	void appendedEventsTriggerCatchUp() {
		when(runner.catchUp()).thenThrow(new GameStorageException("MySQL down", null)).thenReturn(null);

		task.onEventsAppended(new GameEventsAppended(GameId.of(1), List.of(), 0));
		task.poll();

		verify(runner, times(2)).catchUp();
	}

	@Test
	@DisplayName("背景執行緒輪詢時最終會呼叫追趕")
	void pollsFromBackgroundThread() {
		Thread poller = new Thread(task::poll, "projection-poller");
		poller.start();

		Awaitility.await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(runner).catchUp());
	}

	@Test
	@DisplayName("追趕失敗時日誌保留完整的例外堆疊")
	void catchUpFailureLogsStackTrace(CapturedOutput output) {
		when(runner.catchUp()).thenThrow(new GameStorageException("MySQL down", new IllegalStateException("pool exhausted")));

		task.poll();

		assertThat(output).contains("MySQL down").contains(GameStorageException.class.getName())
				.contains("pool exhausted");
	}
}
