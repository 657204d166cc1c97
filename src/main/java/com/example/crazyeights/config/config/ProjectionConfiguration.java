package com.example.crazyeights.config.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.crazyeights.application.port.CardCountRepositoryPort;
import com.example.crazyeights.application.port.GameEventLogPort;
import com.example.crazyeights.application.port.ProjectionCheckpointRepositoryPort;
import com.example.crazyeights.application.port.TurnsSinceLastErrorRepositoryPort;
import com.example.crazyeights.application.projection.CardCountProjection;
import com.example.crazyeights.application.projection.GameProjection;
import com.example.crazyeights.application.projection.ProjectionRunner;
import com.example.crazyeights.application.projection.TurnsSinceLastErrorProjection;

/**
 * <h1>投影配置 (Projection Configuration)</h1>
 * <p>
 * 組裝具名投影與單一的 {@link ProjectionRunner}。每個投影的 Guard 可個別設定， 變更 Guard 即代表讀取模型格式改變，下次啟動時會自動重建。
 * </p>
 */
@Configuration
public class ProjectionConfiguration {

	@Bean
	public CardCountProjection cardCountProjection(@Value("${crazyeights.projection.card-count.guard:v2}") String guard,
			CardCountRepositoryPort store, ProjectionCheckpointRepositoryPort checkpoints) {
		return new CardCountProjection(guard, store, checkpoints);
	}

	@Bean
	public TurnsSinceLastErrorProjection turnsSinceLastErrorProjection(
			@Value("${crazyeights.projection.turns-since-last-error.guard:v2}") String guard,
			TurnsSinceLastErrorRepositoryPort store, ProjectionCheckpointRepositoryPort checkpoints) {
		return new TurnsSinceLastErrorProjection(guard, store, checkpoints);
	}

	/**
	 * 整個應用程式只有一個 Runner，確保全域日誌的單一循序消費
	 */
	@Bean
	public ProjectionRunner projectionRunner(GameEventLogPort eventLog, List<GameProjection> projections,
			PlatformTransactionManager transactionManager,
			@Value("${crazyeights.projection.page-size:500}") int pageSize) {
		return new ProjectionRunner(eventLog, projections, new TransactionTemplate(transactionManager), pageSize);
	}
}
