package com.example.crazyeights.application.port;

import java.util.Optional;

import com.example.crazyeights.application.projection.ProjectionCheckpoint;

/**
 * 投影進度 (Checkpoint) 存取埠
 */
public interface ProjectionCheckpointRepositoryPort {

	Optional<ProjectionCheckpoint> find(String projectionName);

	/**
	 * 必須與該投影的讀取模型異動在同一交易中執行
	 */
	void save(ProjectionCheckpoint checkpoint);
}
