package com.example.crazyeights.infra.adapter;

import java.util.Optional;

import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import com.example.crazyeights.application.port.ProjectionCheckpointRepositoryPort;
import com.example.crazyeights.application.projection.ProjectionCheckpoint;
import com.example.crazyeights.application.shared.eventlog.GlobalPosition;

import lombok.RequiredArgsConstructor;

/**
 * 投影進度表 {@code projection_checkpoints}，每個投影一筆。
 */
@Repository
@RequiredArgsConstructor
public class JdbcProjectionCheckpointAdapter implements ProjectionCheckpointRepositoryPort {

	private final JdbcTemplate jdbcTemplate;

	@Override
	public Optional<ProjectionCheckpoint> find(String projectionName) {
		String sql = "SELECT projection_name, guard, last_commit, last_prepare FROM projection_checkpoints WHERE projection_name = ?";
		try {
			return Optional.ofNullable(jdbcTemplate.queryForObject(sql,
					(rs, rowNum) -> new ProjectionCheckpoint(rs.getString("projection_name"), rs.getString("guard"),
							new GlobalPosition(rs.getLong("last_commit"), rs.getLong("last_prepare"))),
					projectionName));
		} catch (EmptyResultDataAccessException e) {
			return Optional.empty();
		}
	}

	@Override
	public void save(ProjectionCheckpoint checkpoint) {
		GlobalPosition pos = checkpoint.getPosition();
		int updated = jdbcTemplate.update(
				"UPDATE projection_checkpoints SET guard = ?, last_commit = ?, last_prepare = ? WHERE projection_name = ?",
				checkpoint.getGuard(), pos.getCommit(), pos.getPrepare(), checkpoint.getProjectionName());
		if (updated == 0) {
			jdbcTemplate.update(
					"INSERT INTO projection_checkpoints (projection_name, guard, last_commit, last_prepare) VALUES (?, ?, ?, ?)",
					checkpoint.getProjectionName(), checkpoint.getGuard(), pos.getCommit(), pos.getPrepare());
		}
	}
}
