package com.example.crazyeights.application.projection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.example.crazyeights.application.shared.eventlog.GlobalPosition;

import lombok.Getter;
import lombok.ToString;

/**
 * 追趕進度 (Catch-up State)
 * <p>
 * 由單一 {@link ProjectionRunner} 獨佔：記錄全域日誌的讀取位置，以及每個投影已提交的 Checkpoint。
 * 每次提交成功後才更新，因此中途中斷時不會遺失或虛報進度。
 * </p>
 */
@Getter
@ToString
public class CatchUpState {

	/**
	 * 下一次讀取全域日誌的起點 (含)
	 */
	private GlobalPosition readPosition;

	private final Map<String, GlobalPosition> checkpoints;

	public CatchUpState(Map<String, GlobalPosition> checkpoints) {
		this.checkpoints = new LinkedHashMap<>(checkpoints);
		this.readPosition = minimum(this.checkpoints);
	}

	public GlobalPosition checkpointOf(String projectionName) {
		return checkpoints.getOrDefault(projectionName, GlobalPosition.START);
	}

	public Map<String, GlobalPosition> getCheckpoints() {
		return Collections.unmodifiableMap(checkpoints);
	}

	/**
	 * 所有投影中最落後的進度
	 */
	public GlobalPosition minimumCheckpoint() {
		return minimum(checkpoints);
	}

	void committed(String projectionName, GlobalPosition position) {
		checkpoints.put(projectionName, position);
	}

	void readUpTo(GlobalPosition position) {
		if (position.isAfter(readPosition)) {
			readPosition = position;
		}
	}

	private static GlobalPosition minimum(Map<String, GlobalPosition> checkpoints) {
		return checkpoints.values().stream().reduce(GlobalPosition::min).orElse(GlobalPosition.START);
	}
}
