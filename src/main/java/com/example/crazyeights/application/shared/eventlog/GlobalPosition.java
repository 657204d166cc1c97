package com.example.crazyeights.application.shared.eventlog;

import lombok.Value;

/**
 * 全域日誌位置 ($all 的 commit / prepare 位置)
 * <p>
 * 投影器以此作為 Checkpoint。{@link #START} 排在所有真實位置之前，代表「尚未套用任何事件」。
 * </p>
 */
@Value
public class GlobalPosition implements Comparable<GlobalPosition> {

	public static final GlobalPosition START = new GlobalPosition(-1L, -1L);

	long commit;

	long prepare;

	public boolean isStart() {
		return START.equals(this);
	}

	public boolean isAfter(GlobalPosition other) {
		return compareTo(other) > 0;
	}

	public static GlobalPosition min(GlobalPosition a, GlobalPosition b) {
		return a.compareTo(b) <= 0 ? a : b;
	}

	@Override
	public int compareTo(GlobalPosition other) {
		int byCommit = Long.compare(commit, other.commit);
		return byCommit != 0 ? byCommit : Long.compare(prepare, other.prepare);
	}

	@Override
	public String toString() {
		return isStart() ? "START" : commit + "/" + prepare;
	}
}
