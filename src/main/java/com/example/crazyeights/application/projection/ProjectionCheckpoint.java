package com.example.crazyeights.application.projection;

import com.example.crazyeights.application.shared.eventlog.GlobalPosition;

import lombok.Value;

/**
 * 投影進度：投影名稱、讀取模型的 Guard 與最後套用的全域位置
 */
@Value
public class ProjectionCheckpoint {

	String projectionName;

	String guard;

	GlobalPosition position;
}
