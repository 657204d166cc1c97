package com.example.crazyeights.application.projection;

import java.util.Map;

import lombok.Value;

/**
 * 計數型投影對讀取模型下達的單一操作
 *
 * @param <K> 計數鍵
 */
@Value
public class CounterOperation<K> {

	public enum Kind {
		INCREMENT, RESET
	}

	Kind kind;

	K key;

	public static <K> CounterOperation<K> increment(K key) {
		return new CounterOperation<>(Kind.INCREMENT, key);
	}

	public static <K> CounterOperation<K> reset(K key) {
		return new CounterOperation<>(Kind.RESET, key);
	}

	/**
	 * 套用於記憶體中的狀態 (重建模式使用)
	 */
	public void applyTo(Map<K, Integer> counts) {
		switch (kind) {
		case INCREMENT -> counts.merge(key, 1, Integer::sum);
		case RESET -> counts.put(key, 0);
		}
	}
}
