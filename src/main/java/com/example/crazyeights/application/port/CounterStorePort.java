package com.example.crazyeights.application.port;

import java.util.Map;

import com.example.crazyeights.application.projection.CounterOperation;

/**
 * 計數型讀取模型的存取埠
 * <p>
 * 所有方法都必須在呼叫端開啟的交易中執行，與 Checkpoint 一起提交。
 * </p>
 *
 * @param <K> 計數鍵
 */
public interface CounterStorePort<K> {

	/**
	 * 不存在時建立為 1
	 */
	void increment(K key);

	/**
	 * 不存在時建立為 0
	 */
	void reset(K key);

	Map<K, Integer> loadAll();

	/**
	 * 以整份狀態覆蓋目前資料 (重建模式)
	 */
	void replaceAll(Map<K, Integer> counts);

	default void apply(CounterOperation<K> operation) {
		switch (operation.getKind()) {
		case INCREMENT -> increment(operation.getKey());
		case RESET -> reset(operation.getKey());
		}
	}
}
