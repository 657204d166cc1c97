package com.example.crazyeights.infra.event.codec;

import tools.jackson.databind.ObjectMapper;

/**
 * 泛型 JSON 編解碼器
 *
 * <p>
 * 負責將事件或快照的 Payload 與 JSON byte[] 之間互相轉換，完全獨立於 EventStore 與投影。
 * </p>
 *
 * <p>
 * 支援泛型 T，使同一套 Codec 可重用於不同的 Payload 類型。序列化/反序列化失敗均拋出 {@link IllegalStateException}，
 * 是否容忍由呼叫端決定。
 * </p>
 */
public class EventJsonCodec<T> {

	private final ObjectMapper objectMapper;
	private final Class<T> type;

	/**
	 * 建構泛型 Codec
	 *
	 * @param objectMapper Jackson ObjectMapper
	 * @param type         Payload 類型
	 */
	public EventJsonCodec(ObjectMapper objectMapper, Class<T> type) {
		this.objectMapper = objectMapper;
		this.type = type;
	}

	/**
	 * 將 Payload 序列化為 JSON byte[]
	 */
	public byte[] serialize(T payload) {
		try {
			return objectMapper.writeValueAsBytes(payload);
		} catch (Exception e) {
			throw new IllegalStateException(type.getSimpleName() + " JSON 序列化失敗", e);
		}
	}

	/**
	 * 將 JSON byte[] 反序列化回 Payload
	 */
	public T deserialize(byte[] data) {
		try {
			return objectMapper.readValue(data, type);
		} catch (Exception e) {
			throw new IllegalStateException(type.getSimpleName() + " JSON 反序列化失敗", e);
		}
	}
}
