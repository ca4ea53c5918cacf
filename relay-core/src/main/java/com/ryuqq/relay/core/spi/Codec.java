package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.exception.SerializationException;

/**
 * 메시지 직렬화 Codec SPI.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface Codec {

    /**
     * 객체 직렬화.
     *
     * @param message 직렬화 대상
     * @return 직렬화된 바이트
     * @throws SerializationException 직렬화 실패 시
     */
    byte[] serialize(Object message);

    /**
     * 역직렬화.
     *
     * @param data 직렬화된 바이트
     * @param type 대상 타입
     * @param <T> 대상 타입
     * @return 역직렬화된 객체
     * @throws SerializationException 역직렬화 실패 시
     */
    <T> T deserialize(byte[] data, Class<T> type);

    /**
     * 타입의 태그 (Envelope 헤더에 기록됨).
     *
     * @param type 메시지 타입
     * @return 타입 태그
     */
    default String typeTag(Class<?> type) {
        return type.getName();
    }
}
