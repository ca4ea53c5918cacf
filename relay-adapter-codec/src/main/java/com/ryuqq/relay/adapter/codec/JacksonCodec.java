package com.ryuqq.relay.adapter.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.relay.core.exception.SerializationException;
import com.ryuqq.relay.core.spi.Codec;

import java.io.IOException;

/**
 * Jackson 기반 JSON Codec.
 *
 * <p><strong>기본 ObjectMapper 설정:</strong></p>
 * <ul>
 *   <li>JavaTimeModule 등록, 날짜는 ISO-8601 문자열로 기록</li>
 *   <li>알 수 없는 속성은 무시 (발행자가 필드를 추가해도 기존 소비자가 동작)</li>
 * </ul>
 *
 * <p>Jackson 예외는 모두 {@link SerializationException}으로 변환됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class JacksonCodec implements Codec {

    private final ObjectMapper mapper;

    public JacksonCodec() {
        this(defaultMapper());
    }

    public JacksonCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * 기본 설정 ObjectMapper 생성.
     *
     * @return 새 ObjectMapper
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public byte[] serialize(Object message) {
        if (message == null) {
            throw new SerializationException("message cannot be null");
        }
        try {
            return mapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + message.getClass().getName(), e);
        }
    }

    @Override
    public <T> T deserialize(byte[] data, Class<T> type) {
        if (data == null) {
            throw new SerializationException("data cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        try {
            return mapper.readValue(data, type);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize " + type.getName(), e);
        }
    }

    public ObjectMapper getMapper() {
        return mapper;
    }
}
