package com.ryuqq.relay.core.exception;

/**
 * 직렬화/역직렬화, 압축 해제 또는 스키마 검증 실패.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class SerializationException extends RelayException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
