package com.ryuqq.relay.core.exception;

/**
 * 영구적 트랜스포트 오류 (즉시 호출자에게 전파).
 *
 * <p>예시: 권한 없음, 존재하지 않는 destination, 메시지 크기 초과.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class PermanentTransportException extends TransportException {

    public PermanentTransportException(String destination, String message) {
        super(destination, message, null);
    }

    public PermanentTransportException(String destination, String message, Throwable cause) {
        super(destination, message, cause);
    }
}
