package com.ryuqq.relay.core.exception;

/**
 * 일시적 트랜스포트 오류 (로컬 재시도 대상).
 *
 * <p>예시: 연결 끊김, 브로커 리더 재선출, 요청 타임아웃.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class TransientTransportException extends TransportException {

    public TransientTransportException(String destination, String message) {
        super(destination, message, null);
    }

    public TransientTransportException(String destination, String message, Throwable cause) {
        super(destination, message, cause);
    }
}
