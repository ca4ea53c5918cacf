package com.ryuqq.relay.core.exception;

/**
 * Relay 파이프라인 예외의 최상위 타입.
 *
 * <p>파이프라인의 모든 오류는 unchecked 예외로 전파됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class RelayException extends RuntimeException {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
