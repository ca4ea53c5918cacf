package com.ryuqq.relay.core.exception;

/**
 * 트랜스포트 호출 실패.
 *
 * <p>재시도 가능 여부에 따라 {@link TransientTransportException} 또는
 * {@link PermanentTransportException}으로 구분됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public abstract class TransportException extends RelayException {

    private final String destination;

    protected TransportException(String destination, String message, Throwable cause) {
        super(message, cause);
        this.destination = destination;
    }

    /**
     * 실패한 호출의 대상.
     *
     * @return destination (알 수 없으면 null)
     */
    public String getDestination() {
        return destination;
    }
}
