package com.ryuqq.relay.core.exception;

/**
 * 백프레셔 진입 거부.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class BackpressureRejectedException extends RelayException {

    private final String operation;

    public BackpressureRejectedException(String operation, String reason) {
        super("Admission rejected for '" + operation + "': " + reason);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
