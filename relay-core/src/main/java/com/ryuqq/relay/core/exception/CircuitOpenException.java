package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker가 호출을 차단함.
 *
 * <p>이 예외가 발생한 경우 보호 대상 호출은 시도되지 않았습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class CircuitOpenException extends RelayException {

    private final String breakerName;
    private final CircuitBreakerState state;

    public CircuitOpenException(String breakerName, CircuitBreakerState state) {
        super("Circuit breaker '" + breakerName + "' is " + state + ", call not permitted");
        this.breakerName = breakerName;
        this.state = state;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public CircuitBreakerState getState() {
        return state;
    }
}
