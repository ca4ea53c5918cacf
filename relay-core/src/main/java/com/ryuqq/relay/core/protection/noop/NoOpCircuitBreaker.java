package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerMetrics;
import com.ryuqq.relay.core.protection.CircuitBreakerState;

import java.time.Instant;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 호출을 허용하며 상태를 추적하지 않습니다. {@link #isolate()}도 무시됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    @Override
    public String getName() {
        return "noop";
    }

    @Override
    public long tryAcquire() {
        return 1L;
    }

    @Override
    public void recordSuccess(long stamp, long durationNanos) {
        // NoOp
    }

    @Override
    public void recordFailure(long stamp, long durationNanos, Throwable throwable) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerMetrics getMetrics() {
        return new CircuitBreakerMetrics(CircuitBreakerState.CLOSED, 0, 0, 0, 0, 0, 0, 0, 0.0, 0.0, Instant.EPOCH);
    }

    @Override
    public void reset() {
        // NoOp
    }

    @Override
    public void isolate() {
        // NoOp
    }
}
