package com.ryuqq.relay.core.retry;

import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.PermanentTransportException;
import com.ryuqq.relay.core.exception.RelayException;
import com.ryuqq.relay.core.exception.TransientTransportException;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicy / TransientErrorDetector 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class RetryPolicyTest {

    @Test
    void constructor_Defaults() {
        // When
        RetryPolicy policy = new RetryPolicy();

        // Then
        assertEquals(3, policy.maxAttempts());
        assertEquals(Duration.ofMillis(200), policy.initialDelay());
        assertEquals(BackoffStrategy.EXPONENTIAL, policy.strategy());
        assertEquals(1, RetryPolicy.noRetry().maxAttempts());
    }

    @Test
    void withInitialDelay_RaisesMaxDelayWhenNeeded() {
        // When
        RetryPolicy policy = new RetryPolicy().withMaxDelay(Duration.ofSeconds(1)).withInitialDelay(Duration.ofSeconds(5));

        // Then
        assertEquals(Duration.ofSeconds(5), policy.maxDelay());
    }

    @Test
    void constructor_InvalidValues_ThrowsException() {
        RetryPolicy policy = new RetryPolicy();

        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> policy.withMaxAttempts(0)
        );
        assertTrue(exception.getMessage().contains("maxAttempts must be positive (current: 0)"));
        assertThrows(IllegalArgumentException.class, () -> policy.withMaxDelay(Duration.ofMillis(1)));
        assertThrows(IllegalArgumentException.class, () -> policy.withJitterFactor(1.5));
        assertThrows(IllegalArgumentException.class, () -> policy.withStrategy(null));
    }

    @Test
    void defaultDetector_TransientInCauseChain_ReturnsTrue() {
        // Given
        TransientErrorDetector detector = TransientErrorDetector.defaultDetector();
        RuntimeException wrapped = new RelayException("publish failed",
            new TransientTransportException("orders", "connection reset"));

        // Then
        assertTrue(detector.isTransient(new TransientTransportException("orders", "timeout")));
        assertTrue(detector.isTransient(wrapped));
    }

    @Test
    void defaultDetector_PermanentOrCircuitOpen_ReturnsFalse() {
        // Given
        TransientErrorDetector detector = TransientErrorDetector.defaultDetector();

        // Then
        assertFalse(detector.isTransient(new PermanentTransportException("orders", "unknown destination")));
        assertFalse(detector.isTransient(new CircuitOpenException("relay-orders", CircuitBreakerState.OPEN)));
        assertFalse(detector.isTransient(new IllegalStateException("bug")));
        assertFalse(detector.isTransient(null));
    }
}
