package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.MessageId;
import com.ryuqq.relay.core.model.SagaId;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 예외 분류 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class SagaCompensationFailedExceptionTest {

    @Test
    void constructor_KeepsTriggerAndAllCompensationErrors() {
        // Given
        SagaStepFailedException trigger = new SagaStepFailedException(
            SagaId.of("s-1"), "ship", 2, new IllegalStateException("carrier down"));
        List<Throwable> errors = new ArrayList<>(List.of(
            new IllegalStateException("refund failed"),
            new IllegalStateException("release failed")
        ));

        // When
        SagaCompensationFailedException exception =
            new SagaCompensationFailedException(SagaId.of("s-1"), trigger, errors);
        errors.clear();

        // Then
        assertSame(trigger, exception.getTriggeringError());
        assertSame(trigger, exception.getCause());
        assertEquals(2, exception.getCompensationErrors().size());
        assertEquals(2, exception.getSuppressed().length);
        assertTrue(exception.getMessage().contains("failed to compensate 2 step(s)"));
        assertEquals("ship", trigger.getStepName());
        assertEquals(2, trigger.getStepIndex());
    }

    @Test
    void taxonomy_AllExtendRelayException() {
        assertInstanceOf(RelayException.class, new TransientTransportException("orders", "timeout"));
        assertInstanceOf(TransportException.class, new PermanentTransportException("orders", "denied"));
        assertInstanceOf(RelayException.class, new CircuitOpenException("relay-orders", CircuitBreakerState.OPEN));
        assertInstanceOf(RelayException.class, new BackpressureRejectedException("publish:orders", "full"));
        assertInstanceOf(RelayException.class, new SerializationException("bad json"));
        assertInstanceOf(RelayException.class, new SagaNotFoundException(SagaId.of("s-1")));
        assertInstanceOf(RelayException.class, new ConcurrencyConflictException(SagaId.of("s-1"), 1, 2));
        assertInstanceOf(RelayException.class,
            new PoisonMessageQuarantinedException("orders", MessageId.of("m-1"), 3, new IllegalStateException()));
    }

    @Test
    void messages_DescribeContext() {
        assertEquals("orders", new TransientTransportException("orders", "timeout").getDestination());
        assertTrue(new CircuitOpenException("relay-orders", CircuitBreakerState.OPEN).getMessage()
            .contains("'relay-orders' is OPEN"));
        assertTrue(new ConcurrencyConflictException(SagaId.of("s-1"), 1, 2).getMessage()
            .contains("expected: 1, actual: 2"));
        assertEquals("publish:orders", new BackpressureRejectedException("publish:orders", "full").getOperation());
    }
}
