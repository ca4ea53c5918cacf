package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.protection.BackpressureController;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.protection.Permit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOp 보호 구현 유닛 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("NoOp 보호 구현 테스트")
class NoOpProtectionTest {

    @Test
    @DisplayName("NoOpCircuitBreaker는 isolate 후에도 항상 호출을 허용")
    void noOpCircuitBreaker_항상_허용() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();
        AtomicInteger calls = new AtomicInteger();

        // when
        cb.isolate();
        String result = cb.execute(() -> {
            calls.incrementAndGet();
            return "ok";
        });

        // then
        assertEquals("ok", result);
        assertEquals(1, calls.get());
        assertNotEquals(CircuitBreaker.NOT_PERMITTED, cb.tryAcquire());
        assertEquals(CircuitBreakerState.CLOSED, cb.getState());
        assertEquals(0, cb.getMetrics().totalCalls());
    }

    @Test
    @DisplayName("NoOpCircuitBreaker execute는 작업 예외를 그대로 전파")
    void noOpCircuitBreaker_예외_전파() {
        // given
        CircuitBreaker cb = new NoOpCircuitBreaker();

        // when & then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> cb.run(() -> {
                throw new IllegalStateException("boom");
            })
        );
        assertEquals("boom", exception.getMessage());
    }

    @Test
    @DisplayName("NoOpBackpressureController는 항상 permit 발급")
    void noOpBackpressure_항상_허용() {
        // given
        BackpressureController controller = new NoOpBackpressureController();

        // when & then
        for (int i = 0; i < 1_000; i++) {
            Permit permit = controller.acquire("publish:orders");
            assertNotNull(permit);
            assertDoesNotThrow(permit::close);
        }
        assertEquals(0, controller.getInFlight());
        assertEquals(Integer.MAX_VALUE, controller.getConfig().maxInflight());
        assertEquals(0, controller.getMetrics().rejected());
    }
}
