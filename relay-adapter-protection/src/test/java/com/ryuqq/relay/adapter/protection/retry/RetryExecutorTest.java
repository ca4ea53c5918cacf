package com.ryuqq.relay.adapter.protection.retry;

import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.PermanentTransportException;
import com.ryuqq.relay.core.exception.RelayException;
import com.ryuqq.relay.core.exception.TransientTransportException;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.retry.BackoffStrategy;
import com.ryuqq.relay.core.retry.RetryPolicy;
import com.ryuqq.relay.core.retry.TransientErrorDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryExecutor 테스트.
 *
 * <p>Sleeper를 주입하여 실제 대기 없이 지연 시간만 기록합니다.</p>
 */
@DisplayName("RetryExecutor 테스트")
class RetryExecutorTest {

    private final List<Long> sleeps = new ArrayList<>();
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        RetryPolicy policy = new RetryPolicy()
            .withMaxAttempts(3)
            .withInitialDelay(Duration.ofMillis(100))
            .withStrategy(BackoffStrategy.EXPONENTIAL)
            .withJitterFactor(0.0);
        executor = new RetryExecutor(policy, TransientErrorDetector.defaultDetector(),
            new BackoffCalculator(policy), sleeps::add);
    }

    @Test
    @DisplayName("일시적 오류 후 성공하면 결과 반환")
    void 일시적_오류_후_성공() {
        // given
        AtomicInteger attempts = new AtomicInteger();

        // when
        String result = executor.execute(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransientTransportException("orders", "broker unavailable");
            }
            return "published";
        });

        // then
        assertThat(result).isEqualTo("published");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(sleeps).containsExactly(100L, 200L);
    }

    @Test
    @DisplayName("maxAttempts 소진 시 마지막 원래 예외 전파")
    void 재시도_소진_시_원래_예외() {
        // given
        AtomicInteger attempts = new AtomicInteger();
        TransientTransportException error = new TransientTransportException("orders", "still down");

        // when & then
        assertThatThrownBy(() -> executor.run(() -> {
            attempts.incrementAndGet();
            throw error;
        })).isSameAs(error);
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    @DisplayName("영구 오류는 재시도하지 않음")
    void 영구_오류는_즉시_전파() {
        // given
        AtomicInteger attempts = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> executor.run(() -> {
            attempts.incrementAndGet();
            throw new PermanentTransportException("orders", "unknown destination");
        })).isInstanceOf(PermanentTransportException.class);
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("CircuitOpenException은 재시도하지 않음")
    void CircuitOpen은_재시도하지_않음() {
        // given
        AtomicInteger attempts = new AtomicInteger();

        // when & then
        assertThatThrownBy(() -> executor.run(() -> {
            attempts.incrementAndGet();
            throw new CircuitOpenException("orders", CircuitBreakerState.OPEN);
        })).isInstanceOf(CircuitOpenException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("cause 체인에 일시적 오류가 있으면 재시도")
    void cause_체인_일시적_오류_재시도() {
        // given
        AtomicInteger attempts = new AtomicInteger();

        // when
        executor.execute(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("wrapped",
                    new TransientTransportException("orders", "timeout"));
            }
            return null;
        });

        // then
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("재시도 대기 중 인터럽트 시 플래그 복원 후 RelayException")
    void 대기_중_인터럽트() {
        // given
        RetryPolicy policy = new RetryPolicy().withMaxAttempts(3);
        RetryExecutor interrupting = new RetryExecutor(policy, TransientErrorDetector.defaultDetector(),
            new BackoffCalculator(policy), millis -> {
                throw new InterruptedException("stop");
            });

        // when & then
        try {
            assertThatThrownBy(() -> interrupting.run(() -> {
                throw new TransientTransportException("orders", "down");
            }))
                .isInstanceOf(RelayException.class)
                .hasCauseInstanceOf(TransientTransportException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
