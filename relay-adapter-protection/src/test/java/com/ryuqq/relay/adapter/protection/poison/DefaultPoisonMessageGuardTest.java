package com.ryuqq.relay.adapter.protection.poison;

import com.ryuqq.relay.core.model.MessageId;
import com.ryuqq.relay.core.poison.PoisonDecision;
import com.ryuqq.relay.core.poison.PoisonGuardConfig;
import com.ryuqq.relay.core.poison.PoisonRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DefaultPoisonMessageGuard 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("DefaultPoisonMessageGuard 테스트")
class DefaultPoisonMessageGuardTest {

    private static final String DESTINATION = "orders";
    private static final RuntimeException ERROR = new IllegalStateException("handler failed");

    private MutableClock clock;
    private DefaultPoisonMessageGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        guard = new DefaultPoisonMessageGuard(new PoisonGuardConfig().withPoisonThreshold(3), clock);
    }

    @Test
    @DisplayName("threshold - 1 회 실패까지는 재시도 가능")
    void 임계값_직전까지_재시도() {
        // given
        MessageId id = MessageId.of("msg-1");

        // when
        PoisonDecision first = guard.recordFailure(DESTINATION, id, ERROR);
        PoisonDecision second = guard.recordFailure(DESTINATION, id, ERROR);

        // then
        assertThat(first.quarantine()).isFalse();
        assertThat(second.quarantine()).isFalse();
        assertThat(second.failureCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("threshold 회 실패 시 정확히 한 번만 quarantine")
    void 임계값_도달_시_한번만_격리() {
        // given
        MessageId id = MessageId.of("msg-1");
        guard.recordFailure(DESTINATION, id, ERROR);
        guard.recordFailure(DESTINATION, id, ERROR);

        // when
        PoisonDecision third = guard.recordFailure(DESTINATION, id, ERROR);
        PoisonDecision fourth = guard.recordFailure(DESTINATION, id, ERROR);

        // then
        assertThat(third.quarantine()).isTrue();
        assertThat(third.failureCount()).isEqualTo(3);
        assertThat(fourth.quarantine()).isFalse();
        assertThat(guard.find(DESTINATION, id)).get().extracting(PoisonRecord::quarantined).isEqualTo(true);
    }

    @Test
    @DisplayName("성공 시 추적 기록 제거")
    void 성공_시_기록_제거() {
        // given
        MessageId id = MessageId.of("msg-1");
        guard.recordFailure(DESTINATION, id, ERROR);
        guard.recordFailure(DESTINATION, id, ERROR);

        // when
        guard.recordSuccess(DESTINATION, id);

        // then
        assertThat(guard.find(DESTINATION, id)).isEmpty();
        assertThat(guard.recordFailure(DESTINATION, id, ERROR).failureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("release 후 같은 메시지는 다시 처음부터 계산")
    void release_후_초기화() {
        // given
        MessageId id = MessageId.of("msg-1");
        for (int i = 0; i < 3; i++) {
            guard.recordFailure(DESTINATION, id, ERROR);
        }

        // when
        guard.release(DESTINATION, id);

        // then
        assertThat(guard.trackedCount()).isZero();
        assertThat(guard.recordFailure(DESTINATION, id, ERROR).failureCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("실패 횟수는 destination별로 분리")
    void destination별_분리() {
        // given
        MessageId id = MessageId.of("shared-id");

        // when
        guard.recordFailure("orders", id, ERROR);
        guard.recordFailure("orders", id, ERROR);
        PoisonDecision otherDestination = guard.recordFailure("payments", id, ERROR);

        // then
        assertThat(otherDestination.failureCount()).isEqualTo(1);
        assertThat(guard.trackedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("retention이 지난 기록은 만료")
    void retention_만료() {
        // given
        guard = new DefaultPoisonMessageGuard(
            new PoisonGuardConfig().withPoisonThreshold(3).withRetention(Duration.ofMinutes(10)), clock);
        MessageId id = MessageId.of("msg-1");
        guard.recordFailure(DESTINATION, id, ERROR);
        guard.recordFailure(DESTINATION, id, ERROR);

        // when
        clock.advance(Duration.ofMinutes(11));

        // then
        assertThat(guard.snapshot()).isEmpty();
        assertThat(guard.recordFailure(DESTINATION, id, ERROR).quarantine()).isFalse();
    }

    @Test
    @DisplayName("maxTrackedMessages 초과 시 가장 오래된 기록부터 제거")
    void 용량_초과_시_오래된_기록_제거() {
        // given
        guard = new DefaultPoisonMessageGuard(
            new PoisonGuardConfig().withPoisonThreshold(3).withMaxTrackedMessages(2), clock);

        // when
        guard.recordFailure(DESTINATION, MessageId.of("a"), ERROR);
        clock.advance(Duration.ofSeconds(1));
        guard.recordFailure(DESTINATION, MessageId.of("b"), ERROR);
        clock.advance(Duration.ofSeconds(1));
        guard.recordFailure(DESTINATION, MessageId.of("c"), ERROR);

        // then
        assertThat(guard.trackedCount()).isEqualTo(2);
        assertThat(guard.find(DESTINATION, MessageId.of("a"))).isEmpty();
        assertThat(guard.find(DESTINATION, MessageId.of("c"))).isPresent();
    }

    @Test
    @DisplayName("기록에는 마지막 오류와 최초/최근 시각이 남음")
    void 기록_내용() {
        // given
        MessageId id = MessageId.of("msg-1");
        Instant first = clock.instant();
        guard.recordFailure(DESTINATION, id, new IllegalArgumentException("first"));
        clock.advance(Duration.ofSeconds(5));

        // when
        guard.recordFailure(DESTINATION, id, new IllegalStateException("second"));

        // then
        PoisonRecord record = guard.find(DESTINATION, id).orElseThrow();
        assertThat(record.firstSeenAt()).isEqualTo(first);
        assertThat(record.lastSeenAt()).isEqualTo(first.plusSeconds(5));
        assertThat(record.lastError()).contains("IllegalStateException").contains("second");
    }

    /**
     * 수동으로 진행시키는 테스트용 Clock.
     */
    static final class MutableClock extends Clock {

        private Instant current;

        MutableClock(Instant start) {
            this.current = start;
        }

        void advance(Duration duration) {
            current = current.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }
    }
}
