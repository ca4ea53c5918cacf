package com.ryuqq.relay.adapter.protection.circuit;

import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerListener;
import com.ryuqq.relay.core.protection.CircuitBreakerMetrics;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Circuit Breaker 기본 구현.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED ──(연속 실패 ≥ failureThreshold 또는 윈도우 실패율 ≥ failureRateThreshold)──► OPEN
 * OPEN ──(openTimeout 경과 후 첫 tryAcquire)──► HALF_OPEN
 * HALF_OPEN ──(연속 성공 ≥ successThreshold)──► CLOSED
 * HALF_OPEN ──(탐색 호출 실패)──► OPEN
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>상태는 하나의 {@link AtomicReference}에 보관되어 getState()는 락 없이 읽음</li>
 *   <li>상태 전이와 카운터 갱신은 인스턴스별 단일 synchronized 구간에서만 수행</li>
 *   <li>HALF_OPEN에서는 한 번에 하나의 탐색 호출만 허용</li>
 *   <li>상태 전이마다 세대(generation)가 증가하며, 허가 stamp의 세대가 현재와 다른 결과는
 *       누적 카운터에만 반영 (CLOSED에서 허가된 뒤 늦게 끝난 호출이 탐색 결과로 집계되지 않음)</li>
 *   <li>리스너는 락 밖에서 호출되며, 리스너 예외는 로그만 남기고 무시</li>
 * </ul>
 *
 * <p>비율 기반 판정은 샘플링 윈도우 내 호출 수가 minimumThroughput 이상일 때만 평가합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class DefaultCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(DefaultCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final CircuitBreakerListener listener;
    private final LongSupplier nanoTime;
    private final Clock clock;

    private final AtomicReference<CircuitBreakerState> state = new AtomicReference<>(CircuitBreakerState.CLOSED);
    private final Object lock = new Object();
    private final SlidingWindow window;

    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong successfulCalls = new AtomicLong();
    private final AtomicLong failedCalls = new AtomicLong();
    private final AtomicLong slowCalls = new AtomicLong();
    private final AtomicLong rejectedCalls = new AtomicLong();

    // lock 보호 필드
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private long openedAtNanos;
    private long generation = 1;
    private boolean trialInFlight;
    private boolean isolated;
    private volatile Instant lastTransitionAt;

    public DefaultCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, new CircuitBreakerListener() { });
    }

    public DefaultCircuitBreaker(String name, CircuitBreakerConfig config, CircuitBreakerListener listener) {
        this(name, config, listener, System::nanoTime, Clock.systemUTC());
    }

    /**
     * 시간 소스를 주입하는 생성자 (테스트용).
     *
     * @param name 이름
     * @param config 설정
     * @param listener 상태 변경/거부 리스너
     * @param nanoTime 단조 증가 나노초 시간 소스
     * @param clock 전이 시각 기록용 Clock
     * @throws IllegalArgumentException 파라미터가 null이거나 name이 비어 있는 경우
     */
    public DefaultCircuitBreaker(
        String name,
        CircuitBreakerConfig config,
        CircuitBreakerListener listener,
        LongSupplier nanoTime,
        Clock clock
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (nanoTime == null) {
            throw new IllegalArgumentException("nanoTime cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.listener = listener;
        this.nanoTime = nanoTime;
        this.clock = clock;
        this.window = new SlidingWindow(config.samplingWindow().toNanos());
        this.lastTransitionAt = clock.instant();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public long tryAcquire() {
        CircuitBreakerState from = null;
        CircuitBreakerState rejectedIn = null;
        long stamp = NOT_PERMITTED;

        synchronized (lock) {
            CircuitBreakerState current = state.get();
            if (!current.permitsCalls()) {
                long elapsed = nanoTime.getAsLong() - openedAtNanos;
                if (!isolated && elapsed >= config.openTimeout().toNanos()) {
                    from = transitionTo(CircuitBreakerState.HALF_OPEN);
                    trialInFlight = true;
                    stamp = generation;
                } else {
                    rejectedIn = current;
                }
            } else if (current == CircuitBreakerState.HALF_OPEN && trialInFlight) {
                rejectedIn = current;
            } else {
                if (current == CircuitBreakerState.HALF_OPEN) {
                    trialInFlight = true;
                }
                stamp = generation;
            }
        }

        if (from != null) {
            fireStateChange(from, CircuitBreakerState.HALF_OPEN);
        }
        if (rejectedIn != null) {
            rejectedCalls.incrementAndGet();
            fireRejected(rejectedIn);
        }
        return stamp;
    }

    @Override
    public void recordSuccess(long stamp, long durationNanos) {
        boolean slow = isSlow(durationNanos);
        totalCalls.incrementAndGet();
        successfulCalls.incrementAndGet();
        if (slow) {
            slowCalls.incrementAndGet();
        }

        CircuitBreakerState from = null;
        CircuitBreakerState to = null;

        synchronized (lock) {
            if (stamp != generation) {
                log.debug("Circuit breaker '{}' ignored a stale success (stamp {}, generation {})", name, stamp, generation);
                return;
            }
            window.record(nanoTime.getAsLong(), false, slow);
            consecutiveFailures = 0;
            consecutiveSuccesses++;

            CircuitBreakerState current = state.get();
            if (current == CircuitBreakerState.HALF_OPEN) {
                trialInFlight = false;
                if (consecutiveSuccesses >= config.successThreshold()) {
                    to = CircuitBreakerState.CLOSED;
                    from = transitionTo(to);
                }
            } else if (current == CircuitBreakerState.CLOSED && config.trackSlowCalls() && shouldTripOnRate()) {
                to = CircuitBreakerState.OPEN;
                from = transitionTo(to);
            }
        }

        if (from != null) {
            fireStateChange(from, to);
        }
    }

    @Override
    public void recordFailure(long stamp, long durationNanos, Throwable throwable) {
        boolean slow = isSlow(durationNanos);
        totalCalls.incrementAndGet();
        failedCalls.incrementAndGet();
        if (slow) {
            slowCalls.incrementAndGet();
        }

        CircuitBreakerState from = null;

        synchronized (lock) {
            if (stamp != generation) {
                log.debug("Circuit breaker '{}' ignored a stale failure (stamp {}, generation {})", name, stamp, generation);
                return;
            }
            window.record(nanoTime.getAsLong(), true, slow);
            consecutiveSuccesses = 0;
            consecutiveFailures++;

            CircuitBreakerState current = state.get();
            if (current == CircuitBreakerState.HALF_OPEN) {
                trialInFlight = false;
                from = transitionTo(CircuitBreakerState.OPEN);
            } else if (current == CircuitBreakerState.CLOSED
                && (consecutiveFailures >= config.failureThreshold() || shouldTripOnRate())) {
                from = transitionTo(CircuitBreakerState.OPEN);
            }
        }

        if (from != null) {
            log.warn("Circuit breaker '{}' opened after failure: {}", name,
                throwable != null ? throwable.toString() : "unknown");
            fireStateChange(from, CircuitBreakerState.OPEN);
        }
    }

    @Override
    public CircuitBreakerState getState() {
        return state.get();
    }

    @Override
    public CircuitBreakerMetrics getMetrics() {
        synchronized (lock) {
            SlidingWindow.Snapshot snapshot = window.snapshot(nanoTime.getAsLong());
            return new CircuitBreakerMetrics(
                state.get(),
                consecutiveFailures,
                consecutiveSuccesses,
                totalCalls.get(),
                successfulCalls.get(),
                failedCalls.get(),
                slowCalls.get(),
                rejectedCalls.get(),
                snapshot.failureRate(),
                snapshot.slowCallRate(),
                lastTransitionAt
            );
        }
    }

    @Override
    public void reset() {
        CircuitBreakerState from;
        synchronized (lock) {
            isolated = false;
            from = transitionTo(CircuitBreakerState.CLOSED);
            totalCalls.set(0);
            successfulCalls.set(0);
            failedCalls.set(0);
            slowCalls.set(0);
            rejectedCalls.set(0);
        }
        log.info("Circuit breaker '{}' reset", name);
        if (from != CircuitBreakerState.CLOSED) {
            fireStateChange(from, CircuitBreakerState.CLOSED);
        }
    }

    @Override
    public void isolate() {
        CircuitBreakerState from;
        synchronized (lock) {
            isolated = true;
            from = transitionTo(CircuitBreakerState.OPEN);
        }
        log.warn("Circuit breaker '{}' isolated", name);
        if (from != CircuitBreakerState.OPEN) {
            fireStateChange(from, CircuitBreakerState.OPEN);
        }
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /**
     * lock 안에서만 호출. 카운터와 윈도우를 새 상태에 맞게 초기화합니다.
     *
     * @return 이전 상태
     */
    private CircuitBreakerState transitionTo(CircuitBreakerState target) {
        CircuitBreakerState previous = state.getAndSet(target);
        generation++;
        consecutiveFailures = 0;
        consecutiveSuccesses = 0;
        trialInFlight = false;
        if (target == CircuitBreakerState.OPEN) {
            openedAtNanos = nanoTime.getAsLong();
        }
        if (target == CircuitBreakerState.CLOSED) {
            window.clear();
        }
        if (previous != target) {
            lastTransitionAt = clock.instant();
        }
        return previous;
    }

    private boolean shouldTripOnRate() {
        SlidingWindow.Snapshot snapshot = window.snapshot(nanoTime.getAsLong());
        if (snapshot.calls() < config.minimumThroughput()) {
            return false;
        }
        if (config.trackSlowCalls()) {
            return snapshot.failureRateCountingSlow() >= config.failureRateThreshold()
                || snapshot.slowCallRate() >= config.slowCallRateThreshold();
        }
        return snapshot.failureRate() >= config.failureRateThreshold();
    }

    private boolean isSlow(long durationNanos) {
        return config.trackSlowCalls() && durationNanos >= config.slowCallDurationThreshold().toNanos();
    }

    private void fireStateChange(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == to) {
            return;
        }
        log.info("Circuit breaker '{}' state changed: {} -> {}", name, from, to);
        try {
            listener.onStateChange(name, from, to);
        } catch (RuntimeException e) {
            log.warn("Circuit breaker listener failed on state change: {}", name, e);
        }
    }

    private void fireRejected(CircuitBreakerState rejectedIn) {
        log.debug("Circuit breaker '{}' rejected call in state {}", name, rejectedIn);
        try {
            listener.onRejected(name, rejectedIn);
        } catch (RuntimeException e) {
            log.warn("Circuit breaker listener failed on rejection: {}", name, e);
        }
    }
}
