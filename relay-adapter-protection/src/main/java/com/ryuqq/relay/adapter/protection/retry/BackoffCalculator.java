package com.ryuqq.relay.adapter.protection.retry;

import com.ryuqq.relay.core.retry.BackoffStrategy;
import com.ryuqq.relay.core.retry.RetryPolicy;

import java.util.function.DoubleSupplier;

/**
 * 재시도 지연 계산기 (Backoff with Jitter).
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * LINEAR:      base = initialDelay * attempt
 * EXPONENTIAL: base = initialDelay * 2^(attempt-1)
 * delay = min(base + random(0, base * jitterFactor), maxDelay)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=200ms, EXPONENTIAL, jitterFactor=0):</strong></p>
 * <ul>
 *   <li>attempt=1: 200ms</li>
 *   <li>attempt=2: 400ms</li>
 *   <li>attempt=3: 800ms</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final BackoffStrategy strategy;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public BackoffCalculator(RetryPolicy policy) {
        this(policy, Math::random);
    }

    /**
     * 난수 소스를 주입하는 생성자.
     *
     * @param policy 재시도 정책
     * @param random [0, 1) 난수 소스
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public BackoffCalculator(RetryPolicy policy, DoubleSupplier random) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.initialDelayMs = policy.initialDelay().toMillis();
        this.maxDelayMs = policy.maxDelay().toMillis();
        this.strategy = policy.strategy();
        this.jitterFactor = policy.jitterFactor();
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }

        long base;
        if (strategy == BackoffStrategy.LINEAR) {
            base = Math.min(multiplyCapped(initialDelayMs, attempt), maxDelayMs);
        } else {
            // 2^62 이상은 overflow
            int shift = Math.min(attempt - 1, 62);
            base = Math.min(multiplyCapped(initialDelayMs, 1L << shift), maxDelayMs);
        }

        long jitter = (long) (base * jitterFactor * random.getAsDouble());
        return Math.min(base + jitter, maxDelayMs);
    }

    private static long multiplyCapped(long a, long b) {
        long result = a * b;
        if (a != 0 && (result / a != b || result < 0)) {
            return Long.MAX_VALUE;
        }
        return result;
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public BackoffStrategy getStrategy() {
        return strategy;
    }
}
