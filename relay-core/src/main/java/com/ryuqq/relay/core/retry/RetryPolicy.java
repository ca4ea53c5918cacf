package com.ryuqq.relay.core.retry;

import java.time.Duration;

/**
 * 재시도 정책 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 호출을 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>initialDelay: 첫 재시도 전 대기 시간 (기본 200ms)</li>
 *   <li>maxDelay: 대기 시간 상한 (기본 30초)</li>
 *   <li>strategy: LINEAR 또는 EXPONENTIAL (기본 EXPONENTIAL)</li>
 *   <li>jitterFactor: 0.0 ~ 1.0, 계산된 지연에 더할 무작위 비율 (기본 0.1)</li>
 * </ul>
 *
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param initialDelay 첫 재시도 지연 (양수)
 * @param maxDelay 지연 상한 (initialDelay 이상)
 * @param strategy 증가 방식
 * @param jitterFactor jitter 비율
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    Duration maxDelay,
    BackoffStrategy strategy,
    double jitterFactor
) {

    public RetryPolicy() {
        this(3, Duration.ofMillis(200), Duration.ofSeconds(30), BackoffStrategy.EXPONENTIAL, 0.1);
    }

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (initialDelay == null || initialDelay.isZero() || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be positive (current: " + initialDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= initialDelay (initial: " + initialDelay + ", max: " + maxDelay + ")"
            );
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
    }

    /**
     * 재시도 없이 한 번만 시도하는 정책.
     *
     * @return maxAttempts=1 정책
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy().withMaxAttempts(1);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, strategy, jitterFactor);
    }

    /**
     * initialDelay 변경. maxDelay가 더 작으면 함께 올립니다.
     */
    public RetryPolicy withInitialDelay(Duration initialDelay) {
        Duration adjustedMax = maxDelay.compareTo(initialDelay) < 0 ? initialDelay : maxDelay;
        return new RetryPolicy(maxAttempts, initialDelay, adjustedMax, strategy, jitterFactor);
    }

    public RetryPolicy withMaxDelay(Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, strategy, jitterFactor);
    }

    public RetryPolicy withStrategy(BackoffStrategy strategy) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, strategy, jitterFactor);
    }

    public RetryPolicy withJitterFactor(double jitterFactor) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, strategy, jitterFactor);
    }
}
