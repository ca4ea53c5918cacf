package com.ryuqq.relay.core.protection;

import java.time.Duration;

/**
 * 백프레셔 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxInflight: 동시 진행 가능한 최대 작업 수 (기본 100)</li>
 *   <li>throttlePolicy: 한도 도달 시 정책 (기본 REJECT_IMMEDIATELY)</li>
 *   <li>maxWait: WAIT_THEN_RETRY / BOUNDED_QUEUE 최대 대기 시간 (기본 1초)</li>
 *   <li>queueCapacity: BOUNDED_QUEUE 대기열 크기 (기본 100)</li>
 *   <li>rateLimit: 선택적 Token Bucket 속도 제한 (null이면 비활성)</li>
 * </ul>
 *
 * @param maxInflight 최대 동시 작업 수 (1 이상)
 * @param throttlePolicy 정책
 * @param maxWait 최대 대기 시간 (0 이상)
 * @param queueCapacity 대기열 크기 (1 이상)
 * @param rateLimit 속도 제한 (null 허용)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record BackpressureConfig(
    int maxInflight,
    ThrottlePolicy throttlePolicy,
    Duration maxWait,
    int queueCapacity,
    RateLimiterConfig rateLimit
) {

    public BackpressureConfig() {
        this(100, ThrottlePolicy.REJECT_IMMEDIATELY, Duration.ofSeconds(1), 100, null);
    }

    public BackpressureConfig {
        if (maxInflight <= 0) {
            throw new IllegalArgumentException("maxInflight must be positive (current: " + maxInflight + ")");
        }
        if (throttlePolicy == null) {
            throw new IllegalArgumentException("throttlePolicy cannot be null");
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait cannot be null or negative (current: " + maxWait + ")");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive (current: " + queueCapacity + ")");
        }
    }

    public BackpressureConfig withMaxInflight(int maxInflight) {
        return new BackpressureConfig(maxInflight, throttlePolicy, maxWait, queueCapacity, rateLimit);
    }

    public BackpressureConfig withThrottlePolicy(ThrottlePolicy throttlePolicy) {
        return new BackpressureConfig(maxInflight, throttlePolicy, maxWait, queueCapacity, rateLimit);
    }

    public BackpressureConfig withMaxWait(Duration maxWait) {
        return new BackpressureConfig(maxInflight, throttlePolicy, maxWait, queueCapacity, rateLimit);
    }

    public BackpressureConfig withQueueCapacity(int queueCapacity) {
        return new BackpressureConfig(maxInflight, throttlePolicy, maxWait, queueCapacity, rateLimit);
    }

    public BackpressureConfig withRateLimit(RateLimiterConfig rateLimit) {
        return new BackpressureConfig(maxInflight, throttlePolicy, maxWait, queueCapacity, rateLimit);
    }
}
