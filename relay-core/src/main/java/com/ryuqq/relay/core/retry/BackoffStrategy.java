package com.ryuqq.relay.core.retry;

/**
 * 재시도 간격 증가 방식.
 *
 * <pre>
 * LINEAR:      delay = initialDelay * attempt
 * EXPONENTIAL: delay = initialDelay * 2^(attempt-1)
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum BackoffStrategy {
    LINEAR,
    EXPONENTIAL
}
