package com.ryuqq.relay.core.protection;

import java.time.Instant;

/**
 * Circuit Breaker 카운터 스냅샷.
 *
 * @param state 현재 상태
 * @param consecutiveFailures 연속 실패 수
 * @param consecutiveSuccesses 연속 성공 수 (HALF_OPEN 탐색 성공 포함)
 * @param totalCalls 누적 호출 수 (거부 제외)
 * @param successfulCalls 누적 성공 수
 * @param failedCalls 누적 실패 수
 * @param slowCalls 누적 느린 호출 수
 * @param rejectedCalls 누적 거부 수
 * @param failureRate 샘플링 윈도우 실패율 (0.0 ~ 1.0)
 * @param slowCallRate 샘플링 윈도우 느린 호출 비율 (0.0 ~ 1.0)
 * @param lastTransitionAt 마지막 상태 전이 시각
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record CircuitBreakerMetrics(
    CircuitBreakerState state,
    int consecutiveFailures,
    int consecutiveSuccesses,
    long totalCalls,
    long successfulCalls,
    long failedCalls,
    long slowCalls,
    long rejectedCalls,
    double failureRate,
    double slowCallRate,
    Instant lastTransitionAt
) {
}
