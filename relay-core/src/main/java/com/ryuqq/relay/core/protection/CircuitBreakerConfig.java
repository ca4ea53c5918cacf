package com.ryuqq.relay.core.protection;

import java.time.Duration;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: CLOSED → OPEN 연속 실패 수 (기본 5)</li>
 *   <li>successThreshold: HALF_OPEN → CLOSED 연속 성공 수 (기본 2)</li>
 *   <li>failureRateThreshold: 샘플링 윈도우 실패율 임계값 (0.0 ~ 1.0, 기본 0.5)</li>
 *   <li>slowCallRateThreshold: 샘플링 윈도우 느린 호출 비율 임계값 (기본 0.5)</li>
 *   <li>openTimeout: OPEN → HALF_OPEN 대기 시간 (기본 30초)</li>
 *   <li>slowCallDurationThreshold: 느린 호출 판정 기준 (기본 5초)</li>
 *   <li>trackSlowCalls: 느린 호출 추적 여부 (기본 false)</li>
 *   <li>minimumThroughput: 비율 기반 판정 전 필요한 최소 호출 수 (기본 10)</li>
 *   <li>samplingWindow: 비율 계산용 롤링 윈도우 길이 (기본 60초)</li>
 * </ul>
 *
 * @param failureThreshold 연속 실패 임계값 (1 이상)
 * @param successThreshold 연속 성공 임계값 (1 이상)
 * @param failureRateThreshold 실패율 임계값 (0.0 초과 1.0 이하)
 * @param slowCallRateThreshold 느린 호출 비율 임계값 (0.0 초과 1.0 이하)
 * @param openTimeout OPEN 유지 시간
 * @param slowCallDurationThreshold 느린 호출 기준 시간
 * @param trackSlowCalls 느린 호출 추적 여부
 * @param minimumThroughput 최소 호출 수 (1 이상)
 * @param samplingWindow 롤링 윈도우 길이
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    int successThreshold,
    double failureRateThreshold,
    double slowCallRateThreshold,
    Duration openTimeout,
    Duration slowCallDurationThreshold,
    boolean trackSlowCalls,
    int minimumThroughput,
    Duration samplingWindow
) {

    /**
     * 기본 설정 생성자.
     */
    public CircuitBreakerConfig() {
        this(5, 2, 0.5, 0.5, Duration.ofSeconds(30), Duration.ofSeconds(5), false, 10, Duration.ofSeconds(60));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive (current: " + failureThreshold + ")");
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be positive (current: " + successThreshold + ")");
        }
        if (failureRateThreshold <= 0.0 || failureRateThreshold > 1.0) {
            throw new IllegalArgumentException("failureRateThreshold must be in (0.0, 1.0] (current: " + failureRateThreshold + ")");
        }
        if (slowCallRateThreshold <= 0.0 || slowCallRateThreshold > 1.0) {
            throw new IllegalArgumentException("slowCallRateThreshold must be in (0.0, 1.0] (current: " + slowCallRateThreshold + ")");
        }
        requirePositive(openTimeout, "openTimeout");
        requirePositive(slowCallDurationThreshold, "slowCallDurationThreshold");
        requirePositive(samplingWindow, "samplingWindow");
        if (minimumThroughput <= 0) {
            throw new IllegalArgumentException("minimumThroughput must be positive (current: " + minimumThroughput + ")");
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + duration + ")");
        }
    }

    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, failureRateThreshold, slowCallRateThreshold,
            openTimeout, slowCallDurationThreshold, trackSlowCalls, minimumThroughput, samplingWindow);
    }

    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, failureRateThreshold, slowCallRateThreshold,
            openTimeout, slowCallDurationThreshold, trackSlowCalls, minimumThroughput, samplingWindow);
    }

    public CircuitBreakerConfig withFailureRateThreshold(double failureRateThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, failureRateThreshold, slowCallRateThreshold,
            openTimeout, slowCallDurationThreshold, trackSlowCalls, minimumThroughput, samplingWindow);
    }

    public CircuitBreakerConfig withSlowCallRateThreshold(double slowCallRateThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, failureRateThreshold, slowCallRateThreshold,
            openTimeout, slowCallDurationThreshold, trackSlowCalls, minimumThroughput, samplingWindow);
    }

    public CircuitBreakerConfig withOpenTimeout(Duration openTimeout) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, failureRateThreshold, slowCallRateThreshold,
            openTimeout, slowCallDurationThreshold, trackSlowCalls, minimumThroughput, samplingWindow);
    }

    /**
     * 느린 호출 기준 시간을 지정하고 느린 호출 추적을 활성화한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSlowCallDurationThreshold(Duration slowCallDurationThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, failureRateThreshold, slowCallRateThreshold,
            openTimeout, slowCallDurationThreshold, true, minimumThroughput, samplingWindow);
    }

    public CircuitBreakerConfig withTrackSlowCalls(boolean trackSlowCalls) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, failureRateThreshold, slowCallRateThreshold,
            openTimeout, slowCallDurationThreshold, trackSlowCalls, minimumThroughput, samplingWindow);
    }

    public CircuitBreakerConfig withMinimumThroughput(int minimumThroughput) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, failureRateThreshold, slowCallRateThreshold,
            openTimeout, slowCallDurationThreshold, trackSlowCalls, minimumThroughput, samplingWindow);
    }

    public CircuitBreakerConfig withSamplingWindow(Duration samplingWindow) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, failureRateThreshold, slowCallRateThreshold,
            openTimeout, slowCallDurationThreshold, trackSlowCalls, minimumThroughput, samplingWindow);
    }
}
