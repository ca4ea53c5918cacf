package com.ryuqq.relay.core.protection;

/**
 * Circuit Breaker 이벤트 리스너.
 *
 * <p>리스너 예외는 Circuit Breaker 동작에 영향을 주지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface CircuitBreakerListener {

    /**
     * 상태 전이 발생.
     *
     * @param name Circuit Breaker 이름
     * @param from 이전 상태
     * @param to 새 상태
     */
    default void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to) {
    }

    /**
     * 호출 거부 발생 (OPEN 또는 HALF_OPEN 탐색 한도 초과).
     *
     * @param name Circuit Breaker 이름
     * @param state 거부 시점 상태
     */
    default void onRejected(String name, CircuitBreakerState state) {
    }
}
