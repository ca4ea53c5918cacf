package com.ryuqq.relay.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 ≥ failureThreshold, 또는 실패율/느린 호출 비율 임계값 도달)
 * OPEN (차단)
 *   │
 *   ▼ (openTimeout 경과)
 * HALF_OPEN (탐색)
 *   │
 *   ├─► successThreshold 만큼 연속 성공 → CLOSED
 *   └─► 첫 탐색 실패 → OPEN
 * </pre>
 *
 * <p>reset()은 어느 상태에서든 CLOSED로, isolate()는 어느 상태에서든 OPEN으로 강제 전이합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태. 모든 호출을 통과시키고 실패를 집계합니다.
     */
    CLOSED,

    /**
     * 차단 상태. 호출을 시도하지 않고 즉시 {@code CircuitOpenException}으로 실패합니다.
     */
    OPEN,

    /**
     * 탐색 상태. 제한된 수의 탐색 호출만 통과시켜 복구 여부를 확인합니다.
     */
    HALF_OPEN;

    /**
     * 호출을 통과시킬 수 있는 상태인지 확인.
     *
     * @return CLOSED 또는 HALF_OPEN이면 true
     */
    public boolean permitsCalls() {
        return this != OPEN;
    }
}
