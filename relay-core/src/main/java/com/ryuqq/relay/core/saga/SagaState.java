package com.ryuqq.relay.core.saga;

/**
 * Saga 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * NOT_STARTED
 *    │
 *    ▼
 * RUNNING ──────────────► COMPLETED
 *    │
 *    ▼ (단계 실패 또는 취소)
 * COMPENSATING
 *    │
 *    ├─► COMPENSATED (단계 실패 후 모든 보상 성공)
 *    ├─► ABORTED     (취소 요청 후 모든 보상 성공)
 *    └─► FAILED      (하나 이상의 보상 실패)
 * </pre>
 *
 * <p>NOT_STARTED에서 취소되면 보상할 단계가 없으므로 바로 ABORTED가 됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum SagaState {

    NOT_STARTED,

    RUNNING,

    COMPLETED,

    /**
     * 완료된 단계를 역순으로 보상 중.
     */
    COMPENSATING,

    COMPENSATED,

    /**
     * 보상 중 하나 이상의 오류 발생 (치명적).
     */
    FAILED,

    /**
     * 수동 취소로 종료.
     */
    ABORTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED, COMPENSATED, FAILED, ABORTED이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == COMPENSATED || this == FAILED || this == ABORTED;
    }
}
