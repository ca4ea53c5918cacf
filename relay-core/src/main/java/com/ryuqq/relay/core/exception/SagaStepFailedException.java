package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.SagaId;

/**
 * Saga 단계 실행 실패.
 *
 * <p>그 자체로 치명적이지 않으며, 보상(compensation)을 시작시킵니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class SagaStepFailedException extends RelayException {

    private final SagaId sagaId;
    private final String stepName;
    private final int stepIndex;

    public SagaStepFailedException(SagaId sagaId, String stepName, int stepIndex, Throwable cause) {
        super("Saga " + sagaId.getValue() + " step '" + stepName + "' (index " + stepIndex + ") failed", cause);
        this.sagaId = sagaId;
        this.stepName = stepName;
        this.stepIndex = stepIndex;
    }

    public SagaId getSagaId() {
        return sagaId;
    }

    public String getStepName() {
        return stepName;
    }

    public int getStepIndex() {
        return stepIndex;
    }
}
