package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.SagaId;

import java.util.List;

/**
 * Saga 보상 실패 (치명적).
 *
 * <p>원래 실패(보상을 촉발한 오류)를 cause로, 발생한 모든 보상 오류를
 * {@link #getCompensationErrors()}와 suppressed 예외로 함께 보고합니다.
 * 보상 오류는 하나도 누락되지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class SagaCompensationFailedException extends RelayException {

    private final SagaId sagaId;
    private final List<Throwable> compensationErrors;

    public SagaCompensationFailedException(SagaId sagaId, Throwable triggeringError, List<Throwable> compensationErrors) {
        super("Saga " + sagaId.getValue() + " failed to compensate " + compensationErrors.size() + " step(s)", triggeringError);
        this.sagaId = sagaId;
        this.compensationErrors = List.copyOf(compensationErrors);
        for (Throwable error : this.compensationErrors) {
            addSuppressed(error);
        }
    }

    public SagaId getSagaId() {
        return sagaId;
    }

    /**
     * 보상을 촉발한 원래 오류.
     *
     * @return 원래 실패 (취소로 인한 보상인 경우 null)
     */
    public Throwable getTriggeringError() {
        return getCause();
    }

    public List<Throwable> getCompensationErrors() {
        return compensationErrors;
    }
}
