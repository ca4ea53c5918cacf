package com.ryuqq.relay.application.saga;

import com.ryuqq.relay.core.model.SagaId;
import com.ryuqq.relay.core.saga.SagaState;

import java.util.List;
import java.util.Optional;

/**
 * Saga 실행 결과 (불변).
 *
 * @param sagaId Saga 식별자
 * @param state 최종 상태
 * @param data 마지막 데이터
 * @param completedSteps 최종 시점에 완료 상태로 남은 단계 이름 (실행 순서)
 * @param failedStep 실패한 단계 이름 (없으면 null)
 * @param failure 실패 원인 (없으면 null)
 * @param compensationErrors 보상 실패 오류 (FAILED가 아니면 빈 목록)
 * @param <D> Saga 데이터 타입
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record SagaResult<D>(
    SagaId sagaId,
    SagaState state,
    D data,
    List<String> completedSteps,
    String failedStep,
    Throwable failure,
    List<Throwable> compensationErrors
) {

    public SagaResult {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        compensationErrors = compensationErrors == null ? List.of() : List.copyOf(compensationErrors);
    }

    public boolean isCompleted() {
        return state == SagaState.COMPLETED;
    }

    public boolean isCompensated() {
        return state == SagaState.COMPENSATED;
    }

    public boolean isFailed() {
        return state == SagaState.FAILED;
    }

    public boolean isAborted() {
        return state == SagaState.ABORTED;
    }

    public Optional<Throwable> failureCause() {
        return Optional.ofNullable(failure);
    }
}
