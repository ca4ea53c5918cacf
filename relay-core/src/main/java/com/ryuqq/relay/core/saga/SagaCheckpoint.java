package com.ryuqq.relay.core.saga;

import com.ryuqq.relay.core.model.SagaId;

import java.time.Instant;
import java.util.List;

/**
 * Saga 체크포인트 (영속화 단위).
 *
 * <p>재개 시 동일한 보상 순서를 복원할 수 있도록, 완료된 단계 이름을
 * 실행 순서대로 보관합니다. 보상이 진행되면 마지막 항목부터 제거됩니다.</p>
 *
 * <p>보상에 실패한 단계의 오류는 {@code compensationErrors}에 "단계명: 오류" 형식으로 남아
 * FAILED Saga를 다시 조회해도 보고됩니다.</p>
 *
 * @param sagaId Saga 식별자
 * @param sagaType Saga 정의 이름
 * @param state 현재 상태
 * @param nextStepIndex 다음에 실행할 단계 인덱스
 * @param completedSteps 완료된 단계 이름 (실행 순서)
 * @param dataType 데이터 스냅샷 타입 태그
 * @param dataSnapshot 직렬화된 데이터 스냅샷
 * @param failureReason 보상을 촉발한 오류 요약 (null 허용)
 * @param compensationErrors 마지막 보상 시도에서 발생한 오류 요약 (없으면 빈 목록)
 * @param abortRequested 취소 요청 여부
 * @param version 저장된 버전 (저장 전이면 0)
 * @param updatedAt 갱신 시각
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record SagaCheckpoint(
    SagaId sagaId,
    String sagaType,
    SagaState state,
    int nextStepIndex,
    List<String> completedSteps,
    String dataType,
    byte[] dataSnapshot,
    String failureReason,
    List<String> compensationErrors,
    boolean abortRequested,
    long version,
    Instant updatedAt
) {

    public SagaCheckpoint {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        if (sagaType == null || sagaType.isBlank()) {
            throw new IllegalArgumentException("sagaType cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (nextStepIndex < 0) {
            throw new IllegalArgumentException("nextStepIndex must be non-negative (current: " + nextStepIndex + ")");
        }
        if (dataSnapshot == null) {
            throw new IllegalArgumentException("dataSnapshot cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative (current: " + version + ")");
        }
        completedSteps = completedSteps == null ? List.of() : List.copyOf(completedSteps);
        compensationErrors = compensationErrors == null ? List.of() : List.copyOf(compensationErrors);
        dataSnapshot = dataSnapshot.clone();
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    @Override
    public byte[] dataSnapshot() {
        return dataSnapshot.clone();
    }

    /**
     * 저장소가 부여한 버전으로 교체한 사본.
     *
     * @param newVersion 새 버전
     * @return 새 인스턴스
     */
    public SagaCheckpoint withVersion(long newVersion) {
        return new SagaCheckpoint(sagaId, sagaType, state, nextStepIndex, completedSteps, dataType,
            dataSnapshot, failureReason, compensationErrors, abortRequested, newVersion, updatedAt);
    }
}
