package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.SagaId;

/**
 * 낙관적 동시성 충돌.
 *
 * <p>체크포인트 저장 시 기대 버전과 저장소의 현재 버전이 다른 경우 발생합니다.
 * 오래된(stale) 작성자는 덮어쓰지 않고 이 예외로 거부됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ConcurrencyConflictException extends RelayException {

    private final SagaId sagaId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(SagaId sagaId, long expectedVersion, long actualVersion) {
        super("Checkpoint version conflict for saga " + sagaId.getValue()
            + " (expected: " + expectedVersion + ", actual: " + actualVersion + ")");
        this.sagaId = sagaId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public SagaId getSagaId() {
        return sagaId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
