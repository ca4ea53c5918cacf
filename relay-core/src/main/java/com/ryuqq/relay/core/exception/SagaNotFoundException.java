package com.ryuqq.relay.core.exception;

import com.ryuqq.relay.core.model.SagaId;

/**
 * 체크포인트가 존재하지 않는 Saga를 재개하려 함.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class SagaNotFoundException extends RelayException {

    private final SagaId sagaId;

    public SagaNotFoundException(SagaId sagaId) {
        super("No checkpoint found for saga " + sagaId.getValue());
        this.sagaId = sagaId;
    }

    public SagaId getSagaId() {
        return sagaId;
    }
}
