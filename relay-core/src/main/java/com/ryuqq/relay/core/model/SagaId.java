package com.ryuqq.relay.core.model;

import java.util.UUID;

/**
 * Saga 인스턴스의 고유 식별자.
 *
 * <p>체크포인트 저장/조회와 재개(resume)의 키로 사용됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class SagaId {

    private final String value;

    private SagaId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SagaId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("SagaId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    public static SagaId of(String value) {
        return new SagaId(value);
    }

    public static SagaId generate() {
        return new SagaId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SagaId sagaId = (SagaId) o;
        return value.equals(sagaId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SagaId{" + value + '}';
    }
}
