package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.exception.ConcurrencyConflictException;
import com.ryuqq.relay.core.model.SagaId;
import com.ryuqq.relay.core.saga.SagaCheckpoint;

import java.util.Optional;

/**
 * Saga 체크포인트 영속화 SPI.
 *
 * <p><strong>낙관적 동시성:</strong></p>
 * <pre>
 * 최초 저장:  saveCheckpoint(cp, 0) → 1
 * 이후 저장:  saveCheckpoint(cp, 1) → 2
 * 오래된 작성자: saveCheckpoint(cp, 1) → ConcurrencyConflictException (현재 버전 2)
 * </pre>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>버전 비교와 저장은 원자적이어야 함</li>
 *   <li>충돌 시 절대 덮어쓰지 않음</li>
 *   <li>Thread-safe</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface SagaPersistence {

    /**
     * 체크포인트 저장.
     *
     * @param checkpoint 저장할 체크포인트
     * @param expectedVersion 기대하는 현재 버전 (신규 Saga는 0)
     * @return 새 버전
     * @throws ConcurrencyConflictException 저장소 버전이 expectedVersion과 다른 경우
     */
    long saveCheckpoint(SagaCheckpoint checkpoint, long expectedVersion);

    /**
     * 마지막 체크포인트 조회.
     *
     * @param sagaId Saga 식별자
     * @return 체크포인트 (없으면 empty)
     */
    Optional<SagaCheckpoint> loadCheckpoint(SagaId sagaId);
}
