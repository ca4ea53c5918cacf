package com.ryuqq.relay.application.saga;

import com.ryuqq.relay.core.exception.ConcurrencyConflictException;
import com.ryuqq.relay.core.exception.SagaCompensationFailedException;
import com.ryuqq.relay.core.exception.SagaNotFoundException;
import com.ryuqq.relay.core.model.SagaId;
import com.ryuqq.relay.core.saga.SagaState;

import java.util.function.BooleanSupplier;

/**
 * 보상 기반 다단계 작업(Saga) 실행기.
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * NOT_STARTED → RUNNING → COMPLETED
 *                       → COMPENSATING → COMPENSATED  (단계 실패, 보상 성공)
 *                                      → FAILED       (보상 중 오류 발생)
 *                                      → ABORTED      (취소 요청, 보상 성공)
 * </pre>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>보상은 완료된 단계에 대해서만, 완료 역순으로 실행</li>
 *   <li>단계 실행/보상마다 체크포인트 저장 (낙관적 버전 관리)</li>
 *   <li>취소는 단계 경계에서만 반영 (실행 중인 단계는 끝까지 수행)</li>
 *   <li>보상 오류는 버리지 않고 모두 모아 {@link SagaCompensationFailedException}으로 보고</li>
 * </ul>
 *
 * @param <D> Saga 데이터 타입
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface SagaOrchestrator<D> {

    /**
     * 새 Saga 실행 (식별자 자동 생성).
     *
     * @param data Saga 데이터
     * @return 실행 결과 (COMPLETED, COMPENSATED 또는 ABORTED)
     * @throws SagaCompensationFailedException 보상 중 하나 이상이 실패한 경우 (상태 FAILED로 저장됨)
     * @throws ConcurrencyConflictException 다른 실행자가 같은 Saga를 갱신한 경우
     */
    SagaResult<D> execute(D data);

    /**
     * 지정한 식별자로 새 Saga 실행.
     *
     * @throws IllegalStateException 같은 식별자의 체크포인트가 이미 있는 경우
     */
    SagaResult<D> execute(SagaId sagaId, D data);

    /**
     * 취소 신호와 함께 새 Saga 실행.
     *
     * <p>cancelled는 각 단계 시작 전에 확인됩니다. true이면 완료된 단계를 역순으로 보상하고
     * ABORTED로 종료합니다.</p>
     *
     * @param sagaId Saga 식별자
     * @param data Saga 데이터
     * @param cancelled 취소 신호
     * @return 실행 결과
     */
    SagaResult<D> execute(SagaId sagaId, D data, BooleanSupplier cancelled);

    /**
     * 마지막 체크포인트에서 재개.
     *
     * <p>RUNNING이면 기록된 다음 단계부터, COMPENSATING이면 남은 보상부터 이어갑니다.
     * 이미 종료 상태이면 저장된 결과를 그대로 반환합니다.</p>
     *
     * @param sagaId Saga 식별자
     * @return 실행 결과
     * @throws SagaNotFoundException 체크포인트가 없는 경우
     */
    SagaResult<D> resume(SagaId sagaId);

    /**
     * 취소 요청.
     *
     * <p>이 오케스트레이터에서 실행 중인 Saga는 다음 단계 경계에서 보상 후 ABORTED로 종료됩니다.
     * 실행 중이 아닌 비종료 Saga는 즉시 보상 후 ABORTED로 종료됩니다.</p>
     *
     * @param sagaId Saga 식별자
     * @return 요청이 반영되었으면 true, 이미 종료 상태이면 false
     * @throws SagaNotFoundException 체크포인트가 없는 경우
     */
    boolean abort(SagaId sagaId);

    /**
     * 저장된 현재 상태 조회.
     *
     * @param sagaId Saga 식별자
     * @return 상태
     * @throws SagaNotFoundException 체크포인트가 없는 경우
     */
    SagaState getState(SagaId sagaId);
}
