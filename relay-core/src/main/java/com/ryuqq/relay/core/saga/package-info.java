/**
 * Saga 모델 패키지.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.saga.SagaState} - Saga 생명주기 상태</li>
 *   <li>{@link com.ryuqq.relay.core.saga.SagaStateTransition} - 상태 전이 검증</li>
 *   <li>{@link com.ryuqq.relay.core.saga.SagaStep} - 멱등 단계 계약</li>
 *   <li>{@link com.ryuqq.relay.core.saga.SagaCheckpoint} - 영속화 단위</li>
 * </ul>
 *
 * <h2>보상 순서</h2>
 * <p>보상 순서는 호출 스택이 아니라 체크포인트의 완료 단계 목록으로 결정됩니다.
 * 따라서 크래시 후 재개해도 같은 역순이 복원됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.saga;
