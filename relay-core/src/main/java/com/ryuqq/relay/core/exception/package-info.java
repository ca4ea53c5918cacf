/**
 * 오류 분류 체계 패키지.
 *
 * <h2>전파 정책</h2>
 * <pre>
 * TransientTransportException       → 로컬 재시도 (RetryExecutor)
 * PermanentTransportException       → 즉시 호출자에게 전파
 * CircuitOpenException              → 빠른 실패 (트랜스포트 호출 없음)
 * BackpressureRejectedException     → 진입 거부
 * PoisonMessageQuarantinedException → Dead-letter 기록 (파이프라인 실패 아님)
 * SagaStepFailedException           → 보상 시작 (그 자체로 치명적이지 않음)
 * SagaCompensationFailedException   → 치명적 (원래 오류 + 모든 보상 오류)
 * </pre>
 *
 * <p>재시도가 소진되거나 영구/차단 오류인 경우 발행 경로에서는 호출자에게,
 * 구독 경로에서는 Poison/Dead-letter 경로로 전달됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.exception;
