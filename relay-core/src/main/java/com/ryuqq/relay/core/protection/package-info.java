/**
 * Protection SPI 패키지.
 *
 * <p>파이프라인의 장애 격리 및 진입 제어 확장점을 정의합니다.
 * 구현은 {@code relay-adapter-protection} 모듈이 제공합니다.</p>
 *
 * <h2>발행 경로 적용 순서</h2>
 * <pre>
 * 1. BackpressureController → 진입 허가 (try-with-resources)
 * 2. RetryExecutor          → 일시적 오류 재시도
 * 3. CircuitBreaker         → OPEN 상태 시 즉시 실패
 * 4. BrokerTransport        → 실제 publishRaw 호출
 * </pre>
 *
 * <p>재시도는 Circuit Breaker 바깥에 위치하므로 각 재시도 시도가 개별 호출로 집계되며,
 * Circuit이 열리면 {@code CircuitOpenException}은 재시도되지 않습니다.</p>
 *
 * <h2>NoOp 구현</h2>
 * <p>{@code noop} 하위 패키지는 모든 호출을 허용하는 기본 구현을 제공합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.protection;
