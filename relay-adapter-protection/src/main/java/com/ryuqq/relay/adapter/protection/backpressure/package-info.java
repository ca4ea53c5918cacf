/**
 * Backpressure (진입 제어) 구현 패키지.
 *
 * <p>{@link com.ryuqq.relay.adapter.protection.backpressure.DefaultBackpressureController}는
 * in-flight 슬롯을, {@link com.ryuqq.relay.adapter.protection.backpressure.TokenBucket}은
 * 초당 처리량을 제한합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.protection.backpressure;
