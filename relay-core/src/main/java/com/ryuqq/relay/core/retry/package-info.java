/**
 * 재시도 정책 및 일시적 오류 판별 SPI.
 *
 * <p>실행기는 {@code relay-adapter-protection} 모듈의 {@code RetryExecutor}입니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.retry;
