/**
 * SagaOrchestrator 구현.
 *
 * <p>체크포인트는 {@link com.ryuqq.relay.core.spi.SagaPersistence}에, 데이터 스냅샷은
 * {@link com.ryuqq.relay.core.spi.Codec}으로 직렬화해 저장합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner.saga;
