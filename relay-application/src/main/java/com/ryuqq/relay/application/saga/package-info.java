/**
 * Saga 오케스트레이션 API.
 *
 * <p>단계별 보상 작업으로 분산 트랜잭션 없이 롤백과 유사한 의미를 제공합니다.
 * 구현체({@code DefaultSagaOrchestrator})는 adapter-runner 모듈에 있습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.application.saga;
