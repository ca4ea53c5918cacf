/**
 * 식별자 값 객체 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.model.MessageId} - 메시지 식별자</li>
 *   <li>{@link com.ryuqq.relay.core.model.SagaId} - Saga 인스턴스 식별자</li>
 * </ul>
 *
 * <p>모든 값 객체는 불변이며 생성 시점에 유효성을 검증합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.model;
