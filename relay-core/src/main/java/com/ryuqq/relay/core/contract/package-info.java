/**
 * 파이프라인과 트랜스포트 사이의 메시지 계약 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.contract.Envelope} - 직렬화된 payload + 헤더</li>
 *   <li>{@link com.ryuqq.relay.core.contract.Headers} - 표준 헤더 이름</li>
 *   <li>{@link com.ryuqq.relay.core.contract.PublishOptions} - 발행 옵션</li>
 *   <li>{@link com.ryuqq.relay.core.contract.SubscriptionOptions} - 구독 옵션</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.contract;
