/**
 * 메시지 파이프라인 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.application.pipeline.MessagePipeline} - publish/subscribe 진입점</li>
 *   <li>{@link com.ryuqq.relay.application.pipeline.MessageHandler} - 애플리케이션 핸들러</li>
 *   <li>{@link com.ryuqq.relay.application.pipeline.MessageContext} - 수신 메타데이터와 ack/reject</li>
 *   <li>{@link com.ryuqq.relay.application.pipeline.SubscriptionHandle} - 구독 핸들</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 *   <li><strong>트랜스포트 독립성:</strong> 브로커 종류와 무관하게 동일한 전달/격리 의미 제공</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.application.pipeline;
