package com.ryuqq.relay.application.pipeline;

import com.ryuqq.relay.core.contract.PublishOptions;
import com.ryuqq.relay.core.contract.SubscriptionOptions;
import com.ryuqq.relay.core.model.MessageId;

/**
 * 트랜스포트 독립적인 메시지 파이프라인.
 *
 * <p>애플리케이션 핸들러와 브로커 트랜스포트 사이에서 직렬화, 진입 제어, 재시도,
 * Circuit Breaker, Poison 메시지 격리를 일관되게 적용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MessageId id = pipeline.publish(new OrderPlaced("order-1"), PublishOptions.to("orders"));
 *
 * SubscriptionHandle handle = pipeline.subscribe(
 *     OrderPlaced.class,
 *     (message, context) -&gt; orderService.handle(message),
 *     SubscriptionOptions.of("orders")
 * );
 *
 * pipeline.unsubscribe(handle);
 * pipeline.close();
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface MessagePipeline extends AutoCloseable {

    /**
     * 메시지 발행.
     *
     * <p><strong>처리 순서:</strong></p>
     * <ol>
     *   <li>스키마 검증 (설정된 경우)</li>
     *   <li>직렬화 및 조건부 압축</li>
     *   <li>Envelope 생성 (message id, timestamp, correlation id)</li>
     *   <li>Backpressure 허가 획득 (모든 종료 경로에서 해제)</li>
     *   <li>재시도 + Circuit Breaker로 감싼 트랜스포트 발행</li>
     * </ol>
     *
     * @param message 발행할 메시지
     * @param options 발행 옵션
     * @return 생성된 메시지 식별자
     * @throws IllegalArgumentException message 또는 options가 null인 경우
     * @throws IllegalStateException 파이프라인이 종료된 경우
     * @throws com.ryuqq.relay.core.exception.SerializationException 검증 또는 직렬화 실패 시
     * @throws com.ryuqq.relay.core.exception.BackpressureRejectedException 진입이 거부된 경우
     * @throws com.ryuqq.relay.core.exception.CircuitOpenException Circuit이 열린 경우
     * @throws com.ryuqq.relay.core.exception.TransportException 재시도 소진 또는 영구 오류
     */
    MessageId publish(Object message, PublishOptions options);

    /**
     * 메시지 구독.
     *
     * <p>구독마다 독립적인 consume worker 하나가 시작됩니다. 핸들러 예외는 worker를
     * 종료시키지 않으며 Poison 판정 후 재전달 또는 Dead-letter로 처리됩니다.</p>
     *
     * @param type 메시지 타입
     * @param handler 메시지 핸들러
     * @param options 구독 옵션
     * @param <T> 메시지 타입
     * @return 구독 핸들
     * @throws IllegalStateException 파이프라인이 종료된 경우
     */
    <T> SubscriptionHandle subscribe(Class<T> type, MessageHandler<T> handler, SubscriptionOptions options);

    /**
     * 구독 해제. 처리 중인 메시지는 완료될 때까지 기다립니다.
     *
     * @param handle 구독 핸들
     */
    void unsubscribe(SubscriptionHandle handle);

    /**
     * 모든 구독을 해제하고 트랜스포트를 닫습니다.
     */
    @Override
    void close();
}
