package com.ryuqq.relay.application.pipeline;

/**
 * 구독 핸들.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface SubscriptionHandle extends AutoCloseable {

    /**
     * 파이프라인 내 고유 구독 식별자.
     */
    String id();

    String destination();

    boolean isActive();

    /**
     * 구독 해제 ({@link MessagePipeline#unsubscribe(SubscriptionHandle)}와 동일).
     */
    @Override
    void close();
}
