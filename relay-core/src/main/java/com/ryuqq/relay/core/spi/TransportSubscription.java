package com.ryuqq.relay.core.spi;

/**
 * 트랜스포트 구독 핸들.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface TransportSubscription extends AutoCloseable {

    String destination();

    boolean isActive();

    /**
     * 구독 해제 (멱등).
     */
    @Override
    void close();
}
