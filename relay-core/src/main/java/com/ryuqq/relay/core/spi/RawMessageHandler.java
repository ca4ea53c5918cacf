package com.ryuqq.relay.core.spi;

import java.util.Map;

/**
 * 트랜스포트 수신 콜백.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RawMessageHandler {

    /**
     * 원시 메시지 수신.
     *
     * @param envelopeBytes 수신한 payload
     * @param headers 발행 시 전달된 헤더
     * @param control acknowledge/reject 콜백
     */
    void onMessage(byte[] envelopeBytes, Map<String, String> headers, DeliveryControl control);
}
