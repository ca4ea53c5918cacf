package com.ryuqq.relay.adapter.runner.pipeline;

import com.ryuqq.relay.core.spi.DeliveryControl;

import java.util.Map;

/**
 * 트랜스포트 콜백에서 수신 버퍼로 옮겨지는 원시 수신 단위.
 *
 * @author Relay Team
 * @since 1.0.0
 */
record RawDelivery(byte[] body, Map<String, String> headers, DeliveryControl control) {

    RawDelivery {
        headers = headers == null ? Map.of() : headers;
    }
}
