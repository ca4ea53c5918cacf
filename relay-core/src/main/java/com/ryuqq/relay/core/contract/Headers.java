package com.ryuqq.relay.core.contract;

/**
 * Envelope 헤더 이름 상수.
 *
 * <p>파이프라인이 발행 시 생성하고 소비 시 해석하는 메타데이터 키입니다.
 * 트랜스포트는 이 헤더를 그대로 전달해야 합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class Headers {

    public static final String MESSAGE_ID = "relay-message-id";
    public static final String MESSAGE_TYPE = "relay-message-type";
    public static final String CORRELATION_ID = "relay-correlation-id";
    public static final String ROUTING_KEY = "relay-routing-key";
    public static final String TIMESTAMP = "relay-timestamp";
    public static final String CONTENT_TYPE = "relay-content-type";

    /**
     * 압축 마커. 값은 압축 알고리즘 이름 (예: gzip).
     */
    public static final String COMPRESSION = "relay-compression";

    private Headers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
