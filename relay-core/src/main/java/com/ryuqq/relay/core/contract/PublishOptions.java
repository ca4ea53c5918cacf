package com.ryuqq.relay.core.contract;

import java.util.Map;

/**
 * 메시지 발행 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>destination: 발행 대상 (토픽, exchange, 스트림 이름)</li>
 *   <li>routingKey: 라우팅 키 (선택)</li>
 *   <li>correlationId: 상관 ID (선택, 없으면 파이프라인이 생성)</li>
 *   <li>headers: 추가 사용자 헤더</li>
 *   <li>contentType: 콘텐츠 타입 (압축 제외 판단에 사용)</li>
 * </ul>
 *
 * @param destination 발행 대상 (필수)
 * @param routingKey 라우팅 키 (null 허용)
 * @param correlationId 상관 ID (null 허용)
 * @param headers 추가 헤더 (null이면 빈 맵)
 * @param contentType 콘텐츠 타입 (null이면 application/json)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record PublishOptions(
    String destination,
    String routingKey,
    String correlationId,
    Map<String, String> headers,
    String contentType
) {

    public static final String DEFAULT_CONTENT_TYPE = "application/json";

    public PublishOptions {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (contentType == null || contentType.isBlank()) {
            contentType = DEFAULT_CONTENT_TYPE;
        }
    }

    /**
     * destination만 지정한 옵션 생성.
     *
     * @param destination 발행 대상
     * @return PublishOptions
     */
    public static PublishOptions to(String destination) {
        return new PublishOptions(destination, null, null, null, null);
    }

    public PublishOptions withRoutingKey(String routingKey) {
        return new PublishOptions(destination, routingKey, correlationId, headers, contentType);
    }

    public PublishOptions withCorrelationId(String correlationId) {
        return new PublishOptions(destination, routingKey, correlationId, headers, contentType);
    }

    public PublishOptions withHeaders(Map<String, String> headers) {
        return new PublishOptions(destination, routingKey, correlationId, headers, contentType);
    }

    public PublishOptions withContentType(String contentType) {
        return new PublishOptions(destination, routingKey, correlationId, headers, contentType);
    }
}
