package com.ryuqq.relay.core.contract;

/**
 * 구독 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>destination: 구독 대상</li>
 *   <li>prefetch: 컨슈머 워커가 미리 받아둘 수 있는 최대 메시지 수 (기본 16)</li>
 *   <li>ackMode: 확인 방식 (기본 AUTO)</li>
 * </ul>
 *
 * @param destination 구독 대상 (필수)
 * @param prefetch prefetch 한도 (1 이상)
 * @param ackMode 확인 방식
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record SubscriptionOptions(
    String destination,
    int prefetch,
    AckMode ackMode
) {

    public static final int DEFAULT_PREFETCH = 16;

    public SubscriptionOptions {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        if (prefetch <= 0) {
            throw new IllegalArgumentException("prefetch must be positive (current: " + prefetch + ")");
        }
        if (ackMode == null) {
            throw new IllegalArgumentException("ackMode cannot be null");
        }
    }

    /**
     * 기본 prefetch, AUTO ack 모드로 생성.
     *
     * @param destination 구독 대상
     * @return SubscriptionOptions
     */
    public static SubscriptionOptions of(String destination) {
        return new SubscriptionOptions(destination, DEFAULT_PREFETCH, AckMode.AUTO);
    }

    public SubscriptionOptions withPrefetch(int prefetch) {
        return new SubscriptionOptions(destination, prefetch, ackMode);
    }

    public SubscriptionOptions withAckMode(AckMode ackMode) {
        return new SubscriptionOptions(destination, prefetch, ackMode);
    }
}
