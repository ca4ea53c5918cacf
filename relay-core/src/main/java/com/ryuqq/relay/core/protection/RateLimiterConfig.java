package com.ryuqq.relay.core.protection;

/**
 * Token Bucket 속도 제한 설정.
 *
 * <p>백프레셔의 선택적 속도 제한에 사용됩니다. 버킷은 {@code maxBurstSize}개의 토큰으로
 * 시작하며 초당 {@code permitsPerSecond}개씩 다시 채워집니다.</p>
 *
 * @param permitsPerSecond 초당 토큰 보충량 (양수)
 * @param maxBurstSize 버킷 크기 (양수)
 * @author Relay Team
 * @since 1.0.0
 */
public record RateLimiterConfig(double permitsPerSecond, int maxBurstSize) {

    public RateLimiterConfig {
        if (permitsPerSecond <= 0) {
            throw new IllegalArgumentException("permitsPerSecond must be positive (current: " + permitsPerSecond + ")");
        }
        if (maxBurstSize <= 0) {
            throw new IllegalArgumentException("maxBurstSize must be positive (current: " + maxBurstSize + ")");
        }
    }

    /**
     * 토큰 하나가 보충되는 데 걸리는 시간.
     *
     * @return 나노초
     */
    public long nanosPerPermit() {
        return (long) (1_000_000_000L / permitsPerSecond);
    }
}
