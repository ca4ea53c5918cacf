package com.ryuqq.relay.adapter.protection.backpressure;

import com.ryuqq.relay.core.protection.RateLimiterConfig;

import java.util.function.LongSupplier;

/**
 * Token Bucket 속도 제한기.
 *
 * <p>최대 maxBurstSize개의 토큰을 보관하며, nanosPerPermit마다 하나씩 보충됩니다.
 * 버킷은 가득 찬 상태로 시작합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class TokenBucket {

    private final int capacity;
    private final long nanosPerPermit;
    private final LongSupplier nanoTime;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(RateLimiterConfig config) {
        this(config, System::nanoTime);
    }

    public TokenBucket(RateLimiterConfig config, LongSupplier nanoTime) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (nanoTime == null) {
            throw new IllegalArgumentException("nanoTime cannot be null");
        }
        this.capacity = config.maxBurstSize();
        this.nanosPerPermit = Math.max(1L, config.nanosPerPermit());
        this.nanoTime = nanoTime;
        this.tokens = capacity;
        this.lastRefillNanos = nanoTime.getAsLong();
    }

    /**
     * 토큰 하나 소비 시도.
     *
     * @return 토큰이 있으면 true
     */
    public synchronized boolean tryConsume() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    public synchronized int availableTokens() {
        refill();
        return (int) tokens;
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + (double) elapsed / nanosPerPermit);
        lastRefillNanos = now;
    }
}
