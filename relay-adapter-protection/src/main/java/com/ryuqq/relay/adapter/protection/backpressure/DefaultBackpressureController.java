package com.ryuqq.relay.adapter.protection.backpressure;

import com.ryuqq.relay.core.exception.BackpressureRejectedException;
import com.ryuqq.relay.core.protection.BackpressureConfig;
import com.ryuqq.relay.core.protection.BackpressureController;
import com.ryuqq.relay.core.protection.BackpressureMetrics;
import com.ryuqq.relay.core.protection.Permit;
import com.ryuqq.relay.core.protection.ThrottlePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 세마포어 기반 Backpressure 구현.
 *
 * <p><strong>정책별 동작 (in-flight == maxInflight일 때):</strong></p>
 * <ul>
 *   <li>REJECT_IMMEDIATELY: 대기 없이 즉시 {@link BackpressureRejectedException}</li>
 *   <li>WAIT_THEN_RETRY: 최대 maxWait 동안 슬롯 반환을 기다린 뒤, 그래도 없으면 거부</li>
 *   <li>BOUNDED_QUEUE: 대기자가 queueCapacity 미만이면 슬롯이 날 때까지 대기, 아니면 즉시 거부</li>
 * </ul>
 *
 * <p>rateLimit이 설정된 경우 슬롯 획득 후 Token Bucket을 확인하며, 토큰이 없으면
 * 슬롯을 반환하고 거부합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class DefaultBackpressureController implements BackpressureController {

    private static final Logger log = LoggerFactory.getLogger(DefaultBackpressureController.class);

    private final BackpressureConfig config;
    private final TokenBucket tokenBucket;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotReleased = lock.newCondition();

    // lock 보호 필드
    private int inFlight;
    private int waiting;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    public DefaultBackpressureController(BackpressureConfig config) {
        this(config, config != null && config.rateLimit() != null ? new TokenBucket(config.rateLimit()) : null);
    }

    /**
     * Token Bucket을 주입하는 생성자.
     *
     * @param config 설정
     * @param tokenBucket 속도 제한기 (null이면 속도 제한 없음)
     */
    public DefaultBackpressureController(BackpressureConfig config, TokenBucket tokenBucket) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.tokenBucket = tokenBucket;
    }

    @Override
    public Permit acquire(String operation) {
        lock.lock();
        try {
            if (inFlight >= config.maxInflight()) {
                awaitSlot(operation);
            }
            inFlight++;
        } finally {
            lock.unlock();
        }

        if (tokenBucket != null && !tokenBucket.tryConsume()) {
            releaseSlot();
            throw reject(operation, "rate limit exceeded");
        }

        accepted.incrementAndGet();
        return new SlotPermit();
    }

    /**
     * lock 보유 상태에서 호출. 반환 시 슬롯 하나가 비어 있음이 보장됩니다.
     */
    private void awaitSlot(String operation) {
        ThrottlePolicy policy = config.throttlePolicy();
        if (policy == ThrottlePolicy.REJECT_IMMEDIATELY) {
            throw reject(operation, "max in-flight reached (" + config.maxInflight() + ")");
        }
        if (policy == ThrottlePolicy.BOUNDED_QUEUE && waiting >= config.queueCapacity()) {
            throw reject(operation, "wait queue full (" + config.queueCapacity() + ")");
        }

        waiting++;
        try {
            if (policy == ThrottlePolicy.WAIT_THEN_RETRY) {
                long remaining = config.maxWait().toNanos();
                while (inFlight >= config.maxInflight()) {
                    if (remaining <= 0) {
                        throw reject(operation, "no slot within " + config.maxWait().toMillis() + "ms");
                    }
                    remaining = slotReleased.awaitNanos(remaining);
                }
            } else {
                while (inFlight >= config.maxInflight()) {
                    slotReleased.await();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw reject(operation, "interrupted while waiting");
        } finally {
            waiting--;
        }
    }

    private BackpressureRejectedException reject(String operation, String reason) {
        rejected.incrementAndGet();
        log.warn("Backpressure rejected operation '{}': {}", operation, reason);
        return new BackpressureRejectedException(operation, reason);
    }

    private void releaseSlot() {
        lock.lock();
        try {
            inFlight--;
            slotReleased.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getInFlight() {
        lock.lock();
        try {
            return inFlight;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BackpressureMetrics getMetrics() {
        lock.lock();
        try {
            return new BackpressureMetrics(inFlight, config.maxInflight(), waiting, accepted.get(), rejected.get());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BackpressureConfig getConfig() {
        return config;
    }

    private final class SlotPermit implements Permit {

        private final AtomicBoolean released = new AtomicBoolean(false);

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                releaseSlot();
            }
        }
    }
}
