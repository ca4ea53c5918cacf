package com.ryuqq.relay.adapter.runner.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 파이프라인이 소유하는 구독 목록.
 *
 * <p>구독 식별자는 {@code sub-1}, {@code sub-2} 형식으로 순차 발급됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
final class SubscriptionRegistry {

    private final Map<String, ConsumeWorker> workers = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    String nextId() {
        return "sub-" + sequence.incrementAndGet();
    }

    void register(ConsumeWorker worker) {
        if (worker == null) {
            throw new IllegalArgumentException("worker cannot be null");
        }
        if (workers.putIfAbsent(worker.id(), worker) != null) {
            throw new IllegalStateException("Subscription already registered: " + worker.id());
        }
    }

    Optional<ConsumeWorker> find(String id) {
        return Optional.ofNullable(workers.get(id));
    }

    Optional<ConsumeWorker> remove(String id) {
        return Optional.ofNullable(workers.remove(id));
    }

    List<ConsumeWorker> all() {
        return new ArrayList<>(workers.values());
    }

    int size() {
        return workers.size();
    }

    void clear() {
        workers.clear();
    }
}
