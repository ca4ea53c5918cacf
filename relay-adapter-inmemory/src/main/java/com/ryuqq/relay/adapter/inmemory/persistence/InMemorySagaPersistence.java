package com.ryuqq.relay.adapter.inmemory.persistence;

import com.ryuqq.relay.core.exception.ConcurrencyConflictException;
import com.ryuqq.relay.core.model.SagaId;
import com.ryuqq.relay.core.saga.SagaCheckpoint;
import com.ryuqq.relay.core.spi.SagaPersistence;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link SagaPersistence}.
 *
 * <p>The version check and the write happen inside a single
 * {@link ConcurrentHashMap#compute} call, so a stale writer can never overwrite a newer
 * checkpoint.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InMemorySagaPersistence implements SagaPersistence {

    private final ConcurrentHashMap<SagaId, SagaCheckpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public long saveCheckpoint(SagaCheckpoint checkpoint, long expectedVersion) {
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint cannot be null");
        }
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion cannot be negative (current: " + expectedVersion + ")");
        }

        SagaCheckpoint stored = checkpoints.compute(checkpoint.sagaId(), (id, existing) -> {
            long currentVersion = existing == null ? 0L : existing.version();
            if (currentVersion != expectedVersion) {
                throw new ConcurrencyConflictException(id, expectedVersion, currentVersion);
            }
            return checkpoint.withVersion(expectedVersion + 1);
        });
        return stored.version();
    }

    @Override
    public Optional<SagaCheckpoint> loadCheckpoint(SagaId sagaId) {
        if (sagaId == null) {
            throw new IllegalArgumentException("sagaId cannot be null");
        }
        return Optional.ofNullable(checkpoints.get(sagaId));
    }

    /**
     * All stored checkpoints (for test assertions).
     *
     * @return snapshot list
     */
    public List<SagaCheckpoint> findAll() {
        return List.copyOf(checkpoints.values());
    }

    public int size() {
        return checkpoints.size();
    }

    public void clear() {
        checkpoints.clear();
    }
}
