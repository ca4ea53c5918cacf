package com.ryuqq.relay.adapter.protection.poison;

import com.ryuqq.relay.core.model.MessageId;
import com.ryuqq.relay.core.poison.PoisonDecision;
import com.ryuqq.relay.core.poison.PoisonGuardConfig;
import com.ryuqq.relay.core.poison.PoisonMessageGuard;
import com.ryuqq.relay.core.poison.PoisonRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 메모리 기반 Poison Message Guard.
 *
 * <p><strong>추적 규칙:</strong></p>
 * <ul>
 *   <li>키: (destination, messageId)</li>
 *   <li>실패 횟수가 poisonThreshold에 도달하면 한 번만 quarantine 결정을 반환</li>
 *   <li>이미 격리된 기록은 release 전까지 격리 상태 유지 (추가 quarantine 결정 없음)</li>
 *   <li>마지막 실패 후 retention이 지난 기록은 만료</li>
 *   <li>maxTrackedMessages 초과 시 가장 오래 갱신되지 않은 기록부터 제거</li>
 * </ul>
 *
 * <p>모든 연산은 인스턴스 monitor로 직렬화됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class DefaultPoisonMessageGuard implements PoisonMessageGuard {

    private static final Logger log = LoggerFactory.getLogger(DefaultPoisonMessageGuard.class);

    private final PoisonGuardConfig config;
    private final Clock clock;

    // access-order: 가장 오래 갱신되지 않은 기록이 맨 앞
    private final LinkedHashMap<Key, PoisonRecord> records = new LinkedHashMap<>(16, 0.75f, true);

    public DefaultPoisonMessageGuard(PoisonGuardConfig config) {
        this(config, Clock.systemUTC());
    }

    public DefaultPoisonMessageGuard(PoisonGuardConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public synchronized PoisonDecision recordFailure(String destination, MessageId messageId, Throwable error) {
        Key key = new Key(destination, messageId);
        Instant now = clock.instant();
        purgeExpired(now);

        PoisonRecord existing = records.get(key);
        if (existing != null && existing.quarantined()) {
            PoisonRecord updated = new PoisonRecord(destination, messageId, existing.failureCount() + 1,
                describe(error), existing.firstSeenAt(), now, true);
            records.put(key, updated);
            return PoisonDecision.retry(updated.failureCount());
        }

        int failureCount = existing == null ? 1 : existing.failureCount() + 1;
        boolean quarantine = failureCount >= config.poisonThreshold();
        Instant firstSeenAt = existing == null ? now : existing.firstSeenAt();
        records.put(key, new PoisonRecord(destination, messageId, failureCount, describe(error),
            firstSeenAt, now, quarantine));
        evictOverflow();

        if (quarantine) {
            log.warn("Message quarantined as poison: destination={}, messageId={}, failures={}",
                destination, messageId.getValue(), failureCount);
            return PoisonDecision.quarantine(failureCount);
        }
        log.debug("Message failure recorded: destination={}, messageId={}, failures={}",
            destination, messageId.getValue(), failureCount);
        return PoisonDecision.retry(failureCount);
    }

    @Override
    public synchronized void recordSuccess(String destination, MessageId messageId) {
        records.remove(new Key(destination, messageId));
    }

    @Override
    public synchronized void release(String destination, MessageId messageId) {
        records.remove(new Key(destination, messageId));
    }

    @Override
    public synchronized Optional<PoisonRecord> find(String destination, MessageId messageId) {
        purgeExpired(clock.instant());
        Key key = new Key(destination, messageId);
        // get()은 access-order를 갱신하므로 조회에는 순회를 사용
        for (Map.Entry<Key, PoisonRecord> entry : records.entrySet()) {
            if (entry.getKey().equals(key)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized List<PoisonRecord> snapshot() {
        purgeExpired(clock.instant());
        return List.copyOf(new ArrayList<>(records.values()));
    }

    @Override
    public synchronized int trackedCount() {
        purgeExpired(clock.instant());
        return records.size();
    }

    public PoisonGuardConfig getConfig() {
        return config;
    }

    private void purgeExpired(Instant now) {
        Instant threshold = now.minus(config.retention());
        Iterator<PoisonRecord> iterator = records.values().iterator();
        while (iterator.hasNext()) {
            PoisonRecord record = iterator.next();
            if (!record.lastSeenAt().isAfter(threshold)) {
                iterator.remove();
            }
        }
    }

    private void evictOverflow() {
        Iterator<Map.Entry<Key, PoisonRecord>> iterator = records.entrySet().iterator();
        while (records.size() > config.maxTrackedMessages() && iterator.hasNext()) {
            Map.Entry<Key, PoisonRecord> eldest = iterator.next();
            log.debug("Poison tracking capacity reached, evicting: {}", eldest.getKey());
            iterator.remove();
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private record Key(String destination, MessageId messageId) {

        private Key {
            if (destination == null || destination.isBlank()) {
                throw new IllegalArgumentException("destination cannot be null or blank");
            }
            if (messageId == null) {
                throw new IllegalArgumentException("messageId cannot be null");
            }
        }
    }
}
