package com.ryuqq.relay.core.poison;

import java.time.Duration;

/**
 * Poison 메시지 가드 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>poisonThreshold: 격리 결정 실패 횟수 (기본 5)</li>
 *   <li>retention: 마지막 실패 후 기록 보존 시간 (기본 1시간)</li>
 *   <li>maxTrackedMessages: 동시에 추적할 최대 메시지 수 (기본 10,000, 초과 시 가장 오래된 기록 제거)</li>
 * </ul>
 *
 * @param poisonThreshold 격리 임계값 (1 이상)
 * @param retention 보존 시간 (양수)
 * @param maxTrackedMessages 최대 추적 수 (1 이상)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record PoisonGuardConfig(
    int poisonThreshold,
    Duration retention,
    int maxTrackedMessages
) {

    public PoisonGuardConfig() {
        this(5, Duration.ofHours(1), 10_000);
    }

    public PoisonGuardConfig {
        if (poisonThreshold <= 0) {
            throw new IllegalArgumentException("poisonThreshold must be positive (current: " + poisonThreshold + ")");
        }
        if (retention == null || retention.isZero() || retention.isNegative()) {
            throw new IllegalArgumentException("retention must be positive (current: " + retention + ")");
        }
        if (maxTrackedMessages <= 0) {
            throw new IllegalArgumentException("maxTrackedMessages must be positive (current: " + maxTrackedMessages + ")");
        }
    }

    public PoisonGuardConfig withPoisonThreshold(int poisonThreshold) {
        return new PoisonGuardConfig(poisonThreshold, retention, maxTrackedMessages);
    }

    public PoisonGuardConfig withRetention(Duration retention) {
        return new PoisonGuardConfig(poisonThreshold, retention, maxTrackedMessages);
    }

    public PoisonGuardConfig withMaxTrackedMessages(int maxTrackedMessages) {
        return new PoisonGuardConfig(poisonThreshold, retention, maxTrackedMessages);
    }
}
