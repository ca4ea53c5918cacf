package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.contract.Envelope;

import java.time.Instant;

/**
 * Dead-letter 항목.
 *
 * @param destination 원래 구독 대상
 * @param envelope 수신한 Envelope (헤더 포함)
 * @param failureCount 격리 시점 실패 횟수
 * @param reason 격리 사유 (보통 {@code PoisonMessageQuarantinedException})
 * @param deadLetteredAt 기록 시각
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record DeadLetter(
    String destination,
    Envelope envelope,
    int failureCount,
    Throwable reason,
    Instant deadLetteredAt
) {

    public DeadLetter {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (deadLetteredAt == null) {
            deadLetteredAt = Instant.now();
        }
    }
}
