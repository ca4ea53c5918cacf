package com.ryuqq.relay.core.poison;

import com.ryuqq.relay.core.model.MessageId;

import java.time.Instant;

/**
 * 메시지별 실패 추적 기록.
 *
 * @param destination 구독 대상
 * @param messageId 메시지 식별자
 * @param failureCount 누적 실패 횟수
 * @param lastError 마지막 오류 요약 (클래스명: 메시지)
 * @param firstSeenAt 첫 실패 시각
 * @param lastSeenAt 마지막 실패 시각
 * @param quarantined 격리 판정 여부
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record PoisonRecord(
    String destination,
    MessageId messageId,
    int failureCount,
    String lastError,
    Instant firstSeenAt,
    Instant lastSeenAt,
    boolean quarantined
) {
}
