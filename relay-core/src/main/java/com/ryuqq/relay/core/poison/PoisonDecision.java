package com.ryuqq.relay.core.poison;

/**
 * 실패 기록 결과.
 *
 * @param quarantine 이번 실패로 격리가 결정되었는지 여부 (키당 최대 한 번 true)
 * @param failureCount 현재까지의 실패 횟수
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record PoisonDecision(boolean quarantine, int failureCount) {

    public static PoisonDecision retry(int failureCount) {
        return new PoisonDecision(false, failureCount);
    }

    public static PoisonDecision quarantine(int failureCount) {
        return new PoisonDecision(true, failureCount);
    }
}
