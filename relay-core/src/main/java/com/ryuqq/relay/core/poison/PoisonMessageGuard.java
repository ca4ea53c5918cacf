package com.ryuqq.relay.core.poison;

import com.ryuqq.relay.core.model.MessageId;

import java.util.List;
import java.util.Optional;

/**
 * Poison 메시지 가드 SPI.
 *
 * <p>(destination, messageId) 쌍 단위로 핸들러 실패 횟수를 추적하고,
 * 임계값에 도달하면 격리(quarantine)를 결정합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * recordFailure × (threshold-1) → retry
 * recordFailure (threshold 번째)  → quarantine (키당 한 번)
 *   → Dead-letter 기록 후 release()
 * 중간에 처리 성공 시 recordSuccess() → 기록 제거
 * </pre>
 *
 * <p>메모리 사용량은 메시지 처리량과 무관하게 retention(TTL)과
 * maxTrackedMessages(용량)로 제한됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface PoisonMessageGuard {

    /**
     * 실패 기록.
     *
     * @param destination 구독 대상
     * @param messageId 메시지 식별자
     * @param error 핸들러 오류
     * @return 격리 여부와 현재 실패 횟수
     */
    PoisonDecision recordFailure(String destination, MessageId messageId, Throwable error);

    /**
     * 처리 성공 기록 (추적 기록 제거).
     */
    void recordSuccess(String destination, MessageId messageId);

    /**
     * 격리된 기록 해제 (Dead-letter 기록 완료 후 호출).
     */
    void release(String destination, MessageId messageId);

    Optional<PoisonRecord> find(String destination, MessageId messageId);

    /**
     * 현재 추적 중인 기록 스냅샷 (만료된 기록 제외).
     *
     * @return 기록 목록
     */
    List<PoisonRecord> snapshot();

    int trackedCount();
}
