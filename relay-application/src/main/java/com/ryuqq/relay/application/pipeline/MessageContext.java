package com.ryuqq.relay.application.pipeline;

import com.ryuqq.relay.core.model.MessageId;

import java.util.Map;

/**
 * 수신 메시지 컨텍스트.
 *
 * <p>AckMode.AUTO에서는 핸들러가 정상 반환하면 파이프라인이 acknowledge합니다.
 * AckMode.MANUAL에서는 핸들러가 직접 {@link #acknowledge()} 또는 {@link #reject(boolean)}를
 * 호출해야 합니다. 두 모드 모두 첫 번째 호출만 유효합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface MessageContext {

    MessageId messageId();

    /**
     * 상관관계 식별자.
     *
     * @return correlation id (헤더가 없으면 null)
     */
    String correlationId();

    String destination();

    String typeTag();

    /**
     * 수신 헤더 (읽기 전용).
     */
    Map<String, String> headers();

    /**
     * 이 메시지의 전달 시도 번호 (1부터 시작, 이전 실패 횟수 + 1).
     */
    int deliveryAttempt();

    void acknowledge();

    /**
     * @param requeue true면 재전달 요청
     */
    void reject(boolean requeue);

    /**
     * acknowledge 또는 reject가 이미 호출되었는지 여부.
     */
    boolean isSettled();
}
