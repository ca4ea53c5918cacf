package com.ryuqq.relay.core.protection;

/**
 * 백프레셔 한도 도달 시 적용할 정책.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum ThrottlePolicy {

    /**
     * 대기하지 않고 즉시 거부.
     */
    REJECT_IMMEDIATELY,

    /**
     * maxWait 동안 슬롯이 비기를 기다린 뒤, 여전히 없으면 거부.
     */
    WAIT_THEN_RETRY,

    /**
     * queueCapacity 만큼의 호출자만 대기열에 세우고, 대기열이 가득 차면 즉시 거부.
     * 대기 중인 호출자도 maxWait가 지나면 거부됩니다.
     */
    BOUNDED_QUEUE
}
