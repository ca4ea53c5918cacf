package com.ryuqq.relay.core.contract;

/**
 * 구독의 메시지 확인 (Acknowledgment) 방식.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum AckMode {

    /**
     * 핸들러가 정상 반환하면 파이프라인이 자동으로 acknowledge.
     */
    AUTO,

    /**
     * 핸들러가 MessageContext를 통해 직접 acknowledge/reject.
     *
     * <p>핸들러가 아무 것도 호출하지 않고 반환하면 메시지는 확인되지 않은 채 남습니다.</p>
     */
    MANUAL
}
