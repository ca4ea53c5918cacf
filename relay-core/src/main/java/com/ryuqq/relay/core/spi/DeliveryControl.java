package com.ryuqq.relay.core.spi;

/**
 * 개별 수신 메시지의 확인 제어.
 *
 * <p>하나의 수신에 대해 acknowledge 또는 reject 중 하나만 유효하며,
 * 이후 호출은 무시되어야 합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface DeliveryControl {

    /**
     * 처리 완료 확인. 메시지는 스트림에서 제거(또는 커밋)됩니다.
     */
    void acknowledge();

    /**
     * 처리 거부.
     *
     * @param requeue true: 재전달 대상으로 반환, false: 폐기
     */
    void reject(boolean requeue);
}
