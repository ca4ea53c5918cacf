package com.ryuqq.relay.core.protection;

import com.ryuqq.relay.core.exception.BackpressureRejectedException;

/**
 * 백프레셔 진입 제어 SPI.
 *
 * <p>동시 진행 작업 수를 {@code maxInflight}로 제한하고, 선택적으로 Token Bucket
 * 속도 제한을 적용합니다. 한도 도달 시 설정된 {@link ThrottlePolicy}를 따릅니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>진행 중 카운터는 원자적으로 갱신</li>
 *   <li>REJECT_IMMEDIATELY에서 한도 도달 시 블로킹 없이 동기적으로 거부</li>
 *   <li>대기 중 인터럽트 발생 시 인터럽트 플래그를 복원하고 거부</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface BackpressureController {

    /**
     * 진입 허가 획득.
     *
     * @param operation 작업 이름 (로깅 및 예외 메시지용)
     * @return 해제 가능한 Permit
     * @throws BackpressureRejectedException 진입이 거부된 경우
     */
    Permit acquire(String operation);

    /**
     * 현재 진행 중인 작업 수.
     *
     * @return in-flight 수
     */
    int getInFlight();

    BackpressureMetrics getMetrics();

    BackpressureConfig getConfig();
}
