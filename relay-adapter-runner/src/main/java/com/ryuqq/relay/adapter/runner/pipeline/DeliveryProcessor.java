package com.ryuqq.relay.adapter.runner.pipeline;

import java.util.function.BooleanSupplier;

/**
 * Consume worker가 버퍼에서 꺼낸 수신 건을 처리하는 콜백.
 *
 * <p>{@code active}는 worker가 아직 실행 중인지 알려주며, 보류된 ack/reject를 기다리는
 * 동안 정지 요청을 확인하는 데 사용됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
interface DeliveryProcessor {

    void process(RawDelivery delivery, BooleanSupplier active);
}
