package com.ryuqq.relay.core.spi;

import com.ryuqq.relay.core.contract.SubscriptionOptions;
import com.ryuqq.relay.core.exception.PermanentTransportException;
import com.ryuqq.relay.core.exception.TransientTransportException;

import java.util.Map;

/**
 * Broker Transport SPI.
 *
 * <p>브로커별 원시(raw) publish/subscribe 기능을 추상화합니다. 파티션 로그, queue+exchange,
 * 세션 토픽, stream+consumer-group 등 브로커 종류마다 하나의 구현이 존재하며,
 * 파이프라인은 이 인터페이스에만 의존합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: publishRaw는 여러 스레드에서 동시에 호출될 수 있음</li>
 *   <li>헤더 보존: 전달받은 헤더를 수정 없이 소비자에게 전달</li>
 *   <li>순서: 하나의 구독 내에서는 브로커가 보장하는 순서대로 onMessage 호출</li>
 *   <li>오류 분류: 재시도 가능한 오류는 {@link TransientTransportException},
 *       그 외는 {@link PermanentTransportException}</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface BrokerTransport extends AutoCloseable {

    /**
     * 원시 메시지 발행.
     *
     * @param destination 발행 대상
     * @param envelopeBytes 직렬화된 payload
     * @param headers Envelope 헤더 (읽기 전용)
     * @throws TransientTransportException 일시적 오류
     * @throws PermanentTransportException 영구적 오류
     */
    void publishRaw(String destination, byte[] envelopeBytes, Map<String, String> headers);

    /**
     * destination 구독.
     *
     * <p>트랜스포트는 수신한 각 메시지마다 {@code onMessage}를 호출합니다.
     * {@code onMessage}는 블로킹될 수 있으며(컨슈머 버퍼가 가득 찬 경우), 트랜스포트는
     * 이를 자연스러운 흐름 제어로 취급해야 합니다.</p>
     *
     * @param destination 구독 대상
     * @param onMessage 메시지 콜백
     * @param options 구독 옵션
     * @return 구독 핸들
     */
    TransportSubscription subscribe(String destination, RawMessageHandler onMessage, SubscriptionOptions options);

    /**
     * 트랜스포트 종료 (모든 구독 해제 및 연결 정리).
     */
    @Override
    void close();
}
