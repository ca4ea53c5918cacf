package com.ryuqq.relay.application.pipeline;

/**
 * 애플리케이션 메시지 핸들러.
 *
 * @param <T> 메시지 타입
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageHandler<T> {

    /**
     * 메시지 처리.
     *
     * <p>예외를 던지면 실패로 기록되어 재전달되며, 실패가 누적되면 Dead-letter로 격리됩니다.</p>
     *
     * @param message 역직렬화된 메시지
     * @param context 메타데이터 및 ack/reject 콜백
     * @throws Exception 처리 실패 시
     */
    void handle(T message, MessageContext context) throws Exception;
}
