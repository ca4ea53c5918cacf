package com.ryuqq.relay.core.spi;

/**
 * Dead-letter 싱크 SPI.
 *
 * <p>처리할 수 없는 메시지의 종착지입니다. 구독 경로에서 격리된 메시지는
 * 이 싱크에 기록된 뒤 라이브 스트림에서 acknowledge됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeadLetterSink {

    /**
     * Dead-letter 기록.
     *
     * @param deadLetter 항목
     */
    void deadLetter(DeadLetter deadLetter);
}
