package com.ryuqq.relay.core.spi;

import java.util.Map;

/**
 * 텔레메트리 싱크 SPI (fire-and-forget).
 *
 * <p>구현은 예외를 파이프라인으로 던지지 않아야 합니다. 파이프라인은 추가로
 * {@link SafeTelemetrySink}로 감싸 싱크 오류를 격리합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface TelemetrySink {

    /**
     * 카운터 1 증가.
     *
     * @param name 메트릭 이름
     * @param tags 태그
     */
    void counter(String name, Map<String, String> tags);

    /**
     * 히스토그램 값 기록.
     *
     * @param name 메트릭 이름
     * @param value 값
     * @param tags 태그
     */
    void histogram(String name, double value, Map<String, String> tags);

    /**
     * 아무 것도 기록하지 않는 싱크.
     *
     * @return NoOp 싱크
     */
    static TelemetrySink noop() {
        return NoOpTelemetrySink.INSTANCE;
    }
}
