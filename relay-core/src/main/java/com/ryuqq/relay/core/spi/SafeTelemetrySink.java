package com.ryuqq.relay.core.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 싱크 오류를 파이프라인으로 전파하지 않는 래퍼.
 *
 * <p>위임 대상이 던진 예외는 debug 로그로만 남기고 무시합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class SafeTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(SafeTelemetrySink.class);

    private final TelemetrySink delegate;

    private SafeTelemetrySink(TelemetrySink delegate) {
        this.delegate = delegate;
    }

    /**
     * 싱크를 감쌈. 이미 감싼 싱크는 그대로 반환합니다.
     *
     * @param sink 대상 싱크 (null이면 NoOp)
     * @return 안전한 싱크
     */
    public static TelemetrySink wrap(TelemetrySink sink) {
        if (sink == null) {
            return TelemetrySink.noop();
        }
        if (sink instanceof SafeTelemetrySink) {
            return sink;
        }
        return new SafeTelemetrySink(sink);
    }

    @Override
    public void counter(String name, Map<String, String> tags) {
        try {
            delegate.counter(name, tags);
        } catch (RuntimeException e) {
            log.debug("Telemetry counter '{}' dropped: {}", name, e.toString());
        }
    }

    @Override
    public void histogram(String name, double value, Map<String, String> tags) {
        try {
            delegate.histogram(name, value, tags);
        } catch (RuntimeException e) {
            log.debug("Telemetry histogram '{}' dropped: {}", name, e.toString());
        }
    }
}
