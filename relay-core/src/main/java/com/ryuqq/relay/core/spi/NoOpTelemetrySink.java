package com.ryuqq.relay.core.spi;

import java.util.Map;

/**
 * 텔레메트리 NoOp 구현.
 *
 * @author Relay Team
 * @since 1.0.0
 */
final class NoOpTelemetrySink implements TelemetrySink {

    static final NoOpTelemetrySink INSTANCE = new NoOpTelemetrySink();

    private NoOpTelemetrySink() {
    }

    @Override
    public void counter(String name, Map<String, String> tags) {
        // NoOp
    }

    @Override
    public void histogram(String name, double value, Map<String, String> tags) {
        // NoOp
    }
}
