package com.ryuqq.relay.core.protection.noop;

import com.ryuqq.relay.core.protection.BackpressureConfig;
import com.ryuqq.relay.core.protection.BackpressureController;
import com.ryuqq.relay.core.protection.BackpressureMetrics;
import com.ryuqq.relay.core.protection.Permit;

/**
 * 백프레셔 NoOp 구현.
 *
 * <p>항상 허가를 발급하며 진행 중 작업 수를 추적하지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class NoOpBackpressureController implements BackpressureController {

    private static final Permit NOOP_PERMIT = () -> {
        // NoOp
    };

    private final BackpressureConfig config = new BackpressureConfig().withMaxInflight(Integer.MAX_VALUE);

    @Override
    public Permit acquire(String operation) {
        return NOOP_PERMIT;
    }

    @Override
    public int getInFlight() {
        return 0;
    }

    @Override
    public BackpressureMetrics getMetrics() {
        return new BackpressureMetrics(0, Integer.MAX_VALUE, 0, 0, 0);
    }

    @Override
    public BackpressureConfig getConfig() {
        return config;
    }
}
