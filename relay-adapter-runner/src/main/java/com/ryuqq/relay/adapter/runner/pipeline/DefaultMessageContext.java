package com.ryuqq.relay.adapter.runner.pipeline;

import com.ryuqq.relay.application.pipeline.MessageContext;
import com.ryuqq.relay.core.contract.Envelope;
import com.ryuqq.relay.core.contract.Headers;
import com.ryuqq.relay.core.model.MessageId;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.spi.DeliveryControl;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MessageContext 기본 구현.
 *
 * <p>acknowledge/reject는 destination의 Circuit Breaker를 통해 트랜스포트로 전달됩니다.
 * 트랜스포트 호출이 성공한 경우에만 settled로 표시되며, 이후 호출은 무시됩니다.</p>
 *
 * <p>호출이 실패하면 마지막 요청이 보류(pending)로 남습니다. Pipeline은 worker가 실행 중인 동안
 * {@link #retryPendingSettlement()}로 다시 시도하고, worker가 멈추면
 * {@link #returnForRedelivery()}로 수신 건을 트랜스포트에 돌려줍니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
class DefaultMessageContext implements MessageContext {

    private final Envelope envelope;
    private final String destination;
    private final int deliveryAttempt;
    private final DeliveryControl control;
    private final CircuitBreaker circuitBreaker;
    private final AtomicBoolean settled = new AtomicBoolean(false);
    private volatile Runnable pendingSettlement;

    DefaultMessageContext(
        Envelope envelope,
        String destination,
        int deliveryAttempt,
        DeliveryControl control,
        CircuitBreaker circuitBreaker
    ) {
        this.envelope = envelope;
        this.destination = destination;
        this.deliveryAttempt = deliveryAttempt;
        this.control = control;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public MessageId messageId() {
        return envelope.messageId();
    }

    @Override
    public String correlationId() {
        return envelope.header(Headers.CORRELATION_ID);
    }

    @Override
    public String destination() {
        return destination;
    }

    @Override
    public String typeTag() {
        return envelope.typeTag();
    }

    @Override
    public Map<String, String> headers() {
        return envelope.headers();
    }

    @Override
    public int deliveryAttempt() {
        return deliveryAttempt;
    }

    /**
     * @throws com.ryuqq.relay.core.exception.CircuitOpenException Circuit이 열린 경우 (settled 아님, 요청은 보류)
     */
    @Override
    public void acknowledge() {
        settle(control::acknowledge);
    }

    @Override
    public void reject(boolean requeue) {
        settle(() -> control.reject(requeue));
    }

    private void settle(Runnable action) {
        if (settled.get()) {
            return;
        }
        try {
            circuitBreaker.run(action);
        } catch (RuntimeException e) {
            pendingSettlement = action;
            throw e;
        }
        pendingSettlement = null;
        settled.set(true);
    }

    boolean hasPendingSettlement() {
        return !settled.get() && pendingSettlement != null;
    }

    /**
     * 보류된 acknowledge/reject를 Circuit Breaker를 통해 다시 시도.
     *
     * @throws RuntimeException 다시 실패한 경우 (요청은 계속 보류)
     */
    void retryPendingSettlement() {
        Runnable action = pendingSettlement;
        if (action != null) {
            settle(action);
        }
    }

    /**
     * Circuit Breaker를 거치지 않고 수신 건을 재전달 대상으로 반환.
     */
    void returnForRedelivery() {
        if (settled.compareAndSet(false, true)) {
            pendingSettlement = null;
            control.reject(true);
        }
    }

    @Override
    public boolean isSettled() {
        return settled.get();
    }

    Envelope envelope() {
        return envelope;
    }
}
