package com.ryuqq.relay.adapter.runner.pipeline;

import com.ryuqq.relay.application.pipeline.SubscriptionHandle;
import com.ryuqq.relay.core.spi.DeliveryControl;
import com.ryuqq.relay.core.spi.RawMessageHandler;
import com.ryuqq.relay.core.spi.TransportSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 구독 하나를 담당하는 consume worker.
 *
 * <p>트랜스포트 콜백은 수신 건을 크기 {@code prefetch}의 버퍼에 넣기만 하고,
 * 전용 스레드가 버퍼를 짧은 간격으로 polling하며 {@link DeliveryProcessor}를 호출합니다.</p>
 *
 * <p><strong>취소 규칙:</strong></p>
 * <ul>
 *   <li>취소 플래그는 수신 건 사이에서만 확인 (실행 중인 핸들러는 인터럽트하지 않음)</li>
 *   <li>버퍼가 가득 찬 동안 트랜스포트 콜백은 대기 (트랜스포트 쪽으로 역압 전달)</li>
 *   <li>정지 후 버퍼에 남은 수신 건과 새로 도착한 수신 건은 재전달 요청으로 반환</li>
 *   <li>worker 스레드가 인터럽트되면 스스로 정지하고 등록을 해제 ({@link #isActive()}가 false가 됨)</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
final class ConsumeWorker implements SubscriptionHandle, Runnable {

    private static final Logger log = LoggerFactory.getLogger(ConsumeWorker.class);

    private final String id;
    private final String destination;
    private final PipelineConfig config;
    private final DeliveryProcessor processor;
    private final Consumer<ConsumeWorker> onStopped;
    private final BlockingQueue<RawDelivery> buffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Thread thread;

    private volatile TransportSubscription transportSubscription;

    ConsumeWorker(
        String id,
        String destination,
        int prefetch,
        String threadName,
        PipelineConfig config,
        DeliveryProcessor processor,
        Consumer<ConsumeWorker> onStopped
    ) {
        this.id = id;
        this.destination = destination;
        this.config = config;
        this.processor = processor;
        this.onStopped = onStopped;
        this.buffer = new ArrayBlockingQueue<>(prefetch);
        this.thread = new Thread(this, threadName);
        this.thread.setDaemon(true);
    }

    /**
     * 트랜스포트에 등록할 콜백.
     */
    RawMessageHandler callback() {
        return this::enqueue;
    }

    /**
     * Worker 스레드 시작. 트랜스포트 구독 전에 호출되어야 첫 수신 건부터 버퍼에 들어갑니다.
     */
    void start() {
        if (running.compareAndSet(false, true)) {
            thread.start();
            log.info("Subscription {} started on '{}' ({})", id, destination, thread.getName());
        }
    }

    void attach(TransportSubscription subscription) {
        this.transportSubscription = subscription;
        if (!running.get()) {
            subscription.close();
        }
    }

    private void enqueue(byte[] body, Map<String, String> headers, DeliveryControl control) {
        RawDelivery delivery = new RawDelivery(body, headers, control);
        try {
            while (running.get()) {
                if (buffer.offer(delivery, config.pollIntervalMs(), TimeUnit.MILLISECONDS)) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        control.reject(true);
    }

    @Override
    public void run() {
        while (running.get()) {
            RawDelivery delivery;
            try {
                delivery = buffer.poll(config.pollIntervalMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (running.get()) {
                    log.warn("Consumer thread {} was interrupted, stopping subscription {} on '{}'",
                        thread.getName(), id, destination);
                    stop();
                }
                break;
            }
            if (delivery == null) {
                continue;
            }
            try {
                processor.process(delivery, running::get);
            } catch (RuntimeException e) {
                log.error("Unexpected failure while processing delivery on '{}' ({})", destination, id, e);
            }
        }
    }

    /**
     * Worker 정지.
     *
     * <p>트랜스포트 구독을 닫고, 처리 중인 수신 건이 끝날 때까지 최대
     * {@code shutdownTimeoutMs} 동안 기다린 뒤 버퍼를 비웁니다. 여러 번 호출해도 안전합니다.</p>
     */
    void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        TransportSubscription subscription = transportSubscription;
        if (subscription != null) {
            try {
                subscription.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close transport subscription for '{}' ({})", destination, id, e);
            }
        }
        if (Thread.currentThread() != thread) {
            try {
                thread.join(config.shutdownTimeoutMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Consumer thread {} did not stop within {}ms", thread.getName(), config.shutdownTimeoutMs());
            }
        }
        drain();
        onStopped.accept(this);
        log.info("Subscription {} stopped on '{}'", id, destination);
    }

    private void drain() {
        RawDelivery delivery;
        while ((delivery = buffer.poll()) != null) {
            try {
                delivery.control().reject(true);
            } catch (RuntimeException e) {
                log.warn("Failed to return buffered delivery on '{}' ({})", destination, id, e);
            }
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String destination() {
        return destination;
    }

    @Override
    public boolean isActive() {
        return running.get();
    }

    @Override
    public void close() {
        stop();
    }

    int buffered() {
        return buffer.size();
    }

    @Override
    public String toString() {
        return "ConsumeWorker{id=" + id + ", destination=" + destination + ", active=" + running.get() + '}';
    }
}
