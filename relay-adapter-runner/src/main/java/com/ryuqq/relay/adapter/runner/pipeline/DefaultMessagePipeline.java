package com.ryuqq.relay.adapter.runner.pipeline;

import com.ryuqq.relay.adapter.protection.circuit.DefaultCircuitBreaker;
import com.ryuqq.relay.adapter.protection.poison.DefaultPoisonMessageGuard;
import com.ryuqq.relay.adapter.protection.retry.BackoffCalculator;
import com.ryuqq.relay.adapter.protection.retry.RetryExecutor;
import com.ryuqq.relay.application.pipeline.MessageHandler;
import com.ryuqq.relay.application.pipeline.MessagePipeline;
import com.ryuqq.relay.application.pipeline.SubscriptionHandle;
import com.ryuqq.relay.core.contract.AckMode;
import com.ryuqq.relay.core.contract.Envelope;
import com.ryuqq.relay.core.contract.Headers;
import com.ryuqq.relay.core.contract.PublishOptions;
import com.ryuqq.relay.core.contract.SubscriptionOptions;
import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.PoisonMessageQuarantinedException;
import com.ryuqq.relay.core.exception.SerializationException;
import com.ryuqq.relay.core.exception.TransientTransportException;
import com.ryuqq.relay.core.model.MessageId;
import com.ryuqq.relay.core.poison.PoisonDecision;
import com.ryuqq.relay.core.poison.PoisonGuardConfig;
import com.ryuqq.relay.core.poison.PoisonMessageGuard;
import com.ryuqq.relay.core.protection.BackpressureController;
import com.ryuqq.relay.core.protection.CircuitBreaker;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.Permit;
import com.ryuqq.relay.core.protection.noop.NoOpBackpressureController;
import com.ryuqq.relay.core.retry.RetryPolicy;
import com.ryuqq.relay.core.spi.BrokerTransport;
import com.ryuqq.relay.core.spi.Codec;
import com.ryuqq.relay.core.spi.DeadLetter;
import com.ryuqq.relay.core.spi.DeadLetterSink;
import com.ryuqq.relay.core.spi.MessageCompressor;
import com.ryuqq.relay.core.spi.SafeTelemetrySink;
import com.ryuqq.relay.core.spi.SchemaValidator;
import com.ryuqq.relay.core.spi.TelemetrySink;
import com.ryuqq.relay.core.spi.TransportSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * MessagePipeline 기본 구현.
 *
 * <p><strong>발행 흐름:</strong></p>
 * <pre>
 * publish(message, options)
 *   ↓
 * SchemaValidator.validate → Codec.serialize → (조건부) 압축
 *   ↓
 * Envelope 생성 (message id, type, timestamp, correlation id, routing key, content type)
 *   ↓
 * BackpressureController.acquire (try-with-resources)
 *   ↓
 * RetryExecutor → CircuitBreaker(destination) → BrokerTransport.publishRaw
 * </pre>
 *
 * <p><strong>수신 흐름:</strong></p>
 * <pre>
 * ConsumeWorker 버퍼 → 압축 해제 → type 확인 → Codec.deserialize → handler
 *   성공: PoisonMessageGuard.recordSuccess → (AUTO) acknowledge
 *   실패: PoisonMessageGuard.recordFailure
 *         → 격리: DeadLetterSink + acknowledge + release
 *         → 재시도: (선택) 로컬 backoff → reject(requeue)
 *   ack/reject 실패: worker가 실행 중인 동안 settlementRetryIntervalMs 간격으로 재시도,
 *         worker 정지 시 재전달 요청으로 반환
 * </pre>
 *
 * <p>Circuit Breaker는 destination마다 하나씩 생성되며, 발행과 ack/reject가 같은
 * breaker를 공유합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class DefaultMessagePipeline implements MessagePipeline {

    private static final Logger log = LoggerFactory.getLogger(DefaultMessagePipeline.class);

    private final BrokerTransport transport;
    private final Codec codec;
    private final MessageCompressor compressor;
    private final SchemaValidator schemaValidator;
    private final Function<String, CircuitBreaker> circuitBreakerFactory;
    private final BackpressureController backpressureController;
    private final PoisonMessageGuard poisonMessageGuard;
    private final RetryExecutor retryExecutor;
    private final BackoffCalculator redeliveryBackoff;
    private final DeadLetterSink deadLetterSink;
    private final TelemetrySink telemetry;
    private final PipelineConfig config;

    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final AtomicLong workerSequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private DefaultMessagePipeline(Builder builder) {
        this.transport = builder.transport;
        this.codec = builder.codec;
        this.compressor = builder.compressor;
        this.schemaValidator = builder.schemaValidator;
        this.circuitBreakerFactory = builder.circuitBreakerFactory != null
            ? builder.circuitBreakerFactory
            : destination -> new DefaultCircuitBreaker("relay-" + destination, builder.circuitBreakerConfig);
        this.backpressureController = builder.backpressureController;
        this.poisonMessageGuard = builder.poisonMessageGuard;
        this.retryExecutor = builder.retryExecutor;
        this.redeliveryBackoff = new BackoffCalculator(builder.retryExecutor.getPolicy());
        this.deadLetterSink = builder.deadLetterSink;
        this.telemetry = SafeTelemetrySink.wrap(builder.telemetrySink);
        this.config = builder.config;
        log.info("Message pipeline started (compressor: {}, validator: {})",
            compressor == null ? "none" : compressor.algorithm(), schemaValidator != null);
    }

    public static Builder builder(BrokerTransport transport, Codec codec) {
        return new Builder(transport, codec);
    }

    @Override
    public MessageId publish(Object message, PublishOptions options) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        ensureOpen();

        String destination = options.destination();
        String typeTag = codec.typeTag(message.getClass());
        Map<String, String> tags = Map.of("destination", destination, "type", typeTag);

        long startNanos = System.nanoTime();
        try {
            if (schemaValidator != null) {
                schemaValidator.validate(message);
            }
            Envelope envelope = createEnvelope(typeTag, codec.serialize(message), options);
            CircuitBreaker circuitBreaker = circuitBreaker(destination);
            try (Permit permit = backpressureController.acquire("publish:" + destination)) {
                retryExecutor.run(() -> circuitBreaker.run(
                    () -> transport.publishRaw(destination, envelope.payload(), envelope.headers())
                ));
            }
            telemetry.counter("relay.publish.count", tags);
            telemetry.histogram("relay.publish.payload.size", envelope.size(), tags);
            log.debug("Published {} to '{}' ({} bytes)", envelope.messageId().getValue(), destination, envelope.size());
            return envelope.messageId();
        } catch (RuntimeException e) {
            telemetry.counter("relay.publish.failed", tags);
            throw e;
        } finally {
            telemetry.histogram("relay.publish.duration", elapsedMillis(startNanos), tags);
        }
    }

    private Envelope createEnvelope(String typeTag, byte[] serialized, PublishOptions options) {
        byte[] payload = serialized;
        String compression = null;
        if (compressor != null && config.shouldCompress(serialized.length, options.contentType())) {
            payload = compressor.compress(serialized);
            compression = compressor.algorithm();
        }

        MessageId messageId = MessageId.generate();
        Map<String, String> headers = new LinkedHashMap<>(options.headers());
        headers.put(Headers.MESSAGE_ID, messageId.getValue());
        headers.put(Headers.MESSAGE_TYPE, typeTag);
        headers.put(Headers.TIMESTAMP, String.valueOf(Instant.now().toEpochMilli()));
        headers.put(Headers.CORRELATION_ID,
            options.correlationId() != null ? options.correlationId() : UUID.randomUUID().toString());
        if (options.routingKey() != null) {
            headers.put(Headers.ROUTING_KEY, options.routingKey());
        }
        headers.put(Headers.CONTENT_TYPE, options.contentType());
        if (compression != null) {
            headers.put(Headers.COMPRESSION, compression);
        }
        return new Envelope(messageId, typeTag, payload, headers);
    }

    @Override
    public <T> SubscriptionHandle subscribe(Class<T> type, MessageHandler<T> handler, SubscriptionOptions options) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        ensureOpen();

        String destination = options.destination();
        String id = registry.nextId();
        ConsumeWorker worker = new ConsumeWorker(
            id,
            destination,
            options.prefetch(),
            "relay-consumer-" + destination + "-" + workerSequence.incrementAndGet(),
            config,
            (delivery, active) -> process(delivery, active, destination, type, handler, options.ackMode()),
            stopped -> registry.remove(stopped.id())
        );
        registry.register(worker);
        worker.start();
        try {
            TransportSubscription subscription = transport.subscribe(destination, worker.callback(), options);
            worker.attach(subscription);
        } catch (RuntimeException e) {
            worker.stop();
            throw e;
        }
        return worker;
    }

    @Override
    public void unsubscribe(SubscriptionHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        registry.find(handle.id()).ifPresent(ConsumeWorker::stop);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (ConsumeWorker worker : registry.all()) {
            worker.stop();
        }
        registry.clear();
        try {
            transport.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close transport", e);
        }
        log.info("Message pipeline closed");
    }

    /**
     * destination의 Circuit Breaker (없으면 생성).
     *
     * @param destination 대상
     * @return Circuit Breaker
     */
    public CircuitBreaker circuitBreaker(String destination) {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        return circuitBreakers.computeIfAbsent(destination, circuitBreakerFactory);
    }

    public int activeSubscriptions() {
        return registry.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private <T> void process(
        RawDelivery delivery,
        BooleanSupplier active,
        String destination,
        Class<T> type,
        MessageHandler<T> handler,
        AckMode ackMode
    ) {
        Envelope envelope = toEnvelope(delivery);
        if (envelope == null) {
            log.error("Dropping malformed delivery on '{}' (headers: {})", destination, delivery.headers());
            delivery.control().reject(false);
            return;
        }

        MessageId messageId = envelope.messageId();
        Map<String, String> tags = Map.of("destination", destination, "type", envelope.typeTag());
        int deliveryAttempt = poisonMessageGuard.find(destination, messageId)
            .map(record -> record.failureCount() + 1)
            .orElse(1);
        DefaultMessageContext context = new DefaultMessageContext(
            envelope, destination, deliveryAttempt, delivery.control(), circuitBreaker(destination)
        );

        long startNanos = System.nanoTime();
        try {
            T message = decode(envelope, type);
            handler.handle(message, context);
        } catch (Exception e) {
            telemetry.counter("relay.consume.failed", tags);
            telemetry.histogram("relay.consume.duration", elapsedMillis(startNanos), tags);
            handleFailure(envelope, context, e, tags);
            awaitSettlement(context, active);
            return;
        }

        poisonMessageGuard.recordSuccess(destination, messageId);
        telemetry.counter("relay.consume.count", tags);
        telemetry.histogram("relay.consume.duration", elapsedMillis(startNanos), tags);
        if (ackMode == AckMode.AUTO && !context.isSettled()) {
            try {
                context.acknowledge();
            } catch (RuntimeException e) {
                log.warn("Failed to acknowledge {} on '{}': {}", messageId.getValue(), destination, e.toString());
            }
        }
        awaitSettlement(context, active);
        log.debug("Consumed {} from '{}' (attempt {})", messageId.getValue(), destination, deliveryAttempt);
    }

    private Envelope toEnvelope(RawDelivery delivery) {
        String messageId = delivery.headers().get(Headers.MESSAGE_ID);
        String typeTag = delivery.headers().get(Headers.MESSAGE_TYPE);
        if (messageId == null || typeTag == null || typeTag.isBlank() || delivery.body() == null) {
            return null;
        }
        try {
            return new Envelope(MessageId.of(messageId), typeTag, delivery.body(), delivery.headers());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private <T> T decode(Envelope envelope, Class<T> type) {
        byte[] body = envelope.payload();
        String compression = envelope.header(Headers.COMPRESSION);
        if (compression != null) {
            if (compressor == null || !compressor.algorithm().equals(compression)) {
                throw new SerializationException("Unsupported compression: " + compression);
            }
            body = compressor.decompress(body);
        }
        String expected = codec.typeTag(type);
        if (!expected.equals(envelope.typeTag())) {
            throw new SerializationException(
                "Message type mismatch (expected: " + expected + ", actual: " + envelope.typeTag() + ")"
            );
        }
        return codec.deserialize(body, type);
    }

    private void handleFailure(Envelope envelope, DefaultMessageContext context, Exception error, Map<String, String> tags) {
        String destination = context.destination();
        MessageId messageId = envelope.messageId();
        PoisonDecision decision = poisonMessageGuard.recordFailure(destination, messageId, error);

        if (decision.quarantine()) {
            quarantine(envelope, context, decision.failureCount(), error, tags);
            return;
        }

        log.debug("Handler failed for {} on '{}' (failure {}): {}",
            messageId.getValue(), destination, decision.failureCount(), error.toString());
        if (context.isSettled()) {
            return;
        }
        if (config.localRedeliveryBackoff()) {
            awaitRedelivery(decision.failureCount());
        }
        rejectQuietly(context);
    }

    private void quarantine(
        Envelope envelope,
        DefaultMessageContext context,
        int failureCount,
        Exception error,
        Map<String, String> tags
    ) {
        String destination = context.destination();
        MessageId messageId = envelope.messageId();
        PoisonMessageQuarantinedException reason =
            new PoisonMessageQuarantinedException(destination, messageId, failureCount, error);
        try {
            deadLetterSink.deadLetter(new DeadLetter(destination, envelope, failureCount, reason, null));
        } catch (RuntimeException e) {
            log.error("Failed to dead-letter {} on '{}', returning it for redelivery", messageId.getValue(), destination, e);
            poisonMessageGuard.release(destination, messageId);
            rejectQuietly(context);
            return;
        }

        if (!context.isSettled()) {
            try {
                context.acknowledge();
            } catch (RuntimeException e) {
                log.warn("Failed to acknowledge quarantined {} on '{}': {}",
                    messageId.getValue(), destination, e.toString());
            }
        }
        poisonMessageGuard.release(destination, messageId);
        telemetry.counter("relay.consume.quarantined", tags);
        log.warn("Quarantined {} on '{}' after {} failures: {}",
            messageId.getValue(), destination, failureCount, error.toString());
    }

    private void awaitRedelivery(int failureCount) {
        try {
            Thread.sleep(redeliveryBackoff.calculate(failureCount));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void rejectQuietly(DefaultMessageContext context) {
        if (context.isSettled()) {
            return;
        }
        try {
            context.reject(true);
        } catch (RuntimeException e) {
            log.warn("Failed to reject {} on '{}': {}",
                context.messageId().getValue(), context.destination(), e.toString());
        }
    }

    /**
     * 실패한 acknowledge/reject가 있으면 worker가 실행 중인 동안 재시도.
     *
     * <p>수신 건이 정리될 때까지 worker는 다음 수신 건을 처리하지 않습니다. worker가 멈추면
     * Circuit Breaker를 거치지 않고 재전달 요청으로 반환합니다.</p>
     */
    private void awaitSettlement(DefaultMessageContext context, BooleanSupplier active) {
        if (!context.hasPendingSettlement()) {
            return;
        }
        String messageId = context.messageId().getValue();
        String destination = context.destination();
        log.warn("Holding {} on '{}' until its settlement succeeds", messageId, destination);
        while (active.getAsBoolean()) {
            try {
                Thread.sleep(config.settlementRetryIntervalMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                context.retryPendingSettlement();
            } catch (CircuitOpenException | TransientTransportException e) {
                log.debug("Settlement of {} on '{}' still failing: {}", messageId, destination, e.toString());
                continue;
            } catch (RuntimeException e) {
                log.warn("Settlement of {} on '{}' failed, returning it for redelivery", messageId, destination, e);
                break;
            }
            log.info("Settled held delivery {} on '{}'", messageId, destination);
            return;
        }
        try {
            context.returnForRedelivery();
            log.warn("Returned unsettled delivery {} on '{}' for redelivery", messageId, destination);
        } catch (RuntimeException e) {
            log.error("Failed to return unsettled delivery {} on '{}'", messageId, destination, e);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Pipeline is closed");
        }
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    /**
     * DefaultMessagePipeline 빌더.
     *
     * <p>transport와 codec만 필수이며, 나머지는 다음 기본값을 사용합니다.</p>
     * <ul>
     *   <li>Circuit Breaker: destination마다 {@link DefaultCircuitBreaker} (기본 {@link CircuitBreakerConfig})</li>
     *   <li>Backpressure: {@link NoOpBackpressureController}</li>
     *   <li>Poison guard: {@link DefaultPoisonMessageGuard} (기본 {@link PoisonGuardConfig})</li>
     *   <li>Retry: {@link RetryExecutor} (기본 {@link RetryPolicy})</li>
     *   <li>Dead letter: 로그만 남기는 sink</li>
     *   <li>Telemetry: NoOp</li>
     * </ul>
     */
    public static final class Builder {

        private final BrokerTransport transport;
        private final Codec codec;
        private MessageCompressor compressor;
        private SchemaValidator schemaValidator;
        private CircuitBreakerConfig circuitBreakerConfig = new CircuitBreakerConfig();
        private Function<String, CircuitBreaker> circuitBreakerFactory;
        private BackpressureController backpressureController = new NoOpBackpressureController();
        private PoisonMessageGuard poisonMessageGuard;
        private RetryExecutor retryExecutor;
        private DeadLetterSink deadLetterSink;
        private TelemetrySink telemetrySink;
        private PipelineConfig config = new PipelineConfig();

        private Builder(BrokerTransport transport, Codec codec) {
            if (transport == null) {
                throw new IllegalArgumentException("transport cannot be null");
            }
            if (codec == null) {
                throw new IllegalArgumentException("codec cannot be null");
            }
            this.transport = transport;
            this.codec = codec;
        }

        public Builder compressor(MessageCompressor compressor) {
            this.compressor = compressor;
            return this;
        }

        public Builder schemaValidator(SchemaValidator schemaValidator) {
            this.schemaValidator = schemaValidator;
            return this;
        }

        public Builder circuitBreakerConfig(CircuitBreakerConfig circuitBreakerConfig) {
            if (circuitBreakerConfig == null) {
                throw new IllegalArgumentException("circuitBreakerConfig cannot be null");
            }
            this.circuitBreakerConfig = circuitBreakerConfig;
            return this;
        }

        public Builder circuitBreakerFactory(Function<String, CircuitBreaker> circuitBreakerFactory) {
            this.circuitBreakerFactory = circuitBreakerFactory;
            return this;
        }

        public Builder backpressureController(BackpressureController backpressureController) {
            if (backpressureController == null) {
                throw new IllegalArgumentException("backpressureController cannot be null");
            }
            this.backpressureController = backpressureController;
            return this;
        }

        public Builder poisonMessageGuard(PoisonMessageGuard poisonMessageGuard) {
            this.poisonMessageGuard = poisonMessageGuard;
            return this;
        }

        public Builder retryExecutor(RetryExecutor retryExecutor) {
            this.retryExecutor = retryExecutor;
            return this;
        }

        public Builder deadLetterSink(DeadLetterSink deadLetterSink) {
            this.deadLetterSink = deadLetterSink;
            return this;
        }

        public Builder telemetrySink(TelemetrySink telemetrySink) {
            this.telemetrySink = telemetrySink;
            return this;
        }

        public Builder config(PipelineConfig config) {
            if (config == null) {
                throw new IllegalArgumentException("config cannot be null");
            }
            this.config = config;
            return this;
        }

        public DefaultMessagePipeline build() {
            if (poisonMessageGuard == null) {
                poisonMessageGuard = new DefaultPoisonMessageGuard(new PoisonGuardConfig());
            }
            if (retryExecutor == null) {
                retryExecutor = new RetryExecutor(new RetryPolicy());
            }
            if (deadLetterSink == null) {
                deadLetterSink = new LoggingDeadLetterSink();
            }
            return new DefaultMessagePipeline(this);
        }
    }
}
