package com.ryuqq.relay.adapter.inmemory.transport;

import com.ryuqq.relay.core.contract.SubscriptionOptions;
import com.ryuqq.relay.core.exception.PermanentTransportException;
import com.ryuqq.relay.core.spi.BrokerTransport;
import com.ryuqq.relay.core.spi.DeliveryControl;
import com.ryuqq.relay.core.spi.RawMessageHandler;
import com.ryuqq.relay.core.spi.TransportSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link BrokerTransport} for tests and local development.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Destination Queue:</strong> one FIFO {@link LinkedBlockingDeque} per destination</li>
 *   <li><strong>Dispatcher:</strong> one daemon thread per subscription; subscriptions on the same
 *       destination compete for messages</li>
 *   <li><strong>Prefetch:</strong> at most {@code prefetch} unsettled deliveries per subscription</li>
 * </ul>
 *
 * <p><strong>Delivery semantics:</strong></p>
 * <ul>
 *   <li>acknowledge: message removed</li>
 *   <li>reject(requeue=true): message appended to the tail of its destination queue</li>
 *   <li>reject(requeue=false): message dropped</li>
 *   <li>handler throws: treated as reject(requeue=true)</li>
 * </ul>
 *
 * <p><strong>Failure injection:</strong> {@link #failNextPublish(RuntimeException)} queues errors that
 * the next {@code publishRaw} calls throw before storing anything.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InMemoryBrokerTransport implements BrokerTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBrokerTransport.class);

    private static final long POLL_INTERVAL_MS = 20L;
    private static final long JOIN_TIMEOUT_MS = 2_000L;

    private final ConcurrentHashMap<String, LinkedBlockingDeque<StoredMessage>> queues = new ConcurrentHashMap<>();
    private final List<Dispatcher> dispatchers = new CopyOnWriteArrayList<>();
    private final Queue<RuntimeException> publishFailures = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger dispatcherSequence = new AtomicInteger();

    private final AtomicLong published = new AtomicLong();
    private final AtomicLong acknowledged = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong requeued = new AtomicLong();

    @Override
    public void publishRaw(String destination, byte[] envelopeBytes, Map<String, String> headers) {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        if (envelopeBytes == null) {
            throw new IllegalArgumentException("envelopeBytes cannot be null");
        }
        if (closed.get()) {
            throw new PermanentTransportException(destination, "transport is closed");
        }

        RuntimeException injected = publishFailures.poll();
        if (injected != null) {
            throw injected;
        }

        StoredMessage message = new StoredMessage(envelopeBytes.clone(), headers == null ? Map.of() : Map.copyOf(headers));
        queueFor(destination).offerLast(message);
        published.incrementAndGet();
        log.debug("Stored message on '{}' ({} bytes)", destination, envelopeBytes.length);
    }

    @Override
    public TransportSubscription subscribe(String destination, RawMessageHandler onMessage, SubscriptionOptions options) {
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("destination cannot be null or blank");
        }
        if (onMessage == null) {
            throw new IllegalArgumentException("onMessage cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (closed.get()) {
            throw new PermanentTransportException(destination, "transport is closed");
        }

        Dispatcher dispatcher = new Dispatcher(destination, queueFor(destination), onMessage, options.prefetch());
        dispatchers.add(dispatcher);
        dispatcher.start();
        log.info("Subscribed to '{}' (prefetch={})", destination, options.prefetch());
        return dispatcher;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (Dispatcher dispatcher : dispatchers) {
            dispatcher.close();
        }
        dispatchers.clear();
        log.info("In-memory transport closed");
    }

    /**
     * Makes the next {@code publishRaw} call throw the given error.
     *
     * <p>Errors are consumed in FIFO order, one per publish call.</p>
     *
     * @param error error to throw
     */
    public void failNextPublish(RuntimeException error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        publishFailures.add(error);
    }

    /**
     * Number of messages currently waiting in a destination queue (not delivered or requeued).
     *
     * @param destination destination name
     * @return pending message count
     */
    public int pendingCount(String destination) {
        LinkedBlockingDeque<StoredMessage> queue = queues.get(destination);
        return queue == null ? 0 : queue.size();
    }

    /**
     * Snapshot of pending message payloads for a destination.
     *
     * @param destination destination name
     * @return payload copies in queue order
     */
    public List<byte[]> pendingPayloads(String destination) {
        LinkedBlockingDeque<StoredMessage> queue = queues.get(destination);
        List<byte[]> result = new ArrayList<>();
        if (queue != null) {
            for (StoredMessage message : queue) {
                result.add(message.body().clone());
            }
        }
        return result;
    }

    public long publishedCount() {
        return published.get();
    }

    public long acknowledgedCount() {
        return acknowledged.get();
    }

    public long rejectedCount() {
        return rejected.get();
    }

    public long requeuedCount() {
        return requeued.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    private LinkedBlockingDeque<StoredMessage> queueFor(String destination) {
        return queues.computeIfAbsent(destination, key -> new LinkedBlockingDeque<>());
    }

    private record StoredMessage(byte[] body, Map<String, String> headers) {
    }

    /**
     * Pulls messages from a destination queue and hands them to one subscriber.
     */
    private final class Dispatcher implements TransportSubscription, Runnable {

        private final String destination;
        private final LinkedBlockingDeque<StoredMessage> queue;
        private final RawMessageHandler handler;
        private final Semaphore unsettled;
        private final AtomicBoolean active = new AtomicBoolean(true);
        private final Thread thread;

        Dispatcher(String destination, LinkedBlockingDeque<StoredMessage> queue, RawMessageHandler handler, int prefetch) {
            this.destination = destination;
            this.queue = queue;
            this.handler = handler;
            this.unsettled = new Semaphore(prefetch);
            this.thread = new Thread(this, "relay-inmemory-" + destination + "-" + dispatcherSequence.incrementAndGet());
            this.thread.setDaemon(true);
        }

        void start() {
            thread.start();
        }

        @Override
        public void run() {
            try {
                while (active.get()) {
                    if (!unsettled.tryAcquire(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS)) {
                        continue;
                    }
                    StoredMessage message = queue.pollFirst(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                    if (message == null) {
                        unsettled.release();
                        continue;
                    }
                    if (!active.get()) {
                        queue.offerFirst(message);
                        unsettled.release();
                        break;
                    }
                    deliver(message);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.debug("Dispatcher for '{}' stopped", destination);
        }

        private void deliver(StoredMessage message) {
            Control control = new Control(this, message);
            try {
                handler.onMessage(message.body().clone(), message.headers(), control);
            } catch (RuntimeException e) {
                log.warn("Subscriber on '{}' threw, requeueing message", destination, e);
                control.reject(true);
            }
        }

        void settle(StoredMessage message, boolean ack, boolean requeue) {
            unsettled.release();
            if (ack) {
                acknowledged.incrementAndGet();
                return;
            }
            rejected.incrementAndGet();
            if (requeue && !closed.get()) {
                queue.offerLast(message);
                requeued.incrementAndGet();
            }
        }

        @Override
        public String destination() {
            return destination;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            dispatchers.remove(this);
            if (Thread.currentThread() != thread) {
                try {
                    thread.join(JOIN_TIMEOUT_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            log.info("Unsubscribed from '{}'", destination);
        }
    }

    /**
     * Settles one delivery exactly once; later calls are ignored.
     */
    private static final class Control implements DeliveryControl {

        private final Dispatcher dispatcher;
        private final StoredMessage message;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        Control(Dispatcher dispatcher, StoredMessage message) {
            this.dispatcher = dispatcher;
            this.message = message;
        }

        @Override
        public void acknowledge() {
            if (settled.compareAndSet(false, true)) {
                dispatcher.settle(message, true, false);
            }
        }

        @Override
        public void reject(boolean requeue) {
            if (settled.compareAndSet(false, true)) {
                dispatcher.settle(message, false, requeue);
            }
        }
    }
}
