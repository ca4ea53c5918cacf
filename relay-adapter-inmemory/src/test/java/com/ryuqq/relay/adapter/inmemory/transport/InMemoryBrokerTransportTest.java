package com.ryuqq.relay.adapter.inmemory.transport;

import com.ryuqq.relay.core.contract.SubscriptionOptions;
import com.ryuqq.relay.core.exception.PermanentTransportException;
import com.ryuqq.relay.core.exception.TransientTransportException;
import com.ryuqq.relay.core.spi.DeliveryControl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryBrokerTransport 고유 기능 테스트 (계약 외).
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("InMemoryBrokerTransport 테스트")
class InMemoryBrokerTransportTest {

    private InMemoryBrokerTransport transport;

    @BeforeEach
    void setUp() {
        transport = new InMemoryBrokerTransport();
    }

    @AfterEach
    void tearDown() {
        transport.close();
    }

    @Test
    void failNextPublish로_주입한_오류를_순서대로_던짐() {
        // given
        TransientTransportException first = new TransientTransportException("orders", "first");
        PermanentTransportException second = new PermanentTransportException("orders", "second");
        transport.failNextPublish(first);
        transport.failNextPublish(second);

        // when & then
        assertThatThrownBy(() -> transport.publishRaw("orders", bytes("a"), Map.of())).isSameAs(first);
        assertThatThrownBy(() -> transport.publishRaw("orders", bytes("a"), Map.of())).isSameAs(second);
        transport.publishRaw("orders", bytes("a"), Map.of());
        assertThat(transport.pendingCount("orders")).isEqualTo(1);
        assertThat(transport.publishedCount()).isEqualTo(1);
    }

    @Test
    void prefetch_이상으로_미확인_메시지를_전달하지_않음() throws InterruptedException {
        // given
        List<DeliveryControl> unsettled = new CopyOnWriteArrayList<>();
        transport.subscribe("orders", (bytes, headers, control) -> unsettled.add(control),
            SubscriptionOptions.of("orders").withPrefetch(2));

        // when
        for (int i = 0; i < 5; i++) {
            transport.publishRaw("orders", bytes("m" + i), Map.of());
        }
        Thread.sleep(300);

        // then
        assertThat(unsettled).hasSize(2);
        assertThat(transport.pendingCount("orders")).isEqualTo(3);

        // when: 하나 확인
        unsettled.get(0).acknowledge();
        Thread.sleep(300);

        // then
        assertThat(unsettled).hasSize(3);
    }

    @Test
    void 구독자_예외는_재전달로_처리() throws InterruptedException {
        // given
        AtomicInteger deliveries = new AtomicInteger();
        transport.subscribe("orders", (bytes, headers, control) -> {
            if (deliveries.incrementAndGet() == 1) {
                throw new IllegalStateException("subscriber bug");
            }
            control.acknowledge();
        }, SubscriptionOptions.of("orders"));

        // when
        transport.publishRaw("orders", bytes("x"), Map.of());
        Thread.sleep(300);

        // then
        assertThat(deliveries.get()).isEqualTo(2);
        assertThat(transport.requeuedCount()).isEqualTo(1);
        assertThat(transport.acknowledgedCount()).isEqualTo(1);
    }

    @Test
    void DeliveryControl은_한_번만_유효() throws InterruptedException {
        // given
        AtomicInteger deliveries = new AtomicInteger();
        transport.subscribe("orders", (bytes, headers, control) -> {
            deliveries.incrementAndGet();
            control.acknowledge();
            control.reject(true);
        }, SubscriptionOptions.of("orders"));

        // when
        transport.publishRaw("orders", bytes("x"), Map.of());
        Thread.sleep(300);

        // then
        assertThat(deliveries.get()).isEqualTo(1);
        assertThat(transport.rejectedCount()).isZero();
    }

    @Test
    void 종료된_트랜스포트에_발행하면_PermanentTransportException() {
        // given
        transport.close();

        // when & then
        assertThatThrownBy(() -> transport.publishRaw("orders", bytes("x"), Map.of()))
            .isInstanceOf(PermanentTransportException.class);
        assertThat(transport.isClosed()).isTrue();
    }

    @Test
    void 경쟁_소비자는_메시지를_나누어_받음() throws InterruptedException {
        // given
        List<String> first = new CopyOnWriteArrayList<>();
        List<String> second = new CopyOnWriteArrayList<>();
        transport.subscribe("orders", (bytes, headers, control) -> {
            first.add(new String(bytes, StandardCharsets.UTF_8));
            control.acknowledge();
        }, SubscriptionOptions.of("orders"));
        transport.subscribe("orders", (bytes, headers, control) -> {
            second.add(new String(bytes, StandardCharsets.UTF_8));
            control.acknowledge();
        }, SubscriptionOptions.of("orders"));

        // when
        for (int i = 0; i < 20; i++) {
            transport.publishRaw("orders", bytes("m" + i), Map.of());
        }
        Thread.sleep(500);

        // then
        assertThat(first.size() + second.size()).isEqualTo(20);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
