package com.ryuqq.relay.adapter.runner.pipeline;

import com.ryuqq.relay.adapter.codec.JacksonCodec;
import com.ryuqq.relay.adapter.protection.retry.RetryExecutor;
import com.ryuqq.relay.core.contract.PublishOptions;
import com.ryuqq.relay.core.exception.CircuitOpenException;
import com.ryuqq.relay.core.exception.TransientTransportException;
import com.ryuqq.relay.core.protection.CircuitBreakerConfig;
import com.ryuqq.relay.core.protection.CircuitBreakerState;
import com.ryuqq.relay.core.retry.RetryPolicy;
import com.ryuqq.relay.core.spi.BrokerTransport;
import com.ryuqq.relay.core.spi.TelemetrySink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * 발행 경로의 보호 계층(Circuit Breaker, Retry, Telemetry 격리) 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultMessagePipeline 보호 계층 테스트")
class DefaultMessagePipelineProtectionTest {

    private static final String DESTINATION = "payments";

    @Mock
    private BrokerTransport transport;

    @Mock
    private TelemetrySink telemetrySink;

    @Test
    @DisplayName("Circuit이 열려 있으면 트랜스포트를 호출하지 않고 CircuitOpenException")
    void circuit_open_시_전송_시도_없음() {
        // given
        DefaultMessagePipeline pipeline = DefaultMessagePipeline.builder(transport, new JacksonCodec()).build();
        pipeline.circuitBreaker(DESTINATION).isolate();

        // when & then
        assertThatThrownBy(() -> pipeline.publish(new Payment("p-1", 100), PublishOptions.to(DESTINATION)))
            .isInstanceOf(CircuitOpenException.class);
        verify(transport, never()).publishRaw(anyString(), any(), anyMap());
    }

    @Test
    @DisplayName("연속 실패가 임계값에 도달하면 이후 발행은 즉시 실패")
    void 연속_실패_후_circuit_open() {
        // given
        doThrow(new TransientTransportException(DESTINATION, "connection reset"))
            .when(transport).publishRaw(eq(DESTINATION), any(), anyMap());
        DefaultMessagePipeline pipeline = DefaultMessagePipeline.builder(transport, new JacksonCodec())
            .circuitBreakerConfig(new CircuitBreakerConfig().withFailureThreshold(2))
            .retryExecutor(new RetryExecutor(RetryPolicy.noRetry()))
            .build();

        // when
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> pipeline.publish(new Payment("p-1", 100), PublishOptions.to(DESTINATION)))
                .isInstanceOf(TransientTransportException.class);
        }

        // then
        assertThat(pipeline.circuitBreaker(DESTINATION).getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThatThrownBy(() -> pipeline.publish(new Payment("p-2", 100), PublishOptions.to(DESTINATION)))
            .isInstanceOf(CircuitOpenException.class);
        verify(transport, times(2)).publishRaw(eq(DESTINATION), any(), anyMap());
    }

    @Test
    @DisplayName("열린 Circuit의 CircuitOpenException은 재시도하지 않음")
    void circuit_open_재시도_안함() {
        // given
        DefaultMessagePipeline pipeline = DefaultMessagePipeline.builder(transport, new JacksonCodec())
            .retryExecutor(new RetryExecutor(new RetryPolicy().withMaxAttempts(5)))
            .build();
        pipeline.circuitBreaker(DESTINATION).isolate();

        // when & then
        assertThatThrownBy(() -> pipeline.publish(new Payment("p-1", 100), PublishOptions.to(DESTINATION)))
            .isInstanceOf(CircuitOpenException.class);
        assertThat(pipeline.circuitBreaker(DESTINATION).getMetrics().rejectedCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Telemetry sink 오류는 발행 결과에 영향 없음")
    void telemetry_오류_격리() {
        // given
        doThrow(new IllegalStateException("exporter down")).when(telemetrySink).counter(anyString(), anyMap());
        DefaultMessagePipeline pipeline = DefaultMessagePipeline.builder(transport, new JacksonCodec())
            .telemetrySink(telemetrySink)
            .build();

        // when
        pipeline.publish(new Payment("p-1", 100), PublishOptions.to(DESTINATION));

        // then
        verify(transport).publishRaw(eq(DESTINATION), any(), anyMap());
        verify(telemetrySink).counter(eq("relay.publish.count"), anyMap());
    }

    @Test
    @DisplayName("close 시 트랜스포트도 닫음")
    void close_트랜스포트_종료() {
        // given
        DefaultMessagePipeline pipeline = DefaultMessagePipeline.builder(transport, new JacksonCodec()).build();

        // when
        pipeline.close();

        // then
        verify(transport).close();
    }

    @Test
    @DisplayName("필수 의존성 누락 시 IllegalArgumentException")
    void 필수_의존성_검증() {
        assertThatThrownBy(() -> DefaultMessagePipeline.builder(null, new JacksonCodec()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("transport cannot be null");
        assertThatThrownBy(() -> DefaultMessagePipeline.builder(transport, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("codec cannot be null");
    }

    public record Payment(String paymentId, long amount) {
    }
}
