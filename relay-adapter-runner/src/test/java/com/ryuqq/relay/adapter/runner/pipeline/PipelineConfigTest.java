package com.ryuqq.relay.adapter.runner.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PipelineConfig 테스트")
class PipelineConfigTest {

    @Test
    void 기본값() {
        // when
        PipelineConfig config = new PipelineConfig();

        // then
        assertThat(config.compressionEnabled()).isTrue();
        assertThat(config.compressionThreshold()).isEqualTo(1024);
        assertThat(config.excludedContentTypes()).contains("image/png", "application/gzip");
        assertThat(config.localRedeliveryBackoff()).isFalse();
        assertThat(config.pollIntervalMs()).isEqualTo(100);
        assertThat(config.shutdownTimeoutMs()).isEqualTo(5000);
        assertThat(config.settlementRetryIntervalMs()).isEqualTo(500);
    }

    @Test
    void shouldCompress_임계값과_제외_타입_판단() {
        // given
        PipelineConfig config = new PipelineConfig().withCompressionThreshold(100);

        // then
        assertThat(config.shouldCompress(100, "application/json")).isTrue();
        assertThat(config.shouldCompress(99, "application/json")).isFalse();
        assertThat(config.shouldCompress(500, "image/jpeg")).isFalse();
        assertThat(config.shouldCompress(500, null)).isTrue();
        assertThat(config.withCompressionEnabled(false).shouldCompress(500, "application/json")).isFalse();
        assertThat(config.withExcludedContentTypes(Set.of()).shouldCompress(500, "image/jpeg")).isTrue();
    }

    @Test
    void 잘못된_값_검증() {
        assertThatThrownBy(() -> new PipelineConfig().withCompressionThreshold(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("compressionThreshold");
        assertThatThrownBy(() -> new PipelineConfig().withPollIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pollIntervalMs must be positive");
        assertThatThrownBy(() -> new PipelineConfig().withShutdownTimeoutMs(-5))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("shutdownTimeoutMs must be positive");
        assertThatThrownBy(() -> new PipelineConfig().withSettlementRetryIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("settlementRetryIntervalMs must be positive");
    }

    @Test
    void null_제외_타입은_빈_집합() {
        PipelineConfig config = new PipelineConfig().withExcludedContentTypes(null);

        assertThat(config.excludedContentTypes()).isEmpty();
    }
}
