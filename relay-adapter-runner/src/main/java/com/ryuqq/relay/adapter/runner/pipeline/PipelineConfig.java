package com.ryuqq.relay.adapter.runner.pipeline;

import java.util.Set;

/**
 * MessagePipeline 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>compressionEnabled: payload 압축 사용 여부 (기본 true, 압축기가 설정된 경우에만 적용)</li>
 *   <li>compressionThreshold: 압축을 시작하는 최소 payload 크기 (기본 1024 bytes)</li>
 *   <li>excludedContentTypes: 이미 압축된 형식 등 압축하지 않을 content type</li>
 *   <li>localRedeliveryBackoff: 재전달 전 로컬 backoff 대기 여부 (기본 false, 트랜스포트가 재전달 지연을 관리하지 않는 경우 사용)</li>
 *   <li>pollIntervalMs: consume worker의 수신 버퍼 대기 시간 (기본 100ms, 취소 확인 주기)</li>
 *   <li>shutdownTimeoutMs: 구독 해제 시 worker 종료 대기 시간 (기본 5000ms)</li>
 *   <li>settlementRetryIntervalMs: ack/reject가 실패했을 때 (Circuit OPEN 등) 재시도 간격 (기본 500ms)</li>
 * </ul>
 *
 * @param compressionEnabled 압축 사용 여부
 * @param compressionThreshold 압축 임계 크기 (bytes, 0 이상)
 * @param excludedContentTypes 압축 제외 content type
 * @param localRedeliveryBackoff 로컬 재전달 backoff 여부
 * @param pollIntervalMs 수신 대기 간격 (양수)
 * @param shutdownTimeoutMs 종료 대기 시간 (양수)
 * @param settlementRetryIntervalMs 보류된 ack/reject 재시도 간격 (양수)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record PipelineConfig(
    boolean compressionEnabled,
    int compressionThreshold,
    Set<String> excludedContentTypes,
    boolean localRedeliveryBackoff,
    long pollIntervalMs,
    long shutdownTimeoutMs,
    long settlementRetryIntervalMs
) {

    public static final Set<String> DEFAULT_EXCLUDED_CONTENT_TYPES = Set.of(
        "application/gzip",
        "application/zip",
        "image/jpeg",
        "image/png",
        "video/mp4"
    );

    /**
     * 기본 설정 생성자.
     */
    public PipelineConfig() {
        this(true, 1024, DEFAULT_EXCLUDED_CONTENT_TYPES, false, 100, 5000, 500);
    }

    public PipelineConfig {
        if (compressionThreshold < 0) {
            throw new IllegalArgumentException(
                "compressionThreshold cannot be negative (current: " + compressionThreshold + ")"
            );
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive (current: " + pollIntervalMs + ")");
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException("shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")");
        }
        if (settlementRetryIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "settlementRetryIntervalMs must be positive (current: " + settlementRetryIntervalMs + ")"
            );
        }
        excludedContentTypes = excludedContentTypes == null ? Set.of() : Set.copyOf(excludedContentTypes);
    }

    public PipelineConfig withCompressionEnabled(boolean compressionEnabled) {
        return new PipelineConfig(compressionEnabled, compressionThreshold, excludedContentTypes,
            localRedeliveryBackoff, pollIntervalMs, shutdownTimeoutMs, settlementRetryIntervalMs);
    }

    public PipelineConfig withCompressionThreshold(int compressionThreshold) {
        return new PipelineConfig(compressionEnabled, compressionThreshold, excludedContentTypes,
            localRedeliveryBackoff, pollIntervalMs, shutdownTimeoutMs, settlementRetryIntervalMs);
    }

    public PipelineConfig withExcludedContentTypes(Set<String> excludedContentTypes) {
        return new PipelineConfig(compressionEnabled, compressionThreshold, excludedContentTypes,
            localRedeliveryBackoff, pollIntervalMs, shutdownTimeoutMs, settlementRetryIntervalMs);
    }

    public PipelineConfig withLocalRedeliveryBackoff(boolean localRedeliveryBackoff) {
        return new PipelineConfig(compressionEnabled, compressionThreshold, excludedContentTypes,
            localRedeliveryBackoff, pollIntervalMs, shutdownTimeoutMs, settlementRetryIntervalMs);
    }

    public PipelineConfig withPollIntervalMs(long pollIntervalMs) {
        return new PipelineConfig(compressionEnabled, compressionThreshold, excludedContentTypes,
            localRedeliveryBackoff, pollIntervalMs, shutdownTimeoutMs, settlementRetryIntervalMs);
    }

    public PipelineConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new PipelineConfig(compressionEnabled, compressionThreshold, excludedContentTypes,
            localRedeliveryBackoff, pollIntervalMs, shutdownTimeoutMs, settlementRetryIntervalMs);
    }

    public PipelineConfig withSettlementRetryIntervalMs(long settlementRetryIntervalMs) {
        return new PipelineConfig(compressionEnabled, compressionThreshold, excludedContentTypes,
            localRedeliveryBackoff, pollIntervalMs, shutdownTimeoutMs, settlementRetryIntervalMs);
    }

    /**
     * 주어진 크기/content type의 payload를 압축해야 하는지 판단.
     *
     * @param payloadSize 직렬화된 크기
     * @param contentType content type
     * @return 압축 대상이면 true
     */
    public boolean shouldCompress(int payloadSize, String contentType) {
        return compressionEnabled
            && payloadSize >= compressionThreshold
            && (contentType == null || !excludedContentTypes.contains(contentType));
    }
}
