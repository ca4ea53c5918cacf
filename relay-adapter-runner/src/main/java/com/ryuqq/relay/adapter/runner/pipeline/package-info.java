/**
 * MessagePipeline 구현.
 *
 * <p>{@link com.ryuqq.relay.adapter.runner.pipeline.DefaultMessagePipeline}이 발행 경로와
 * 구독별 consume worker를 관리합니다. 보호 계층(Circuit Breaker, Backpressure, Retry,
 * Poison guard)은 relay-adapter-protection 구현을 기본값으로 사용합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.adapter.runner.pipeline;
