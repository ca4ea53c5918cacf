/**
 * 외부 협력자 SPI (Service Provider Interface) 패키지.
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.spi.BrokerTransport} - 브로커별 원시 publish/subscribe</li>
 *   <li>{@link com.ryuqq.relay.core.spi.Codec} - 직렬화</li>
 *   <li>{@link com.ryuqq.relay.core.spi.MessageCompressor} - payload 압축</li>
 *   <li>{@link com.ryuqq.relay.core.spi.SchemaValidator} - 발행 전 계약 검증</li>
 *   <li>{@link com.ryuqq.relay.core.spi.SagaPersistence} - Saga 체크포인트 영속화</li>
 *   <li>{@link com.ryuqq.relay.core.spi.TelemetrySink} - 카운터/히스토그램</li>
 *   <li>{@link com.ryuqq.relay.core.spi.DeadLetterSink} - 격리 메시지 종착지</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core는 인터페이스만 정의하고 어댑터가 구현</li>
 *   <li><strong>Pluggability:</strong> 테스트용 InMemory 구현과 운영용 브로커 구현을 교체 가능</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
package com.ryuqq.relay.core.spi;
