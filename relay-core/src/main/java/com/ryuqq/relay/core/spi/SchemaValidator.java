package com.ryuqq.relay.core.spi;

/**
 * 발행 전 메시지 계약 검증 SPI.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SchemaValidator {

    /**
     * 메시지 검증.
     *
     * @param message 발행할 메시지
     * @throws com.ryuqq.relay.core.exception.SerializationException 계약 위반 시
     */
    void validate(Object message);
}
