package com.ryuqq.relay.core.spi;

/**
 * payload 압축기 SPI.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public interface MessageCompressor {

    /**
     * 압축 알고리즘 이름 (압축 마커 헤더 값).
     *
     * @return 예: gzip
     */
    String algorithm();

    byte[] compress(byte[] data);

    /**
     * @throws com.ryuqq.relay.core.exception.SerializationException 손상된 데이터인 경우
     */
    byte[] decompress(byte[] data);
}
