package com.ryuqq.relay.adapter.codec;

import com.ryuqq.relay.core.exception.SerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GzipMessageCompressor 테스트")
class GzipMessageCompressorTest {

    private final GzipMessageCompressor compressor = new GzipMessageCompressor();

    @Test
    void 압축_해제하면_원본과_동일() {
        // given
        byte[] original = "payload ".repeat(500).getBytes(StandardCharsets.UTF_8);

        // when
        byte[] restored = compressor.decompress(compressor.compress(original));

        // then
        assertThat(restored).isEqualTo(original);
    }

    @Test
    void 빈_payload도_처리() {
        assertThat(compressor.decompress(compressor.compress(new byte[0]))).isEmpty();
    }

    @Test
    void 손상된_데이터는_SerializationException() {
        byte[] notGzip = "plain text".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> compressor.decompress(notGzip))
            .isInstanceOf(SerializationException.class);
    }

    @Test
    void 알고리즘_이름은_gzip() {
        assertThat(compressor.algorithm()).isEqualTo("gzip");
    }
}
