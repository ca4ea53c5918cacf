package com.ryuqq.relay.adapter.codec;

import com.ryuqq.relay.core.exception.SerializationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JacksonCodec 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
@DisplayName("JacksonCodec 테스트")
class JacksonCodecTest {

    record OrderPlaced(String orderId, BigDecimal amount, List<String> items, Instant placedAt) {
    }

    record Tagged(String name, Map<String, Integer> counts) {
    }

    private final JacksonCodec codec = new JacksonCodec();
    private final GzipMessageCompressor compressor = new GzipMessageCompressor();

    private final OrderPlaced order = new OrderPlaced(
        "order-1",
        new BigDecimal("12500.50"),
        List.of("book", "pen"),
        Instant.parse("2026-03-01T10:15:30Z")
    );

    @Test
    @DisplayName("직렬화 후 역직렬화하면 원래 값과 동일 (압축 없음)")
    void 압축_없는_왕복() {
        // when
        byte[] bytes = codec.serialize(order);
        OrderPlaced restored = codec.deserialize(bytes, OrderPlaced.class);

        // then
        assertThat(restored).isEqualTo(order);
    }

    @Test
    @DisplayName("압축을 거친 왕복도 원래 값과 동일")
    void 압축_왕복() {
        // given
        Tagged tagged = new Tagged("x".repeat(2048), Map.of("a", 1, "b", 2));

        // when
        byte[] compressed = compressor.compress(codec.serialize(tagged));
        Tagged restored = codec.deserialize(compressor.decompress(compressed), Tagged.class);

        // then
        assertThat(restored).isEqualTo(tagged);
        assertThat(compressed.length).isLessThan(2048);
    }

    @Test
    @DisplayName("Instant는 ISO-8601 문자열로 기록")
    void Instant는_ISO_문자열() {
        // when
        String json = new String(codec.serialize(order), StandardCharsets.UTF_8);

        // then
        assertThat(json).contains("\"placedAt\":\"2026-03-01T10:15:30Z\"");
    }

    @Test
    @DisplayName("알 수 없는 속성은 무시")
    void 알_수_없는_속성_무시() {
        // given
        byte[] json = "{\"name\":\"n\",\"counts\":{},\"addedLater\":true}".getBytes(StandardCharsets.UTF_8);

        // when
        Tagged restored = codec.deserialize(json, Tagged.class);

        // then
        assertThat(restored.name()).isEqualTo("n");
    }

    @Test
    @DisplayName("잘못된 JSON은 SerializationException")
    void 잘못된_JSON() {
        byte[] broken = "{not-json".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> codec.deserialize(broken, Tagged.class))
            .isInstanceOf(SerializationException.class)
            .hasMessageContaining(Tagged.class.getName());
    }

    @Test
    @DisplayName("기본 타입 태그는 클래스 이름")
    void 기본_타입_태그() {
        assertThat(codec.typeTag(OrderPlaced.class)).isEqualTo(OrderPlaced.class.getName());
    }

    @Test
    @DisplayName("null 메시지 직렬화는 SerializationException")
    void null_직렬화() {
        assertThatThrownBy(() -> codec.serialize(null))
            .isInstanceOf(SerializationException.class);
    }
}
