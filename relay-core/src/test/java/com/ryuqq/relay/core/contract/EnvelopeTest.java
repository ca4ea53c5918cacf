package com.ryuqq.relay.core.contract;

import com.ryuqq.relay.core.model.MessageId;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Envelope Record 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class EnvelopeTest {

    @Test
    void constructor_ValidValues_CreatesEnvelope() {
        // Given
        MessageId messageId = MessageId.of("msg-1");
        byte[] payload = {1, 2, 3};

        // When
        Envelope envelope = new Envelope(messageId, "OrderCreated", payload, Map.of(Headers.CORRELATION_ID, "c-1"));

        // Then
        assertEquals(messageId, envelope.messageId());
        assertEquals("OrderCreated", envelope.typeTag());
        assertArrayEquals(payload, envelope.payload());
        assertEquals("c-1", envelope.header(Headers.CORRELATION_ID));
        assertNull(envelope.header(Headers.ROUTING_KEY));
        assertEquals(3, envelope.size());
    }

    @Test
    void constructor_CopiesPayloadAndHeaders() {
        // Given
        byte[] payload = {1, 2, 3};
        Map<String, String> headers = new HashMap<>();
        headers.put("tenant", "acme");

        // When
        Envelope envelope = new Envelope(MessageId.of("msg-1"), "OrderCreated", payload, headers);
        payload[0] = 9;
        headers.put("tenant", "other");

        // Then
        assertEquals(1, envelope.payload()[0]);
        assertEquals("acme", envelope.header("tenant"));
    }

    @Test
    void payload_ReturnsDefensiveCopy() {
        // Given
        Envelope envelope = new Envelope(MessageId.of("msg-1"), "OrderCreated", new byte[]{1}, Map.of());

        // When
        envelope.payload()[0] = 7;

        // Then
        assertEquals(1, envelope.payload()[0]);
    }

    @Test
    void headers_AreUnmodifiable() {
        // Given
        Envelope envelope = new Envelope(MessageId.of("msg-1"), "OrderCreated", new byte[0], Map.of());

        // When & Then
        assertThrows(UnsupportedOperationException.class, () -> envelope.headers().put("k", "v"));
    }

    @Test
    void equals_ComparesPayloadContent() {
        // Given
        Envelope first = new Envelope(MessageId.of("msg-1"), "OrderCreated", new byte[]{1, 2}, Map.of());
        Envelope second = new Envelope(MessageId.of("msg-1"), "OrderCreated", new byte[]{1, 2}, Map.of());

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void constructor_NullMessageId_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Envelope(null, "OrderCreated", new byte[0], Map.of())
        );
        assertTrue(exception.getMessage().contains("messageId cannot be null"));
    }

    @Test
    void constructor_BlankTypeTag_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Envelope(MessageId.of("msg-1"), " ", new byte[0], Map.of())
        );
        assertTrue(exception.getMessage().contains("typeTag cannot be null or blank"));
    }

    @Test
    void constructor_NullPayload_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new Envelope(MessageId.of("msg-1"), "OrderCreated", null, Map.of()));
    }
}
