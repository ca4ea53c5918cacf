package com.ryuqq.relay.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageId / SagaId 값 객체 테스트.
 *
 * @author Relay Team
 * @since 1.0.0
 */
class MessageIdTest {

    @Test
    void of_ValidValue_CreatesMessageId() {
        // When
        MessageId messageId = MessageId.of("order-123:v1");

        // Then
        assertEquals("order-123:v1", messageId.getValue());
    }

    @Test
    void generate_ReturnsUniqueIds() {
        // When
        MessageId first = MessageId.generate();
        MessageId second = MessageId.generate();

        // Then
        assertNotEquals(first, second);
        assertEquals(36, first.getValue().length());
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> MessageId.of("  ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_NullValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> MessageId.of(null));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> MessageId.of(value)
        );
        assertTrue(exception.getMessage().contains("cannot exceed 255"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> MessageId.of("order 123/abc")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        MessageId first = MessageId.of("msg-1");
        MessageId second = MessageId.of("msg-1");

        // Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals("MessageId{msg-1}", first.toString());
    }

    @Test
    void sagaId_AllowsFreeFormValue() {
        // When
        SagaId sagaId = SagaId.of("order saga/42");

        // Then
        assertEquals("order saga/42", sagaId.getValue());
        assertEquals(SagaId.of("order saga/42"), sagaId);
        assertThrows(IllegalArgumentException.class, () -> SagaId.of(""));
        assertNotEquals(SagaId.generate(), SagaId.generate());
    }
}
