package com.ryuqq.relay.core.saga;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SagaStepTest {

    @Test
    void of_DelegatesToActions() throws Exception {
        // Given
        List<String> calls = new ArrayList<>();
        SagaStep<String> step = SagaStep.of("reserve", data -> calls.add("exec:" + data), data -> calls.add("comp:" + data));

        // When
        step.execute("o-1");
        step.compensate("o-1");

        // Then
        assertEquals("reserve", step.name());
        assertEquals(List.of("exec:o-1", "comp:o-1"), calls);
        assertEquals("SagaStep{reserve}", step.toString());
    }

    @Test
    void of_PropagatesCheckedException() {
        // Given
        SagaStep<String> step = SagaStep.of("charge", data -> {
            throw new Exception("declined");
        }, data -> { });

        // When & Then
        Exception exception = assertThrows(Exception.class, () -> step.execute("o-1"));
        assertEquals("declined", exception.getMessage());
    }

    @Test
    void of_InvalidArguments_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> SagaStep.<String>of(" ", data -> { }, data -> { }));
        assertThrows(IllegalArgumentException.class, () -> SagaStep.<String>of("a", null, data -> { }));
        assertThrows(IllegalArgumentException.class, () -> SagaStep.<String>of("a", data -> { }, null));
    }
}
