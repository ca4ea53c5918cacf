package com.ryuqq.relay.core.saga;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.relay.core.saga.SagaState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SagaStateTransition 테스트.
 *
 * <ul>
 *   <li>정상 흐름: NOT_STARTED → RUNNING → COMPLETED</li>
 *   <li>보상 흐름: RUNNING → COMPENSATING → COMPENSATED / FAILED / ABORTED</li>
 *   <li>종료 상태에서의 전이는 모두 IllegalStateException</li>
 * </ul>
 *
 * @author Relay Team
 * @since 1.0.0
 */
class SagaStateTransitionTest {

    // ========== 정상 전이 ==========

    @Test
    void transition_NormalFlowToCompleted_Succeeds() {
        // Given
        SagaState state = NOT_STARTED;

        // When
        state = SagaStateTransition.transition(state, RUNNING);
        state = SagaStateTransition.transition(state, COMPLETED);

        // Then
        assertEquals(COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void transition_CompensationFlows_Succeed() {
        assertDoesNotThrow(() -> SagaStateTransition.validate(RUNNING, COMPENSATING));
        assertDoesNotThrow(() -> SagaStateTransition.validate(COMPENSATING, COMPENSATED));
        assertDoesNotThrow(() -> SagaStateTransition.validate(COMPENSATING, FAILED));
        assertDoesNotThrow(() -> SagaStateTransition.validate(COMPENSATING, ABORTED));
    }

    @Test
    void validate_NotStartedToAborted_Succeeds() {
        assertDoesNotThrow(() -> SagaStateTransition.validate(NOT_STARTED, ABORTED));
    }

    // ========== 불법 전이 ==========

    @ParameterizedTest
    @EnumSource(value = SagaState.class, names = {"COMPLETED", "COMPENSATED", "FAILED", "ABORTED"})
    void validate_FromTerminal_ThrowsException(SagaState terminal) {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> SagaStateTransition.validate(terminal, RUNNING)
        );
        assertTrue(exception.getMessage().contains("terminal state"));
    }

    @Test
    void validate_RunningToAborted_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> SagaStateTransition.validate(RUNNING, ABORTED)
        );
        assertTrue(exception.getMessage().contains("Invalid saga state transition"));
    }

    @Test
    void validate_NotStartedToCompleted_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> SagaStateTransition.validate(NOT_STARTED, COMPLETED));
    }

    @Test
    void validate_CompensatingToRunning_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> SagaStateTransition.validate(COMPENSATING, RUNNING));
    }

    @Test
    void validate_NullState_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> SagaStateTransition.validate(null, RUNNING));
        assertThrows(IllegalArgumentException.class, () -> SagaStateTransition.validate(RUNNING, null));
    }

    @Test
    void isTerminal_OnlyForEndStates() {
        assertFalse(NOT_STARTED.isTerminal());
        assertFalse(RUNNING.isTerminal());
        assertFalse(COMPENSATING.isTerminal());
        assertTrue(COMPENSATED.isTerminal());
        assertTrue(ABORTED.isTerminal());
    }
}
