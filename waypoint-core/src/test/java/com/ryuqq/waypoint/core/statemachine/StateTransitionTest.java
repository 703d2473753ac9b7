package com.ryuqq.waypoint.core.statemachine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.ryuqq.waypoint.core.statemachine.ExecutionStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>PENDING → RUNNING → AWAITING_APPROVAL → RUNNING → COMPLETED 정상 흐름</li>
 *   <li>종료 상태에서의 모든 전이는 IllegalStateException</li>
 *   <li>역방향 전이 불가</li>
 * </ul>
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_ApprovalRoundTrip_Succeeds() {
        // Given
        ExecutionStatus state = PENDING;

        // When
        state = StateTransition.transition(state, RUNNING);
        state = StateTransition.transition(state, AWAITING_APPROVAL);
        state = StateTransition.transition(state, RUNNING);
        state = StateTransition.transition(state, COMPLETED);

        // Then
        assertEquals(COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void validate_AwaitingApprovalToCancelled_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(AWAITING_APPROVAL, CANCELLED));
        assertDoesNotThrow(() -> StateTransition.validate(AWAITING_APPROVAL, FAILED));
    }

    @Test
    void validate_PendingToCancelled_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PENDING, CANCELLED));
    }

    // ========== 불법 전이 테스트 ==========

    @ParameterizedTest
    @EnumSource(value = ExecutionStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void validate_FromTerminal_ThrowsException(ExecutionStatus terminal) {
        for (ExecutionStatus target : ExecutionStatus.values()) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> StateTransition.validate(terminal, target)
            );
            assertTrue(exception.getMessage().contains("terminal state"));
        }
    }

    @Test
    void validate_PendingToAwaitingApproval_ThrowsException() {
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> StateTransition.validate(PENDING, AWAITING_APPROVAL)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_RunningToPending_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(RUNNING, PENDING));
        assertThrows(IllegalStateException.class, () -> StateTransition.validate(AWAITING_APPROVAL, COMPLETED));
    }

    @Test
    void validate_NullState_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, RUNNING));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(RUNNING, null));
    }

    @Test
    void isAllowed_DoesNotThrow() {
        assertTrue(StateTransition.isAllowed(RUNNING, AWAITING_APPROVAL));
        assertFalse(StateTransition.isAllowed(COMPLETED, RUNNING));
    }

    @Test
    void stepStatus_TerminalAndSuccess() {
        assertTrue(StepStatus.SKIPPED.isTerminal());
        assertFalse(StepStatus.AWAITING_APPROVAL.isTerminal());
        assertTrue(StepStatus.SUCCEEDED.isSuccessful());
        assertFalse(StepStatus.FAILED.isSuccessful());
    }
}
