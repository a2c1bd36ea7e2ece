package com.ryuqq.synergyflow.core.statemachine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WorkflowState / WorkflowAction 테스트.
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
class WorkflowStateTest {

    @Test
    void initial_IsDraft() {
        assertEquals(WorkflowState.DRAFT, WorkflowState.initial());
    }

    @Test
    void isTerminal_OnlyRealized() {
        for (WorkflowState state : WorkflowState.values()) {
            assertEquals(state == WorkflowState.REALIZED, state.isTerminal(), state.name());
        }
    }

    @Test
    void isReopenable_OnlyRejected() {
        assertTrue(WorkflowState.REJECTED.isReopenable());
        assertFalse(WorkflowState.REJECTED.isTerminal());
        assertFalse(WorkflowState.REALIZED.isReopenable());
    }

    @Test
    void fromWireValue_EveryState_RoundTrips() {
        for (WorkflowState state : WorkflowState.values()) {
            assertEquals(state, WorkflowState.fromWireValue(state.wireValue()));
        }
    }

    @Test
    void fromWireValue_Unknown_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> WorkflowState.fromWireValue("archived")
        );
        assertTrue(exception.getMessage().contains("archived"));
    }

    @Test
    void fromWireValue_UpperCase_IsNotAccepted() {
        assertThrows(IllegalArgumentException.class, () -> WorkflowState.fromWireValue("DRAFT"));
    }

    @Test
    void action_WireValueAndLabel() {
        assertEquals("return_to_draft", WorkflowAction.RETURN_TO_DRAFT.wireValue());
        assertEquals("RETURN TO DRAFT", WorkflowAction.RETURN_TO_DRAFT.label());
        assertEquals("SUBMIT", WorkflowAction.SUBMIT.label());
        assertEquals(WorkflowAction.REALIZE, WorkflowAction.fromWireValue("realize"));
    }

    @Test
    void action_FromWireValue_Null_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> WorkflowAction.fromWireValue(null));
    }
}
