package com.ryuqq.synergyflow.core.exception;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 예외 메시지 및 컨텍스트 테스트.
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
class WorkflowExceptionTest {

    private static final RecordId RECORD = RecordId.of("42");

    @Test
    void staleExpectation_NamesBothStates() {
        ConcurrentTransitionException exception = ConcurrentTransitionException.staleExpectation(
            RECORD, WorkflowState.REVIEW, WorkflowState.APPROVED, WorkflowAction.APPROVE);

        assertThat(exception.getMessage())
            .isEqualTo("record 42 changed since you loaded it; refresh and retry"
                + " (expected state: review, current state: approved)");
        assertThat(exception.getExpectedState()).isEqualTo(WorkflowState.REVIEW);
        assertThat(exception.getObservedState()).isEqualTo(WorkflowState.APPROVED);
        assertThat(exception.getAttemptedAction()).isEqualTo(WorkflowAction.APPROVE);
        assertThat(exception.getAttempts()).isEqualTo(1);
    }

    @Test
    void retriesExhausted_ReportsAttempts() {
        ConcurrentTransitionException exception = ConcurrentTransitionException.retriesExhausted(
            RECORD, null, WorkflowState.REVIEW, WorkflowAction.SUBMIT, 4);

        assertThat(exception.getMessage()).contains("lost 4 concurrent append attempts");
        assertThat(exception.getExpectedState()).isNull();
        assertThat(exception.getAttempts()).isEqualTo(4);
    }

    @Test
    void transitionNotFound_NamesSequence() {
        TransitionNotFoundException exception = new TransitionNotFoundException(RECORD, 7);

        assertThat(exception.getMessage()).isEqualTo("no transition #7 found for record 42");
        assertThat(exception.getSequence()).isEqualTo(7);
        assertThat(exception.getRecordId()).isEqualTo(RECORD);
    }

    @Test
    void storeUnavailable_KeepsCause() {
        SQLException cause = new SQLException("connection refused");

        StoreUnavailableException exception = new StoreUnavailableException("failed to read transitions", RECORD, cause);

        assertThat(exception).hasCause(cause);
        assertThat(exception.getRecordId()).isEqualTo(RECORD);
    }

    @Test
    void allWorkflowExceptionsAreUnchecked() {
        assertThat(RuntimeException.class).isAssignableFrom(WorkflowException.class);
    }
}
