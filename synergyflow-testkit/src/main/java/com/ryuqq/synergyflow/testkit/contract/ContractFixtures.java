package com.ryuqq.synergyflow.testkit.contract;

import com.ryuqq.synergyflow.core.model.Actor;
import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.statemachine.StateMachine;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.transition.CurrentState;
import com.ryuqq.synergyflow.core.transition.TransitionDraft;

import java.util.UUID;

/**
 * Shared fixtures for contract tests.
 *
 * <p>Record ids are random so that suites can run against a persistent store whose
 * log cannot be deleted between tests.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public final class ContractFixtures {

    /** Analyst who drafts and submits records. */
    public static final Actor ANALYST = Actor.of("5", "analyst@company.com");

    /** Manager who reviews records. */
    public static final Actor MANAGER = Actor.of("9", "manager@company.com");

    private ContractFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Creates a record id that no other test uses.
     *
     * @return fresh record id
     */
    public static RecordId freshRecordId() {
        return RecordId.of("rec-" + UUID.randomUUID());
    }

    /**
     * Builds the draft for applying an action on top of the observed state.
     *
     * @param observed observed current state
     * @param action action to apply (must be legal)
     * @param actor actor
     * @return draft with sequence = observed + 1
     */
    public static TransitionDraft draftFor(CurrentState observed, WorkflowAction action, Actor actor) {
        return TransitionDraft.following(
            observed,
            StateMachine.transition(observed.recordId(), observed.state(), action),
            action,
            actor,
            null
        );
    }
}
