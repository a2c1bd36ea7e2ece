package com.ryuqq.synergyflow.core.projection;

import com.ryuqq.synergyflow.core.model.Actor;
import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;

import java.time.Instant;

final class ProjectionFixtures {

    static final RecordId RECORD = RecordId.of("42");
    static final Instant T0 = Instant.parse("2026-02-17T10:30:00Z");

    private ProjectionFixtures() {
    }

    static WorkflowTransition transition(long sequence,
                                         WorkflowState from,
                                         WorkflowState to,
                                         WorkflowAction action,
                                         String actorLabel,
                                         String comment) {
        return new WorkflowTransition(
            sequence, RECORD, from, to, action, Actor.of("actor-" + actorLabel, actorLabel),
            comment, sequence, T0.plusSeconds(sequence * 60));
    }
}
