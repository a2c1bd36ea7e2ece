package com.ryuqq.synergyflow.testkit.contract;

import com.ryuqq.synergyflow.application.engine.TransitionRequest;
import com.ryuqq.synergyflow.application.engine.WorkflowEngine;
import com.ryuqq.synergyflow.application.engine.WorkflowStatus;
import com.ryuqq.synergyflow.core.exception.ConcurrentTransitionException;
import com.ryuqq.synergyflow.core.exception.InvalidTransitionException;
import com.ryuqq.synergyflow.core.exception.TransitionNotFoundException;
import com.ryuqq.synergyflow.core.model.Actor;
import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.projection.StageStatus;
import com.ryuqq.synergyflow.core.projection.StateSummary;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import com.ryuqq.synergyflow.core.transition.CurrentState;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.ryuqq.synergyflow.testkit.contract.ContractFixtures.ANALYST;
import static com.ryuqq.synergyflow.testkit.contract.ContractFixtures.MANAGER;
import static com.ryuqq.synergyflow.testkit.contract.ContractFixtures.freshRecordId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract every {@link WorkflowEngine} must satisfy, independent of the backing store.
 *
 * <p>Covers chain integrity, terminal-state enforcement, the reopen path, the pipeline
 * scenarios and optimistic concurrency between two reviewers.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public abstract class AbstractWorkflowEngineContractTest {

    protected WorkflowEngine engine;

    /**
     * Creates the engine under test. Called before each test.
     *
     * @return engine instance
     */
    protected abstract WorkflowEngine createEngine();

    @BeforeEach
    void setUpEngine() {
        engine = createEngine();
    }

    @Test
    void newRecord_IsDraftWithoutStoredTransition() {
        RecordId recordId = freshRecordId();

        CurrentState current = engine.currentState(recordId);

        assertThat(current.state()).isEqualTo(WorkflowState.DRAFT);
        assertThat(current.sequence()).isZero();
        assertThat(engine.history(recordId)).isEmpty();
    }

    @Test
    void submitNewRecord_ReviewIsActive() {
        RecordId recordId = freshRecordId();

        WorkflowTransition committed = apply(recordId, WorkflowAction.SUBMIT, ANALYST);

        assertThat(committed.sequence()).isEqualTo(1);
        assertThat(committed.fromState()).isEqualTo(WorkflowState.DRAFT);
        WorkflowStatus status = engine.status(recordId);
        assertThat(status.currentState()).isEqualTo(WorkflowState.REVIEW);
        assertThat(status.stages()).containsExactly(
            Map.entry(WorkflowState.DRAFT, StageStatus.COMPLETE),
            Map.entry(WorkflowState.REVIEW, StageStatus.ACTIVE),
            Map.entry(WorkflowState.APPROVED, StageStatus.PENDING),
            Map.entry(WorkflowState.REALIZED, StageStatus.PENDING)
        );
    }

    @Test
    void rejectInReview_AllButDraftRejected() {
        RecordId recordId = freshRecordId();
        apply(recordId, WorkflowAction.SUBMIT, ANALYST);

        apply(recordId, WorkflowAction.REJECT, MANAGER);

        WorkflowStatus status = engine.status(recordId);
        assertThat(status.currentState()).isEqualTo(WorkflowState.REJECTED);
        assertThat(status.stages()).containsExactly(
            Map.entry(WorkflowState.DRAFT, StageStatus.COMPLETE),
            Map.entry(WorkflowState.REVIEW, StageStatus.REJECTED),
            Map.entry(WorkflowState.APPROVED, StageStatus.REJECTED),
            Map.entry(WorkflowState.REALIZED, StageStatus.REJECTED)
        );
        assertThat(status.allowedActions()).containsExactly(WorkflowAction.RETURN_TO_DRAFT);
    }

    @Test
    void reopenPath_SequenceKeepsIncreasing() {
        RecordId recordId = freshRecordId();
        WorkflowTransition firstReview = apply(recordId, WorkflowAction.SUBMIT, ANALYST);
        apply(recordId, WorkflowAction.REJECT, MANAGER);

        WorkflowTransition reopened = apply(recordId, WorkflowAction.RETURN_TO_DRAFT, ANALYST);
        WorkflowTransition secondReview = apply(recordId, WorkflowAction.SUBMIT, ANALYST);

        assertThat(reopened.toState()).isEqualTo(WorkflowState.DRAFT);
        assertThat(reopened.sequence()).isEqualTo(3);
        assertThat(secondReview.toState()).isEqualTo(WorkflowState.REVIEW);
        assertThat(secondReview.sequence()).isGreaterThan(firstReview.sequence());
        assertThat(engine.currentState(recordId).sequence()).isEqualTo(4);
    }

    @Test
    void successfulApplies_FormUnbrokenChain() {
        RecordId recordId = freshRecordId();
        for (WorkflowAction action : List.of(WorkflowAction.SUBMIT, WorkflowAction.REJECT,
                WorkflowAction.RETURN_TO_DRAFT, WorkflowAction.SUBMIT, WorkflowAction.APPROVE,
                WorkflowAction.REALIZE)) {
            apply(recordId, action, ANALYST);
        }

        List<WorkflowTransition> history = engine.history(recordId);

        assertThat(history).hasSize(6);
        assertThat(history.get(0).fromState()).isEqualTo(WorkflowState.DRAFT);
        for (int n = 1; n < history.size(); n++) {
            assertThat(history.get(n).fromState()).isEqualTo(history.get(n - 1).toState());
            assertThat(history.get(n).sequence()).isEqualTo(n + 1L);
        }
    }

    @ParameterizedTest
    @EnumSource(WorkflowAction.class)
    void realizedRecord_RejectsEveryAction(WorkflowAction action) {
        RecordId recordId = freshRecordId();
        apply(recordId, WorkflowAction.SUBMIT, ANALYST);
        apply(recordId, WorkflowAction.APPROVE, MANAGER);
        apply(recordId, WorkflowAction.REALIZE, MANAGER);

        assertThatThrownBy(() -> apply(recordId, action, MANAGER))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("already realized; no further transitions are possible");
        assertThat(engine.history(recordId)).hasSize(3);
    }

    @Test
    void illegalAction_IsRejectedWithObservedState() {
        RecordId recordId = freshRecordId();

        assertThatThrownBy(() -> apply(recordId, WorkflowAction.APPROVE, MANAGER))
            .isInstanceOfSatisfying(InvalidTransitionException.class, e -> {
                assertThat(e.getObservedState()).isEqualTo(WorkflowState.DRAFT);
                assertThat(e.getAttemptedAction()).isEqualTo(WorkflowAction.APPROVE);
            });
        assertThat(engine.history(recordId)).isEmpty();
    }

    @Test
    void staleExpectation_IsRejectedWithoutWriting() {
        RecordId recordId = freshRecordId();
        apply(recordId, WorkflowAction.SUBMIT, ANALYST);

        TransitionRequest request = TransitionRequest.of(recordId, WorkflowAction.SUBMIT, ANALYST, null)
            .expecting(WorkflowState.DRAFT);

        assertThatThrownBy(() -> engine.apply(request))
            .isInstanceOfSatisfying(ConcurrentTransitionException.class, e -> {
                assertThat(e.getExpectedState()).isEqualTo(WorkflowState.DRAFT);
                assertThat(e.getObservedState()).isEqualTo(WorkflowState.REVIEW);
            })
            .hasMessageContaining("changed since you loaded it; refresh and retry");
        assertThat(engine.history(recordId)).hasSize(1);
    }

    @Test
    void matchingExpectation_IsApplied() {
        RecordId recordId = freshRecordId();
        apply(recordId, WorkflowAction.SUBMIT, ANALYST);

        WorkflowTransition committed = engine.apply(
            TransitionRequest.of(recordId, WorkflowAction.APPROVE, MANAGER, "looks good")
                .expecting(WorkflowState.REVIEW));

        assertThat(committed.toState()).isEqualTo(WorkflowState.APPROVED);
        assertThat(committed.comment()).isEqualTo("looks good");
        assertThat(committed.actorLabel()).isEqualTo("manager@company.com");
    }

    @Test
    void twoReviewersApproveTogether_ExactlyOneWins() throws Exception {
        RecordId recordId = freshRecordId();
        apply(recordId, WorkflowAction.SUBMIT, ANALYST);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<WorkflowTransition>> futures = new ArrayList<>();
            for (Actor reviewer : List.of(MANAGER, Actor.of("11", "director@company.com"))) {
                Callable<WorkflowTransition> approve = () -> {
                    start.await();
                    return engine.apply(TransitionRequest.of(recordId, WorkflowAction.APPROVE, reviewer, null)
                        .expecting(WorkflowState.REVIEW));
                };
                futures.add(executor.submit(approve));
            }
            start.countDown();

            int successes = 0;
            int conflicts = 0;
            for (Future<WorkflowTransition> future : futures) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                    successes++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ConcurrentTransitionException.class);
                    conflicts++;
                }
            }

            assertThat(successes).isEqualTo(1);
            assertThat(conflicts).isEqualTo(1);
            assertThat(engine.history(recordId)).hasSize(2);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void transitionAt_ReturnsStoredTransition() {
        RecordId recordId = freshRecordId();
        apply(recordId, WorkflowAction.SUBMIT, ANALYST);
        WorkflowTransition approved = apply(recordId, WorkflowAction.APPROVE, MANAGER);

        assertThat(engine.transitionAt(recordId, 2)).isEqualTo(approved);
    }

    @Test
    void transitionAt_MissingSequence_ThrowsNotFound() {
        RecordId recordId = freshRecordId();
        apply(recordId, WorkflowAction.SUBMIT, ANALYST);

        assertThatThrownBy(() -> engine.transitionAt(recordId, 2))
            .isInstanceOfSatisfying(TransitionNotFoundException.class,
                e -> assertThat(e.getSequence()).isEqualTo(2));
    }

    @Test
    void summarize_CountsCurrentStates() {
        RecordId untouched = freshRecordId();
        RecordId inReview = freshRecordId();
        RecordId rejected = freshRecordId();
        apply(inReview, WorkflowAction.SUBMIT, ANALYST);
        apply(rejected, WorkflowAction.SUBMIT, ANALYST);
        apply(rejected, WorkflowAction.REJECT, MANAGER);

        StateSummary summary = engine.summarize(List.of(untouched, inReview, rejected));

        assertThat(summary.countOf(WorkflowState.DRAFT)).isEqualTo(1);
        assertThat(summary.countOf(WorkflowState.REVIEW)).isEqualTo(1);
        assertThat(summary.countOf(WorkflowState.REJECTED)).isEqualTo(1);
        assertThat(summary.countOf(WorkflowState.APPROVED)).isZero();
        assertThat(summary.total()).isEqualTo(3);
    }

    /**
     * Applies an action without a state expectation.
     *
     * @param recordId record
     * @param action action
     * @param actor actor
     * @return committed transition
     */
    protected WorkflowTransition apply(RecordId recordId, WorkflowAction action, Actor actor) {
        return engine.apply(TransitionRequest.of(recordId, action, actor, null));
    }
}
