package com.ryuqq.synergyflow.application.engine;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.projection.StageProjector;
import com.ryuqq.synergyflow.core.projection.StageStatus;
import com.ryuqq.synergyflow.core.statemachine.StateMachine;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import com.ryuqq.synergyflow.core.transition.CurrentState;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkflowStatus 유닛 테스트.
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
class WorkflowStatusTest {

    private static final RecordId RECORD = RecordId.of("42");

    @Test
    void 이력이_없는_레코드는_draft_활성() {
        // when
        WorkflowStatus status = WorkflowStatus.of(CurrentState.initial(RECORD));

        // then
        assertThat(status.currentState()).isEqualTo(WorkflowState.DRAFT);
        assertThat(status.sequence()).isZero();
        assertThat(status.stages().get(WorkflowState.DRAFT)).isEqualTo(StageStatus.ACTIVE);
        assertThat(status.allowedActions()).containsExactly(WorkflowAction.SUBMIT);
        assertThat(status.isFinal()).isFalse();
    }

    @Test
    void review_상태는_승인_반려_되돌리기_가능() {
        // when
        WorkflowStatus status = WorkflowStatus.of(new CurrentState(RECORD, WorkflowState.REVIEW, 1));

        // then
        assertThat(status.stages())
            .containsEntry(WorkflowState.DRAFT, StageStatus.COMPLETE)
            .containsEntry(WorkflowState.REVIEW, StageStatus.ACTIVE)
            .containsEntry(WorkflowState.APPROVED, StageStatus.PENDING)
            .containsEntry(WorkflowState.REALIZED, StageStatus.PENDING);
        assertThat(status.allowedActions())
            .containsExactly(WorkflowAction.APPROVE, WorkflowAction.REJECT, WorkflowAction.RETURN_TO_DRAFT);
        assertThat(status.allows(WorkflowAction.REALIZE)).isFalse();
    }

    @Test
    void realized_상태는_최종() {
        // when
        WorkflowStatus status = WorkflowStatus.of(new CurrentState(RECORD, WorkflowState.REALIZED, 3));

        // then
        assertThat(status.isFinal()).isTrue();
        assertThat(status.allowedActions()).isEmpty();
    }

    @Test
    void 동작_순서는_입력과_무관하게_선언_순서() {
        // given
        Set<WorkflowAction> shuffled = new LinkedHashSet<>(
            List.of(WorkflowAction.RETURN_TO_DRAFT, WorkflowAction.REJECT, WorkflowAction.APPROVE)
        );

        // when
        WorkflowStatus status = new WorkflowStatus(
            RECORD, WorkflowState.REVIEW, 1, StageProjector.project(WorkflowState.REVIEW), shuffled
        );

        // then
        assertThat(status.allowedActions())
            .containsExactlyElementsOf(StateMachine.allowedActions(WorkflowState.REVIEW));
        assertThatThrownBy(() -> status.allowedActions().add(WorkflowAction.SUBMIT))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void 단계_맵은_변경_불가() {
        WorkflowStatus status = WorkflowStatus.of(CurrentState.initial(RECORD));

        assertThatThrownBy(() -> status.stages().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
