package com.ryuqq.synergyflow.application.engine;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.projection.StageProjector;
import com.ryuqq.synergyflow.core.projection.StageStatus;
import com.ryuqq.synergyflow.core.statemachine.StateMachine;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import com.ryuqq.synergyflow.core.transition.CurrentState;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 화면 표시용 워크플로우 상태.
 *
 * <p>파이프라인 위젯과 동작 버튼이 필요로 하는 값을 한 번에 제공합니다.
 * 생성 후 변경되지 않습니다.</p>
 *
 * @param recordId 레코드 ID
 * @param currentState 현재 상태
 * @param sequence 최근 전이 sequence (이력이 없으면 0)
 * @param stages 기본 파이프라인의 단계별 상태 (파이프라인 순서)
 * @param allowedActions 현재 상태에서 가능한 동작 (WorkflowAction 선언 순서)
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public record WorkflowStatus(
    RecordId recordId,
    WorkflowState currentState,
    long sequence,
    Map<WorkflowState, StageStatus> stages,
    Set<WorkflowAction> allowedActions
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public WorkflowStatus {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (currentState == null) {
            throw new IllegalArgumentException("currentState cannot be null");
        }
        if (stages == null || allowedActions == null) {
            throw new IllegalArgumentException("stages and allowedActions cannot be null");
        }
        stages = Collections.unmodifiableMap(new LinkedHashMap<>(stages));
        allowedActions = Collections.unmodifiableSet(
            allowedActions.isEmpty() ? EnumSet.noneOf(WorkflowAction.class) : EnumSet.copyOf(allowedActions)
        );
    }

    /**
     * 현재 상태로부터 생성.
     *
     * @param current 현재 상태
     * @return 워크플로우 상태
     */
    public static WorkflowStatus of(CurrentState current) {
        if (current == null) {
            throw new IllegalArgumentException("current cannot be null");
        }
        return new WorkflowStatus(
            current.recordId(),
            current.state(),
            current.sequence(),
            StageProjector.project(current.state()),
            StateMachine.allowedActions(current.state())
        );
    }

    /**
     * 더 이상 전이가 불가능한지 여부.
     *
     * @return realized 상태이면 true
     */
    public boolean isFinal() {
        return currentState.isTerminal();
    }

    /**
     * 동작 가능 여부.
     *
     * @param action 동작
     * @return 현재 상태에서 허용되면 true
     */
    public boolean allows(WorkflowAction action) {
        return allowedActions.contains(action);
    }
}
