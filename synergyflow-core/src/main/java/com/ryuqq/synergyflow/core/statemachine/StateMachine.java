package com.ryuqq.synergyflow.core.statemachine;

import com.ryuqq.synergyflow.core.exception.InvalidTransitionException;
import com.ryuqq.synergyflow.core.model.RecordId;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 워크플로우 상태 전이 규칙.
 *
 * <p>(현재 상태, 동작) → 다음 상태를 계산하는 순수 함수입니다. I/O가 없고 결정적이며,
 * 모든 상태 × 동작 조합에 대해 정의됩니다 (허용되지 않은 조합은 빈 결과).</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>DRAFT --submit--&gt; REVIEW</li>
 *   <li>REVIEW --approve--&gt; APPROVED</li>
 *   <li>REVIEW --reject--&gt; REJECTED</li>
 *   <li>REVIEW --return_to_draft--&gt; DRAFT</li>
 *   <li>APPROVED --realize--&gt; REALIZED</li>
 *   <li>APPROVED --reject--&gt; REJECTED</li>
 *   <li>REJECTED --return_to_draft--&gt; DRAFT</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>REALIZED에서는 어떤 동작도 불가</li>
 *   <li>REJECTED에서는 return_to_draft만 가능</li>
 *   <li>허용되지 않은 동작을 가장 가까운 합법 전이로 바꾸지 않음</li>
 * </ul>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public final class StateMachine {

    private StateMachine() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 다음 상태 계산.
     *
     * @param current 현재 상태
     * @param action 요청된 동작
     * @return 허용된 경우 다음 상태, 아니면 빈 Optional
     * @throws IllegalArgumentException current 또는 action이 null인 경우
     */
    public static Optional<WorkflowState> nextState(WorkflowState current, WorkflowAction action) {
        if (current == null || action == null) {
            throw new IllegalArgumentException(
                "State and action cannot be null (state: " + current + ", action: " + action + ")");
        }

        WorkflowState next = switch (current) {
            case DRAFT -> action == WorkflowAction.SUBMIT ? WorkflowState.REVIEW : null;
            case REVIEW -> switch (action) {
                case APPROVE -> WorkflowState.APPROVED;
                case REJECT -> WorkflowState.REJECTED;
                case RETURN_TO_DRAFT -> WorkflowState.DRAFT;
                default -> null;
            };
            case APPROVED -> switch (action) {
                case REALIZE -> WorkflowState.REALIZED;
                case REJECT -> WorkflowState.REJECTED;
                default -> null;
            };
            case REJECTED -> action == WorkflowAction.RETURN_TO_DRAFT ? WorkflowState.DRAFT : null;
            case REALIZED -> null;
        };
        return Optional.ofNullable(next);
    }

    /**
     * 전이 가능 여부 확인.
     *
     * @param current 현재 상태
     * @param action 요청된 동작
     * @return 허용된 전이이면 true
     * @throws IllegalArgumentException current 또는 action이 null인 경우
     */
    public static boolean canApply(WorkflowState current, WorkflowAction action) {
        return nextState(current, action).isPresent();
    }

    /**
     * 전이 실행 (검증 후).
     *
     * @param recordId 대상 레코드 (오류 메시지용)
     * @param current 현재 상태
     * @param action 요청된 동작
     * @return 다음 상태
     * @throws IllegalArgumentException current 또는 action이 null인 경우
     * @throws InvalidTransitionException 허용되지 않은 전이인 경우
     */
    public static WorkflowState transition(RecordId recordId, WorkflowState current, WorkflowAction action) {
        return nextState(current, action)
            .orElseThrow(() -> new InvalidTransitionException(recordId, current, action));
    }

    /**
     * 현재 상태에서 허용되는 동작 목록.
     *
     * @param current 현재 상태
     * @return 선언 순서의 불변 동작 집합 (REALIZED는 빈 집합)
     * @throws IllegalArgumentException current가 null인 경우
     */
    public static Set<WorkflowAction> allowedActions(WorkflowState current) {
        if (current == null) {
            throw new IllegalArgumentException("State cannot be null");
        }
        EnumSet<WorkflowAction> allowed = EnumSet.noneOf(WorkflowAction.class);
        for (WorkflowAction action : WorkflowAction.values()) {
            if (canApply(current, action)) {
                allowed.add(action);
            }
        }
        return Collections.unmodifiableSet(allowed);
    }
}
