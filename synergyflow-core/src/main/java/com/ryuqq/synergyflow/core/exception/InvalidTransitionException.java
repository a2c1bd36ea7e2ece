package com.ryuqq.synergyflow.core.exception;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.statemachine.StateMachine;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;

import java.io.Serial;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 관측된 상태에서 허용되지 않은 동작을 요청한 경우.
 *
 * <p>항상 클라이언트 입력 오류이며 엔진은 재시도하지 않습니다.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public class InvalidTransitionException extends WorkflowException {

    @Serial
    private static final long serialVersionUID = -2286153730262405719L;

    /**
     * 생성자.
     *
     * @param recordId 대상 레코드 (null 허용)
     * @param observedState 관측된 현재 상태
     * @param attemptedAction 시도한 동작
     */
    public InvalidTransitionException(RecordId recordId, WorkflowState observedState, WorkflowAction attemptedAction) {
        super(buildMessage(recordId, observedState, attemptedAction), recordId, observedState, attemptedAction, null);
    }

    private static String buildMessage(RecordId recordId, WorkflowState state, WorkflowAction action) {
        if (state == null || action == null) {
            throw new IllegalArgumentException(
                "State and action cannot be null (state: " + state + ", action: " + action + ")");
        }
        String subject = describe(recordId);
        if (state.isTerminal()) {
            return String.format("%s is already %s; no further transitions are possible (attempted: %s)",
                subject, state.wireValue(), action.wireValue());
        }
        Set<WorkflowAction> allowed = StateMachine.allowedActions(state);
        String allowedText = allowed.stream()
            .map(WorkflowAction::wireValue)
            .collect(Collectors.joining(", ", "[", "]"));
        return String.format("cannot %s %s in state '%s'; allowed actions: %s",
            action.wireValue(), subject, state.wireValue(), allowedText);
    }
}
