package com.ryuqq.synergyflow.core.exception;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;

import java.io.Serial;

/**
 * 동시 수정 감지 (낙관적 동시성 충돌).
 *
 * <p>두 가지 경우에 발생합니다:</p>
 * <ul>
 *   <li>호출자가 기대한 현재 상태와 관측된 상태가 다른 경우 (즉시 실패)</li>
 *   <li>저장소 조건부 추가 충돌이 재시도 한도를 넘어 반복된 경우</li>
 * </ul>
 *
 * <p>호출자는 현재 상태를 다시 조회한 뒤 재시도해야 합니다.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public class ConcurrentTransitionException extends WorkflowException {

    @Serial
    private static final long serialVersionUID = 6618421504405231987L;

    private final WorkflowState expectedState;
    private final int attempts;

    private ConcurrentTransitionException(String message,
                                          RecordId recordId,
                                          WorkflowState expectedState,
                                          WorkflowState observedState,
                                          WorkflowAction attemptedAction,
                                          int attempts) {
        super(message, recordId, observedState, attemptedAction, null);
        this.expectedState = expectedState;
        this.attempts = attempts;
    }

    /**
     * 기대 상태 불일치.
     *
     * @param recordId 대상 레코드
     * @param expectedState 호출자가 기대한 상태
     * @param observedState 실제 관측된 상태
     * @param attemptedAction 시도한 동작
     * @return 예외 인스턴스
     */
    public static ConcurrentTransitionException staleExpectation(RecordId recordId,
                                                                 WorkflowState expectedState,
                                                                 WorkflowState observedState,
                                                                 WorkflowAction attemptedAction) {
        String message = String.format(
            "%s changed since you loaded it; refresh and retry (expected state: %s, current state: %s)",
            describe(recordId), expectedState, observedState);
        return new ConcurrentTransitionException(message, recordId, expectedState, observedState, attemptedAction, 1);
    }

    /**
     * 조건부 추가 충돌 재시도 한도 초과.
     *
     * @param recordId 대상 레코드
     * @param expectedState 호출자가 기대한 상태 (null 허용)
     * @param observedState 마지막 시도에서 관측된 상태
     * @param attemptedAction 시도한 동작
     * @param attempts 총 시도 횟수
     * @return 예외 인스턴스
     */
    public static ConcurrentTransitionException retriesExhausted(RecordId recordId,
                                                                 WorkflowState expectedState,
                                                                 WorkflowState observedState,
                                                                 WorkflowAction attemptedAction,
                                                                 int attempts) {
        String message = String.format(
            "%s changed since you loaded it; refresh and retry (lost %d concurrent append attempts)",
            describe(recordId), attempts);
        return new ConcurrentTransitionException(message, recordId, expectedState, observedState, attemptedAction, attempts);
    }

    /**
     * 호출자가 기대한 상태.
     *
     * @return 기대 상태 (지정하지 않았으면 null)
     */
    public WorkflowState getExpectedState() {
        return expectedState;
    }

    /**
     * 실패 전까지 수행한 시도 횟수.
     *
     * @return 시도 횟수 (1 이상)
     */
    public int getAttempts() {
        return attempts;
    }
}
