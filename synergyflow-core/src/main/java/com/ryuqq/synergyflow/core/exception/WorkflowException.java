package com.ryuqq.synergyflow.core.exception;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;

import java.io.Serial;

/**
 * 워크플로우 엔진 오류의 공통 상위 타입.
 *
 * <p>모든 오류는 호출자가 재시도 여부를 판단하거나 사용자에게 안내할 수 있도록
 * 대상 레코드, 관측된 현재 상태, 시도한 동작을 함께 전달합니다 (알 수 없는 경우 null).</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link InvalidTransitionException}: 허용되지 않은 동작 (클라이언트 입력 오류, 재시도 불가)</li>
 *   <li>{@link ConcurrentTransitionException}: 동시 수정 감지 (새로 조회 후 재시도)</li>
 *   <li>{@link TransitionNotFoundException}: 요청한 전이 없음</li>
 *   <li>{@link StoreUnavailableException}: 저장소 장애 (일시적, 호출자 정책으로 재시도)</li>
 * </ul>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public abstract class WorkflowException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4127308713366517029L;

    private final transient RecordId recordId;
    private final WorkflowState observedState;
    private final WorkflowAction attemptedAction;

    protected WorkflowException(String message,
                                RecordId recordId,
                                WorkflowState observedState,
                                WorkflowAction attemptedAction,
                                Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
        this.observedState = observedState;
        this.attemptedAction = attemptedAction;
    }

    /**
     * 대상 레코드.
     *
     * @return RecordId (알 수 없으면 null)
     */
    public RecordId getRecordId() {
        return recordId;
    }

    /**
     * 오류 시점에 관측된 현재 상태.
     *
     * @return 관측 상태 (알 수 없으면 null)
     */
    public WorkflowState getObservedState() {
        return observedState;
    }

    /**
     * 시도한 동작.
     *
     * @return 동작 (해당 없으면 null)
     */
    public WorkflowAction getAttemptedAction() {
        return attemptedAction;
    }

    static String describe(RecordId recordId) {
        return recordId == null ? "record" : "record " + recordId.getValue();
    }
}
