package com.ryuqq.synergyflow.core.transition;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;

import java.util.Optional;

/**
 * 레코드의 파생된 현재 상태.
 *
 * <p>현재 상태는 저장되지 않고 항상 최신 전이(가장 큰 sequence)의 {@code toState}로 계산됩니다.
 * 전이가 없으면 (DRAFT, sequence 0)입니다. 레코드 생성 시 별도의 쓰기가 필요 없습니다.</p>
 *
 * @param recordId 레코드
 * @param state 현재 상태
 * @param sequence 최신 전이의 sequence (전이가 없으면 0)
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public record CurrentState(RecordId recordId, WorkflowState state, long sequence) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException recordId 또는 state가 null이거나 sequence가 음수인 경우
     */
    public CurrentState {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
    }

    /**
     * 전이가 없는 레코드의 상태.
     *
     * @param recordId 레코드
     * @return (DRAFT, 0)
     */
    public static CurrentState initial(RecordId recordId) {
        return new CurrentState(recordId, WorkflowState.initial(), 0);
    }

    /**
     * 최신 전이로부터 현재 상태 계산.
     *
     * @param recordId 레코드
     * @param latest 최신 전이 (없으면 empty)
     * @return 파생된 현재 상태
     * @throws IllegalArgumentException latest가 다른 레코드의 전이인 경우
     */
    public static CurrentState derive(RecordId recordId, Optional<WorkflowTransition> latest) {
        return latest.map(transition -> {
            if (!transition.recordId().equals(recordId)) {
                throw new IllegalArgumentException(
                    "Transition belongs to " + transition.recordId() + ", not " + recordId);
            }
            return new CurrentState(recordId, transition.toState(), transition.sequence());
        }).orElseGet(() -> initial(recordId));
    }

    /**
     * 전이 이력이 없는지 확인.
     *
     * @return sequence가 0이면 true
     */
    public boolean isPristine() {
        return sequence == 0;
    }
}
