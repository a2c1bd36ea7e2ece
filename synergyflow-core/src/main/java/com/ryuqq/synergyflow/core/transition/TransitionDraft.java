package com.ryuqq.synergyflow.core.transition;

import com.ryuqq.synergyflow.core.model.Actor;
import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;

import java.time.Instant;

/**
 * 아직 커밋되지 않은 전이 (조건부 추가 요청).
 *
 * <p>엔진이 관측한 현재 상태를 기준으로 만들어지며, 저장소는
 * 해당 레코드의 최신 sequence가 {@code sequence - 1}인 경우에만 커밋합니다.
 * id와 createdAt은 커밋 시점에 저장소가 부여합니다.</p>
 *
 * @param recordId 소유 레코드
 * @param fromState 관측된 현재 상태
 * @param toState 상태 머신이 계산한 다음 상태
 * @param action 요청된 동작
 * @param actor 요청자
 * @param comment 선택적 코멘트 (null 허용)
 * @param sequence 부여할 sequence (관측된 sequence + 1)
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public record TransitionDraft(
    RecordId recordId,
    WorkflowState fromState,
    WorkflowState toState,
    WorkflowAction action,
    Actor actor,
    String comment,
    long sequence
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 sequence가 1 미만인 경우
     */
    public TransitionDraft {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (fromState == null || toState == null) {
            throw new IllegalArgumentException(
                "States cannot be null (from: " + fromState + ", to: " + toState + ")");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1 (current: " + sequence + ")");
        }
    }

    /**
     * 관측된 현재 상태에서 다음 전이 초안 생성.
     *
     * @param observed 관측된 현재 상태
     * @param toState 다음 상태
     * @param action 동작
     * @param actor 요청자
     * @param comment 코멘트 (null 허용)
     * @return sequence가 관측값 + 1인 초안
     */
    public static TransitionDraft following(CurrentState observed,
                                            WorkflowState toState,
                                            WorkflowAction action,
                                            Actor actor,
                                            String comment) {
        return new TransitionDraft(
            observed.recordId(), observed.state(), toState, action, actor, comment, observed.sequence() + 1);
    }

    /**
     * 커밋 직전 선행 sequence (조건부 추가의 비교 값).
     *
     * @return sequence - 1 (첫 전이이면 0)
     */
    public long expectedLatestSequence() {
        return sequence - 1;
    }

    /**
     * 저장소가 부여한 값으로 커밋된 전이 생성.
     *
     * @param id 저장소 식별자
     * @param createdAt 커밋 시각
     * @return 커밋된 전이
     */
    public WorkflowTransition commit(long id, Instant createdAt) {
        return new WorkflowTransition(id, recordId, fromState, toState, action, actor, comment, sequence, createdAt);
    }
}
