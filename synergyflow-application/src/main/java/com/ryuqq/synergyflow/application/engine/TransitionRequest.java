package com.ryuqq.synergyflow.application.engine;

import com.ryuqq.synergyflow.core.model.Actor;
import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;

import java.util.Optional;

/**
 * 상태 변경 요청.
 *
 * <p>expectedCurrentState는 호출자가 화면을 불러올 때 본 상태입니다. 지정하면 그 사이에
 * 다른 사용자가 상태를 바꾼 경우 요청이 거부됩니다 (낙관적 동시성).</p>
 *
 * @param recordId 대상 레코드
 * @param action 수행할 동작
 * @param actor 수행자
 * @param comment 코멘트 (null 허용)
 * @param expectedCurrentState 기대 현재 상태 (null이면 검사하지 않음)
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public record TransitionRequest(
    RecordId recordId,
    WorkflowAction action,
    Actor actor,
    String comment,
    WorkflowState expectedCurrentState
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public TransitionRequest {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
    }

    /**
     * 기대 상태 없이 요청 생성.
     *
     * @param recordId 대상 레코드
     * @param action 수행할 동작
     * @param actor 수행자
     * @param comment 코멘트 (null 허용)
     * @return 요청
     */
    public static TransitionRequest of(RecordId recordId, WorkflowAction action, Actor actor, String comment) {
        return new TransitionRequest(recordId, action, actor, comment, null);
    }

    /**
     * 기대 현재 상태를 지정한 사본.
     *
     * @param state 호출자가 관측한 현재 상태
     * @return 새 요청
     */
    public TransitionRequest expecting(WorkflowState state) {
        if (state == null) {
            throw new IllegalArgumentException("expected state cannot be null");
        }
        return new TransitionRequest(recordId, action, actor, comment, state);
    }

    /**
     * 기대 현재 상태.
     *
     * @return 지정했으면 상태, 아니면 empty
     */
    public Optional<WorkflowState> expectation() {
        return Optional.ofNullable(expectedCurrentState);
    }
}
