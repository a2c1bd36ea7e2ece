package com.ryuqq.synergyflow.core.transition;

import com.ryuqq.synergyflow.core.model.Actor;
import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;

import java.time.Instant;

/**
 * 커밋된 상태 전이 (불변 감사 이벤트).
 *
 * <p>엔진의 성공한 apply 호출로만 생성되며, 생성 후에는 수정되거나 삭제되지 않습니다.
 * 수정은 새로운 전이(예: return_to_draft)를 추가하는 방식으로만 이루어집니다.</p>
 *
 * <p><strong>순서:</strong> 동일 레코드의 전이는 {@code sequence}(1부터 시작)로 전순서를 가집니다.
 * {@code createdAt}은 참고용 벽시계 시각이며, 순서나 상태 계산에 사용하지 않습니다.</p>
 *
 * @param id 저장소가 부여한 고유 식별자 (양수)
 * @param recordId 소유 레코드
 * @param fromState 전이 전 상태
 * @param toState 전이 후 상태
 * @param action 전이를 일으킨 동작
 * @param actor 전이를 수행한 사용자
 * @param comment 선택적 코멘트 (null 허용)
 * @param sequence 레코드별 순번 (1 이상)
 * @param createdAt 커밋 시각 (참고용)
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public record WorkflowTransition(
    long id,
    RecordId recordId,
    WorkflowState fromState,
    WorkflowState toState,
    WorkflowAction action,
    Actor actor,
    String comment,
    long sequence,
    Instant createdAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 id/sequence가 양수가 아닌 경우
     */
    public WorkflowTransition {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive (current: " + id + ")");
        }
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
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
    }

    /**
     * 사용자 식별자.
     *
     * @return actor id
     */
    public String actorId() {
        return actor.id();
    }

    /**
     * 사용자 표시 문자열.
     *
     * @return actor label (예: 이메일)
     */
    public String actorLabel() {
        return actor.label();
    }

    /**
     * 코멘트 존재 여부.
     *
     * @return 비어 있지 않은 코멘트가 있으면 true
     */
    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
