package com.ryuqq.synergyflow.core.spi;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;

/**
 * 조건부 추가 결과.
 *
 * <ul>
 *   <li>{@link Appended}: 커밋 성공</li>
 *   <li>{@link SequenceConflict}: 다른 작성자가 먼저 커밋함 (아무것도 기록되지 않음)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AppendResult result = store.appendIfSequenceMatches(draft);
 * if (result instanceof AppendResult.Appended appended) {
 *     return appended.transition();
 * }
 * // SequenceConflict → 다시 조회 후 재시도
 * </pre>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public sealed interface AppendResult permits AppendResult.Appended, AppendResult.SequenceConflict {

    /**
     * 커밋 성공 여부.
     *
     * @return Appended이면 true
     */
    default boolean isAppended() {
        return this instanceof Appended;
    }

    /**
     * 커밋 성공.
     *
     * @param transition 커밋된 전이
     */
    record Appended(WorkflowTransition transition) implements AppendResult {

        public Appended {
            if (transition == null) {
                throw new IllegalArgumentException("transition cannot be null");
            }
        }
    }

    /**
     * sequence 충돌.
     *
     * @param recordId 대상 레코드
     * @param attemptedSequence 추가하려던 sequence
     * @param latestSequence 충돌 시점의 실제 최신 sequence
     */
    record SequenceConflict(RecordId recordId, long attemptedSequence, long latestSequence) implements AppendResult {

        public SequenceConflict {
            if (recordId == null) {
                throw new IllegalArgumentException("recordId cannot be null");
            }
        }
    }
}
