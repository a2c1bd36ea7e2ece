package com.ryuqq.synergyflow.core.projection;

import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 감사 타임라인의 한 행.
 *
 * <p>예: {@code "SUBMIT: Draft → Review"}, by {@code analyst@company.com}</p>
 *
 * @param sequence 전이 sequence
 * @param headline 동작과 상태 변화 요약
 * @param actorLabel 수행자 표시 문자열
 * @param comment 코멘트 (없으면 null)
 * @param occurredAt 커밋 시각
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public record TimelineEntry(long sequence, String headline, String actorLabel, String comment, Instant occurredAt) {

    /**
     * 전이 하나를 타임라인 행으로 변환.
     *
     * @param transition 커밋된 전이
     * @return 타임라인 행
     */
    public static TimelineEntry of(WorkflowTransition transition) {
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        String headline = transition.action().label() + ": "
            + capitalize(transition.fromState()) + " → " + capitalize(transition.toState());
        return new TimelineEntry(
            transition.sequence(),
            headline,
            transition.actorLabel(),
            transition.hasComment() ? transition.comment() : null,
            transition.createdAt()
        );
    }

    /**
     * 이력 전체를 타임라인으로 변환 (순서 유지).
     *
     * @param history sequence 오름차순 전이 이력
     * @return 타임라인 행 목록
     */
    public static List<TimelineEntry> fromHistory(List<WorkflowTransition> history) {
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        return history.stream().map(TimelineEntry::of).collect(Collectors.toUnmodifiableList());
    }

    private static String capitalize(WorkflowState state) {
        String value = state.wireValue();
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }
}
