package com.ryuqq.synergyflow.core.projection;

import com.ryuqq.synergyflow.core.statemachine.WorkflowState;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 여러 레코드의 현재 상태별 개수 (대시보드 개요).
 *
 * <p>모든 상태가 항상 포함되며, 해당 레코드가 없으면 0입니다.</p>
 *
 * @param counts 상태별 레코드 수 (불변)
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public record StateSummary(Map<WorkflowState, Long> counts) {

    /**
     * Compact Constructor.
     *
     * <p>누락된 상태는 0으로 채우고 불변 맵으로 복사합니다.</p>
     */
    public StateSummary {
        if (counts == null) {
            throw new IllegalArgumentException("counts cannot be null");
        }
        Map<WorkflowState, Long> filled = new EnumMap<>(WorkflowState.class);
        for (WorkflowState state : WorkflowState.values()) {
            Long count = counts.get(state);
            if (count != null && count < 0) {
                throw new IllegalArgumentException("count for " + state + " must be non-negative (current: " + count + ")");
            }
            filled.put(state, count == null ? 0L : count);
        }
        counts = Collections.unmodifiableMap(filled);
    }

    /**
     * 현재 상태 목록으로 집계.
     *
     * @param states 레코드별 현재 상태
     * @return 집계 결과
     */
    public static StateSummary of(Collection<WorkflowState> states) {
        if (states == null) {
            throw new IllegalArgumentException("states cannot be null");
        }
        Map<WorkflowState, Long> counts = new EnumMap<>(WorkflowState.class);
        for (WorkflowState state : states) {
            if (state == null) {
                throw new IllegalArgumentException("states cannot contain null");
            }
            counts.merge(state, 1L, Long::sum);
        }
        return new StateSummary(counts);
    }

    /**
     * 특정 상태의 레코드 수.
     *
     * @param state 상태
     * @return 레코드 수
     * @throws IllegalArgumentException state가 null인 경우
     */
    public long countOf(WorkflowState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return counts.get(state);
    }

    /**
     * 전체 레코드 수.
     *
     * @return 합계
     */
    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }
}
