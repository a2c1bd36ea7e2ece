package com.ryuqq.synergyflow.core.projection;

import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 상태별로 그 상태에 처음 진입한 전이를 찾음.
 *
 * <p>파이프라인 뱃지에 "누가, 언제" 단계를 진행시켰는지 표시하는 데 사용합니다.
 * 단계 상태 계산({@link StageProjector})과 달리 이력을 입력으로 받습니다.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public final class StageMilestones {

    private StageMilestones() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태별 최초 진입 전이.
     *
     * @param history sequence 오름차순 전이 이력
     * @return 진입한 적 있는 상태만 포함하는 불변 맵
     * @throws IllegalArgumentException history가 null인 경우
     */
    public static Map<WorkflowState, WorkflowTransition> firstArrivals(List<WorkflowTransition> history) {
        if (history == null) {
            throw new IllegalArgumentException("history cannot be null");
        }
        Map<WorkflowState, WorkflowTransition> arrivals = new EnumMap<>(WorkflowState.class);
        for (WorkflowTransition transition : history) {
            arrivals.putIfAbsent(transition.toState(), transition);
        }
        return Collections.unmodifiableMap(arrivals);
    }
}
