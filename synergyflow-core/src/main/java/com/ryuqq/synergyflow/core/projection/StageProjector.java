package com.ryuqq.synergyflow.core.projection;

import com.ryuqq.synergyflow.core.statemachine.WorkflowState;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 현재 상태로부터 파이프라인 단계별 표시 상태를 계산.
 *
 * <p>현재 상태만으로 계산되는 순수 함수입니다. 전이 메타데이터를 사용하지 않으므로,
 * 이력이 없는 레코드와 여러 번 반려·재제출된 레코드라도 현재 상태가 같으면 결과가 같습니다.</p>
 *
 * <p><strong>알고리즘 (단계마다):</strong></p>
 * <ol>
 *   <li>현재 상태가 REJECTED: DRAFT는 COMPLETE, 나머지는 REJECTED</li>
 *   <li>현재 상태 == 단계: ACTIVE</li>
 *   <li>index(단계) &lt; index(현재 상태): COMPLETE, 아니면 PENDING
 *       (현재 상태가 파이프라인에 없으면 DRAFT의 위치를 사용)</li>
 * </ol>
 *
 * <p><strong>예시 (기본 파이프라인):</strong></p>
 * <pre>
 * REVIEW   → draft=complete, review=active,   approved=pending,  realized=pending
 * REJECTED → draft=complete, review=rejected, approved=rejected, realized=rejected
 * </pre>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public final class StageProjector {

    /**
     * 화면에 표시하는 기본 파이프라인. REJECTED는 선형 파이프라인에서 제외하고 별도로 표시합니다.
     */
    public static final List<WorkflowState> DEFAULT_PIPELINE = List.of(
        WorkflowState.DRAFT,
        WorkflowState.REVIEW,
        WorkflowState.APPROVED,
        WorkflowState.REALIZED
    );

    private StageProjector() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기본 파이프라인으로 계산.
     *
     * @param current 현재 상태
     * @return 파이프라인 순서를 유지하는 불변 맵
     * @throws IllegalArgumentException current가 null인 경우
     */
    public static Map<WorkflowState, StageStatus> project(WorkflowState current) {
        return project(current, DEFAULT_PIPELINE);
    }

    /**
     * 지정한 파이프라인으로 계산.
     *
     * <p>REJECTED가 아닌 현재 상태가 pipeline에 없으면 DRAFT의 위치를 현재 위치로 보고 계산합니다.
     * DRAFT도 없으면 첫 단계 위치를 사용하므로, 이 경우 모든 단계가 PENDING입니다.</p>
     *
     * @param current 현재 상태
     * @param pipeline 순서가 있는 단계 목록 (비어 있거나 null·중복 포함 불가)
     * @return 파이프라인 순서를 유지하는 불변 맵
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public static Map<WorkflowState, StageStatus> project(WorkflowState current, List<WorkflowState> pipeline) {
        if (current == null) {
            throw new IllegalArgumentException("current state cannot be null");
        }
        validatePipeline(pipeline);

        int currentIndex = pipeline.indexOf(current);
        if (currentIndex < 0) {
            currentIndex = Math.max(pipeline.indexOf(WorkflowState.DRAFT), 0);
        }

        Map<WorkflowState, StageStatus> stages = new LinkedHashMap<>();
        for (int index = 0; index < pipeline.size(); index++) {
            WorkflowState stage = pipeline.get(index);
            stages.put(stage, statusOf(stage, index, current, currentIndex));
        }
        return Collections.unmodifiableMap(stages);
    }

    private static StageStatus statusOf(WorkflowState stage, int stageIndex, WorkflowState current, int currentIndex) {
        if (current == WorkflowState.REJECTED) {
            // 반려된 레코드도 draft는 지나왔음
            return stage == WorkflowState.DRAFT ? StageStatus.COMPLETE : StageStatus.REJECTED;
        }
        if (current == stage) {
            return StageStatus.ACTIVE;
        }
        return stageIndex < currentIndex ? StageStatus.COMPLETE : StageStatus.PENDING;
    }

    private static void validatePipeline(List<WorkflowState> pipeline) {
        if (pipeline == null || pipeline.isEmpty()) {
            throw new IllegalArgumentException("pipeline cannot be null or empty");
        }
        Set<WorkflowState> seen = EnumSet.noneOf(WorkflowState.class);
        for (WorkflowState stage : pipeline) {
            if (stage == null) {
                throw new IllegalArgumentException("pipeline cannot contain null stages: " + pipeline);
            }
            if (!seen.add(stage)) {
                throw new IllegalArgumentException("pipeline contains duplicate stage " + stage + ": " + pipeline);
            }
        }
    }
}
