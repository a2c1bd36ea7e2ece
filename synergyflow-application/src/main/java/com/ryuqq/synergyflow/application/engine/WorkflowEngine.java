package com.ryuqq.synergyflow.application.engine;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.projection.StateSummary;
import com.ryuqq.synergyflow.core.transition.CurrentState;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;

import java.util.Collection;
import java.util.List;

/**
 * 승인 워크플로우 엔진.
 *
 * <p>레코드의 상태 변경 요청을 검증하고, 전이 로그에 원자적으로 추가합니다.
 * 현재 상태는 별도 컬럼 없이 가장 최근 전이로부터 계산됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkflowStatus status = engine.status(recordId);
 *
 * TransitionRequest request = TransitionRequest.of(recordId, WorkflowAction.APPROVE, actor, "looks good")
 *     .expecting(status.currentState());
 *
 * try {
 *     WorkflowTransition committed = engine.apply(request);
 * } catch (ConcurrentTransitionException e) {
 *     // 다른 사용자가 먼저 변경함: 새로고침 후 재시도
 * }
 * </pre>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public interface WorkflowEngine {

    /**
     * 상태 변경 요청 적용.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>최근 전이 조회 (없으면 draft, sequence 0)</li>
     *   <li>expectedCurrentState가 있고 관측 상태와 다르면 즉시 실패</li>
     *   <li>상태 머신으로 (상태, 동작) 검증</li>
     *   <li>sequence = 관측 sequence + 1로 조건부 추가</li>
     *   <li>sequence 충돌 시 1번부터 재시도 (한도 초과 시 실패)</li>
     * </ol>
     *
     * @param request 상태 변경 요청
     * @return 커밋된 전이
     * @throws IllegalArgumentException request가 null인 경우
     * @throws com.ryuqq.synergyflow.core.exception.InvalidTransitionException 허용되지 않는 동작인 경우
     * @throws com.ryuqq.synergyflow.core.exception.ConcurrentTransitionException 동시 수정이 감지된 경우
     * @throws com.ryuqq.synergyflow.core.exception.StoreUnavailableException 저장소 장애
     */
    WorkflowTransition apply(TransitionRequest request);

    /**
     * 현재 상태 조회.
     *
     * @param recordId 레코드 ID
     * @return 현재 상태와 최근 sequence (이력이 없으면 draft, 0)
     */
    CurrentState currentState(RecordId recordId);

    /**
     * 전체 전이 이력 (sequence 오름차순).
     *
     * @param recordId 레코드 ID
     * @return 불변 이력 목록 (없으면 빈 목록)
     */
    List<WorkflowTransition> history(RecordId recordId);

    /**
     * 특정 sequence의 전이 조회.
     *
     * @param recordId 레코드 ID
     * @param sequence 전이 sequence (1부터)
     * @return 전이
     * @throws com.ryuqq.synergyflow.core.exception.TransitionNotFoundException 해당 전이가 없는 경우
     */
    WorkflowTransition transitionAt(RecordId recordId, long sequence);

    /**
     * 화면 표시용 상태 (현재 상태, 단계별 상태, 가능한 동작).
     *
     * @param recordId 레코드 ID
     * @return 워크플로우 상태
     */
    WorkflowStatus status(RecordId recordId);

    /**
     * 여러 레코드의 현재 상태별 개수.
     *
     * @param recordIds 레코드 ID 목록 (중복은 한 번만 집계)
     * @return 상태별 집계
     */
    StateSummary summarize(Collection<RecordId> recordIds);
}
