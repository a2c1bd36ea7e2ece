package com.ryuqq.synergyflow.adapter.runner;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.spi.TransitionLogStore;
import com.ryuqq.synergyflow.core.statemachine.StateMachine;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 전이 체인 감사 컴포넌트.
 *
 * <p>저장된 로그를 다시 읽어 엔진이 보장해야 하는 불변식을 검증합니다.
 * 운영자용 읽기 전용 도구이며, 로그는 불변이므로 위반을 수정하지 않습니다.</p>
 *
 * <p><strong>검증 항목:</strong></p>
 * <ol>
 *   <li>sequence가 1부터 빈틈없이 증가</li>
 *   <li>첫 전이의 fromState는 draft</li>
 *   <li>fromState[n] == toState[n-1]</li>
 *   <li>모든 (fromState, action) → toState가 상태 머신과 일치</li>
 * </ol>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public final class TransitionChainAuditor {

    private static final Logger log = LoggerFactory.getLogger(TransitionChainAuditor.class);
    private final TransitionLogStore store;

    /**
     * 생성자.
     *
     * @param store 전이 로그 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public TransitionChainAuditor(TransitionLogStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
    }

    /**
     * 레코드 하나의 체인 감사.
     *
     * @param recordId 레코드 ID
     * @return 감사 결과
     * @throws com.ryuqq.synergyflow.core.exception.StoreUnavailableException 저장소 장애
     */
    public ChainAuditReport audit(RecordId recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }

        List<WorkflowTransition> history = store.findAll(recordId);
        List<ChainAuditReport.Violation> violations = new ArrayList<>();
        WorkflowState previous = WorkflowState.initial();
        long expectedSequence = 1;

        for (WorkflowTransition transition : history) {
            if (transition.sequence() != expectedSequence) {
                violations.add(new ChainAuditReport.Violation(transition.sequence(),
                    ChainAuditReport.Kind.SEQUENCE_GAP,
                    "expected sequence " + expectedSequence + " but found " + transition.sequence()));
            }
            if (transition.fromState() != previous) {
                violations.add(new ChainAuditReport.Violation(transition.sequence(),
                    ChainAuditReport.Kind.BROKEN_CHAIN,
                    "from state " + transition.fromState() + " does not follow " + previous));
            }
            Optional<WorkflowState> legal = StateMachine.nextState(transition.fromState(), transition.action());
            if (legal.isEmpty() || legal.get() != transition.toState()) {
                violations.add(new ChainAuditReport.Violation(transition.sequence(),
                    ChainAuditReport.Kind.ILLEGAL_EDGE,
                    transition.fromState() + " --" + transition.action() + "--> " + transition.toState()
                        + " is not a legal transition"));
            }
            previous = transition.toState();
            expectedSequence = transition.sequence() + 1;
        }

        ChainAuditReport report = new ChainAuditReport(recordId, history.size(), violations);
        if (!report.isIntact()) {
            log.warn("Transition chain of {} has {} violation(s): {}", recordId, violations.size(), violations);
        }
        return report;
    }

    /**
     * 여러 레코드 감사.
     *
     * <p>조회에 실패한 레코드는 로그를 남기고 건너뜁니다.</p>
     *
     * @param recordIds 레코드 ID 목록
     * @return 감사에 성공한 레코드의 결과 (입력 순서)
     */
    public List<ChainAuditReport> auditAll(Collection<RecordId> recordIds) {
        if (recordIds == null) {
            throw new IllegalArgumentException("recordIds cannot be null");
        }

        log.info("Chain audit started for {} record(s)", recordIds.size());
        List<ChainAuditReport> reports = new ArrayList<>(recordIds.size());
        int broken = 0;
        for (RecordId recordId : recordIds) {
            try {
                ChainAuditReport report = audit(recordId);
                reports.add(report);
                if (!report.isIntact()) {
                    broken++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to audit transition chain of {}", recordId, e);
            }
        }
        log.info("Chain audit completed: {} broken out of {} audited", broken, reports.size());
        return reports;
    }
}
