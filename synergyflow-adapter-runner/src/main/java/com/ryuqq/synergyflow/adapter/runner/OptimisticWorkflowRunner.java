package com.ryuqq.synergyflow.adapter.runner;

import com.ryuqq.synergyflow.application.engine.TransitionRequest;
import com.ryuqq.synergyflow.application.engine.WorkflowEngine;
import com.ryuqq.synergyflow.application.engine.WorkflowStatus;
import com.ryuqq.synergyflow.core.exception.ConcurrentTransitionException;
import com.ryuqq.synergyflow.core.exception.TransitionNotFoundException;
import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.projection.StateSummary;
import com.ryuqq.synergyflow.core.spi.AppendResult;
import com.ryuqq.synergyflow.core.spi.TransitionLogStore;
import com.ryuqq.synergyflow.core.statemachine.StateMachine;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import com.ryuqq.synergyflow.core.transition.CurrentState;
import com.ryuqq.synergyflow.core.transition.TransitionDraft;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 낙관적 동시성 기반 워크플로우 엔진.
 *
 * <p>잠금 없이 "읽기 → 검증 → 조건부 추가"를 수행하고, 다른 작성자가 먼저 추가해
 * sequence가 충돌하면 처음부터 다시 시도합니다.</p>
 *
 * <p><strong>실패 처리:</strong></p>
 * <ul>
 *   <li>InvalidTransitionException: 즉시 전파 (재시도 없음)</li>
 *   <li>기대 상태 불일치: 즉시 ConcurrentTransitionException</li>
 *   <li>sequence 충돌: Backoff 후 재시도, 한도 초과 시 ConcurrentTransitionException</li>
 *   <li>StoreUnavailableException: 그대로 전파 (재시도는 호출자 정책)</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> 상태를 갖지 않으므로 여러 스레드가 공유해도 안전합니다.
 * 원자성은 {@link TransitionLogStore#appendIfSequenceMatches}가 보장합니다.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public final class OptimisticWorkflowRunner implements WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(OptimisticWorkflowRunner.class);

    private final TransitionLogStore store;
    private final EngineConfig config;
    private final BackoffCalculator backoff;

    /**
     * 기본 설정으로 생성.
     *
     * @param store 전이 로그 저장소
     * @throws IllegalArgumentException store가 null인 경우
     */
    public OptimisticWorkflowRunner(TransitionLogStore store) {
        this(store, new EngineConfig());
    }

    /**
     * 생성자.
     *
     * @param store 전이 로그 저장소
     * @param config 엔진 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OptimisticWorkflowRunner(TransitionLogStore store, EngineConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.config = config;
        this.backoff = config.backoff();
    }

    @Override
    public WorkflowTransition apply(TransitionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        RecordId recordId = request.recordId();
        int attempt = 0;
        while (true) {
            attempt++;
            CurrentState observed = currentState(recordId);
            checkExpectation(request, observed);

            WorkflowState next = StateMachine.transition(recordId, observed.state(), request.action());
            TransitionDraft draft = TransitionDraft.following(
                observed, next, request.action(), request.actor(), request.comment());

            AppendResult result = store.appendIfSequenceMatches(draft);
            if (result instanceof AppendResult.Appended appended) {
                WorkflowTransition committed = appended.transition();
                log.info("Committed {} #{}: {} → {} by {}",
                    recordId, committed.sequence(), committed.fromState(), committed.toState(), committed.actorId());
                return committed;
            }

            AppendResult.SequenceConflict conflict = (AppendResult.SequenceConflict) result;
            if (attempt > config.maxConflictRetries()) {
                log.warn("Giving up on {} {} after {} attempts (latest sequence: {})",
                    recordId, request.action(), attempt, conflict.latestSequence());
                throw ConcurrentTransitionException.retriesExhausted(
                    recordId, request.expectedCurrentState(), observed.state(), request.action(), attempt);
            }

            long delayMs = backoff.calculate(attempt);
            log.warn("Sequence conflict on {} (attempted #{}, latest #{}), retrying in {}ms",
                recordId, conflict.attemptedSequence(), conflict.latestSequence(), delayMs);
            sleep(delayMs);
        }
    }

    @Override
    public CurrentState currentState(RecordId recordId) {
        requireRecordId(recordId);
        return CurrentState.derive(recordId, store.findLatest(recordId));
    }

    @Override
    public List<WorkflowTransition> history(RecordId recordId) {
        requireRecordId(recordId);
        return List.copyOf(store.findAll(recordId));
    }

    @Override
    public WorkflowTransition transitionAt(RecordId recordId, long sequence) {
        requireRecordId(recordId);
        return store.findBySequence(recordId, sequence)
            .orElseThrow(() -> new TransitionNotFoundException(recordId, sequence));
    }

    @Override
    public WorkflowStatus status(RecordId recordId) {
        return WorkflowStatus.of(currentState(recordId));
    }

    @Override
    public StateSummary summarize(Collection<RecordId> recordIds) {
        if (recordIds == null) {
            throw new IllegalArgumentException("recordIds cannot be null");
        }
        Set<RecordId> distinct = new LinkedHashSet<>(recordIds);
        List<WorkflowState> states = new ArrayList<>(distinct.size());
        for (RecordId recordId : distinct) {
            states.add(currentState(recordId).state());
        }
        return StateSummary.of(states);
    }

    /**
     * 엔진 설정 조회.
     *
     * @return 설정
     */
    public EngineConfig getConfig() {
        return config;
    }

    private void checkExpectation(TransitionRequest request, CurrentState observed) {
        WorkflowState expected = request.expectedCurrentState();
        if (expected != null && expected != observed.state()) {
            throw ConcurrentTransitionException.staleExpectation(
                request.recordId(), expected, observed.state(), request.action());
        }
    }

    private static void requireRecordId(RecordId recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
    }

    private static void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry a conflicting transition", e);
        }
    }
}
