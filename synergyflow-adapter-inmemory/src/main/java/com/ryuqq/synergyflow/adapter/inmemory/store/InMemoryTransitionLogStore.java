package com.ryuqq.synergyflow.adapter.inmemory.store;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.spi.AppendResult;
import com.ryuqq.synergyflow.core.spi.TransitionLogStore;
import com.ryuqq.synergyflow.core.transition.TransitionDraft;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of TransitionLogStore.
 *
 * <p>Each record's log is held as an immutable list. An append replaces the list inside
 * {@link ConcurrentHashMap#compute}, so the sequence check and the write happen atomically
 * per record while different records never contend.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No durability (state is lost on restart)</li>
 *   <li>Single JVM only</li>
 *   <li>Suitable for tests, demos and embedded use, not for shared deployments</li>
 * </ul>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public class InMemoryTransitionLogStore implements TransitionLogStore {

    private final ConcurrentHashMap<RecordId, List<WorkflowTransition>> logs;
    private final AtomicLong idSequence;
    private final Clock clock;

    /**
     * Creates an empty store using the system UTC clock.
     */
    public InMemoryTransitionLogStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates an empty store.
     *
     * @param clock clock used for commit timestamps
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryTransitionLogStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.logs = new ConcurrentHashMap<>();
        this.idSequence = new AtomicLong();
        this.clock = clock;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<WorkflowTransition> findLatest(RecordId recordId) {
        List<WorkflowTransition> log = logOf(recordId);
        return log.isEmpty() ? Optional.empty() : Optional.of(log.get(log.size() - 1));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<WorkflowTransition> findAll(RecordId recordId) {
        return logOf(recordId);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<WorkflowTransition> findBySequence(RecordId recordId, long sequence) {
        List<WorkflowTransition> log = logOf(recordId);
        // sequence n is stored at index n-1
        if (sequence < 1 || sequence > log.size()) {
            return Optional.empty();
        }
        return Optional.of(log.get((int) (sequence - 1)));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public AppendResult appendIfSequenceMatches(TransitionDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }

        AppendResult[] result = new AppendResult[1];
        logs.compute(draft.recordId(), (recordId, current) -> {
            List<WorkflowTransition> log = current == null ? List.of() : current;
            long latestSequence = log.size();
            if (latestSequence != draft.expectedLatestSequence()) {
                result[0] = new AppendResult.SequenceConflict(recordId, draft.sequence(), latestSequence);
                return current;
            }

            WorkflowTransition committed = draft.commit(idSequence.incrementAndGet(), Instant.now(clock));
            List<WorkflowTransition> appended = new ArrayList<>(log.size() + 1);
            appended.addAll(log);
            appended.add(committed);
            result[0] = new AppendResult.Appended(committed);
            return Collections.unmodifiableList(appended);
        });
        return result[0];
    }

    /**
     * Number of records with at least one transition.
     *
     * @return record count
     */
    public int recordCount() {
        return logs.size();
    }

    /**
     * Clears all logs. Intended for test isolation only.
     */
    public void clear() {
        logs.clear();
    }

    private List<WorkflowTransition> logOf(RecordId recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
        return logs.getOrDefault(recordId, List.of());
    }
}
