package com.ryuqq.synergyflow.core.spi;

import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.transition.TransitionDraft;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;

import java.util.List;
import java.util.Optional;

/**
 * Append-only persistence SPI for workflow transitions.
 *
 * <p>Transitions are keyed by record and totally ordered by a per-record {@code sequence}
 * that starts at 1. The store never edits or deletes a committed transition.</p>
 *
 * <p><strong>Compare-and-Append:</strong></p>
 * <pre>
 * 1. engine reads findLatest(recordId)            → sequence n (0 when empty)
 * 2. engine builds TransitionDraft(sequence n + 1)
 * 3. appendIfSequenceMatches(draft)
 *      latest == n → commit, return Appended
 *      latest != n → nothing written, return SequenceConflict
 * </pre>
 *
 * <p><strong>Persisted Layout:</strong></p>
 * <pre>
 * workflow_transitions (id, record_id, sequence, from_state, to_state, action,
 *                       actor_id, actor_label, comment, created_at)
 * UNIQUE (record_id, sequence)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomicity: the sequence check and the insert are a single indivisible operation</li>
 *   <li>Visibility: a transition is readable only once its commit is durable</li>
 *   <li>No reuse: sequence values are never reused or renumbered</li>
 *   <li>Thread-safe: all methods may be called concurrently for the same or different records</li>
 *   <li>Failures: infrastructure errors surface as
 *       {@link com.ryuqq.synergyflow.core.exception.StoreUnavailableException}</li>
 * </ul>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public interface TransitionLogStore {

    /**
     * Returns the transition with the highest sequence for the record.
     *
     * @param recordId the record
     * @return the latest transition, or empty when the record has no transitions
     * @throws IllegalArgumentException if recordId is null
     */
    Optional<WorkflowTransition> findLatest(RecordId recordId);

    /**
     * Returns the full transition history of the record.
     *
     * @param recordId the record
     * @return transitions in ascending sequence order (may be empty, never null)
     * @throws IllegalArgumentException if recordId is null
     */
    List<WorkflowTransition> findAll(RecordId recordId);

    /**
     * Returns the transition at the given sequence.
     *
     * @param recordId the record
     * @param sequence the sequence to look up
     * @return the transition, or empty when no such sequence exists
     * @throws IllegalArgumentException if recordId is null
     */
    Optional<WorkflowTransition> findBySequence(RecordId recordId, long sequence);

    /**
     * Commits the draft if and only if the record's latest sequence equals
     * {@code draft.sequence() - 1}.
     *
     * <p>The store assigns {@code id} and {@code createdAt}. On conflict nothing is written.</p>
     *
     * @param draft the candidate transition
     * @return {@link AppendResult.Appended} with the committed transition, or
     *         {@link AppendResult.SequenceConflict} when another writer won the race
     * @throws IllegalArgumentException if draft is null
     */
    AppendResult appendIfSequenceMatches(TransitionDraft draft);
}
