package com.ryuqq.synergyflow.adapter.jdbc;

import com.ryuqq.synergyflow.core.model.Actor;
import com.ryuqq.synergyflow.core.model.RecordId;
import com.ryuqq.synergyflow.core.spi.AppendResult;
import com.ryuqq.synergyflow.core.spi.TransitionLogStore;
import com.ryuqq.synergyflow.core.statemachine.WorkflowAction;
import com.ryuqq.synergyflow.core.statemachine.WorkflowState;
import com.ryuqq.synergyflow.core.transition.TransitionDraft;
import com.ryuqq.synergyflow.core.transition.WorkflowTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed transition log.
 *
 * <p>Rows live in {@code synergyflow.workflow_transitions}, keyed by {@code (record_id, sequence)}.
 * The append is a single statement: the row is inserted only when the record's latest sequence
 * equals the draft's expected sequence, and the unique key turns a lost race into
 * {@code DO NOTHING}. No explicit transaction or lock is taken.</p>
 *
 * <p><strong>Preconditions:</strong> {@link TransitionLogSchema#migrate(DataSource)} has run.</p>
 *
 * <p>Thread-safe. Each call acquires its own connection from the given {@link DataSource}.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public class JdbcTransitionLogStore implements TransitionLogStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransitionLogStore.class);

    private static final String SQL_FIND_LATEST = """
        SELECT id, record_id, from_state, to_state, action, actor_id, actor_label, comment, sequence, created_at
        FROM synergyflow.workflow_transitions
        WHERE record_id = ?
        ORDER BY sequence DESC
        LIMIT 1
        """;

    private static final String SQL_FIND_ALL = """
        SELECT id, record_id, from_state, to_state, action, actor_id, actor_label, comment, sequence, created_at
        FROM synergyflow.workflow_transitions
        WHERE record_id = ?
        ORDER BY sequence
        """;

    private static final String SQL_FIND_BY_SEQUENCE = """
        SELECT id, record_id, from_state, to_state, action, actor_id, actor_label, comment, sequence, created_at
        FROM synergyflow.workflow_transitions
        WHERE record_id = ? AND sequence = ?
        """;

    private static final String SQL_LATEST_SEQUENCE = """
        SELECT COALESCE(MAX(sequence), 0)
        FROM synergyflow.workflow_transitions
        WHERE record_id = ?
        """;

    // inserts only if the latest sequence still matches; the unique key settles races
    private static final String SQL_APPEND = """
        INSERT INTO synergyflow.workflow_transitions
            (record_id, from_state, to_state, action, actor_id, actor_label, comment, sequence, created_at)
        SELECT CAST(? AS VARCHAR), CAST(? AS VARCHAR), CAST(? AS VARCHAR), CAST(? AS VARCHAR),
               CAST(? AS VARCHAR), CAST(? AS VARCHAR), CAST(? AS TEXT), CAST(? AS BIGINT),
               CAST(? AS TIMESTAMPTZ)
        WHERE (SELECT COALESCE(MAX(sequence), 0)
               FROM synergyflow.workflow_transitions
               WHERE record_id = ?) = ?
        ON CONFLICT (record_id, sequence) DO NOTHING
        RETURNING id
        """;

    private final JdbcSupport jdbc;
    private final Clock clock;

    /**
     * Creates a store using the system UTC clock.
     *
     * @param dataSource JDBC connection source
     * @throws IllegalArgumentException if dataSource is null
     */
    public JdbcTransitionLogStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    /**
     * Creates a store.
     *
     * @param dataSource JDBC connection source
     * @param clock clock used for commit timestamps
     * @throws IllegalArgumentException if any argument is null
     */
    public JdbcTransitionLogStore(DataSource dataSource, Clock clock) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.jdbc = new JdbcSupport(dataSource);
        this.clock = clock;
    }

    @Override
    public Optional<WorkflowTransition> findLatest(RecordId recordId) {
        requireRecordId(recordId);
        return jdbc.queryOne(SQL_FIND_LATEST,
            ps -> ps.setString(1, recordId.getValue()),
            JdbcTransitionLogStore::mapTransition,
            recordId, "failed to read latest transition of " + recordId.getValue());
    }

    @Override
    public List<WorkflowTransition> findAll(RecordId recordId) {
        requireRecordId(recordId);
        return List.copyOf(jdbc.queryList(SQL_FIND_ALL,
            ps -> ps.setString(1, recordId.getValue()),
            JdbcTransitionLogStore::mapTransition,
            recordId, "failed to read transitions of " + recordId.getValue()));
    }

    @Override
    public Optional<WorkflowTransition> findBySequence(RecordId recordId, long sequence) {
        requireRecordId(recordId);
        return jdbc.queryOne(SQL_FIND_BY_SEQUENCE,
            ps -> {
                ps.setString(1, recordId.getValue());
                ps.setLong(2, sequence);
            },
            JdbcTransitionLogStore::mapTransition,
            recordId, "failed to read transition #" + sequence + " of " + recordId.getValue());
    }

    @Override
    public AppendResult appendIfSequenceMatches(TransitionDraft draft) {
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }

        RecordId recordId = draft.recordId();
        // PostgreSQL keeps microseconds; truncate so the returned value equals the stored one
        Instant createdAt = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);

        Optional<Long> id = jdbc.queryOne(SQL_APPEND,
            ps -> {
                ps.setString(1, recordId.getValue());
                ps.setString(2, draft.fromState().wireValue());
                ps.setString(3, draft.toState().wireValue());
                ps.setString(4, draft.action().wireValue());
                ps.setString(5, draft.actor().id());
                ps.setString(6, draft.actor().label());
                if (draft.comment() == null) {
                    ps.setNull(7, Types.VARCHAR);
                } else {
                    ps.setString(7, draft.comment());
                }
                ps.setLong(8, draft.sequence());
                ps.setObject(9, OffsetDateTime.ofInstant(createdAt, ZoneOffset.UTC));
                ps.setString(10, recordId.getValue());
                ps.setLong(11, draft.expectedLatestSequence());
            },
            rs -> rs.getLong(1),
            recordId, "failed to append transition #" + draft.sequence() + " of " + recordId.getValue());

        if (id.isPresent()) {
            return new AppendResult.Appended(draft.commit(id.get(), createdAt));
        }

        long latest = latestSequence(recordId);
        log.debug("Append of {} #{} lost to latest #{}", recordId, draft.sequence(), latest);
        return new AppendResult.SequenceConflict(recordId, draft.sequence(), latest);
    }

    private long latestSequence(RecordId recordId) {
        return jdbc.queryOne(SQL_LATEST_SEQUENCE,
                ps -> ps.setString(1, recordId.getValue()),
                rs -> rs.getLong(1),
                recordId, "failed to read latest sequence of " + recordId.getValue())
            .orElse(0L);
    }

    private static WorkflowTransition mapTransition(ResultSet rs) throws SQLException {
        return new WorkflowTransition(
            rs.getLong("id"),
            RecordId.of(rs.getString("record_id")),
            WorkflowState.fromWireValue(rs.getString("from_state")),
            WorkflowState.fromWireValue(rs.getString("to_state")),
            WorkflowAction.fromWireValue(rs.getString("action")),
            Actor.of(rs.getString("actor_id"), rs.getString("actor_label")),
            rs.getString("comment"),
            rs.getLong("sequence"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant()
        );
    }

    private static void requireRecordId(RecordId recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("recordId cannot be null");
        }
    }
}
