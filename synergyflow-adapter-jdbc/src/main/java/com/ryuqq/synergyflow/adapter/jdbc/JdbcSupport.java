package com.ryuqq.synergyflow.adapter.jdbc;

import com.ryuqq.synergyflow.core.exception.StoreUnavailableException;
import com.ryuqq.synergyflow.core.model.RecordId;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC helper that owns connection handling and SQLException translation.
 *
 * <p>SQL is always a constant; parameters are bound through a {@link StatementPreparer}.
 * Every failure surfaces as {@link StoreUnavailableException}.</p>
 *
 * <p>Thread-safe. Each call acquires and releases its own connection.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
final class JdbcSupport {

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Executes a query returning zero or one mapped row.
     *
     * <p>Also used for {@code INSERT ... RETURNING} statements.</p>
     *
     * @param sql statement
     * @param preparer parameter binder
     * @param mapper row mapper
     * @param recordId record the call is about (for error context)
     * @param errorContext message for {@link StoreUnavailableException}
     * @return mapped row if present
     */
    <T> Optional<T> queryOne(String sql, StatementPreparer preparer, RowMapper<T> mapper,
                             RecordId recordId, String errorContext) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException(errorContext, recordId, e);
        }
    }

    /**
     * Executes a query returning zero or more mapped rows.
     *
     * @param sql statement
     * @param preparer parameter binder
     * @param mapper row mapper
     * @param recordId record the call is about (for error context)
     * @param errorContext message for {@link StoreUnavailableException}
     * @return mapped rows, never null
     */
    <T> List<T> queryList(String sql, StatementPreparer preparer, RowMapper<T> mapper,
                          RecordId recordId, String errorContext) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> results = new ArrayList<>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException(errorContext, recordId, e);
        }
    }

    /**
     * Binds parameters to a {@link PreparedStatement} before execution.
     */
    @FunctionalInterface
    interface StatementPreparer {

        void prepare(PreparedStatement ps) throws SQLException;
    }

    /**
     * Maps the current {@link ResultSet} row to a domain object.
     *
     * @param <T> domain type
     */
    @FunctionalInterface
    interface RowMapper<T> {

        T map(ResultSet rs) throws SQLException;
    }
}
