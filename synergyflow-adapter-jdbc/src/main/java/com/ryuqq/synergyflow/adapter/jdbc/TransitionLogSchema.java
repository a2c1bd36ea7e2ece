package com.ryuqq.synergyflow.adapter.jdbc;

import com.ryuqq.synergyflow.core.exception.StoreUnavailableException;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Creates and upgrades the transition log schema with Flyway.
 *
 * <p>Migrations live in {@code classpath:db/migration} and target the {@code synergyflow} schema.</p>
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
public final class TransitionLogSchema {

    /** Schema that holds the transition log. */
    public static final String SCHEMA = "synergyflow";

    private static final Logger log = LoggerFactory.getLogger(TransitionLogSchema.class);

    private TransitionLogSchema() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Applies pending migrations.
     *
     * @param dataSource target database
     * @return number of migrations applied by this call
     * @throws StoreUnavailableException if migration fails
     */
    public static int migrate(DataSource dataSource) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource cannot be null");
        }
        try {
            MigrateResult result = Flyway.configure()
                .dataSource(dataSource)
                .schemas(SCHEMA)
                .locations("classpath:db/migration")
                .load()
                .migrate();
            log.info("Transition log schema at version {} ({} migration(s) applied)",
                result.targetSchemaVersion, result.migrationsExecuted);
            return result.migrationsExecuted;
        } catch (FlywayException e) {
            throw new StoreUnavailableException("failed to migrate transition log schema", e);
        }
    }
}
