package org.loesak.pgmigrate.core.postgres;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.pgmigrate.core.concurrent.PostgresAdvisoryLock;
import org.loesak.pgmigrate.core.exception.LedgerConflictException;
import org.loesak.pgmigrate.core.exception.QueryException;
import org.loesak.pgmigrate.core.postgres.records.ExecutedMigration;

import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and appends the persistent record of applied migrations. Every operation goes through the given
 * connection, so reads made while a transaction is active see that transaction's writes.
 */
@Slf4j
public class MigrationLedger {

    static final String SQL_STATE_UNIQUE_VIOLATION = "23505";
    static final String SQL_STATE_DUPLICATE_SCHEMA = "42P06";
    static final String SQL_STATE_DUPLICATE_TABLE = "42P07";

    private final DatabaseConnection connection;
    private final MigrationTableConfiguration tableConfiguration;

    public MigrationLedger(@NonNull final DatabaseConnection connection, @NonNull final MigrationTableConfiguration tableConfiguration) {
        this.connection = connection;
        this.tableConfiguration = tableConfiguration;
    }

    public MigrationTableConfiguration getTableConfiguration() {
        return this.tableConfiguration;
    }

    /**
     * Creates the ledger schema and table when missing. Safe to call repeatedly and from concurrent processes.
     */
    public void ensureSchema() {
        final String table = this.tableConfiguration.getFullyQualifiedTableName();

        try {
            if (this.ledgerTableExists()) {
                log.debug("Migration ledger [{}] already exists", table);
                return;
            }

            log.info("Creating migration ledger [{}]", table);

            this.createIfNotExists(String.format("CREATE SCHEMA IF NOT EXISTS %s", this.tableConfiguration.getQuotedSchema()));
            this.createIfNotExists(String.format("""
                    CREATE TABLE IF NOT EXISTS %s (
                       identifier  BIGINT      NOT NULL,
                       name        TEXT        NOT NULL,
                       executed_at TIMESTAMPTZ NOT NULL,
                       PRIMARY KEY (identifier)
                    )
                    """, table));

            log.info("Migration ledger [{}] created", table);
        } catch (Exception e) {
            log.error("Failed to create migration ledger [{}]", table, e);
            throw e;
        }
    }

    public boolean ledgerTableExists() {
        try {
            return this.connection.tableExists(this.tableConfiguration.getSchema(), this.tableConfiguration.getTable());
        } catch (Exception e) {
            log.error("Failed to check if migration ledger [{}] exists", this.tableConfiguration.getFullyQualifiedTableName(), e);
            throw e;
        }
    }

    public Set<Long> getAppliedIdentifiers() {
        try {
            final List<Long> identifiers = this.connection.query(
                    String.format("SELECT identifier FROM %s ORDER BY identifier", this.tableConfiguration.getFullyQualifiedTableName()),
                    Map.of(),
                    (rs, ctx) -> rs.getLong("identifier"));

            log.info("Found [{}] applied migrations", identifiers.size());

            return Collections.unmodifiableSet(new LinkedHashSet<>(identifiers));
        } catch (Exception e) {
            log.error("Failed to read applied migration identifiers", e);
            throw e;
        }
    }

    public List<ExecutedMigration> getExecutedMigrations() {
        try {
            return this.connection.query(
                    String.format("""
                            SELECT
                               identifier,
                               name,
                               executed_at
                            FROM %s
                            ORDER BY identifier
                            """, this.tableConfiguration.getFullyQualifiedTableName()),
                    Map.of(),
                    (rs, ctx) -> new ExecutedMigration(
                            rs.getLong("identifier"),
                            rs.getString("name"),
                            rs.getObject("executed_at", OffsetDateTime.class).toInstant()));
        } catch (Exception e) {
            log.error("Failed to read executed migrations", e);
            throw e;
        }
    }

    public long countExecutedMigrations() {
        return this.connection.executeScalar(
                String.format("SELECT COUNT(*) FROM %s", this.tableConfiguration.getFullyQualifiedTableName()),
                Long.class);
    }

    /**
     * Blocks until this transaction holds the advisory lock for the ledger's location. The lock is released when the
     * transaction ends. Uses the key of {@link PostgresAdvisoryLock#keyFor(MigrationTableConfiguration)}, so it
     * also waits for a batch lock held by another process.
     */
    public void lockForTransaction() {
        if (!this.connection.isInTransaction()) {
            throw new IllegalStateException("a transaction scoped lock requires an active transaction");
        }

        final long key = PostgresAdvisoryLock.keyFor(this.tableConfiguration);
        log.debug("Acquiring transaction lock [{}] on migration ledger [{}]", key, this.tableConfiguration.getFullyQualifiedTableName());

        this.connection.query(
                "SELECT true FROM (SELECT pg_advisory_xact_lock(:key)) AS acquired",
                Map.of("key", key),
                (rs, ctx) -> Boolean.TRUE);
    }

    /**
     * Appends a ledger entry.
     *
     * @throws LedgerConflictException when an entry with the same identifier already exists
     */
    public void recordExecution(final long identifier, @NonNull final String name, @NonNull final Instant executedAt) {
        try {
            log.info("Recording execution of migration [{}] ([{}])", identifier, name);

            this.connection.execute(
                    String.format(
                            "INSERT INTO %s (identifier, name, executed_at) VALUES (:identifier, :name, :executedAt)",
                            this.tableConfiguration.getFullyQualifiedTableName()),
                    Map.of(
                            "identifier", identifier,
                            "name", name,
                            "executedAt", executedAt));
        } catch (QueryException e) {
            if (hasSqlState(e, SQL_STATE_UNIQUE_VIOLATION)) {
                log.info("Migration [{}] has already been recorded by another process", identifier);
                throw new LedgerConflictException(identifier, e);
            }

            log.error("Failed to record execution of migration [{}]", identifier, e);
            throw e;
        }
    }

    private void createIfNotExists(final String sql) {
        try {
            this.connection.execute(sql);
        } catch (QueryException e) {
            // concurrent CREATE ... IF NOT EXISTS can still collide on the catalog
            if (!hasSqlState(e, SQL_STATE_UNIQUE_VIOLATION, SQL_STATE_DUPLICATE_SCHEMA, SQL_STATE_DUPLICATE_TABLE)) {
                throw e;
            }

            log.info("Object was created concurrently by another process while executing [{}]", sql.strip());
        }
    }

    static boolean hasSqlState(final Throwable throwable, final String... sqlStates) {
        for (Throwable current = throwable; current != null; current = current.getCause()) {
            if (current instanceof SQLException sqlException) {
                for (String sqlState : sqlStates) {
                    if (sqlState.equals(sqlException.getSQLState())) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
