package org.loesak.pgmigrate.core.postgres;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.HandleCallback;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.loesak.pgmigrate.core.exception.QueryException;

import javax.sql.DataSource;
import java.io.Closeable;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around {@link Jdbi} that tracks at most one open transaction. While a transaction is active every
 * statement runs on its handle, otherwise each statement runs on a short-lived handle in auto-commit mode.
 * <p>
 * Named parameters use the {@code :name} syntax. Instances are not thread-safe.
 */
@Slf4j
public class DatabaseConnection implements Closeable {

    private static final String TABLE_EXISTS_SQL = """
            SELECT EXISTS (
               SELECT table_name
               FROM information_schema.tables
               WHERE table_name = :tableName
               AND table_schema = :schema
            )
            """;

    private final Jdbi jdbi;

    private Handle transaction;

    public DatabaseConnection(@NonNull final String jdbcUrl) {
        this(Jdbi.create(jdbcUrl));
    }

    public DatabaseConnection(@NonNull final String jdbcUrl, final String username, final String password) {
        this(Jdbi.create(jdbcUrl, username, password));
    }

    public DatabaseConnection(@NonNull final DataSource dataSource) {
        this(Jdbi.create(dataSource));
    }

    public DatabaseConnection(@NonNull final Jdbi jdbi) {
        this.jdbi = jdbi;
    }

    public Jdbi getJdbi() {
        return this.jdbi;
    }

    public boolean isInTransaction() {
        return this.transaction != null;
    }

    /**
     * Starts a transaction unless one is already active.
     *
     * @return true when a transaction was started
     */
    public boolean beginTransaction() {
        if (this.transaction != null) {
            return false;
        }

        final Handle handle = this.jdbi.open();
        try {
            handle.begin();
        } catch (RuntimeException e) {
            handle.close();
            throw e;
        }

        this.transaction = handle;
        log.debug("Transaction started");
        return true;
    }

    public void commitTransaction() {
        if (this.transaction == null) {
            throw new IllegalStateException("No transaction active");
        }

        try {
            this.transaction.commit();
            log.debug("Transaction committed");
        } finally {
            this.releaseTransaction();
        }
    }

    public void rollbackTransaction() {
        if (this.transaction == null) {
            throw new IllegalStateException("No transaction active");
        }

        try {
            this.transaction.rollback();
            log.debug("Transaction rolled back");
        } finally {
            this.releaseTransaction();
        }
    }

    /**
     * Runs the work in a transaction which is committed when the work completes and rolled back when it throws. When
     * a transaction is already active the work joins it and the caller stays responsible for ending it.
     */
    public void inTransaction(@NonNull final TransactionalWork work) throws Exception {
        if (!this.beginTransaction()) {
            work.execute(this);
            return;
        }

        try {
            work.execute(this);
            this.commitTransaction();
        } catch (Exception e) {
            this.rollbackAfterFailure(e);
            throw e;
        }
    }

    /**
     * Rolls back the active transaction, if any, after the given failure. A failing rollback is attached to the
     * failure as a suppressed exception.
     */
    public void rollbackAfterFailure(@NonNull final Exception failure) {
        if (this.transaction == null) {
            return;
        }

        try {
            this.rollbackTransaction();
        } catch (Exception rollbackFailure) {
            log.warn("Failed to roll back transaction", rollbackFailure);
            failure.addSuppressed(rollbackFailure);
        }
    }

    public int execute(@NonNull final String sql) {
        return this.execute(sql, Map.of());
    }

    public int execute(@NonNull final String sql, @NonNull final Map<String, ?> parameters) {
        return this.withHandle(sql, handle -> handle.createUpdate(sql).bindMap(parameters).execute());
    }

    public <T> T executeScalar(@NonNull final String sql, @NonNull final Class<T> type) {
        return this.executeScalar(sql, Map.of(), type);
    }

    public <T> T executeScalar(@NonNull final String sql, @NonNull final Map<String, ?> parameters, @NonNull final Class<T> type) {
        return this.withHandle(sql, handle -> handle.createQuery(sql).bindMap(parameters).mapTo(type).one());
    }

    public <T> List<T> query(@NonNull final String sql, @NonNull final Map<String, ?> parameters, @NonNull final RowMapper<T> mapper) {
        return this.withHandle(sql, handle -> handle.createQuery(sql).bindMap(parameters).map(mapper).list());
    }

    /**
     * Executes a script of one or more statements as-is, without parameter parsing.
     */
    public void executeScript(@NonNull final String sql) {
        this.withHandle(sql, handle -> {
            try (Statement statement = handle.getConnection().createStatement()) {
                statement.execute(sql);
            }
            return null;
        });
    }

    public boolean tableExists(@NonNull final String schema, @NonNull final String tableName) {
        return this.executeScalar(TABLE_EXISTS_SQL, Map.of("schema", schema, "tableName", tableName), Boolean.class);
    }

    @Override
    public void close() {
        if (this.transaction != null) {
            log.warn("Closing connection with an active transaction. Rolling it back");
            this.rollbackTransaction();
        }
    }

    private <T> T withHandle(final String sql, final HandleCallback<T, SQLException> callback) {
        log.debug("executing sql [{}]", sql);

        try {
            if (this.transaction != null) {
                return callback.withHandle(this.transaction);
            }
            return this.jdbi.withHandle(callback);
        } catch (JdbiException | SQLException e) {
            throw new QueryException(sql, e);
        }
    }

    private void releaseTransaction() {
        final Handle handle = this.transaction;
        this.transaction = null;

        try {
            if (handle.isInTransaction()) {
                handle.rollback();
            }
        } finally {
            handle.close();
        }
    }
}
