package org.loesak.pgmigrate.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.pgmigrate.core.concurrent.PostgresAdvisoryLock;
import org.loesak.pgmigrate.core.exception.DatabaseException;
import org.loesak.pgmigrate.core.exception.LedgerConflictException;
import org.loesak.pgmigrate.core.exception.MigrationCancelledException;
import org.loesak.pgmigrate.core.exception.MigrationConfigurationException;
import org.loesak.pgmigrate.core.exception.MigrationException;
import org.loesak.pgmigrate.core.exception.MigrationLockException;
import org.loesak.pgmigrate.core.migration.Migration;
import org.loesak.pgmigrate.core.migration.MigrationSource;
import org.loesak.pgmigrate.core.postgres.DatabaseConnection;
import org.loesak.pgmigrate.core.postgres.MigrationLedger;
import org.loesak.pgmigrate.core.postgres.MigrationTableConfiguration;
import org.loesak.pgmigrate.core.postgres.records.ExecutedMigration;
import org.loesak.pgmigrate.core.schema.EmbeddedSchemaDiscovery;
import org.loesak.pgmigrate.core.schema.SchemaFileMigrationInfo;
import org.loesak.pgmigrate.core.schema.SchemaFileParser;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.stream.Collectors;

/**
 * Applies pending migrations in ascending identifier order. Each migration runs in its own transaction together
 * with its ledger entry, so a migration is either applied and recorded or neither.
 * <p>
 * A batch is serialized against other processes by a PostgreSQL advisory lock (unless disabled), and a ledger
 * entry that another process wrote first is treated as that migration having been applied concurrently.
 * Interrupting the migrating thread cancels the batch; the migration in flight is rolled back.
 */
@Slf4j
public class DatabaseMigrator {

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofMinutes(5);

    private final DatabaseConnection connection;
    private final MigrationSource migrationSource;
    private final MigrationLedger ledger;
    private final EmbeddedSchemaDiscovery schemaDiscovery;
    private final Lock batchLock;
    private final Duration lockTimeout;
    private final Clock clock;

    public DatabaseMigrator(final DatabaseConnection connection, final MigrationSource migrationSource) {
        this(connection, MigrationTableConfiguration.DEFAULT, migrationSource);
    }

    public DatabaseMigrator(
            final DatabaseConnection connection,
            final MigrationTableConfiguration tableConfiguration,
            final MigrationSource migrationSource) {
        this(connection, tableConfiguration, migrationSource, null, null, null, null, null, null);
    }

    /**
     * @param tableConfiguration ledger location, {@link MigrationTableConfiguration#DEFAULT} when null
     * @param schemaDiscovery    bundled schema applied to empty databases, none when null
     * @param lockingEnabled     whether batches hold an advisory lock, true when null
     * @param batchLock          lock to hold instead of the advisory lock derived from the ledger location
     * @param lockTimeout        how long to wait for the lock, {@link #DEFAULT_LOCK_TIMEOUT} when null
     * @param ledger             ledger to use instead of one over {@code connection} and {@code tableConfiguration}
     * @param clock              source of ledger timestamps, UTC system clock when null
     */
    @Builder
    private DatabaseMigrator(
            @NonNull final DatabaseConnection connection,
            final MigrationTableConfiguration tableConfiguration,
            @NonNull final MigrationSource migrationSource,
            final EmbeddedSchemaDiscovery schemaDiscovery,
            final Boolean lockingEnabled,
            final Lock batchLock,
            final Duration lockTimeout,
            final MigrationLedger ledger,
            final Clock clock) {
        final MigrationTableConfiguration table = tableConfiguration != null ? tableConfiguration : MigrationTableConfiguration.DEFAULT;

        this.connection = connection;
        this.migrationSource = migrationSource;
        this.ledger = ledger != null ? ledger : new MigrationLedger(connection, table);
        this.schemaDiscovery = schemaDiscovery;
        this.lockTimeout = lockTimeout != null ? lockTimeout : DEFAULT_LOCK_TIMEOUT;
        this.clock = clock != null ? clock : Clock.systemUTC();

        if (Boolean.FALSE.equals(lockingEnabled)) {
            this.batchLock = null;
        } else if (batchLock != null) {
            this.batchLock = batchLock;
        } else {
            this.batchLock = new PostgresAdvisoryLock(connection.getJdbi(), PostgresAdvisoryLock.keyFor(table));
        }
    }

    /**
     * Applies every pending migration.
     *
     * @throws MigrationConfigurationException if the migration set is unusable; nothing has been executed
     * @throws MigrationException              if a migration failed; earlier migrations stay committed
     * @throws MigrationCancelledException     if the thread was interrupted
     * @throws MigrationLockException          if the migration lock could not be acquired
     */
    public MigrationResult migrateToLatest() {
        return this.migrate(null);
    }

    /**
     * Applies every pending migration whose identifier is less than or equal to {@code targetIdentifier}.
     */
    public MigrationResult migrateTo(final long targetIdentifier) {
        return this.migrate(targetIdentifier);
    }

    /**
     * Applies a single migration, outside of the ordered batch, with the same transactional guarantees.
     */
    public MigrationOutcome runSingle(@NonNull final Migration migration) {
        final PlannedMigration planned = plan(migration);

        this.acquireBatchLock();
        try {
            this.ledger.ensureSchema();
            this.ensureNotCancelled(String.format("migration run cancelled before migration [%d] started", planned.identifier()), List.of(planned.identifier()));

            return this.apply(planned, List.of());
        } finally {
            this.releaseBatchLock();
        }
    }

    public List<ExecutedMigration> retrieveAlreadyExecuted() {
        if (!this.ledger.ledgerTableExists()) {
            return List.of();
        }
        return this.ledger.getExecutedMigrations();
    }

    /**
     * @return true when the ledger table does not exist or holds no entries
     */
    public boolean isDatabaseEmpty() {
        return !this.ledger.ledgerTableExists() || this.ledger.countExecutedMigrations() == 0;
    }

    private MigrationResult migrate(final Long targetIdentifier) {
        log.info("Starting migration run{}", targetIdentifier == null ? "" : String.format(" up to [%d]", targetIdentifier));

        final List<PlannedMigration> migrations = this.discoverMigrations();
        this.ensureNotCancelled("migration run cancelled before it started", identifiers(migrations));

        this.acquireBatchLock();
        try {
            final boolean schemaApplied = this.shouldApplySchema(targetIdentifier) && this.applySchema(migrations);
            if (!schemaApplied) {
                this.ledger.ensureSchema();
            }

            final Set<Long> applied = this.ledger.getAppliedIdentifiers();
            final List<PlannedMigration> pending = migrations.stream()
                    .filter(migration -> !applied.contains(migration.identifier()))
                    .filter(migration -> targetIdentifier == null || migration.identifier() <= targetIdentifier)
                    .toList();

            log.info("Found [{}] migrations, [{}] already applied, [{}] pending", migrations.size(), applied.size(), pending.size());

            final MigrationResult result = this.runPending(pending, schemaApplied);

            log.info("Completed migration run. Applied [{}] migrations", result.getAppliedCount());

            return result;
        } finally {
            this.releaseBatchLock();
        }
    }

    private List<PlannedMigration> discoverMigrations() {
        final List<Migration> discovered;
        try {
            discovered = this.migrationSource.discover();
        } catch (MigrationConfigurationException e) {
            log.error("Failed to discover migrations", e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to discover migrations", e);
            throw new MigrationConfigurationException("failed to discover migrations", e);
        }

        final List<PlannedMigration> planned = discovered.stream()
                .map(DatabaseMigrator::plan)
                .sorted(Comparator.comparingLong(PlannedMigration::identifier))
                .toList();

        final Map<Long, List<PlannedMigration>> byIdentifier = planned.stream()
                .collect(Collectors.groupingBy(PlannedMigration::identifier, LinkedHashMap::new, Collectors.toList()));

        byIdentifier.forEach((identifier, group) -> {
            if (group.size() > 1) {
                throw new MigrationConfigurationException(String.format(
                        "migration identifier [%d] is shared by multiple migrations: %s",
                        identifier,
                        group.stream().map(migration -> migration.migration().getClass().getName()).toList()));
            }
        });

        return planned;
    }

    private static PlannedMigration plan(final Migration migration) {
        final long identifier;
        final String name;
        try {
            identifier = migration.getIdentifier();
            name = migration.getName();
        } catch (RuntimeException e) {
            throw new MigrationConfigurationException(
                    String.format("could not determine the identity of migration [%s]", migration.getClass().getName()),
                    e);
        }

        if (name == null || name.isBlank()) {
            throw new MigrationConfigurationException(
                    String.format("migration [%s] with identifier [%d] has no name", migration.getClass().getName(), identifier));
        }

        return new PlannedMigration(identifier, name, migration);
    }

    private MigrationResult runPending(final List<PlannedMigration> pending, final boolean schemaApplied) {
        final List<Long> applied = new ArrayList<>();
        final List<Long> concurrentlyApplied = new ArrayList<>();

        for (int i = 0; i < pending.size(); i++) {
            final PlannedMigration migration = pending.get(i);
            final List<Long> notAttempted = identifiers(pending.subList(i + 1, pending.size()));

            this.ensureNotCancelled(
                    String.format("migration run cancelled before migration [%d] started", migration.identifier()),
                    identifiers(pending.subList(i, pending.size())));

            switch (this.apply(migration, notAttempted)) {
                case APPLIED -> applied.add(migration.identifier());
                case ALREADY_APPLIED -> concurrentlyApplied.add(migration.identifier());
            }
        }

        return new MigrationResult(List.copyOf(applied), List.copyOf(concurrentlyApplied), schemaApplied);
    }

    private MigrationOutcome apply(final PlannedMigration migration, final List<Long> notAttempted) {
        log.info("Applying migration [{}] ([{}])", migration.identifier(), migration.name());

        if (!this.connection.beginTransaction()) {
            throw new IllegalStateException("cannot apply a migration while another transaction is active on the migration connection");
        }

        final Instant start = this.clock.instant();
        try {
            // the ledger row goes first so a concurrent process blocks on it before running the migration itself
            this.ledger.recordExecution(migration.identifier(), migration.name(), this.clock.instant());
            migration.migration().up(this.connection);

            if (Thread.currentThread().isInterrupted()) {
                throw new MigrationCancelledException(
                        String.format("migration run cancelled while applying migration [%d]. Its changes were rolled back", migration.identifier()),
                        notAttempted);
            }

            this.connection.commitTransaction();

            log.info("Migration [{}] applied. Took [{}] milliseconds",
                    migration.identifier(),
                    Duration.between(start, this.clock.instant()).toMillis());

            return MigrationOutcome.APPLIED;
        } catch (LedgerConflictException e) {
            this.connection.rollbackAfterFailure(e);
            log.info("Migration [{}] ([{}]) was applied concurrently by another process. Skipping", migration.identifier(), migration.name());
            return MigrationOutcome.ALREADY_APPLIED;
        } catch (MigrationCancelledException e) {
            this.connection.rollbackAfterFailure(e);
            throw e;
        } catch (InterruptedException e) {
            this.connection.rollbackAfterFailure(e);
            Thread.currentThread().interrupt();
            log.warn("Migration [{}] was interrupted. Its changes were rolled back and [{}] later migrations were not attempted",
                    migration.identifier(), notAttempted.size());
            throw new MigrationCancelledException(
                    String.format("migration run cancelled while applying migration [%d]. Its changes were rolled back", migration.identifier()),
                    notAttempted,
                    e);
        } catch (Exception e) {
            this.connection.rollbackAfterFailure(e);
            log.error("Failed to apply migration [{}] ([{}]). [{}] later migrations were not attempted",
                    migration.identifier(), migration.name(), notAttempted.size(), e);
            throw new MigrationException(migration.identifier(), migration.name(), notAttempted, e);
        }
    }

    private boolean shouldApplySchema(final Long targetIdentifier) {
        if (this.schemaDiscovery == null || !this.schemaDiscovery.schemaResourceExists()) {
            return false;
        }

        if (!this.isDatabaseEmpty()) {
            return false;
        }

        if (targetIdentifier != null) {
            final Optional<SchemaFileMigrationInfo> version = this.schemaDiscovery.readSchemaContent()
                    .flatMap(SchemaFileParser::parseMigrationVersion);

            if (version.isPresent() && version.get().identifier() > targetIdentifier) {
                log.info("Schema version [{}] is newer than target [{}]. Running migrations instead", version.get().identifier(), targetIdentifier);
                return false;
            }
        }

        return true;
    }

    /*
     * The schema script is a snapshot taken at its migration version, so every known migration up to that version
     * is recorded along with it. Otherwise they would show up as pending on the next run.
     *
     * Without a batch lock another process may be bootstrapping the same database, so the transaction takes the
     * ledger's advisory lock and checks again that nobody created the ledger in the meantime.
     */
    private boolean applySchema(final List<PlannedMigration> migrations) {
        final String content = this.schemaDiscovery.readSchemaContent()
                .filter(script -> !script.isBlank())
                .orElseThrow(() -> new IllegalStateException("No embedded schema resource found."));
        final Optional<SchemaFileMigrationInfo> version = SchemaFileParser.parseMigrationVersion(content);

        log.info("Database is empty. Applying schema resource [{}]", this.schemaDiscovery.getSchemaResourceName().orElse("unknown"));

        final AtomicBoolean applied = new AtomicBoolean();
        try {
            this.connection.inTransaction(db -> {
                if (this.batchLock == null) {
                    final boolean ledgerExisted = this.ledger.ledgerTableExists();
                    this.ledger.lockForTransaction();

                    if (this.ledger.ledgerTableExists() && (!ledgerExisted || this.ledger.countExecutedMigrations() > 0)) {
                        log.info("Migration ledger was created concurrently by another process. Skipping schema resource");
                        return;
                    }
                }

                db.executeScript(content);
                this.ledger.ensureSchema();

                if (version.isPresent()) {
                    final Set<Long> recorded = this.ledger.getAppliedIdentifiers();
                    final Instant now = this.clock.instant();
                    final long schemaIdentifier = version.get().identifier();

                    if (!recorded.contains(schemaIdentifier)) {
                        this.ledger.recordExecution(schemaIdentifier, version.get().name(), now);
                    }

                    for (PlannedMigration migration : migrations) {
                        if (migration.identifier() < schemaIdentifier && !recorded.contains(migration.identifier())) {
                            this.ledger.recordExecution(migration.identifier(), migration.name(), now);
                        }
                    }
                }

                applied.set(true);
            });

            if (applied.get()) {
                log.info("Schema applied{}", version.map(v -> String.format(" at migration version [%d] (%s)", v.identifier(), v.name())).orElse(""));
            }
            return applied.get();
        } catch (DatabaseException e) {
            log.error("Failed to apply schema resource", e);
            throw e;
        } catch (Exception e) {
            log.error("Failed to apply schema resource", e);
            throw new DatabaseException("failed to apply schema resource", e);
        }
    }

    private void acquireBatchLock() {
        if (this.batchLock == null) {
            return;
        }

        try {
            log.info("Attempting to acquire migration lock");

            if (!this.batchLock.tryLock(this.lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.error("Failed to acquire migration lock in the allotted time period. Is another process still migrating?");
                throw new MigrationLockException(String.format("failed to acquire migration lock within [%s]", this.lockTimeout));
            }

            log.info("Migration lock acquired");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MigrationCancelledException("migration run cancelled while waiting for the migration lock", e);
        }
    }

    private void releaseBatchLock() {
        if (this.batchLock == null) {
            return;
        }

        try {
            log.info("Releasing migration lock");
            this.batchLock.unlock();
        } catch (Exception e) {
            log.warn("failed to release the migration lock. It is dropped once its database session closes", e);
        }
    }

    private void ensureNotCancelled(final String message, final List<Long> notAttempted) {
        if (Thread.currentThread().isInterrupted()) {
            log.warn("{}. [{}] migrations were not attempted", message, notAttempted.size());
            throw new MigrationCancelledException(message, notAttempted);
        }
    }

    private static List<Long> identifiers(final List<PlannedMigration> migrations) {
        return migrations.stream().map(PlannedMigration::identifier).toList();
    }

    private record PlannedMigration(long identifier, String name, Migration migration) {
    }
}
