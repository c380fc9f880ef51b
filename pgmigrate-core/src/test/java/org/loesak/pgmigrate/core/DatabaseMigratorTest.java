package org.loesak.pgmigrate.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.loesak.pgmigrate.core.exception.LedgerConflictException;
import org.loesak.pgmigrate.core.exception.MigrationCancelledException;
import org.loesak.pgmigrate.core.exception.MigrationConfigurationException;
import org.loesak.pgmigrate.core.exception.MigrationException;
import org.loesak.pgmigrate.core.exception.MigrationLockException;
import org.loesak.pgmigrate.core.migration.Migration;
import org.loesak.pgmigrate.core.migration.MigrationSource;
import org.loesak.pgmigrate.core.migration.RegisteredMigrationSource;
import org.loesak.pgmigrate.core.postgres.DatabaseConnection;
import org.loesak.pgmigrate.core.postgres.MigrationLedger;
import org.loesak.pgmigrate.core.postgres.records.ExecutedMigration;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatabaseMigratorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private DatabaseConnection connection;

    @Mock
    private MigrationLedger ledger;

    @Mock
    private Lock batchLock;

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void migrateToLatest_appliesPendingInAscendingOrder() throws Exception {
        TestMigration m300 = TestMigration.noop(300);
        TestMigration m100 = TestMigration.noop(100);
        TestMigration m200 = TestMigration.noop(200);
        when(ledger.getAppliedIdentifiers()).thenReturn(Set.of(100L));
        when(connection.beginTransaction()).thenReturn(true);

        MigrationResult result = migrator(RegisteredMigrationSource.of(m300, m100, m200)).migrateToLatest();

        assertThat(result.getAppliedIdentifiers()).containsExactly(200L, 300L);
        assertThat(result.getConcurrentlyAppliedIdentifiers()).isEmpty();
        assertThat(result.isSchemaApplied()).isFalse();
        assertThat(m100.getInvocations()).isZero();

        InOrder order = inOrder(ledger, connection);
        order.verify(ledger).ensureSchema();
        order.verify(ledger).getAppliedIdentifiers();
        order.verify(connection).beginTransaction();
        order.verify(ledger).recordExecution(200L, "Migration200", NOW);
        order.verify(connection).commitTransaction();
        order.verify(connection).beginTransaction();
        order.verify(ledger).recordExecution(300L, "Migration300", NOW);
        order.verify(connection).commitTransaction();
    }

    @Test
    void migrateToLatest_failureRollsBackAndStops() {
        TestMigration first = TestMigration.noop(1);
        TestMigration failing = new TestMigration(2, "Failing", db -> {
            throw new IllegalStateException("boom");
        });
        TestMigration third = TestMigration.noop(3);
        when(ledger.getAppliedIdentifiers()).thenReturn(Set.of());
        when(connection.beginTransaction()).thenReturn(true);

        assertThatThrownBy(() -> migrator(RegisteredMigrationSource.of(first, failing, third)).migrateToLatest())
                .isInstanceOfSatisfying(MigrationException.class, e -> {
                    assertThat(e.getIdentifier()).isEqualTo(2L);
                    assertThat(e.getName()).isEqualTo("Failing");
                    assertThat(e.getNotAttempted()).containsExactly(3L);
                    assertThat(e).hasMessage("Error while executing migration 2: Failing.");
                    assertThat(e).hasCauseInstanceOf(IllegalStateException.class);
                });

        assertThat(third.getInvocations()).isZero();
        verify(connection, times(1)).commitTransaction();
        verify(connection).rollbackAfterFailure(any(IllegalStateException.class));
        verify(ledger, never()).recordExecution(eq(3L), anyString(), any());
    }

    @Test
    void migrateToLatest_ledgerConflictCountsAsConcurrentlyApplied() {
        TestMigration first = TestMigration.noop(1);
        when(ledger.getAppliedIdentifiers()).thenReturn(Set.of());
        when(connection.beginTransaction()).thenReturn(true);
        doThrow(new LedgerConflictException(1L, null)).when(ledger).recordExecution(eq(1L), anyString(), any());

        MigrationResult result = migrator(RegisteredMigrationSource.of(first, TestMigration.noop(2)))
                .migrateToLatest();

        assertThat(first.getInvocations()).isZero();
        assertThat(result.getConcurrentlyAppliedIdentifiers()).containsExactly(1L);
        assertThat(result.getAppliedIdentifiers()).containsExactly(2L);
        verify(connection).rollbackAfterFailure(any(LedgerConflictException.class));
        verify(connection, times(1)).commitTransaction();
    }

    @Test
    void migrateTo_skipsMigrationsAfterTarget() {
        TestMigration third = TestMigration.noop(3);
        when(ledger.getAppliedIdentifiers()).thenReturn(Set.of());
        when(connection.beginTransaction()).thenReturn(true);

        MigrationResult result = migrator(RegisteredMigrationSource.of(TestMigration.noop(1), TestMigration.noop(2), third))
                .migrateTo(2);

        assertThat(result.getAppliedIdentifiers()).containsExactly(1L, 2L);
        assertThat(third.getInvocations()).isZero();
    }

    @Test
    void migrateToLatest_emptySetOnlyEnsuresLedger() {
        when(ledger.getAppliedIdentifiers()).thenReturn(Set.of());

        MigrationResult result = migrator(new RegisteredMigrationSource()).migrateToLatest();

        assertThat(result.getAppliedCount()).isZero();
        verify(ledger).ensureSchema();
        verifyNoInteractions(connection);
    }

    @Test
    void migrateToLatest_rejectsDuplicateIdentifiersBeforeTouchingDatabase() {
        MigrationSource source = RegisteredMigrationSource.of(
                new TestMigration(1, "First", db -> { }),
                new TestMigration(1, "AlsoFirst", db -> { }));

        assertThatThrownBy(() -> migrator(source).migrateToLatest())
                .isInstanceOf(MigrationConfigurationException.class)
                .hasMessageContaining("[1]");

        verifyNoInteractions(connection, ledger);
    }

    @Test
    void migrateToLatest_rejectsBlankNames() {
        MigrationSource source = RegisteredMigrationSource.of(new TestMigration(1, " ", db -> { }));

        assertThatThrownBy(() -> migrator(source).migrateToLatest())
                .isInstanceOf(MigrationConfigurationException.class);

        verifyNoInteractions(connection, ledger);
    }

    @Test
    void migrateToLatest_rejectsUnresolvableIdentity() {
        Migration unnamed = db -> { };

        assertThatThrownBy(() -> migrator(RegisteredMigrationSource.of(unnamed)).migrateToLatest())
                .isInstanceOf(MigrationConfigurationException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(connection, ledger);
    }

    @Test
    void migrateToLatest_wrapsDiscoveryFailures() {
        MigrationSource source = () -> {
            throw new IllegalStateException("classpath scan failed");
        };

        assertThatThrownBy(() -> migrator(source).migrateToLatest())
                .isInstanceOf(MigrationConfigurationException.class)
                .hasRootCauseMessage("classpath scan failed");
    }

    @Test
    void migrateToLatest_interruptedBeforeStartAttemptsNothing() {
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> migrator(RegisteredMigrationSource.of(TestMigration.noop(1), TestMigration.noop(2))).migrateToLatest())
                .isInstanceOfSatisfying(MigrationCancelledException.class, e ->
                        assertThat(e.getNotAttempted()).containsExactly(1L, 2L));

        verifyNoInteractions(connection, ledger);
    }

    @Test
    void migrateToLatest_interruptedDuringMigrationRollsItBack() {
        TestMigration interrupting = new TestMigration(1, "Interrupting", db -> Thread.currentThread().interrupt());
        TestMigration second = TestMigration.noop(2);
        when(ledger.getAppliedIdentifiers()).thenReturn(Set.of());
        when(connection.beginTransaction()).thenReturn(true);

        assertThatThrownBy(() -> migrator(RegisteredMigrationSource.of(interrupting, second)).migrateToLatest())
                .isInstanceOfSatisfying(MigrationCancelledException.class, e ->
                        assertThat(e.getNotAttempted()).containsExactly(2L));

        assertThat(second.getInvocations()).isZero();
        verify(connection).rollbackAfterFailure(any(MigrationCancelledException.class));
        verify(connection, never()).commitTransaction();
    }

    @Test
    void migrateToLatest_recordsLedgerEntryBeforeRunningMigration() {
        InOrder order = inOrder(ledger);
        TestMigration migration = new TestMigration(1, "Checked", db ->
                order.verify(ledger).recordExecution(1L, "Checked", NOW));
        when(ledger.getAppliedIdentifiers()).thenReturn(Set.of());
        when(connection.beginTransaction()).thenReturn(true);

        migrator(RegisteredMigrationSource.of(migration)).migrateToLatest();

        assertThat(migration.getInvocations()).isEqualTo(1);
        verify(connection).commitTransaction();
    }

    @Test
    void migrateToLatest_interruptedWhileMigrationBlocksRollsItBack() {
        TestMigration blocking = new TestMigration(1, "Blocking", db -> {
            Thread.currentThread().interrupt();
            Thread.sleep(1000);
        });
        TestMigration second = TestMigration.noop(2);
        when(ledger.getAppliedIdentifiers()).thenReturn(Set.of());
        when(connection.beginTransaction()).thenReturn(true);

        assertThatThrownBy(() -> migrator(RegisteredMigrationSource.of(blocking, second)).migrateToLatest())
                .isInstanceOfSatisfying(MigrationCancelledException.class, e -> {
                    assertThat(e.getNotAttempted()).containsExactly(2L);
                    assertThat(e).hasCauseInstanceOf(InterruptedException.class);
                });

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(second.getInvocations()).isZero();
        verify(connection).rollbackAfterFailure(any(InterruptedException.class));
        verify(connection, never()).commitTransaction();
    }

    @Test
    void migrateToLatest_holdsLockAroundBatch() throws Exception {
        when(batchLock.tryLock(anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(ledger.getAppliedIdentifiers()).thenReturn(Set.of());
        when(connection.beginTransaction()).thenReturn(true);

        lockingMigrator(RegisteredMigrationSource.of(TestMigration.noop(1))).migrateToLatest();

        InOrder order = inOrder(batchLock, ledger, connection);
        order.verify(batchLock).tryLock(anyLong(), any(TimeUnit.class));
        order.verify(ledger).ensureSchema();
        order.verify(connection).commitTransaction();
        order.verify(batchLock).unlock();
    }

    @Test
    void migrateToLatest_releasesLockAfterFailure() throws Exception {
        when(batchLock.tryLock(anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(ledger.getAppliedIdentifiers()).thenReturn(Set.of());
        when(connection.beginTransaction()).thenReturn(true);
        TestMigration failing = new TestMigration(1, "Failing", db -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> lockingMigrator(RegisteredMigrationSource.of(failing)).migrateToLatest())
                .isInstanceOf(MigrationException.class);

        verify(batchLock).unlock();
    }

    @Test
    void migrateToLatest_failsWhenLockNotAcquired() throws Exception {
        when(batchLock.tryLock(anyLong(), any(TimeUnit.class))).thenReturn(false);

        assertThatThrownBy(() -> lockingMigrator(RegisteredMigrationSource.of(TestMigration.noop(1))).migrateToLatest())
                .isInstanceOf(MigrationLockException.class);

        verifyNoInteractions(ledger, connection);
        verify(batchLock, never()).unlock();
    }

    @Test
    void runSingle_appliesMigration() {
        when(connection.beginTransaction()).thenReturn(true);

        MigrationOutcome outcome = migrator(new RegisteredMigrationSource()).runSingle(TestMigration.noop(7));

        assertThat(outcome).isEqualTo(MigrationOutcome.APPLIED);
        verify(ledger).ensureSchema();
        verify(ledger).recordExecution(7L, "Migration7", NOW);
        verify(connection).commitTransaction();
    }

    @Test
    void runSingle_reportsConcurrentApplication() {
        when(connection.beginTransaction()).thenReturn(true);
        doThrow(new LedgerConflictException(7L, null)).when(ledger).recordExecution(eq(7L), anyString(), any());

        MigrationOutcome outcome = migrator(new RegisteredMigrationSource()).runSingle(TestMigration.noop(7));

        assertThat(outcome).isEqualTo(MigrationOutcome.ALREADY_APPLIED);
        verify(connection, never()).commitTransaction();
    }

    @Test
    void runSingle_refusesToJoinActiveTransaction() {
        when(connection.beginTransaction()).thenReturn(false);

        assertThatThrownBy(() -> migrator(new RegisteredMigrationSource()).runSingle(TestMigration.noop(7)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void retrieveAlreadyExecuted_emptyWithoutLedgerTable() {
        when(ledger.ledgerTableExists()).thenReturn(false);

        assertThat(migrator(new RegisteredMigrationSource()).retrieveAlreadyExecuted()).isEmpty();
        verify(ledger, never()).getExecutedMigrations();
    }

    @Test
    void retrieveAlreadyExecuted_readsLedger() {
        List<ExecutedMigration> executed = List.of(new ExecutedMigration(1L, "First", NOW));
        when(ledger.ledgerTableExists()).thenReturn(true);
        when(ledger.getExecutedMigrations()).thenReturn(executed);

        assertThat(migrator(new RegisteredMigrationSource()).retrieveAlreadyExecuted()).isEqualTo(executed);
    }

    @Test
    void isDatabaseEmpty() {
        when(ledger.ledgerTableExists()).thenReturn(false, true, true);
        when(ledger.countExecutedMigrations()).thenReturn(0L, 3L);

        DatabaseMigrator migrator = migrator(new RegisteredMigrationSource());

        assertThat(migrator.isDatabaseEmpty()).isTrue();
        assertThat(migrator.isDatabaseEmpty()).isTrue();
        assertThat(migrator.isDatabaseEmpty()).isFalse();
    }

    private DatabaseMigrator migrator(final MigrationSource source) {
        return DatabaseMigrator.builder()
                .connection(connection)
                .migrationSource(source)
                .ledger(ledger)
                .lockingEnabled(false)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    private DatabaseMigrator lockingMigrator(final MigrationSource source) {
        return DatabaseMigrator.builder()
                .connection(connection)
                .migrationSource(source)
                .ledger(ledger)
                .batchLock(batchLock)
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }
}
