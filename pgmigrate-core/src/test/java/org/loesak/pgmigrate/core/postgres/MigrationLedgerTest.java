package org.loesak.pgmigrate.core.postgres;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.loesak.pgmigrate.core.exception.LedgerConflictException;
import org.loesak.pgmigrate.core.exception.QueryException;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MigrationLedgerTest {

    @Mock
    private DatabaseConnection connection;

    @Test
    void recordExecution_translatesUniqueViolationToConflict() {
        when(connection.execute(anyString(), anyMap()))
                .thenThrow(new QueryException("INSERT", new SQLException("duplicate key", "23505")));

        MigrationLedger ledger = new MigrationLedger(connection, MigrationTableConfiguration.DEFAULT);

        assertThatThrownBy(() -> ledger.recordExecution(202401010900L, "CreateAccountsTable", Instant.now()))
                .isInstanceOf(LedgerConflictException.class)
                .satisfies(e -> assertThat(((LedgerConflictException) e).getIdentifier()).isEqualTo(202401010900L));
    }

    @Test
    void recordExecution_rethrowsOtherFailures() {
        QueryException failure = new QueryException("INSERT", new SQLException("connection lost", "08006"));
        when(connection.execute(anyString(), anyMap())).thenThrow(failure);

        MigrationLedger ledger = new MigrationLedger(connection, MigrationTableConfiguration.DEFAULT);

        assertThatThrownBy(() -> ledger.recordExecution(1L, "Something", Instant.now())).isSameAs(failure);
    }

    @Test
    void ensureSchema_toleratesConcurrentCreation() {
        when(connection.tableExists("pgmigrate", "migrations")).thenReturn(false);
        when(connection.execute(startsWith("CREATE SCHEMA")))
                .thenThrow(new QueryException("CREATE SCHEMA", new SQLException("duplicate key", "23505")));
        when(connection.execute(startsWith("CREATE TABLE")))
                .thenThrow(new QueryException("CREATE TABLE", new SQLException("relation exists", "42P07")));

        MigrationLedger ledger = new MigrationLedger(connection, MigrationTableConfiguration.DEFAULT);

        ledger.ensureSchema();

        verify(connection, times(1)).execute(startsWith("CREATE TABLE"));
    }

    @Test
    void ensureSchema_skipsCreationWhenTableExists() {
        when(connection.tableExists("pgmigrate", "migrations")).thenReturn(true);

        new MigrationLedger(connection, MigrationTableConfiguration.DEFAULT).ensureSchema();

        verify(connection, times(0)).execute(anyString());
    }

    @Test
    void ensureSchema_rethrowsUnrelatedFailures() {
        when(connection.tableExists("pgmigrate", "migrations")).thenReturn(false);
        when(connection.execute(startsWith("CREATE SCHEMA")))
                .thenThrow(new QueryException("CREATE SCHEMA", new SQLException("permission denied", "42501")));

        MigrationLedger ledger = new MigrationLedger(connection, MigrationTableConfiguration.DEFAULT);

        assertThatThrownBy(ledger::ensureSchema).isInstanceOf(QueryException.class);
    }

    @Test
    void hasSqlState_walksCauseChain() {
        Exception wrapped = new RuntimeException(new IllegalStateException(new SQLException("boom", "42P06")));

        assertThat(MigrationLedger.hasSqlState(wrapped, "42P07", "42P06")).isTrue();
        assertThat(MigrationLedger.hasSqlState(wrapped, "23505")).isFalse();
        assertThat(MigrationLedger.hasSqlState(null, "23505")).isFalse();
    }
}
