package org.loesak.pgmigrate.core.postgres.records;

import java.time.Instant;
import java.util.Objects;

/**
 * A ledger row: a migration that has been applied, with the name it had at the time and when it completed.
 */
public record ExecutedMigration(long identifier, String name, Instant executedAt) {

    public ExecutedMigration {
        Objects.requireNonNull(name);
        Objects.requireNonNull(executedAt);
    }

}
