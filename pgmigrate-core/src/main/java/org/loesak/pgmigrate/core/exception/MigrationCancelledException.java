package org.loesak.pgmigrate.core.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when the migrating thread is interrupted. Nothing is recorded for the migration that was in flight.
 */
@Getter
public class MigrationCancelledException extends DatabaseException {

    private final List<Long> notAttempted;

    public MigrationCancelledException(final String message, final List<Long> notAttempted) {
        super(message);
        this.notAttempted = List.copyOf(notAttempted);
    }

    public MigrationCancelledException(final String message, final List<Long> notAttempted, final Throwable cause) {
        super(message, cause);
        this.notAttempted = List.copyOf(notAttempted);
    }

    public MigrationCancelledException(final String message, final Throwable cause) {
        super(message, cause);
        this.notAttempted = List.of();
    }
}
