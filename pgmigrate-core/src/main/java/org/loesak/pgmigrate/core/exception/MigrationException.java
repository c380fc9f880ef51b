package org.loesak.pgmigrate.core.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a migration fails to apply. The migration's transaction has been rolled back and the migrations
 * listed in {@link #getNotAttempted()} were not started.
 */
@Getter
public class MigrationException extends DatabaseException {

    private final long identifier;
    private final String name;
    private final List<Long> notAttempted;

    public MigrationException(final long identifier, final String name, final Throwable cause) {
        this(identifier, name, List.of(), cause);
    }

    public MigrationException(final long identifier, final String name, final List<Long> notAttempted, final Throwable cause) {
        super(String.format("Error while executing migration %d: %s.", identifier, name), cause);
        this.identifier = identifier;
        this.name = name;
        this.notAttempted = List.copyOf(notAttempted);
    }
}
