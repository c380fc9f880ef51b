package org.loesak.pgmigrate.core.exception;

public class MigrationLockException extends DatabaseException {

    public MigrationLockException(final String message) {
        super(message);
    }

    public MigrationLockException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
