package org.loesak.pgmigrate.core.exception;

/**
 * Base class for all database and migration related failures raised by pgmigrate.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(final String message) {
        super(message);
    }

    public DatabaseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
