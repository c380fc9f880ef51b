package org.loesak.pgmigrate.core.exception;

/**
 * Raised when the set of available migrations is unusable: a migration cannot be instantiated, its identity cannot
 * be derived, or two migrations share an identifier. Always raised before any migration executes.
 */
public class MigrationConfigurationException extends DatabaseException {

    public MigrationConfigurationException(final String message) {
        super(message);
    }

    public MigrationConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
