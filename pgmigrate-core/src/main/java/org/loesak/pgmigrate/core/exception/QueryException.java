package org.loesak.pgmigrate.core.exception;

import lombok.Getter;

/**
 * Raised when a SQL statement fails. Carries the statement that was being executed.
 */
@Getter
public class QueryException extends DatabaseException {

    private final String sql;

    public QueryException(final String sql, final Throwable cause) {
        super(String.format("Error while executing SQL [%s]", sql.strip()), cause);
        this.sql = sql;
    }
}
