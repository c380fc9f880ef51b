package org.loesak.pgmigrate.core.exception;

import lombok.Getter;

/**
 * Raised when a ledger entry cannot be written because an entry with the same identifier already exists.
 */
@Getter
public class LedgerConflictException extends DatabaseException {

    private final long identifier;

    public LedgerConflictException(final long identifier, final Throwable cause) {
        super(String.format("A ledger entry for migration [%d] already exists", identifier), cause);
        this.identifier = identifier;
    }
}
