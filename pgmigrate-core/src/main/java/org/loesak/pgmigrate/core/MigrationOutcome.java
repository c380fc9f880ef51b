package org.loesak.pgmigrate.core;

public enum MigrationOutcome {
    /**
     * The migration ran and its ledger entry was committed.
     */
    APPLIED,

    /**
     * Another process recorded the migration first; this run's changes were rolled back.
     */
    ALREADY_APPLIED
}
