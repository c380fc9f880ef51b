package org.loesak.pgmigrate.core.migration;

import org.loesak.pgmigrate.core.postgres.DatabaseConnection;

/**
 * A single, forward-only schema change.
 * <p>
 * By default the identifier and name are parsed from the simple class name, which must follow the
 * {@code _{identifier}_{name}} convention, e.g. {@code _202310191050_AddUsersTable}. Override both getters to set
 * them explicitly instead.
 */
public interface Migration {

    /**
     * Identifier of the migration, used for ordering and to determine whether it already ran. By convention a
     * {@code yyyyMMddHHmm} timestamp, e.g. {@code 202310191050} for 2023-10-19 10:50.
     */
    default long getIdentifier() {
        return MigrationClassNameParser.parse(this.getClass().getSimpleName()).identifier();
    }

    /**
     * Human-readable name of the migration.
     */
    default String getName() {
        return MigrationClassNameParser.parse(this.getClass().getSimpleName()).name();
    }

    /**
     * Applies the migration. Runs inside a transaction that also records the migration in the ledger.
     *
     * @param db connection bound to the migration's transaction
     */
    void up(DatabaseConnection db) throws Exception;
}
