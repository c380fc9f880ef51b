package org.loesak.pgmigrate.core.migration;

import java.util.List;

/**
 * Enumerates the migrations available to the running process. Implementations make no ordering or filtering
 * guarantees; that is the job of the migrator.
 */
public interface MigrationSource {

    /**
     * @return every known migration, freshly resolved on each call
     * @throws org.loesak.pgmigrate.core.exception.MigrationConfigurationException if a migration cannot be instantiated
     */
    List<Migration> discover();
}
