package org.loesak.pgmigrate.core.migration;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.pgmigrate.core.exception.MigrationConfigurationException;

import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Discovers migrations listed in {@code META-INF/services/org.loesak.pgmigrate.core.migration.Migration}.
 */
@Slf4j
public class ServiceLoaderMigrationSource implements MigrationSource {

    private final ClassLoader classLoader;

    public ServiceLoaderMigrationSource() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ServiceLoaderMigrationSource(@NonNull final ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public List<Migration> discover() {
        log.info("Discovering migrations registered as [{}] services", Migration.class.getName());

        try {
            final List<Migration> migrations = ServiceLoader.load(Migration.class, this.classLoader)
                    .stream()
                    .map(ServiceLoader.Provider::get)
                    .toList();

            log.info("Found [{}] migrations", migrations.size());

            return migrations;
        } catch (ServiceConfigurationError e) {
            throw new MigrationConfigurationException("failed to instantiate a registered migration", e);
        }
    }
}
