package org.loesak.pgmigrate.springboot.starter.autoconfigure;

import lombok.extern.slf4j.Slf4j;
import org.loesak.pgmigrate.core.DatabaseMigrator;
import org.loesak.pgmigrate.core.MigrationResult;
import org.springframework.beans.factory.InitializingBean;

@Slf4j
public class PgMigrateInitializer implements InitializingBean {

    private final DatabaseMigrator migrator;

    public PgMigrateInitializer(final DatabaseMigrator migrator) {
        this.migrator = migrator;
    }

    @Override
    public void afterPropertiesSet() {
        final MigrationResult result = this.migrator.migrateToLatest();

        log.info("Database migrations complete. Applied [{}] migrations", result.getAppliedCount());
    }
}
