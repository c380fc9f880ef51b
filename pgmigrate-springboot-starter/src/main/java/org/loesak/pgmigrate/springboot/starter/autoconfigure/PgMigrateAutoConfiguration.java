package org.loesak.pgmigrate.springboot.starter.autoconfigure;

import org.loesak.pgmigrate.core.DatabaseMigrator;
import org.loesak.pgmigrate.core.migration.Migration;
import org.loesak.pgmigrate.core.migration.MigrationSource;
import org.loesak.pgmigrate.core.migration.RegisteredMigrationSource;
import org.loesak.pgmigrate.core.postgres.DatabaseConnection;
import org.loesak.pgmigrate.core.postgres.MigrationTableConfiguration;
import org.loesak.pgmigrate.core.schema.EmbeddedSchemaDiscovery;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import javax.sql.DataSource;
import java.util.function.Supplier;

@Configuration
@ConditionalOnProperty(prefix = "pgmigrate", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(PgMigrateConfigurationProperties.class)
@AutoConfigureAfter(name = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
public class PgMigrateAutoConfiguration {

    private final PgMigrateConfigurationProperties pgmigrateProperties;
    private final DataSource dataSource;

    public PgMigrateAutoConfiguration(
            final PgMigrateConfigurationProperties pgmigrateProperties,
            final ObjectProvider<DataSource> dataSource) {
        this.pgmigrateProperties = pgmigrateProperties;
        this.dataSource = dataSource.getIfUnique();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public DatabaseConnection pgmigrateDatabaseConnection() {
        /*
         an explicit url means migrations run against a database other than (or as a different user than) the
         application's own DataSource
         */

        if (StringUtils.hasText(this.pgmigrateProperties.getUrl())) {
            return new DatabaseConnection(
                    this.pgmigrateProperties.getUrl(),
                    this.pgmigrateProperties.getUsername(),
                    this.pgmigrateProperties.getPassword());
        } else if (this.dataSource != null) {
            return new DatabaseConnection(this.dataSource);
        } else {
            throw new IllegalStateException("could not create or find a DataSource to use for migrations. You either need to configure pgmigrate.url or the application needs a single DataSource bean");
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationSource pgmigrateMigrationSource(final ObjectProvider<Migration> migrations) {
        return new RegisteredMigrationSource(migrations.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public DatabaseMigrator databaseMigrator(final DatabaseConnection connection, final MigrationSource migrationSource) {
        return DatabaseMigrator.builder()
                .connection(connection)
                .migrationSource(migrationSource)
                .tableConfiguration(MigrationTableConfiguration.builder()
                        .schema(this.pgmigrateProperties.getSchema())
                        .table(this.pgmigrateProperties.getTable())
                        .build())
                .schemaDiscovery(this.getProperty(this.pgmigrateProperties::getEmbeddedSchemaEnabled, () -> true)
                        ? new EmbeddedSchemaDiscovery(this.pgmigrateProperties.getEnvironment())
                        : null)
                .lockingEnabled(this.pgmigrateProperties.getLockingEnabled())
                .lockTimeout(this.pgmigrateProperties.getLockTimeout())
                .build();
    }

    @Bean
    public PgMigrateInitializer pgmigrateInitializer(final DatabaseMigrator databaseMigrator) {
        return new PgMigrateInitializer(databaseMigrator);
    }

    private <T> T getProperty(Supplier<T> property, Supplier<T> defaultValue) {
        T value = property.get();
        return (value != null) ? value : defaultValue.get();
    }

}
