package org.loesak.pgmigrate.springboot.starter.autoconfigure;

import lombok.Data;
import org.loesak.pgmigrate.core.DatabaseMigrator;
import org.loesak.pgmigrate.core.postgres.MigrationTableConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;

import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "pgmigrate")
public class PgMigrateConfigurationProperties {

    /**
     * Enables pgmigrate auto configuration.
     */
    @NotNull
    private Boolean enabled = true;

    /**
     * JDBC url of the database to migrate. The application's DataSource is used when not set.
     */
    private String url;

    /**
     * Credentials username.
     */
    private String username;

    /**
     * Credentials password.
     */
    private String password;

    /**
     * Schema of the migration ledger table.
     */
    @NotEmpty
    private String schema = MigrationTableConfiguration.DEFAULT_SCHEMA;

    /**
     * Name of the migration ledger table.
     */
    @NotEmpty
    private String table = MigrationTableConfiguration.DEFAULT_TABLE;

    /**
     * Environment used to pick an embedded schema.&lt;environment&gt;.sql.
     */
    private String environment;

    /**
     * Whether an embedded schema is applied to an empty database before migrating.
     */
    @NotNull
    private Boolean embeddedSchemaEnabled = true;

    /**
     * Whether migration runs hold a database advisory lock.
     */
    @NotNull
    private Boolean lockingEnabled = true;

    /**
     * How long to wait for the advisory lock.
     */
    @NotNull
    private Duration lockTimeout = DatabaseMigrator.DEFAULT_LOCK_TIMEOUT;

}
