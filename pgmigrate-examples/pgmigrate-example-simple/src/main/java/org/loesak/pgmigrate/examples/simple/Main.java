package org.loesak.pgmigrate.examples.simple;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.loesak.pgmigrate.core.DatabaseMigrator;
import org.loesak.pgmigrate.core.MigrationResult;
import org.loesak.pgmigrate.core.migration.ServiceLoaderMigrationSource;
import org.loesak.pgmigrate.core.postgres.DatabaseConnection;
import org.loesak.pgmigrate.core.postgres.records.ExecutedMigration;
import org.loesak.pgmigrate.core.schema.EmbeddedSchemaDiscovery;
import org.loesak.pgmigrate.core.yaml.MigrationToolConfiguration;

/**
 * Usage: {@code Main [latest | to <identifier> | status] [--environment <name>] [--connection <jdbc url>]}
 * <p>
 * Connection settings come from the nearest .pgmigrate.yml unless given on the command line.
 */
@Slf4j
public class Main {

    static final String USAGE = "Main [latest | to <identifier> | status] [--environment <name>] [--connection <jdbc url>]";

    public static void main(String... args) {
        final Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("{}. Usage: {}", e.getMessage(), USAGE);
            System.exit(1);
            return;
        }

        String command = arguments.getCommand();
        Long target = arguments.getTarget();
        String environment = arguments.getEnvironment();
        String connectionOverride = arguments.getConnectionOverride();

        MigrationToolConfiguration configuration = MigrationToolConfiguration.load();
        String connectionString = configuration.resolveConnectionString(connectionOverride, environment);
        if (connectionString == null) {
            log.error("No connection string found. Environments in [{}]: {}",
                    MigrationToolConfiguration.CONFIG_FILE_NAME, configuration.getAvailableEnvironments());
            System.exit(1);
            return;
        }

        String effectiveEnvironment = environment != null ? environment : configuration.getEnvironment();

        try (DatabaseConnection connection = new DatabaseConnection(connectionString, configuration.getUsername(), configuration.getPassword())) {
            DatabaseMigrator migrator = DatabaseMigrator.builder()
                    .connection(connection)
                    .tableConfiguration(configuration.getMigrationTableConfiguration())
                    .migrationSource(new ServiceLoaderMigrationSource(Main.class.getClassLoader()))
                    .schemaDiscovery(new EmbeddedSchemaDiscovery(effectiveEnvironment))
                    .lockTimeout(configuration.getLockTimeout())
                    .build();

            switch (command) {
                case "latest" -> report(migrator.migrateToLatest());
                case "to" -> report(migrator.migrateTo(target));
                case "status" -> {
                    for (ExecutedMigration migration : migrator.retrieveAlreadyExecuted()) {
                        log.info("[{}] {} executed at [{}]", migration.identifier(), migration.name(), migration.executedAt());
                    }
                }
                default -> {
                    log.error("Unknown command [{}]. Expected one of [latest, to <identifier>, status]", command);
                    System.exit(1);
                }
            }
        }
    }

    private static void report(MigrationResult result) {
        log.info("Applied migrations {}", result.getAppliedIdentifiers());
        if (!result.getConcurrentlyAppliedIdentifiers().isEmpty()) {
            log.info("Applied concurrently by another process {}", result.getConcurrentlyAppliedIdentifiers());
        }
        if (result.isSchemaApplied()) {
            log.info("Empty database was initialized from the embedded schema");
        }
    }

    @Value
    static class Arguments {

        String command;
        Long target;
        String environment;
        String connectionOverride;

        static Arguments parse(String... args) {
            String command = "latest";
            Long target = null;
            String environment = null;
            String connectionOverride = null;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--environment", "-e" -> environment = valueOf(args, ++i, "--environment");
                    case "--connection", "-c" -> connectionOverride = valueOf(args, ++i, "--connection");
                    case "to" -> {
                        command = "to";
                        String identifier = valueOf(args, ++i, "to");
                        try {
                            target = Long.parseLong(identifier);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException(String.format("Invalid migration identifier [%s]", identifier), e);
                        }
                    }
                    default -> command = args[i];
                }
            }

            return new Arguments(command, target, environment, connectionOverride);
        }

        private static String valueOf(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException(String.format("Missing value for [%s]", option));
            }
            return args[index];
        }
    }
}
