package org.loesak.pgmigrate.core.yaml;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.loesak.pgmigrate.core.exception.MigrationConfigurationException;
import org.loesak.pgmigrate.core.postgres.MigrationTableConfiguration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Settings for running migrations from the command line, read from the nearest {@value #CONFIG_FILE_NAME}.
 * <pre>
 * connectionStrings:
 *   local: jdbc:postgresql://localhost:5432/app
 *   prod: jdbc:postgresql://prod-db:5432/app
 * username: app
 * schema: pgmigrate
 * lockTimeout: PT2M
 * </pre>
 */
@Data
@Slf4j
public class MigrationToolConfiguration {

    public static final String CONFIG_FILE_NAME = ".pgmigrate.yml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private String connectionString;
    private Map<String, String> connectionStrings;
    private String username;
    private String password;
    private String schema;
    private String table;
    private String environment;
    private Duration lockTimeout;

    /**
     * Loads the nearest configuration file, searching upward from the working directory.
     * Returns defaults when there is none.
     */
    public static MigrationToolConfiguration load() {
        return load(Paths.get("").toAbsolutePath());
    }

    public static MigrationToolConfiguration load(final Path startDirectory) {
        final Optional<Path> file = findConfigFile(startDirectory);

        if (file.isEmpty()) {
            log.info("No [{}] found from [{}] upward. Using defaults", CONFIG_FILE_NAME, startDirectory);
            return new MigrationToolConfiguration();
        }

        return read(file.get());
    }

    public static MigrationToolConfiguration read(final Path file) {
        log.info("Reading configuration file [{}]", file);

        try (InputStream input = Files.newInputStream(file)) {
            return Optional
                    .ofNullable(YAML_MAPPER.readValue(input, MigrationToolConfiguration.class))
                    .orElseGet(MigrationToolConfiguration::new);
        } catch (IOException e) {
            throw new MigrationConfigurationException(String.format("failed to read configuration file [%s]", file), e);
        }
    }

    public static Optional<Path> findConfigFile(final Path startDirectory) {
        Path directory = startDirectory.toAbsolutePath();

        while (directory != null) {
            final Path candidate = directory.resolve(CONFIG_FILE_NAME);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
            directory = directory.getParent();
        }

        return Optional.empty();
    }

    public void setConnectionStrings(final Map<String, String> connectionStrings) {
        this.connectionStrings = connectionStrings == null ? null : new LinkedHashMap<>(connectionStrings);
    }

    /**
     * Picks the connection string to use. An explicit override wins. Otherwise a named environment selects its
     * entry (case-insensitive, null when unknown). Without either, the plain {@code connectionString} is used,
     * then the first configured environment.
     *
     * @return the connection string, or null when nothing matches
     */
    public String resolveConnectionString(final String override, final String environment) {
        if (override != null && !override.isBlank()) {
            return override;
        }

        final String requestedEnvironment = environment != null && !environment.isBlank() ? environment : this.environment;

        if (requestedEnvironment != null && !requestedEnvironment.isBlank()) {
            if (this.connectionStrings == null) {
                return null;
            }

            return this.connectionStrings.entrySet().stream()
                    .filter(entry -> entry.getKey().equalsIgnoreCase(requestedEnvironment))
                    .map(Map.Entry::getValue)
                    .findFirst()
                    .orElse(null);
        }

        if (this.connectionString != null && !this.connectionString.isBlank()) {
            return this.connectionString;
        }

        if (this.connectionStrings == null || this.connectionStrings.isEmpty()) {
            return null;
        }

        return this.connectionStrings.values().iterator().next();
    }

    @JsonIgnore
    public List<String> getAvailableEnvironments() {
        if (this.connectionStrings == null) {
            return List.of();
        }
        return List.copyOf(this.connectionStrings.keySet());
    }

    @JsonIgnore
    public MigrationTableConfiguration getMigrationTableConfiguration() {
        return MigrationTableConfiguration.builder()
                .schema(this.schema)
                .table(this.table)
                .build();
    }
}
