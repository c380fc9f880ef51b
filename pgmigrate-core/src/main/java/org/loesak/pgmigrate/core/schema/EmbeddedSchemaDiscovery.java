package org.loesak.pgmigrate.core.schema;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.JarURLConnection;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

/**
 * Locates a bundled schema script on the classpath, under {@value #DEFAULT_RESOURCE_DIRECTORY}/ by default.
 * <p>
 * With an environment, {@code schema.<environment>.sql} (case-insensitive) is preferred, falling back to
 * {@code schema.sql}. Without one, {@code schema.sql} is preferred, then the first {@code schema.*.sql} by name.
 */
@Slf4j
public class EmbeddedSchemaDiscovery {

    public static final String DEFAULT_RESOURCE_DIRECTORY = "pgmigrate";

    private static final String SCHEMA_PREFIX = "schema.";
    private static final String SCHEMA_SUFFIX = ".sql";
    private static final String DEFAULT_SCHEMA_NAME = "schema.sql";

    private final ClassLoader classLoader;
    private final String resourceDirectory;
    private final String environment;

    public EmbeddedSchemaDiscovery(final String environment) {
        this(Thread.currentThread().getContextClassLoader(), DEFAULT_RESOURCE_DIRECTORY, environment);
    }

    public EmbeddedSchemaDiscovery(@NonNull final ClassLoader classLoader, @NonNull final String resourceDirectory, final String environment) {
        this.classLoader = classLoader;
        this.resourceDirectory = stripSlashes(resourceDirectory);
        this.environment = environment;
    }

    public record SchemaResource(String name, URL url) {
    }

    public Optional<SchemaResource> findSchemaResource() {
        if (this.environment != null && !this.environment.isBlank()) {
            final String environmentSchemaName = SCHEMA_PREFIX + this.environment.toLowerCase(Locale.ROOT) + SCHEMA_SUFFIX;
            return this.findResourceByName(environmentSchemaName)
                    .or(() -> this.findResourceByName(DEFAULT_SCHEMA_NAME));
        }

        return this.findResourceByName(DEFAULT_SCHEMA_NAME)
                .or(this::findAnySchemaResource);
    }

    public boolean schemaResourceExists() {
        return this.findSchemaResource().isPresent();
    }

    public Optional<String> getSchemaResourceName() {
        return this.findSchemaResource().map(SchemaResource::name);
    }

    public Optional<String> readSchemaContent() {
        return this.findSchemaResource().map(resource -> {
            log.info("Reading schema resource [{}]", resource.name());

            try (InputStream stream = resource.url().openStream()) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(String.format("failed to read schema resource [%s]", resource.name()), e);
            }
        });
    }

    private Optional<SchemaResource> findResourceByName(final String fileName) {
        final URL exact = this.classLoader.getResource(this.resourcePath(fileName));
        if (exact != null) {
            return Optional.of(new SchemaResource(fileName, exact));
        }

        return this.listResourceFileNames().stream()
                .filter(name -> name.equalsIgnoreCase(fileName))
                .findFirst()
                .map(this::toSchemaResource);
    }

    private Optional<SchemaResource> findAnySchemaResource() {
        return this.listResourceFileNames().stream()
                .filter(name -> {
                    final String lower = name.toLowerCase(Locale.ROOT);
                    return lower.startsWith(SCHEMA_PREFIX) && lower.endsWith(SCHEMA_SUFFIX);
                })
                .findFirst()
                .map(this::toSchemaResource);
    }

    private SchemaResource toSchemaResource(final String fileName) {
        return new SchemaResource(fileName, this.classLoader.getResource(this.resourcePath(fileName)));
    }

    private List<String> listResourceFileNames() {
        final URL directory = this.classLoader.getResource(this.resourceDirectory + "/");
        if (directory == null) {
            return Collections.emptyList();
        }

        try {
            switch (directory.getProtocol()) {
                case "file":
                    try (Stream<Path> paths = Files.list(Paths.get(directory.toURI()))) {
                        return paths.filter(Files::isRegularFile)
                                .map(path -> path.getFileName().toString())
                                .sorted()
                                .toList();
                    }
                case "jar":
                    final JarURLConnection connection = (JarURLConnection) directory.openConnection();
                    connection.setUseCaches(false);
                    final String prefix = connection.getEntryName().endsWith("/")
                            ? connection.getEntryName()
                            : connection.getEntryName() + "/";
                    try (JarFile jar = connection.getJarFile()) {
                        return jar.stream()
                                .map(JarEntry::getName)
                                .filter(name -> name.startsWith(prefix) && name.indexOf('/', prefix.length()) < 0)
                                .map(name -> name.substring(prefix.length()))
                                .filter(name -> !name.isEmpty())
                                .sorted()
                                .toList();
                    }
                default:
                    log.debug("Cannot list schema resources for protocol [{}]", directory.getProtocol());
                    return Collections.emptyList();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(String.format("failed to list schema resources in [%s]", this.resourceDirectory), e);
        } catch (URISyntaxException e) {
            throw new IllegalStateException(String.format("failed to list schema resources in [%s]", this.resourceDirectory), e);
        }
    }

    private String resourcePath(final String fileName) {
        return this.resourceDirectory.isEmpty() ? fileName : this.resourceDirectory + "/" + fileName;
    }

    private static String stripSlashes(final String directory) {
        String result = directory;
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
