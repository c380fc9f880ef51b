package org.loesak.pgmigrate.core.schema;

import lombok.NonNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class SchemaFileParser {

    private static final Pattern MIGRATION_VERSION_PATTERN =
            Pattern.compile("^\\s*--\\s*Migration version:\\s*(\\d+)\\s*\\(\\s*(.*?)\\s*\\)\\s*$");

    private SchemaFileParser() {
    }

    /**
     * Finds the first {@code -- Migration version: <identifier> (<name>)} line in the given schema script.
     *
     * @return the version, or empty when the header is missing, reads {@code (none)} or is malformed
     */
    public static Optional<SchemaFileMigrationInfo> parseMigrationVersion(final String content) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }

        return content.lines()
                .map(MIGRATION_VERSION_PATTERN::matcher)
                .filter(Matcher::matches)
                .findFirst()
                .flatMap(SchemaFileParser::toMigrationInfo);
    }

    public static Optional<SchemaFileMigrationInfo> parseMigrationVersionFromFile(@NonNull final Path path) throws IOException {
        return parseMigrationVersion(Files.readString(path, StandardCharsets.UTF_8));
    }

    private static Optional<SchemaFileMigrationInfo> toMigrationInfo(final Matcher matcher) {
        final String name = matcher.group(2);
        if (name.isBlank()) {
            return Optional.empty();
        }

        try {
            return Optional.of(new SchemaFileMigrationInfo(Long.parseLong(matcher.group(1)), name));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
