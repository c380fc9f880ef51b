package org.loesak.pgmigrate.core.schema;

import java.util.Objects;

/**
 * Migration version embodied by a schema file, read from its {@code -- Migration version: <identifier> (<name>)}
 * header line.
 */
public record SchemaFileMigrationInfo(long identifier, String name) {

    public SchemaFileMigrationInfo {
        Objects.requireNonNull(name);
    }

}
