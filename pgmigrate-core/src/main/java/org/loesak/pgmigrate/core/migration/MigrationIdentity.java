package org.loesak.pgmigrate.core.migration;

import java.util.Objects;

public record MigrationIdentity(long identifier, String name) {

    public MigrationIdentity {
        Objects.requireNonNull(name);
    }

}
