package org.loesak.pgmigrate.core;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

@Value
public class MigrationResult {

    /**
     * Identifiers of the migrations this run applied, in execution order.
     */
    @NonNull List<Long> appliedIdentifiers;

    /**
     * Identifiers this run selected as pending but found recorded by a concurrent process.
     */
    @NonNull List<Long> concurrentlyAppliedIdentifiers;

    /**
     * Whether an embedded schema was applied to an empty database before migrating.
     */
    boolean schemaApplied;

    public int getAppliedCount() {
        return this.appliedIdentifiers.size();
    }
}
