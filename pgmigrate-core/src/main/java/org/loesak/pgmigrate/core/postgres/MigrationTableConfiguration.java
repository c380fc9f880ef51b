package org.loesak.pgmigrate.core.postgres;

import lombok.Builder;
import lombok.Value;

/**
 * Location of the migration ledger table.
 */
@Value
public class MigrationTableConfiguration {

    public static final String DEFAULT_SCHEMA = "pgmigrate";
    public static final String DEFAULT_TABLE = "migrations";

    public static final MigrationTableConfiguration DEFAULT = MigrationTableConfiguration.builder().build();

    String schema;
    String table;

    @Builder(toBuilder = true)
    private MigrationTableConfiguration(final String schema, final String table) {
        this.schema = requireName(schema == null ? DEFAULT_SCHEMA : schema, "schema");
        this.table = requireName(table == null ? DEFAULT_TABLE : table, "table");
    }

    /**
     * @return the table name in the format {@code "schema"."table"}
     */
    public String getFullyQualifiedTableName() {
        return quoteIdentifier(this.schema) + "." + quoteIdentifier(this.table);
    }

    public String getQuotedSchema() {
        return quoteIdentifier(this.schema);
    }

    static String quoteIdentifier(final String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    private static String requireName(final String value, final String kind) {
        if (value.isBlank()) {
            throw new IllegalArgumentException(String.format("migration table %s name must not be blank", kind));
        }
        return value;
    }
}
