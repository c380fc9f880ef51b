package org.loesak.pgmigrate.examples.simple.migrations;

import org.loesak.pgmigrate.core.migration.Migration;
import org.loesak.pgmigrate.core.postgres.DatabaseConnection;

import java.util.Map;

public class _202505192230_AddUserDisplayName implements Migration {

    @Override
    public void up(DatabaseConnection db) {
        db.execute("ALTER TABLE users ADD COLUMN display_name TEXT");
        db.execute("UPDATE users SET display_name = split_part(email, '@', 1) WHERE display_name IS NULL", Map.of());
    }
}
