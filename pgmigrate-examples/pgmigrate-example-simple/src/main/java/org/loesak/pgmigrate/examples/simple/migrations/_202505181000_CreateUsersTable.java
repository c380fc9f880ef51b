package org.loesak.pgmigrate.examples.simple.migrations;

import org.loesak.pgmigrate.core.migration.Migration;
import org.loesak.pgmigrate.core.postgres.DatabaseConnection;

public class _202505181000_CreateUsersTable implements Migration {

    @Override
    public void up(DatabaseConnection db) {
        db.execute("""
                CREATE TABLE users (
                   id         BIGSERIAL   PRIMARY KEY,
                   email      TEXT        NOT NULL UNIQUE,
                   created_at TIMESTAMPTZ NOT NULL DEFAULT now()
                )
                """);
    }
}
