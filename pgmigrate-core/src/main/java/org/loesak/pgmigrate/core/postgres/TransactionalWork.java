package org.loesak.pgmigrate.core.postgres;

@FunctionalInterface
public interface TransactionalWork {

    void execute(DatabaseConnection db) throws Exception;
}
