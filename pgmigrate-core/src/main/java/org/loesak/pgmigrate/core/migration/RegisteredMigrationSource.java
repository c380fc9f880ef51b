package org.loesak.pgmigrate.core.migration;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.pgmigrate.core.exception.MigrationConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Migration source backed by an explicit registration list. Migration classes registered by type are instantiated
 * through their no-arg constructor every time {@link #discover()} is called.
 */
@Slf4j
public class RegisteredMigrationSource implements MigrationSource {

    private final List<Supplier<Migration>> registrations = new ArrayList<>();

    public RegisteredMigrationSource() {
    }

    public RegisteredMigrationSource(@NonNull final Collection<? extends Migration> migrations) {
        this.registerAll(migrations);
    }

    public static RegisteredMigrationSource of(final Migration... migrations) {
        return new RegisteredMigrationSource(List.of(migrations));
    }

    public synchronized RegisteredMigrationSource register(@NonNull final Migration migration) {
        this.registrations.add(() -> migration);
        return this;
    }

    public synchronized RegisteredMigrationSource register(@NonNull final Class<? extends Migration> type) {
        this.registrations.add(() -> instantiate(type));
        return this;
    }

    public synchronized RegisteredMigrationSource registerAll(@NonNull final Collection<? extends Migration> migrations) {
        migrations.forEach(this::register);
        return this;
    }

    @Override
    public synchronized List<Migration> discover() {
        final List<Migration> migrations = this.registrations.stream()
                .map(Supplier::get)
                .toList();

        log.debug("Discovered [{}] registered migrations", migrations.size());

        return migrations;
    }

    private static Migration instantiate(final Class<? extends Migration> type) {
        try {
            return type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new MigrationConfigurationException(
                    String.format("failed to instantiate migration class [%s]", type.getName()),
                    e);
        }
    }
}
