package org.loesak.pgmigrate.core.concurrent;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.loesak.pgmigrate.core.exception.MigrationLockException;
import org.loesak.pgmigrate.core.postgres.MigrationTableConfiguration;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.zip.CRC32;

/*
 * Modeled after the Spring Lock implementations for JDBC (mostly), Zookeeper, and Redis found here:
 * https://github.com/spring-projects/spring-integration/blob/master/spring-integration-jdbc/src/main/java/org/springframework/integration/jdbc/lock/JdbcLockRegistry.java#L102
 * https://github.com/spring-projects/spring-integration/blob/master/spring-integration-zookeeper/src/main/java/org/springframework/integration/zookeeper/lock/ZookeeperLockRegistry.java#L216
 *
 * The advisory lock is session scoped, so the handle that acquired it stays open until the lock is released.
 */
@Slf4j
public class PostgresAdvisoryLock implements Lock {

    private static final Duration DEFAULT_IDLE_BETWEEN_TRIES = Duration.ofMillis(100);

    private final ReentrantLock delegate = new ReentrantLock();

    private final Jdbi jdbi;
    private final long key;
    private final Duration idleBetweenTries;

    private Handle session;

    public PostgresAdvisoryLock(final Jdbi jdbi, final long key) {
        this(jdbi, key, DEFAULT_IDLE_BETWEEN_TRIES);
    }

    public PostgresAdvisoryLock(@NonNull final Jdbi jdbi, final long key, @NonNull final Duration idleBetweenTries) {
        this.jdbi = jdbi;
        this.key = key;
        this.idleBetweenTries = idleBetweenTries;
    }

    /**
     * Derives the advisory lock key guarding the given ledger table, so that batches against different ledgers
     * never block each other.
     */
    public static long keyFor(@NonNull final MigrationTableConfiguration tableConfiguration) {
        final CRC32 crc = new CRC32();
        crc.update(tableConfiguration.getFullyQualifiedTableName().getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }

    public long getKey() {
        return this.key;
    }

    @Override
    public void lock() {
        this.delegate.lock();
        if (this.delegate.getHoldCount() > 1) {
            return;
        }

        boolean interrupted = false;
        while (true) {
            try {
                while (!doLock()) {
                    Thread.sleep(this.idleBetweenTries.toMillis());
                }
                break;
            } catch (InterruptedException e) {
                // uninterruptible; the interrupt is restored once the lock is held
                interrupted = true;
            } catch (Exception e) {
                this.releaseSession();
                this.delegate.unlock();
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
                rethrowAsLockException(e);
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void lockInterruptibly() throws InterruptedException {
        this.delegate.lockInterruptibly();
        if (this.delegate.getHoldCount() > 1) {
            return;
        }

        while (true) {
            try {
                while (!doLock()) {
                    Thread.sleep(this.idleBetweenTries.toMillis());
                    if (Thread.currentThread().isInterrupted()) {
                        throw new InterruptedException();
                    }
                }
                break;
            } catch (InterruptedException ie) {
                this.releaseSession();
                this.delegate.unlock();
                Thread.currentThread().interrupt();
                throw ie;
            } catch (Exception e) {
                this.releaseSession();
                this.delegate.unlock();
                rethrowAsLockException(e);
            }
        }
    }

    @Override
    public boolean tryLock() {
        try {
            return tryLock(0, TimeUnit.MICROSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public boolean tryLock(long time, TimeUnit timeUnit) throws InterruptedException {
        long now = System.currentTimeMillis();

        if (!this.delegate.tryLock(time, timeUnit)) {
            return false;
        }

        if (this.delegate.getHoldCount() > 1) {
            return true;
        }

        long expire = now + TimeUnit.MILLISECONDS.convert(time, timeUnit);

        boolean acquired;
        try {
            while (!(acquired = doLock()) && System.currentTimeMillis() < expire) {
                Thread.sleep(this.idleBetweenTries.toMillis());
            }

            if (!acquired) {
                log.info("Advisory lock [{}] not acquired within [{}] {}", this.key, time, timeUnit);
                this.releaseSession();
                this.delegate.unlock();
            }

            return acquired;
        } catch (InterruptedException ie) {
            this.releaseSession();
            this.delegate.unlock();
            throw ie;
        } catch (Exception e) {
            this.releaseSession();
            this.delegate.unlock();
            throw rethrowAsLockException(e);
        }
    }

    @Override
    public void unlock() {
        if (!this.delegate.isHeldByCurrentThread()) {
            throw new IllegalMonitorStateException("You do not own mutex");
        }

        if (this.delegate.getHoldCount() > 1) {
            this.delegate.unlock();
            return;
        }

        try {
            log.info("Releasing advisory lock [{}]", this.key);
            this.session.createQuery("SELECT pg_advisory_unlock(:key)")
                    .bind("key", this.key)
                    .mapTo(Boolean.class)
                    .one();
        } catch (Exception e) {
            throw new MigrationLockException(String.format("Failed to release advisory lock [%d]", this.key), e);
        } finally {
            this.releaseSession();
            this.delegate.unlock();
        }
    }

    @Override
    public Condition newCondition() {
        throw new UnsupportedOperationException("Conditions are not supported");
    }

    private boolean doLock() {
        if (this.session == null) {
            this.session = this.jdbi.open();
        }

        final boolean acquired = this.session.createQuery("SELECT pg_try_advisory_lock(:key)")
                .bind("key", this.key)
                .mapTo(Boolean.class)
                .one();

        if (acquired) {
            log.info("Acquired advisory lock [{}]", this.key);
        } else {
            log.debug("Advisory lock [{}] is held by another session", this.key);
        }

        return acquired;
    }

    // closing the session also drops any advisory lock it still holds
    private void releaseSession() {
        if (this.session == null) {
            return;
        }

        try {
            this.session.close();
        } catch (Exception e) {
            log.warn("Failed to close advisory lock session for key [{}]", this.key, e);
        } finally {
            this.session = null;
        }
    }

    private MigrationLockException rethrowAsLockException(Exception e) {
        throw new MigrationLockException(String.format("Failed to lock advisory lock [%d]", this.key), e);
    }
}
