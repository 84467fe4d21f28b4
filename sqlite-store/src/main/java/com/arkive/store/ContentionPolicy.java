package com.arkive.store;

import com.arkive.spi.exceptions.ContentionException;
import com.arkive.spi.exceptions.StorageException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.time.Duration;

import static com.arkive.store.MetricConstants.CONTENTION_RETRY_METRIC;

/**
 * Retry policy for lock contention, shared by every caller of the store.
 * <p>
 * A call failing with {@code SQLITE_BUSY} or {@code SQLITE_LOCKED} is attempted again up to {@code maxAttempts}
 * times in total, sleeping {@code backoffStep * n} before the n-th retry. Every other {@link SQLException} is
 * surfaced at once as a {@link StorageException}.
 */
@Slf4j
public class ContentionPolicy {

    public static final int SQLITE_BUSY = 5;
    public static final int SQLITE_LOCKED = 6;

    @Getter
    private final int maxAttempts;
    @Getter
    private final Duration backoffStep;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;

    public ContentionPolicy(int maxAttempts, Duration backoffStep, MeterRegistry meterRegistry) {
        this(maxAttempts, backoffStep, meterRegistry, duration -> Thread.sleep(duration.toMillis()));
    }

    public ContentionPolicy(int maxAttempts, Duration backoffStep, MeterRegistry meterRegistry, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoffStep = backoffStep;
        this.meterRegistry = meterRegistry;
        this.sleeper = sleeper;
    }

    public <T> T run(SqlCall<T> call) {
        SQLException lastContention = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                pause(attempt - 1, lastContention);
            }
            try {
                return call.call();
            } catch (SQLException e) {
                if (!isContention(e)) {
                    throw new StorageException(e.getMessage(), e);
                }
                lastContention = e;
                meterRegistry.counter(CONTENTION_RETRY_METRIC).increment();
                log.warn("store busy on attempt {}/{}: {}", attempt, maxAttempts, e.getMessage());
            }
        }
        throw new ContentionException(maxAttempts, lastContention);
    }

    private void pause(int retry, SQLException lastContention) {
        try {
            sleeper.sleep(backoffStep.multipliedBy(retry));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ContentionException contentionException = new ContentionException(retry, lastContention);
            contentionException.addSuppressed(e);
            throw contentionException;
        }
    }

    /**
     * True if {@code e} or one of its causes carries a busy or locked primary result code.
     */
    public static boolean isContention(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sqlException) {
                int primaryCode = sqlException.getErrorCode() & 0xff;
                if (primaryCode == SQLITE_BUSY || primaryCode == SQLITE_LOCKED) {
                    return true;
                }
            }
        }
        return false;
    }

    @FunctionalInterface
    public interface SqlCall<T> {
        T call() throws SQLException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
