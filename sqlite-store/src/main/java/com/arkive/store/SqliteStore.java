package com.arkive.store;

import com.arkive.spi.exceptions.StorageException;
import com.arkive.spi.exceptions.StorageInitException;
import com.arkive.store.utils.CriticalSection;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owns the single SQLite connection of the application.
 * <p>
 * Every operation runs inside a critical section, so at most one logical operation touches the connection at a
 * time. Busy or locked failures are retried through the shared {@link ContentionPolicy}; the critical section is
 * left while the policy sleeps between attempts.
 */
@Slf4j
public class SqliteStore implements AutoCloseable {

    private static final String JDBC_PREFIX = "jdbc:sqlite:";

    private final StoreProperties properties;
    private final ContentionPolicy contentionPolicy;
    private final CriticalSection criticalSection = new CriticalSection();

    private volatile Path path;
    private Connection connection;

    public SqliteStore(StoreProperties properties, ContentionPolicy contentionPolicy) {
        this.properties = properties;
        this.contentionPolicy = contentionPolicy;
    }

    /**
     * Opens (creating if needed) the database at {@code path} and brings its schema up to date. Calling this
     * again on an initialized file leaves schema and data untouched.
     *
     * @throws StorageInitException if the location is not writable or the file is not a SQLite database
     */
    public void initialize(Path path) {
        try (var ignored = criticalSection.enter()) {
            if (connection != null) {
                closeConnection();
            }
            Path absolute = path.toAbsolutePath();
            this.connection = open(absolute);
            this.path = absolute;
            log.info("store initialized at {}", absolute);
        }
    }

    public <T> T execute(SqlWork<T> work) {
        return contentionPolicy.run(() -> {
            try (var ignored = criticalSection.enter()) {
                return work.apply(requireOpen());
            }
        });
    }

    /**
     * Runs {@code work} in one {@code BEGIN IMMEDIATE} transaction, committed when the work returns and rolled
     * back when it throws.
     */
    public <T> T executeInTransaction(SqlWork<T> work) {
        return contentionPolicy.run(() -> {
            try (var ignored = criticalSection.enter()) {
                Connection current = requireOpen();
                try (Statement statement = current.createStatement()) {
                    statement.execute("BEGIN IMMEDIATE");
                }
                try {
                    T result = work.apply(current);
                    try (Statement statement = current.createStatement()) {
                        statement.execute("COMMIT");
                    }
                    return result;
                } catch (SQLException | RuntimeException e) {
                    rollback(current, e);
                    throw e;
                }
            }
        });
    }

    /**
     * Flushes the write-ahead log into the main file and hands the file path to {@code work} while no other
     * operation can write.
     */
    public <T> T withCheckpointedSnapshot(Function<Path, T> work) {
        return contentionPolicy.run(() -> {
            try (var ignored = criticalSection.enter()) {
                checkpoint(requireOpen());
                return work.apply(path);
            }
        });
    }

    /**
     * Closes the connection, runs file level {@code work} on the database file and opens it again, re-applying
     * the schema.
     */
    public void runDetached(Consumer<Path> work) {
        try (var ignored = criticalSection.enter()) {
            requireOpen();
            closeConnection();
            RuntimeException failure = null;
            try {
                work.accept(path);
            } catch (RuntimeException e) {
                failure = e;
            }
            try {
                this.connection = open(path);
                log.info("store reopened at {}", path);
            } catch (StorageInitException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
            if (failure != null) {
                throw failure;
            }
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        try (var ignored = criticalSection.enter()) {
            if (connection != null) {
                closeConnection();
                log.info("store closed at {}", path);
            }
        }
    }

    private Connection open(Path target) {
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageInitException("cannot create directory for store " + target, e);
        }
        Connection opened = null;
        try {
            opened = DriverManager.getConnection(JDBC_PREFIX + target);
            StoreSchema.configure(opened, properties);
            StoreSchema.apply(opened);
            return opened;
        } catch (SQLException e) {
            if (opened != null) {
                try {
                    opened.close();
                } catch (SQLException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw new StorageInitException("cannot open store " + target + ": " + e.getMessage(), e);
        }
    }

    private void checkpoint(Connection current) throws SQLException {
        try (Statement statement = current.createStatement();
                ResultSet resultSet = statement.executeQuery("PRAGMA wal_checkpoint(TRUNCATE)")) {
            if (resultSet.next() && resultSet.getInt(1) != 0) {
                throw new SQLException("checkpoint blocked by a concurrent reader", null, ContentionPolicy.SQLITE_BUSY);
            }
        }
    }

    private void rollback(Connection current, Exception cause) {
        try (Statement statement = current.createStatement()) {
            statement.execute("ROLLBACK");
        } catch (SQLException e) {
            log.warn("rollback failed after {}", cause.getMessage(), e);
            cause.addSuppressed(e);
        }
    }

    private Connection requireOpen() {
        if (connection == null) {
            throw new StorageException("store is not initialized");
        }
        return connection;
    }

    private void closeConnection() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StorageException("failed to close store " + path, e);
        } finally {
            connection = null;
        }
    }
}
