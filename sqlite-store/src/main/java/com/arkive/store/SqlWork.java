package com.arkive.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of work run against the store connection by {@link SqliteStore}.
 */
@FunctionalInterface
public interface SqlWork<T> {
    T apply(Connection connection) throws SQLException;
}
