package com.arkive.store;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Connection pragmas and DDL of the store. Every statement is safe to run against an already initialized file.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class StoreSchema {

    public static final List<String> REQUIRED_TABLES = List.of("users", "documents", "activities", "audit_logs");

    public static final String NO_UPDATE_TRIGGER = "audit_logs_no_update";
    public static final String NO_DELETE_TRIGGER = "audit_logs_no_delete";

    private static final List<String> DDL = List.of(
            """
            CREATE TABLE IF NOT EXISTS users (
                id TEXT PRIMARY KEY,
                username TEXT NOT NULL UNIQUE,
                email TEXT NOT NULL UNIQUE,
                password_hash TEXT NOT NULL,
                created_at TEXT NOT NULL,
                last_login TEXT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS documents (
                id TEXT PRIMARY KEY,
                user_id TEXT NOT NULL REFERENCES users(id),
                name TEXT NOT NULL,
                file_path TEXT NOT NULL,
                file_type TEXT,
                file_size INTEGER NOT NULL DEFAULT 0,
                category TEXT NOT NULL DEFAULT 'General',
                is_active INTEGER NOT NULL DEFAULT 1,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS activities (
                id TEXT PRIMARY KEY,
                user_id TEXT NOT NULL,
                action TEXT NOT NULL,
                resource_type TEXT,
                resource_id TEXT,
                details TEXT,
                created_at TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS document_search (
                document_id TEXT PRIMARY KEY REFERENCES documents(id) ON DELETE CASCADE,
                extracted_text TEXT,
                document_type TEXT,
                fields TEXT NOT NULL DEFAULT '{}',
                indexed_at TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS audit_logs (
                sequence_id INTEGER PRIMARY KEY AUTOINCREMENT,
                id TEXT NOT NULL UNIQUE,
                user_id TEXT NOT NULL,
                username TEXT NOT NULL,
                action TEXT NOT NULL,
                resource_type TEXT NOT NULL,
                resource_id TEXT,
                resource_name TEXT,
                metadata TEXT NOT NULL,
                timestamp TEXT NOT NULL,
                is_success INTEGER NOT NULL,
                previous_hash TEXT NOT NULL,
                current_hash TEXT NOT NULL
            )
            """,
            """
            CREATE TRIGGER IF NOT EXISTS audit_logs_no_update BEFORE UPDATE ON audit_logs
            BEGIN
                SELECT RAISE(ABORT, 'audit_logs is append-only: UPDATE rejected');
            END
            """,
            """
            CREATE TRIGGER IF NOT EXISTS audit_logs_no_delete BEFORE DELETE ON audit_logs
            BEGIN
                SELECT RAISE(ABORT, 'audit_logs is append-only: DELETE rejected');
            END
            """,
            "CREATE INDEX IF NOT EXISTS idx_documents_user ON documents(user_id, is_active)",
            "CREATE INDEX IF NOT EXISTS idx_activities_user ON activities(user_id, created_at)",
            "CREATE INDEX IF NOT EXISTS idx_audit_logs_user ON audit_logs(user_id)",
            "CREATE INDEX IF NOT EXISTS idx_audit_logs_action ON audit_logs(action)",
            "CREATE INDEX IF NOT EXISTS idx_audit_logs_timestamp ON audit_logs(timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_audit_logs_resource ON audit_logs(resource_type, resource_id)"
    );

    public static void configure(Connection connection, StoreProperties properties) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode = WAL");
            statement.execute("PRAGMA synchronous = NORMAL");
            statement.execute("PRAGMA busy_timeout = " + properties.getBusyTimeoutMillis());
            statement.execute("PRAGMA temp_store = MEMORY");
            statement.execute("PRAGMA cache_size = " + properties.getCacheSizePages());
            statement.execute("PRAGMA wal_autocheckpoint = " + properties.getWalAutocheckpointPages());
            statement.execute("PRAGMA foreign_keys = ON");
        }
    }

    public static void apply(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String ddl : DDL) {
                statement.execute(ddl);
            }
        }
    }
}
