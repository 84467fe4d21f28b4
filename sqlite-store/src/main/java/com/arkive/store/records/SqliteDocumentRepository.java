package com.arkive.store.records;

import com.arkive.spi.models.Document;
import com.arkive.spi.models.DocumentStats;
import com.arkive.spi.repositories.DocumentRepository;
import com.arkive.store.SqliteStore;
import com.arkive.store.SqliteTimestamps;
import lombok.AllArgsConstructor;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@AllArgsConstructor
public class SqliteDocumentRepository implements DocumentRepository {

    private static final String COLUMNS = "d.id, d.user_id, d.name, d.file_path, d.file_type, d.file_size, d.category, "
            + "d.is_active, d.created_at, d.updated_at";

    private final SqliteStore store;
    private final Clock clock;

    @Override
    public Document create(Document document) {
        Instant now = SqliteTimestamps.truncate(clock.instant());
        Document created = document.toBuilder()
                .id(document.getId() == null ? UUID.randomUUID().toString() : document.getId())
                .category(document.getCategory() == null ? Document.DEFAULT_CATEGORY : document.getCategory())
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO documents (id, user_id, name, file_path, file_type, file_size, category, is_active, created_at, updated_at) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?, 1, ?, ?)")) {
                statement.setString(1, created.getId());
                statement.setString(2, created.getUserId());
                statement.setString(3, created.getName());
                statement.setString(4, created.getFilePath());
                statement.setString(5, created.getFileType());
                statement.setLong(6, created.getFileSize());
                statement.setString(7, created.getCategory());
                statement.setString(8, SqliteTimestamps.format(now));
                statement.setString(9, SqliteTimestamps.format(now));
                statement.executeUpdate();
                return created;
            }
        });
    }

    @Override
    public Optional<Document> findById(String id) {
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT " + COLUMNS + " FROM documents d WHERE d.id = ?")) {
                statement.setString(1, id);
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() ? Optional.of(toDocument(resultSet)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<Document> findActiveByUser(String userId) {
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM documents d WHERE d.user_id = ? AND d.is_active = 1 ORDER BY d.created_at DESC")) {
                statement.setString(1, userId);
                return readAll(statement);
            }
        });
    }

    @Override
    public boolean softDelete(String id, String userId) {
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE documents SET is_active = 0, updated_at = ? WHERE id = ? AND user_id = ? AND is_active = 1")) {
                statement.setString(1, SqliteTimestamps.format(clock.instant()));
                statement.setString(2, id);
                statement.setString(3, userId);
                return statement.executeUpdate() == 1;
            }
        });
    }

    @Override
    public boolean hardDelete(String id, String userId) {
        return store.executeInTransaction(connection -> {
            try (PreparedStatement owned = connection.prepareStatement("SELECT 1 FROM documents WHERE id = ? AND user_id = ?")) {
                owned.setString(1, id);
                owned.setString(2, userId);
                try (ResultSet resultSet = owned.executeQuery()) {
                    if (!resultSet.next()) {
                        return false;
                    }
                }
            }
            try (PreparedStatement content = connection.prepareStatement("DELETE FROM document_search WHERE document_id = ?")) {
                content.setString(1, id);
                content.executeUpdate();
            }
            try (PreparedStatement document = connection.prepareStatement("DELETE FROM documents WHERE id = ? AND user_id = ?")) {
                document.setString(1, id);
                document.setString(2, userId);
                return document.executeUpdate() == 1;
            }
        });
    }

    @Override
    public List<Document> search(String userId, String query, int limit) {
        String pattern = "%" + escapeLike(query.toLowerCase(Locale.ROOT)) + "%";
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT " + COLUMNS + " FROM documents d LEFT JOIN document_search s ON s.document_id = d.id "
                            + "WHERE d.user_id = ? AND d.is_active = 1 "
                            + "AND (lower(d.name) LIKE ? ESCAPE '\\' OR lower(s.extracted_text) LIKE ? ESCAPE '\\') "
                            + "ORDER BY d.created_at DESC LIMIT ?")) {
                statement.setString(1, userId);
                statement.setString(2, pattern);
                statement.setString(3, pattern);
                statement.setInt(4, limit);
                return readAll(statement);
            }
        });
    }

    @Override
    public DocumentStats stats(String userId) {
        Instant startOfDay = LocalDate.now(clock).atStartOfDay(ZoneOffset.UTC).toInstant();
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT COUNT(*), "
                            + "COALESCE(SUM(CASE WHEN created_at >= ? THEN 1 ELSE 0 END), 0), "
                            + "COALESCE(SUM(CASE WHEN is_active = 1 THEN file_size ELSE 0 END), 0), "
                            + "COALESCE(SUM(is_active), 0) "
                            + "FROM documents WHERE user_id = ?")) {
                statement.setString(1, SqliteTimestamps.format(startOfDay));
                statement.setString(2, userId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    resultSet.next();
                    return new DocumentStats(resultSet.getLong(1), resultSet.getLong(2), resultSet.getLong(3), resultSet.getLong(4));
                }
            }
        });
    }

    static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private List<Document> readAll(PreparedStatement statement) throws SQLException {
        try (ResultSet resultSet = statement.executeQuery()) {
            List<Document> documents = new ArrayList<>();
            while (resultSet.next()) {
                documents.add(toDocument(resultSet));
            }
            return documents;
        }
    }

    private Document toDocument(ResultSet resultSet) throws SQLException {
        return Document.builder()
                .id(resultSet.getString("id"))
                .userId(resultSet.getString("user_id"))
                .name(resultSet.getString("name"))
                .filePath(resultSet.getString("file_path"))
                .fileType(resultSet.getString("file_type"))
                .fileSize(resultSet.getLong("file_size"))
                .category(resultSet.getString("category"))
                .active(resultSet.getInt("is_active") != 0)
                .createdAt(SqliteTimestamps.parse(resultSet.getString("created_at")))
                .updatedAt(SqliteTimestamps.parse(resultSet.getString("updated_at")))
                .build();
    }
}
