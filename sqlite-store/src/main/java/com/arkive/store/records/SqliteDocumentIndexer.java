package com.arkive.store.records;

import com.arkive.spi.DocumentIndexer;
import com.arkive.spi.exceptions.StorageException;
import com.arkive.spi.models.DocumentSearchContent;
import com.arkive.store.SqliteStore;
import com.arkive.store.SqliteTimestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the {@code document_search} table. One row per document, replaced on every index call.
 */
@Slf4j
@AllArgsConstructor
public class SqliteDocumentIndexer implements DocumentIndexer {

    private static final TypeReference<Map<String, String>> FIELDS_TYPE = new TypeReference<>() {
    };

    private static final String UPSERT_SQL = """
            INSERT INTO document_search (document_id, extracted_text, document_type, fields, indexed_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT(document_id) DO UPDATE SET
                extracted_text = excluded.extracted_text,
                document_type = excluded.document_type,
                fields = excluded.fields,
                indexed_at = excluded.indexed_at
            """;

    private final SqliteStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void index(String documentId, String extractedText, String documentType, Map<String, String> fields) {
        String fieldsJson;
        try {
            fieldsJson = objectMapper.writeValueAsString(fields == null ? Map.of() : fields);
        } catch (JsonProcessingException e) {
            throw new StorageException("cannot serialize fields of document " + documentId, e);
        }
        store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(UPSERT_SQL)) {
                statement.setString(1, documentId);
                statement.setString(2, extractedText);
                statement.setString(3, documentType);
                statement.setString(4, fieldsJson);
                statement.setString(5, SqliteTimestamps.format(clock.instant()));
                return statement.executeUpdate();
            }
        });
        log.debug("indexed document {} as {}", documentId, documentType);
    }

    public Optional<DocumentSearchContent> findContent(String documentId) {
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT document_id, extracted_text, document_type, fields, indexed_at FROM document_search WHERE document_id = ?")) {
                statement.setString(1, documentId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.empty();
                    }
                    Map<String, String> fields;
                    try {
                        fields = objectMapper.readValue(resultSet.getString("fields"), FIELDS_TYPE);
                    } catch (JsonProcessingException e) {
                        throw new StorageException("unreadable fields of document " + documentId, e);
                    }
                    return Optional.of(new DocumentSearchContent(
                            resultSet.getString("document_id"),
                            resultSet.getString("extracted_text"),
                            resultSet.getString("document_type"),
                            fields,
                            SqliteTimestamps.parse(resultSet.getString("indexed_at"))));
                }
            }
        });
    }
}
