package com.arkive.store.audit;

import com.arkive.spi.AuditTrail;
import com.arkive.spi.exceptions.AuditWriteException;
import com.arkive.spi.exceptions.StorageException;
import com.arkive.spi.models.Actor;
import com.arkive.spi.models.AuditChainStatus;
import com.arkive.spi.models.AuditEntry;
import com.arkive.spi.models.AuditFilter;
import com.arkive.spi.models.AuditResource;
import com.arkive.spi.models.enums.AuditAction;
import com.arkive.spi.models.enums.ChainViolation;
import com.arkive.store.SqliteStore;
import com.arkive.store.SqliteTimestamps;
import com.arkive.store.audit.AuditHasher.ChainLink;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.arkive.store.MetricConstants.ACTION_TAG;
import static com.arkive.store.MetricConstants.AUDIT_ERROR_METRIC;
import static com.arkive.store.MetricConstants.CHAIN_VIOLATION_METRIC;
import static com.arkive.store.MetricConstants.EXCEPTION_TAG;

/**
 * Hash-chained audit log kept in the {@code audit_logs} table. Rows are only ever inserted; the table triggers
 * reject UPDATE and DELETE.
 */
@Slf4j
@AllArgsConstructor
public class SqliteAuditTrail implements AuditTrail {

    private static final String COLUMNS = "sequence_id, id, user_id, username, action, resource_type, resource_id, "
            + "resource_name, metadata, timestamp, is_success, previous_hash, current_hash";

    private static final String INSERT_SQL = "INSERT INTO audit_logs (id, user_id, username, action, resource_type, "
            + "resource_id, resource_name, metadata, timestamp, is_success, previous_hash, current_hash) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final SqliteStore store;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Override
    public AuditEntry append(Actor actor, AuditAction action, AuditResource resource, Map<String, Object> metadata, boolean success) {
        Map<String, Object> safeMetadata = metadata == null ? Map.of() : metadata;
        String metadataJson;
        try {
            metadataJson = AuditHasher.canonicalMetadata(safeMetadata);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize metadata of audit entry {} for {}", action, actor.userId(), e);
            meterRegistry.counter(AUDIT_ERROR_METRIC, ACTION_TAG, action.name(), EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
            throw new AuditWriteException("audit metadata for " + action + " is not serializable", e);
        }
        Instant timestamp = SqliteTimestamps.truncate(clock.instant());
        try {
            return store.executeInTransaction(connection -> insert(connection, actor, action, resource, safeMetadata, metadataJson, timestamp, success));
        } catch (StorageException e) {
            log.error("Failed to append audit entry {} for {}", action, actor.userId(), e);
            meterRegistry.counter(AUDIT_ERROR_METRIC, ACTION_TAG, action.name(), EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
            throw new AuditWriteException("audit entry " + action + " was not recorded", e);
        }
    }

    private AuditEntry insert(Connection connection, Actor actor, AuditAction action, AuditResource resource,
                              Map<String, Object> metadata, String metadataJson, Instant timestamp, boolean success) throws SQLException {
        String previousHash = latestHash(connection);
        String id = UUID.randomUUID().toString();
        String timestampText = SqliteTimestamps.format(timestamp);
        ChainLink link = new ChainLink(id, actor.userId(), actor.username(), action.name(), resource.type(), resource.id(),
                resource.name(), metadataJson, timestampText, success, previousHash);
        String currentHash = AuditHasher.digest(link);

        try (PreparedStatement statement = connection.prepareStatement(INSERT_SQL)) {
            statement.setString(1, id);
            statement.setString(2, link.userId());
            statement.setString(3, link.username());
            statement.setString(4, link.action());
            statement.setString(5, link.resourceType());
            statement.setString(6, link.resourceId());
            statement.setString(7, link.resourceName());
            statement.setString(8, metadataJson);
            statement.setString(9, timestampText);
            statement.setInt(10, success ? 1 : 0);
            statement.setString(11, previousHash);
            statement.setString(12, currentHash);
            statement.executeUpdate();
        }
        long sequenceId;
        try (Statement statement = connection.createStatement();
                ResultSet resultSet = statement.executeQuery("SELECT last_insert_rowid()")) {
            resultSet.next();
            sequenceId = resultSet.getLong(1);
        }
        return AuditEntry.builder()
                .sequenceId(sequenceId)
                .id(id)
                .userId(link.userId())
                .username(link.username())
                .action(link.action())
                .resourceType(link.resourceType())
                .resourceId(link.resourceId())
                .resourceName(link.resourceName())
                .metadata(metadata)
                .timestamp(timestamp)
                .success(success)
                .previousHash(previousHash)
                .currentHash(currentHash)
                .build();
    }

    private String latestHash(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
                ResultSet resultSet = statement.executeQuery("SELECT current_hash FROM audit_logs ORDER BY sequence_id DESC LIMIT 1")) {
            return resultSet.next() ? resultSet.getString(1) : AuditHasher.GENESIS_HASH;
        }
    }

    @Override
    public AuditChainStatus verifyChain() {
        AuditChainStatus status = store.execute(this::scanChain);
        if (status.isValid()) {
            log.info("audit chain verified: {} entries", status.getTotalEntries());
        } else {
            log.warn("audit chain broken at sequence {}: {}", status.getFirstInvalidSequenceId(), status.getReason());
            meterRegistry.counter(CHAIN_VIOLATION_METRIC, "violation", status.getViolation().name()).increment();
        }
        return status;
    }

    private AuditChainStatus scanChain(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
                ResultSet resultSet = statement.executeQuery("SELECT " + COLUMNS + " FROM audit_logs ORDER BY sequence_id ASC")) {
            long expectedSequence = 1;
            String expectedPrevious = AuditHasher.GENESIS_HASH;
            Instant firstEntryAt = null;
            Instant lastEntryAt = null;
            while (resultSet.next()) {
                long sequenceId = resultSet.getLong("sequence_id");
                ChainLink link = readLink(resultSet);
                String storedHash = resultSet.getString("current_hash");
                lastEntryAt = parseTimestamp(sequenceId, link.timestamp());
                if (firstEntryAt == null) {
                    firstEntryAt = lastEntryAt;
                }
                ChainViolation violation = null;
                String reason = null;
                if (sequenceId != expectedSequence) {
                    violation = ChainViolation.SEQUENCE_GAP;
                    reason = "expected sequence " + expectedSequence + " but found " + sequenceId;
                } else if (!expectedPrevious.equals(link.previousHash())) {
                    violation = ChainViolation.BROKEN_LINK;
                    reason = "previous hash of entry " + sequenceId + " does not match entry " + (sequenceId - 1);
                } else if (!AuditHasher.digest(link).equals(storedHash)) {
                    violation = ChainViolation.HASH_MISMATCH;
                    reason = "content of entry " + sequenceId + " does not match its hash";
                }
                if (violation != null) {
                    return AuditChainStatus.builder()
                            .valid(false)
                            .totalEntries(expectedSequence)
                            .firstInvalidSequenceId(sequenceId)
                            .violation(violation)
                            .reason(reason)
                            .firstEntryAt(firstEntryAt)
                            .lastEntryAt(lastEntryAt)
                            .build();
                }
                expectedPrevious = storedHash;
                expectedSequence++;
            }
            return AuditChainStatus.builder()
                    .valid(true)
                    .totalEntries(expectedSequence - 1)
                    .firstEntryAt(firstEntryAt)
                    .lastEntryAt(lastEntryAt)
                    .build();
        }
    }

    private ChainLink readLink(ResultSet resultSet) throws SQLException {
        return new ChainLink(
                resultSet.getString("id"),
                resultSet.getString("user_id"),
                resultSet.getString("username"),
                resultSet.getString("action"),
                resultSet.getString("resource_type"),
                resultSet.getString("resource_id"),
                resultSet.getString("resource_name"),
                resultSet.getString("metadata"),
                resultSet.getString("timestamp"),
                resultSet.getInt("is_success") != 0,
                resultSet.getString("previous_hash"));
    }

    private Instant parseTimestamp(long sequenceId, String text) {
        try {
            return SqliteTimestamps.parse(text);
        } catch (DateTimeParseException e) {
            log.warn("audit entry {} has an unreadable timestamp '{}'", sequenceId, text);
            return null;
        }
    }

    @Override
    public List<AuditEntry> query(AuditFilter filter) {
        WhereClause where = WhereClause.of(filter);
        int limit = filter.getLimit() > 0 ? filter.getLimit() : AuditFilter.DEFAULT_LIMIT;
        String sql = "SELECT " + COLUMNS + " FROM audit_logs" + where.sql()
                + " ORDER BY sequence_id " + (filter.isAscending() ? "ASC" : "DESC") + " LIMIT ? OFFSET ?";
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                int index = where.bind(statement);
                statement.setInt(index++, limit);
                statement.setInt(index, Math.max(filter.getOffset(), 0));
                try (ResultSet resultSet = statement.executeQuery()) {
                    List<AuditEntry> entries = new ArrayList<>();
                    while (resultSet.next()) {
                        entries.add(toEntry(resultSet));
                    }
                    return entries;
                }
            }
        });
    }

    @Override
    public long count(AuditFilter filter) {
        WhereClause where = WhereClause.of(filter);
        return store.execute(connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM audit_logs" + where.sql())) {
                where.bind(statement);
                try (ResultSet resultSet = statement.executeQuery()) {
                    resultSet.next();
                    return resultSet.getLong(1);
                }
            }
        });
    }

    private AuditEntry toEntry(ResultSet resultSet) throws SQLException {
        long sequenceId = resultSet.getLong("sequence_id");
        ChainLink link = readLink(resultSet);
        Map<String, Object> metadata;
        try {
            metadata = AuditHasher.readMetadata(link.metadata());
        } catch (JsonProcessingException e) {
            throw new StorageException("unreadable metadata in audit entry " + sequenceId, e);
        }
        return AuditEntry.builder()
                .sequenceId(sequenceId)
                .id(link.id())
                .userId(link.userId())
                .username(link.username())
                .action(link.action())
                .resourceType(link.resourceType())
                .resourceId(link.resourceId())
                .resourceName(link.resourceName())
                .metadata(metadata)
                .timestamp(parseTimestamp(sequenceId, link.timestamp()))
                .success(link.success())
                .previousHash(link.previousHash())
                .currentHash(resultSet.getString("current_hash"))
                .build();
    }

    private record WhereClause(String sql, List<String> params) {

        static WhereClause of(AuditFilter filter) {
            List<String> conditions = new ArrayList<>();
            List<String> params = new ArrayList<>();
            add(conditions, params, "user_id = ?", filter.getUserId());
            add(conditions, params, "action = ?", filter.getAction());
            add(conditions, params, "resource_type = ?", filter.getResourceType());
            add(conditions, params, "resource_id = ?", filter.getResourceId());
            add(conditions, params, "timestamp >= ?", SqliteTimestamps.formatCeiling(filter.getStartDate()));
            add(conditions, params, "timestamp <= ?", SqliteTimestamps.format(filter.getEndDate()));
            String sql = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
            return new WhereClause(sql, params);
        }

        private static void add(List<String> conditions, List<String> params, String condition, String value) {
            if (value != null) {
                conditions.add(condition);
                params.add(value);
            }
        }

        int bind(PreparedStatement statement) throws SQLException {
            int index = 1;
            for (String param : params) {
                statement.setString(index++, param);
            }
            return index;
        }
    }
}
