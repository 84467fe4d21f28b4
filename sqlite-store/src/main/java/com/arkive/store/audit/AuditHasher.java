package com.arkive.store.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical serialization and digest of audit rows.
 * <p>
 * The digest covers every persisted column except {@code sequence_id} and {@code current_hash}, taken in a fixed
 * order and in the exact text form they are stored in, so verification can recompute it from a raw row.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuditHasher {

    public static final String GENESIS_HASH = "0".repeat(64);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    /**
     * Metadata as stored: a JSON object with keys sorted at every level.
     */
    public static String canonicalMetadata(Map<String, Object> metadata) throws JsonProcessingException {
        return CANONICAL_MAPPER.writeValueAsString(metadata == null ? Map.of() : metadata);
    }

    public static Map<String, Object> readMetadata(String json) throws JsonProcessingException {
        return CANONICAL_MAPPER.readValue(json, METADATA_TYPE);
    }

    public static String digest(ChainLink link) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("id", link.id());
        canonical.put("user_id", link.userId());
        canonical.put("username", link.username());
        canonical.put("action", link.action());
        canonical.put("resource_type", link.resourceType());
        canonical.put("resource_id", link.resourceId());
        canonical.put("resource_name", link.resourceName());
        canonical.put("metadata", link.metadata());
        canonical.put("timestamp", link.timestamp());
        canonical.put("is_success", link.success());
        canonical.put("previous_hash", link.previousHash());
        try {
            byte[] bytes = CANONICAL_MAPPER.writeValueAsBytes(canonical);
            return HexFormat.of().formatHex(sha256().digest(bytes));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize audit entry " + link.id(), e);
        }
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Hashed columns of one audit row, in their stored text form.
     */
    public record ChainLink(String id, String userId, String username, String action, String resourceType,
                            String resourceId, String resourceName, String metadata, String timestamp,
                            boolean success, String previousHash) {
    }
}
