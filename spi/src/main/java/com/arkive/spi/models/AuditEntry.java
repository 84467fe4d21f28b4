package com.arkive.spi.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One committed row of the audit trail.
 * <p>
 * Entries are immutable once the store has accepted them. The store assigns {@code sequenceId}; every other
 * field, {@code previousHash} included, feeds the digest stored in {@code currentHash}, so altering any
 * committed entry breaks the chain from that entry onwards.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AuditEntry {

    /**
     * Position in the chain, assigned by the store at insert time. Starts at 1, gap-free, never reused.
     */
    private Long sequenceId;

    /**
     * Externally visible token used by callers to correlate an entry. Independent of {@code sequenceId}.
     */
    private String id;

    /**
     * Identifier of the principal that performed the action.
     */
    private String userId;

    /**
     * Display name of the principal at the time of the action.
     */
    private String username;

    /**
     * Name of the {@link com.arkive.spi.models.enums.AuditAction} performed.
     */
    private String action;

    /**
     * Kind of resource the action touched, e.g. "DOCUMENT" or "SYSTEM".
     */
    private String resourceType;

    private String resourceId;

    private String resourceName;

    /**
     * Free-form structured payload. Persisted as JSON with keys in sorted order.
     */
    private Map<String, Object> metadata;

    /**
     * UTC time of the action, millisecond precision.
     */
    private Instant timestamp;

    private boolean success;

    /**
     * {@code currentHash} of the entry with {@code sequenceId - 1}, or the all-zero genesis value for the first entry.
     */
    private String previousHash;

    /**
     * Lowercase hex SHA-256 over the canonical form of all other fields except {@code sequenceId}.
     */
    private String currentHash;
}
