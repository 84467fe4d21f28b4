package com.arkive.spi.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Filters accepted by {@link com.arkive.spi.AuditTrail#query(AuditFilter)}. Null fields do not filter.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AuditFilter {

    public static final int DEFAULT_LIMIT = 100;

    private String userId;
    private String action;
    private String resourceType;
    private String resourceId;

    /**
     * Inclusive lower bound on the entry timestamp.
     */
    private Instant startDate;

    /**
     * Inclusive upper bound on the entry timestamp.
     */
    private Instant endDate;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;

    private int offset;

    /**
     * Results are ordered by sequence id descending unless this is set.
     */
    private boolean ascending;

    public static AuditFilter all() {
        return AuditFilter.builder().build();
    }
}
