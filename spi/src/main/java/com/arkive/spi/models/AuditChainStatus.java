package com.arkive.spi.models;

import com.arkive.spi.models.enums.ChainViolation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of a full chain verification.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditChainStatus {

    private boolean valid;

    /**
     * Number of entries examined. On failure this counts the entries up to and including the offending one.
     */
    private long totalEntries;

    /**
     * Sequence id of the first entry that failed a check, null when the chain is valid.
     */
    private Long firstInvalidSequenceId;

    private ChainViolation violation;

    /**
     * Human readable description of the violation.
     */
    private String reason;

    private Instant firstEntryAt;

    private Instant lastEntryAt;
}
