package com.arkive.spi.models.enums;

/**
 * The check an audit entry failed during chain verification.
 */
public enum ChainViolation {
    /**
     * Sequence id is not the next expected value.
     */
    SEQUENCE_GAP,
    /**
     * Previous hash does not equal the current hash of the prior entry.
     */
    BROKEN_LINK,
    /**
     * Recomputed digest differs from the stored current hash.
     */
    HASH_MISMATCH
}
