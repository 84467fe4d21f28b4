package com.arkive.spi.exceptions;

/**
 * Why an integrity validation failed.
 */
public enum ValidationFailure {
    MISSING_ARCHIVE,
    INVALID_ARCHIVE,
    MISSING_ENTRY,
    INVALID_MANIFEST,
    CHECKSUM_MISMATCH,
    CORRUPT_DATABASE,
    MISSING_TABLE,
    UNSAFE_ENTRY
}
