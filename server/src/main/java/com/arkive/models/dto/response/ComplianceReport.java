package com.arkive.models.dto.response;

import com.arkive.spi.models.AuditChainStatus;
import com.arkive.spi.models.AuditEntry;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit export handed to compliance reviewers.
 */
@Value
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComplianceReport {

    Instant exportDate;

    String exportedBy;

    long totalEntries;

    /**
     * Result of verifying the whole chain at export time, not only the exported entries.
     */
    AuditChainStatus chainStatus;

    /**
     * Filters the export was taken with. Absent filters are omitted.
     */
    Map<String, String> filters;

    List<AuditEntry> entries;

    /**
     * Hex SHA-256 of the JSON serialization of {@code entries}, so a reviewer can detect edits to the export.
     */
    String entriesSha256;
}
