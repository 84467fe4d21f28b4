package com.arkive.models.dto.response;

import com.arkive.spi.models.AuditEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of audit entries, newest first.
 */
@Value
@Builder
@AllArgsConstructor
public class AuditLogPage {

    List<AuditEntry> entries;

    /**
     * Entries matching the filters across all pages.
     */
    long total;

    /**
     * 1-based page number.
     */
    int page;

    int limit;

    long totalPages;
}
