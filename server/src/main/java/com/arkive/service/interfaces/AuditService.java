package com.arkive.service.interfaces;

import com.arkive.models.dto.response.AuditLogPage;
import com.arkive.models.dto.response.ComplianceReport;
import com.arkive.spi.models.AuditChainStatus;
import com.arkive.spi.models.AuditFilter;

public interface AuditService {

    /**
     * @param filter filters only, its limit and offset are derived from {@code page} and {@code limit}
     */
    AuditLogPage listAuditLogs(AuditFilter filter, int page, int limit);

    AuditChainStatus verifyChain();

    /**
     * Exports every entry matching {@code filter}, oldest first.
     *
     * @throws org.springframework.web.server.ResponseStatusException with 422 if more entries match than one export may hold
     */
    ComplianceReport exportAuditLogs(AuditFilter filter);
}
