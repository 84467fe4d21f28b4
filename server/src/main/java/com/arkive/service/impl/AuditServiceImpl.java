package com.arkive.service.impl;

import com.arkive.audit.AuditRecorder;
import com.arkive.models.dto.response.AuditLogPage;
import com.arkive.models.dto.response.ComplianceReport;
import com.arkive.service.interfaces.AuditService;
import com.arkive.service.utils.AuthnUtil;
import com.arkive.spi.AuditTrail;
import com.arkive.spi.models.Actor;
import com.arkive.spi.models.AuditChainStatus;
import com.arkive.spi.models.AuditEntry;
import com.arkive.spi.models.AuditFilter;
import com.arkive.spi.models.AuditResource;
import com.arkive.spi.models.enums.AuditAction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuditServiceImpl implements AuditService {

    /**
     * Upper bound on the entries in one export. Larger exports are rejected rather than cut short.
     */
    static final int MAX_EXPORT_ENTRIES = 10000;

    private final AuditTrail auditTrail;
    private final AuditRecorder auditRecorder;
    private final AuthnUtil authnUtil;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public AuditLogPage listAuditLogs(AuditFilter filter, int page, int limit) {
        long offset = (long) (page - 1) * limit;
        long total = auditTrail.count(filter);
        List<AuditEntry> entries = offset >= total
                ? List.of()
                : auditTrail.query(filter.toBuilder().limit(limit).offset((int) offset).ascending(false).build());
        return AuditLogPage.builder()
                .entries(entries)
                .total(total)
                .page(page)
                .limit(limit)
                .totalPages((total + limit - 1) / limit)
                .build();
    }

    @Override
    public AuditChainStatus verifyChain() {
        return auditTrail.verifyChain();
    }

    @Override
    public ComplianceReport exportAuditLogs(AuditFilter filter) {
        Actor actor = authnUtil.currentActor();
        List<AuditEntry> entries = auditTrail.query(filter.toBuilder().limit(MAX_EXPORT_ENTRIES + 1).offset(0).ascending(true).build());
        if (entries.size() > MAX_EXPORT_ENTRIES) {
            long matching = auditTrail.count(filter);
            auditRecorder.failure(actor, AuditAction.EXPORT_AUDIT, AuditResource.of(AuditResource.AUDIT_LOG, null, null),
                    Map.of("matching_entries", matching, "max_entries", MAX_EXPORT_ENTRIES));
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY,
                    "Export matches " + matching + " audit entries, at most " + MAX_EXPORT_ENTRIES + " can be exported at once. Narrow the filters.");
        }
        AuditChainStatus chainStatus = auditTrail.verifyChain();
        Instant exportDate = clock.instant();
        ComplianceReport report = ComplianceReport.builder()
                .exportDate(exportDate)
                .exportedBy(actor.username())
                .totalEntries(entries.size())
                .chainStatus(chainStatus)
                .filters(describe(filter))
                .entries(entries)
                .entriesSha256(digest(entries))
                .build();
        auditRecorder.success(actor, AuditAction.EXPORT_AUDIT, AuditResource.of(AuditResource.AUDIT_LOG, null, null),
                Map.of("entries", entries.size(), "chain_valid", chainStatus.isValid()));
        log.info("User {} exported {} audit entries", actor.username(), entries.size());
        return report;
    }

    private Map<String, String> describe(AuditFilter filter) {
        Map<String, String> filters = new LinkedHashMap<>();
        putIfPresent(filters, "user_id", filter.getUserId());
        putIfPresent(filters, "action", filter.getAction());
        putIfPresent(filters, "resource_type", filter.getResourceType());
        putIfPresent(filters, "resource_id", filter.getResourceId());
        putIfPresent(filters, "start_date", filter.getStartDate());
        putIfPresent(filters, "end_date", filter.getEndDate());
        return filters;
    }

    private static void putIfPresent(Map<String, String> filters, String key, Object value) {
        if (value != null) {
            filters.put(key, value.toString());
        }
    }

    private String digest(List<AuditEntry> entries) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(entries);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(json));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to digest audit export", e);
        }
    }
}
