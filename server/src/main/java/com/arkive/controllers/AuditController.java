package com.arkive.controllers;

import com.arkive.models.dto.response.AuditLogPage;
import com.arkive.models.dto.response.ComplianceReport;
import com.arkive.models.dto.response.ResponseTemplate;
import com.arkive.service.interfaces.AuditService;
import com.arkive.spi.models.AuditChainStatus;
import com.arkive.spi.models.AuditFilter;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/v1/audit-logs")
@RequiredArgsConstructor
@Validated
public class AuditController {

    private static final int MAX_PAGE = 1_000_000;

    private final AuditService auditService;

    @Operation(summary = "Lists audit entries, newest first, with exact-match filters and an inclusive time range.")
    @GetMapping
    public ResponseTemplate<AuditLogPage> listAuditLogs(
            @RequestParam(name = "userId", required = false) @Size(max = 255) String userId,
            @RequestParam(name = "action", required = false) @Size(max = 64) String action,
            @RequestParam(name = "resourceType", required = false) @Size(max = 64) String resourceType,
            @RequestParam(name = "resourceId", required = false) @Size(max = 255) String resourceId,
            @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(name = "page", defaultValue = "1") @Min(1) @Max(MAX_PAGE) int page,
            @RequestParam(name = "limit", defaultValue = "50") @Min(1) @Max(500) int limit) {
        AuditFilter filter = filter(userId, action, resourceType, resourceId, startDate, endDate);
        return ResponseTemplate.success(auditService.listAuditLogs(filter, page, limit), "Successfully listed audit logs.");
    }

    @Operation(summary = "Re-verifies the whole hash chain and reports the first violation, if any.")
    @GetMapping("/verification")
    public ResponseTemplate<AuditChainStatus> verifyChain() {
        AuditChainStatus status = auditService.verifyChain();
        return ResponseTemplate.success(status, status.isValid() ? "Audit chain is intact." : "Audit chain is broken.");
    }

    @Operation(summary = "Exports matching audit entries as a JSON compliance report with the chain status and a digest.")
    @PostMapping("/export")
    public ResponseTemplate<ComplianceReport> exportAuditLogs(
            @RequestParam(name = "userId", required = false) @Size(max = 255) String userId,
            @RequestParam(name = "action", required = false) @Size(max = 64) String action,
            @RequestParam(name = "resourceType", required = false) @Size(max = 64) String resourceType,
            @RequestParam(name = "resourceId", required = false) @Size(max = 255) String resourceId,
            @RequestParam(name = "startDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(name = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate) {
        AuditFilter filter = filter(userId, action, resourceType, resourceId, startDate, endDate);
        return ResponseTemplate.success(auditService.exportAuditLogs(filter), "Successfully exported audit logs.");
    }

    private static AuditFilter filter(String userId, String action, String resourceType, String resourceId, Instant startDate, Instant endDate) {
        return AuditFilter.builder()
                .userId(userId)
                .action(action)
                .resourceType(resourceType)
                .resourceId(resourceId)
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }
}
