package com.arkive.service.impl;

import com.arkive.audit.AuditRecorder;
import com.arkive.models.dto.response.AuditLogPage;
import com.arkive.models.dto.response.ComplianceReport;
import com.arkive.service.utils.AuthnUtil;
import com.arkive.spi.AuditTrail;
import com.arkive.spi.models.Actor;
import com.arkive.spi.models.AuditChainStatus;
import com.arkive.spi.models.AuditEntry;
import com.arkive.spi.models.AuditFilter;
import com.arkive.spi.models.AuditResource;
import com.arkive.spi.models.enums.AuditAction;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AuditServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123Z");
    private static final Actor AUDITOR = new Actor("u-7", "auditor");

    private final AuditTrail auditTrail = mock();
    private final AuditRecorder auditRecorder = mock();
    private final AuthnUtil authnUtil = mock();
    private final AuditServiceImpl auditService = new AuditServiceImpl(auditTrail, auditRecorder, authnUtil,
            new ObjectMapper().registerModule(new JavaTimeModule()), Clock.fixed(NOW, ZoneOffset.UTC));

    @BeforeEach
    void setUp() {
        when(authnUtil.currentActor()).thenReturn(AUDITOR);
    }

    @Test
    void listAuditLogs_TranslatesPageToOffset() {
        // Given
        AuditFilter filter = AuditFilter.builder().action("LOGIN").build();
        when(auditTrail.query(any())).thenReturn(List.of(entry(5), entry(4)));
        when(auditTrail.count(filter)).thenReturn(5L);

        // When
        AuditLogPage page = auditService.listAuditLogs(filter, 2, 2);

        // Then
        ArgumentCaptor<AuditFilter> captor = ArgumentCaptor.forClass(AuditFilter.class);
        verify(auditTrail).query(captor.capture());
        assertThat(captor.getValue().getOffset()).isEqualTo(2);
        assertThat(captor.getValue().getLimit()).isEqualTo(2);
        assertThat(captor.getValue().isAscending()).isFalse();
        assertThat(captor.getValue().getAction()).isEqualTo("LOGIN");
        assertThat(page.getTotal()).isEqualTo(5);
        assertThat(page.getTotalPages()).isEqualTo(3);
        assertThat(page.getEntries()).hasSize(2);
    }

    @Test
    void exportAuditLogs_ReportsChainStatusAndAuditsTheExport() {
        // Given
        AuditFilter filter = AuditFilter.builder().userId("u-1").startDate(Instant.parse("2024-04-01T00:00:00Z")).build();
        AuditChainStatus status = AuditChainStatus.builder().valid(true).totalEntries(2).build();
        when(auditTrail.query(any())).thenReturn(List.of(entry(1), entry(2)));
        when(auditTrail.verifyChain()).thenReturn(status);

        // When
        ComplianceReport report = auditService.exportAuditLogs(filter);

        // Then
        ArgumentCaptor<AuditFilter> captor = ArgumentCaptor.forClass(AuditFilter.class);
        verify(auditTrail).query(captor.capture());
        assertThat(captor.getValue().isAscending()).isTrue();
        assertThat(captor.getValue().getLimit()).isEqualTo(AuditServiceImpl.MAX_EXPORT_ENTRIES + 1);
        assertThat(report.getExportDate()).isEqualTo(NOW);
        assertThat(report.getExportedBy()).isEqualTo("auditor");
        assertThat(report.getTotalEntries()).isEqualTo(2);
        assertThat(report.getChainStatus()).isSameAs(status);
        assertThat(report.getFilters()).containsEntry("user_id", "u-1").containsEntry("start_date", "2024-04-01T00:00:00Z").hasSize(2);
        assertThat(report.getEntriesSha256()).matches("[0-9a-f]{64}");
        verify(auditRecorder).success(AUDITOR, AuditAction.EXPORT_AUDIT, AuditResource.of(AuditResource.AUDIT_LOG, null, null),
                Map.of("entries", 2, "chain_valid", true));
    }

    @Test
    void listAuditLogs_PageBeyondTheEndIsEmpty() {
        // Given
        when(auditTrail.count(any())).thenReturn(5L);

        // When
        AuditLogPage page = auditService.listAuditLogs(AuditFilter.all(), Integer.MAX_VALUE, 500);

        // Then
        assertThat(page.getEntries()).isEmpty();
        assertThat(page.getPage()).isEqualTo(Integer.MAX_VALUE);
        assertThat(page.getTotal()).isEqualTo(5);
        verify(auditTrail, never()).query(any());
    }

    @Test
    void exportAuditLogs_RejectsMoreEntriesThanTheCap() {
        // Given
        List<AuditEntry> tooMany = Collections.nCopies(AuditServiceImpl.MAX_EXPORT_ENTRIES + 1, entry(1));
        when(auditTrail.query(any())).thenReturn(tooMany);
        when(auditTrail.count(any())).thenReturn(AuditServiceImpl.MAX_EXPORT_ENTRIES + 5L);

        // When
        ResponseStatusException exception = assertThrows(ResponseStatusException.class, () -> auditService.exportAuditLogs(AuditFilter.all()));

        // Then
        assertThat(exception.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(exception.getReason()).contains("10005");
        verify(auditRecorder).failure(AUDITOR, AuditAction.EXPORT_AUDIT, AuditResource.of(AuditResource.AUDIT_LOG, null, null),
                Map.of("matching_entries", AuditServiceImpl.MAX_EXPORT_ENTRIES + 5L, "max_entries", AuditServiceImpl.MAX_EXPORT_ENTRIES));
        verify(auditRecorder, never()).success(any(), any(), any(), any());
        verify(auditTrail, never()).verifyChain();
    }

    @Test
    void exportAuditLogs_ExactlyAtTheCapIsComplete() {
        // Given
        when(auditTrail.query(any())).thenReturn(Collections.nCopies(AuditServiceImpl.MAX_EXPORT_ENTRIES, entry(1)));
        when(auditTrail.verifyChain()).thenReturn(AuditChainStatus.builder().valid(true).build());

        // When
        ComplianceReport report = auditService.exportAuditLogs(AuditFilter.all());

        // Then
        assertThat(report.getTotalEntries()).isEqualTo(AuditServiceImpl.MAX_EXPORT_ENTRIES);
        assertThat(report.getEntries()).hasSize(AuditServiceImpl.MAX_EXPORT_ENTRIES);
    }

    @Test
    void exportAuditLogs_DigestDependsOnEntries() {
        // Given
        when(auditTrail.verifyChain()).thenReturn(AuditChainStatus.builder().valid(true).build());
        when(auditTrail.query(any())).thenReturn(List.of(entry(1)), List.of(entry(2)));

        // When
        String first = auditService.exportAuditLogs(AuditFilter.all()).getEntriesSha256();
        String second = auditService.exportAuditLogs(AuditFilter.all()).getEntriesSha256();

        // Then
        assertThat(first).isNotEqualTo(second);
    }

    private static AuditEntry entry(long sequenceId) {
        return AuditEntry.builder()
                .sequenceId(sequenceId)
                .id("e-" + sequenceId)
                .userId("u-1")
                .username("alice")
                .action("LOGIN")
                .resourceType(AuditResource.SYSTEM)
                .metadata(Map.of())
                .timestamp(NOW)
                .success(true)
                .previousHash("0".repeat(64))
                .currentHash("a".repeat(64))
                .build();
    }
}
