package com.arkive.service.impl;

import com.arkive.audit.AuditRecorder;
import com.arkive.models.dto.response.BackupSummary;
import com.arkive.service.utils.AuthnUtil;
import com.arkive.spi.exceptions.IntegrityValidationException;
import com.arkive.spi.exceptions.ValidationFailure;
import com.arkive.spi.models.Actor;
import com.arkive.spi.models.AuditResource;
import com.arkive.spi.models.BackupManifest;
import com.arkive.spi.models.enums.AuditAction;
import com.arkive.store.BackupProperties;
import com.arkive.store.SqliteStore;
import com.arkive.store.backup.BackupManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BackupServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123Z");
    private static final Actor ADMIN = new Actor("u-1", "admin");

    @TempDir
    Path tempDir;

    private final BackupManager backupManager = mock();
    private final SqliteStore sqliteStore = mock();
    private final AuditRecorder auditRecorder = mock();
    private final AuthnUtil authnUtil = mock();
    private final BackupProperties backupProperties = new BackupProperties();
    private BackupServiceImpl backupService;

    @BeforeEach
    void setUp() {
        backupProperties.setDirectory(tempDir.resolve("backups").toString());
        backupProperties.setFilesRoot(tempDir.resolve("files").toString());
        backupProperties.setKeepCount(4);
        when(authnUtil.currentActor()).thenReturn(ADMIN);
        backupService = new BackupServiceImpl(backupManager, sqliteStore, backupProperties, auditRecorder, authnUtil, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void createBackup_NamesArchiveAfterClockAndAudits() throws IOException {
        // Given
        Path expected = tempDir.resolve("backups").resolve("arkive-backup-20240501-101530-123.zip");
        BackupManifest manifest = BackupManifest.builder().createdAt(NOW).filesCount(3).databaseSize(4096).checksum("c").build();
        when(backupManager.create(eq(sqliteStore), eq(tempDir.resolve("files")), eq(expected))).thenAnswer(invocation -> {
            Files.createDirectories(expected.getParent());
            Files.write(expected, new byte[]{1, 2, 3});
            return manifest;
        });

        // When
        BackupSummary summary = backupService.createBackup();

        // Then
        assertEquals("arkive-backup-20240501-101530-123.zip", summary.getFileName());
        assertEquals(3, summary.getArchiveSize());
        assertSame(manifest, summary.getManifest());
        verify(auditRecorder).success(ADMIN, AuditAction.BACKUP_CREATE,
                AuditResource.of(AuditResource.BACKUP, summary.getFileName(), summary.getFileName()),
                Map.of("files_count", 3, "database_size", 4096L));
    }

    @Test
    void restoreBackup_FailedVerificationIsAuditedAndRethrown() {
        // Given
        Path archive = tempDir.resolve("backups").resolve("old.zip");
        IntegrityValidationException failure = new IntegrityValidationException(ValidationFailure.CHECKSUM_MISMATCH, "checksum mismatch");
        when(backupManager.restore(sqliteStore, archive, tempDir.resolve("files"))).thenThrow(failure);

        // When
        IntegrityValidationException thrown = assertThrows(IntegrityValidationException.class, () -> backupService.restoreBackup("old.zip"));

        // Then
        assertSame(failure, thrown);
        verify(auditRecorder).failure(ADMIN, AuditAction.BACKUP_RESTORE, AuditResource.of(AuditResource.BACKUP, "old.zip", "old.zip"),
                Map.of("error", "checksum mismatch"));
        verify(auditRecorder, never()).success(any(), any(), any(), any());
    }

    @Test
    void restoreBackup_AuditsSuccess() {
        // Given
        Path archive = tempDir.resolve("backups").resolve("old.zip");
        when(backupManager.restore(sqliteStore, archive, tempDir.resolve("files")))
                .thenReturn(BackupManifest.builder().createdAt(NOW).filesCount(1).build());

        // When
        BackupManifest manifest = backupService.restoreBackup("old.zip");

        // Then
        assertEquals(NOW, manifest.getCreatedAt());
        verify(auditRecorder).success(ADMIN, AuditAction.BACKUP_RESTORE, AuditResource.of(AuditResource.BACKUP, "old.zip", "old.zip"),
                Map.of("backup_created_at", NOW.toString(), "files_count", 1));
    }

    @Test
    void verifyBackup_RejectsNamesWithPath() {
        // When
        ResponseStatusException exception = assertThrows(ResponseStatusException.class, () -> backupService.verifyBackup("../escape.zip"));

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, exception.getStatusCode());
        verifyNoInteractions(backupManager);
    }

    @Test
    void cleanupBackups_UsesConfiguredKeepCountByDefault() {
        // Given
        when(backupManager.cleanup(tempDir.resolve("backups"), 4)).thenReturn(2);

        // When
        int removed = backupService.cleanupBackups(null);

        // Then
        assertEquals(2, removed);
        verify(auditRecorder).success(ADMIN, AuditAction.BACKUP_CLEANUP, AuditResource.of(AuditResource.BACKUP, null, null),
                Map.of("keep_count", 4, "removed", 2));
    }
}
