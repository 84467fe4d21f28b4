package com.arkive.service.impl;

import com.arkive.audit.AuditRecorder;
import com.arkive.models.dto.response.BackupSummary;
import com.arkive.service.interfaces.BackupService;
import com.arkive.service.utils.AuthnUtil;
import com.arkive.spi.exceptions.ArkiveException;
import com.arkive.spi.models.Actor;
import com.arkive.spi.models.AuditResource;
import com.arkive.spi.models.BackupManifest;
import com.arkive.spi.models.enums.AuditAction;
import com.arkive.store.BackupProperties;
import com.arkive.store.SqliteStore;
import com.arkive.store.backup.BackupManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class BackupServiceImpl implements BackupService {

    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final BackupManager backupManager;
    private final SqliteStore sqliteStore;
    private final BackupProperties backupProperties;
    private final AuditRecorder auditRecorder;
    private final AuthnUtil authnUtil;
    private final Clock clock;

    @Override
    public BackupSummary createBackup() {
        Actor actor = authnUtil.currentActor();
        String fileName = "arkive-backup-" + NAME_FORMAT.format(clock.instant()) + ".zip";
        Path archive = backupDirectory().resolve(fileName);
        BackupManifest manifest;
        try {
            manifest = backupManager.create(sqliteStore, Path.of(backupProperties.getFilesRoot()), archive);
        } catch (ArkiveException e) {
            auditRecorder.failure(actor, AuditAction.BACKUP_CREATE, resourceOf(fileName), Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        }
        auditRecorder.success(actor, AuditAction.BACKUP_CREATE, resourceOf(fileName),
                Map.of("files_count", manifest.getFilesCount(), "database_size", manifest.getDatabaseSize()));
        return summarize(archive, manifest);
    }

    @Override
    public List<BackupSummary> listBackups() {
        return backupManager.list(backupDirectory()).stream()
                .map(listing -> summarize(listing.path(), listing.manifest()))
                .toList();
    }

    @Override
    public BackupManifest verifyBackup(String fileName) {
        return backupManager.verify(resolve(fileName));
    }

    @Override
    public BackupManifest restoreBackup(String fileName) {
        Actor actor = authnUtil.currentActor();
        Path archive = resolve(fileName);
        BackupManifest manifest;
        try {
            manifest = backupManager.restore(sqliteStore, archive, Path.of(backupProperties.getFilesRoot()));
        } catch (ArkiveException e) {
            auditRecorder.failure(actor, AuditAction.BACKUP_RESTORE, resourceOf(fileName), Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        }
        log.info("User {} restored backup {} taken at {}", actor.username(), fileName, manifest.getCreatedAt());
        auditRecorder.success(actor, AuditAction.BACKUP_RESTORE, resourceOf(fileName),
                Map.of("backup_created_at", manifest.getCreatedAt().toString(), "files_count", manifest.getFilesCount()));
        return manifest;
    }

    @Override
    public int cleanupBackups(Integer keepCount) {
        Actor actor = authnUtil.currentActor();
        int keep = keepCount == null ? backupProperties.getKeepCount() : keepCount;
        int removed = backupManager.cleanup(backupDirectory(), keep);
        auditRecorder.success(actor, AuditAction.BACKUP_CLEANUP, AuditResource.of(AuditResource.BACKUP, null, null),
                Map.of("keep_count", keep, "removed", removed));
        return removed;
    }

    private Path backupDirectory() {
        return Path.of(backupProperties.getDirectory());
    }

    private Path resolve(String fileName) {
        if (!fileName.equals(FilenameUtils.getName(fileName))) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Backup file name must not contain a path");
        }
        return backupDirectory().resolve(fileName);
    }

    private BackupSummary summarize(Path archive, BackupManifest manifest) {
        long size;
        try {
            size = Files.size(archive);
        } catch (IOException e) {
            log.warn("Cannot read size of backup {}", archive, e);
            size = -1;
        }
        return new BackupSummary(archive.getFileName().toString(), size, manifest);
    }

    private static AuditResource resourceOf(String fileName) {
        return AuditResource.of(AuditResource.BACKUP, fileName, fileName);
    }
}
