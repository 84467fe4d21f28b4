package com.arkive.service.interfaces;

import com.arkive.models.dto.response.BackupSummary;
import com.arkive.spi.models.BackupManifest;

import java.util.List;

public interface BackupService {

    BackupSummary createBackup();

    List<BackupSummary> listBackups();

    BackupManifest verifyBackup(String fileName);

    BackupManifest restoreBackup(String fileName);

    /**
     * @param keepCount number of most recent backups to keep, the configured default when null
     * @return number of archives deleted
     */
    int cleanupBackups(Integer keepCount);
}
