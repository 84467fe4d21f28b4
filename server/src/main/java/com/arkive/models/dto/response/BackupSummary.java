package com.arkive.models.dto.response;

import com.arkive.spi.models.BackupManifest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class BackupSummary {

    /**
     * Archive name inside the backup directory.
     */
    String fileName;

    long archiveSize;

    BackupManifest manifest;
}
