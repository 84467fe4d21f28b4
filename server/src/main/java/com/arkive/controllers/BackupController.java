package com.arkive.controllers;

import com.arkive.models.dto.request.BackupFileRequest;
import com.arkive.models.dto.response.BackupSummary;
import com.arkive.models.dto.response.ResponseTemplate;
import com.arkive.service.interfaces.BackupService;
import com.arkive.spi.models.BackupManifest;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/backups")
@RequiredArgsConstructor
@Validated
public class BackupController {

    private final BackupService backupService;

    @Operation(summary = "Snapshots the store and the document files into a new archive.")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseTemplate<BackupSummary> createBackup() {
        return ResponseTemplate.success(backupService.createBackup(), "Successfully created backup.");
    }

    @Operation(summary = "Lists verified backups, newest first. Archives failing verification are left out.")
    @GetMapping
    public ResponseTemplate<List<BackupSummary>> listBackups() {
        return ResponseTemplate.success(backupService.listBackups(), "Successfully listed backups.");
    }

    @Operation(summary = "Verifies an archive without restoring it.")
    @PostMapping("/verification")
    public ResponseTemplate<BackupManifest> verifyBackup(@Valid @RequestBody BackupFileRequest request) {
        return ResponseTemplate.success(backupService.verifyBackup(request.getFileName()), "Backup is valid.");
    }

    @Operation(summary = "Replaces the store and document files with the content of an archive. The archive is verified first.")
    @PostMapping("/restore")
    public ResponseTemplate<BackupManifest> restoreBackup(@Valid @RequestBody BackupFileRequest request) {
        return ResponseTemplate.success(backupService.restoreBackup(request.getFileName()), "Successfully restored backup.");
    }

    @Operation(summary = "Deletes all but the most recent backups. Returns the number of archives deleted.")
    @DeleteMapping
    public ResponseTemplate<Integer> cleanupBackups(@RequestParam(name = "keep", required = false) @Min(0) Integer keep) {
        return ResponseTemplate.success(backupService.cleanupBackups(keep), "Successfully cleaned up backups.");
    }
}
