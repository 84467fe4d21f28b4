package com.arkive.models.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Names an archive inside the backup directory.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackupFileRequest {

    @NotBlank
    @Size(max = 255)
    @Pattern(regexp = "[A-Za-z0-9._-]+\\.zip")
    private String fileName;
}
