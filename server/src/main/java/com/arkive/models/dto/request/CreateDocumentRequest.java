package com.arkive.models.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registers a file that the desktop shell has already copied into the files root.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateDocumentRequest {

    @NotBlank
    @Size(max = 255)
    private String name;

    /**
     * Location of the file relative to the files root.
     */
    @NotBlank
    @Size(max = 1024)
    private String filePath;

    @Size(max = 64)
    private String fileType;

    @Min(0)
    private long fileSize;

    @Size(max = 64)
    private String category;
}
