package com.arkive.models.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Output of the extraction pipeline for one document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexDocumentRequest {

    @NotNull
    private String extractedText;

    @Size(max = 64)
    private String documentType;

    /**
     * Structured fields recognised in the document, e.g. {"total": "12.50", "vendor": "ACME"}.
     */
    private Map<String, String> fields = new HashMap<>();
}
