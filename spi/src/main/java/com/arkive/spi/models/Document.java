package com.arkive.spi.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Document {

    public static final String DEFAULT_CATEGORY = "General";

    private String id;

    /**
     * Owner of the document.
     */
    private String userId;

    private String name;
    private String filePath;
    private String fileType;
    private long fileSize;

    @Builder.Default
    private String category = DEFAULT_CATEGORY;

    /**
     * False once the document has been soft deleted.
     */
    @Builder.Default
    private boolean active = true;

    private Instant createdAt;
    private Instant updatedAt;
}
