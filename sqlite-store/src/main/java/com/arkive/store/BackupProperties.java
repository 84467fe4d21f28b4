package com.arkive.store;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@ConfigurationProperties(prefix = "arkive.backup")
@Validated
public class BackupProperties {
    /**
     * directory holding the backup archives
     */
    @NotEmpty
    private String directory;
    /**
     * root of the uploaded document files captured next to the database
     */
    @NotEmpty
    private String filesRoot;
    /**
     * number of most recent backups kept by cleanup
     */
    @Min(0)
    private int keepCount = 5;
    @NotEmpty
    private String producerVersion = "1.0.0";
}
