package com.arkive.spi.models;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Describes one snapshot. Stored as {@code backup_info.json} inside the archive next to the database copy.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackupManifest {

    @JsonProperty("created_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant createdAt;

    /**
     * Version of the application that produced the archive.
     */
    @JsonProperty("version")
    private String version;

    /**
     * Size in bytes of the database snapshot.
     */
    @JsonProperty("database_size")
    private long databaseSize;

    /**
     * Number of captured items, the database snapshot included.
     */
    @JsonProperty("files_count")
    private int filesCount;

    /**
     * Hex SHA-256 over the byte length of every captured item in archive order.
     */
    @JsonProperty("checksum")
    private String checksum;
}
