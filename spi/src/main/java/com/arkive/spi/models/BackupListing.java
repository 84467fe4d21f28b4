package com.arkive.spi.models;

import java.nio.file.Path;

/**
 * A verified archive found in a backup directory.
 */
public record BackupListing(Path path, BackupManifest manifest) {
}
