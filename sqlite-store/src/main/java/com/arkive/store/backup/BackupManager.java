package com.arkive.store.backup;

import com.arkive.spi.exceptions.BackupException;
import com.arkive.spi.exceptions.IntegrityValidationException;
import com.arkive.spi.exceptions.ValidationFailure;
import com.arkive.spi.models.BackupListing;
import com.arkive.spi.models.BackupManifest;
import com.arkive.store.SqliteStore;
import com.arkive.store.StoreSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.file.PathUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

import static com.arkive.store.MetricConstants.ACTION_TAG;
import static com.arkive.store.MetricConstants.BACKUP_ERROR_METRIC;
import static com.arkive.store.MetricConstants.EXCEPTION_TAG;

/**
 * Point-in-time ZIP snapshots of the store and the document files next to it.
 * <p>
 * Archive layout: {@code database.db}, then {@code files/<relative path>} for every regular file under the
 * files root in sorted order, then {@code backup_info.json}. The manifest checksum is a SHA-256 over the
 * little-endian 64 bit length of each captured item in archive order. It detects truncated or missing items,
 * not altered content; content is checked by running {@code PRAGMA integrity_check} on the extracted database.
 */
@Slf4j
@AllArgsConstructor
public class BackupManager {

    public static final String DATABASE_ENTRY = "database.db";
    public static final String FILES_PREFIX = "files/";
    public static final String MANIFEST_ENTRY = "backup_info.json";
    public static final String ARCHIVE_EXTENSION = "zip";

    private static final String PARTIAL_SUFFIX = ".partial";

    static final ObjectMapper MANIFEST_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final String producerVersion;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    /**
     * Snapshots a live store. The write-ahead log is checkpointed and writers are held off while the database
     * file is copied.
     */
    public BackupManifest create(SqliteStore store, Path filesRoot, Path output) {
        return store.withCheckpointedSnapshot(storeFile -> create(storeFile, filesRoot, output));
    }

    /**
     * Writes an archive of {@code storePath} and everything below {@code filesRoot} to {@code output}. The archive
     * only appears at {@code output} once it is complete.
     */
    public BackupManifest create(Path storePath, Path filesRoot, Path output) {
        if (!Files.isRegularFile(storePath)) {
            throw new BackupException("database not found: " + storePath);
        }
        Path partial = output.resolveSibling(output.getFileName() + PARTIAL_SUFFIX);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            BackupManifest manifest;
            try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(partial))) {
                zip.setLevel(Deflater.DEFAULT_COMPRESSION);
                List<Long> sizes = new ArrayList<>();
                long databaseSize = addFile(zip, DATABASE_ENTRY, storePath);
                sizes.add(databaseSize);
                for (Path file : listFiles(filesRoot)) {
                    String relative = FilenameUtils.separatorsToUnix(filesRoot.relativize(file).toString());
                    sizes.add(addFile(zip, FILES_PREFIX + relative, file));
                }
                manifest = BackupManifest.builder()
                        .createdAt(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                        .version(producerVersion)
                        .databaseSize(databaseSize)
                        .filesCount(sizes.size())
                        .checksum(lengthChecksum(sizes))
                        .build();
                zip.putNextEntry(new ZipEntry(MANIFEST_ENTRY));
                zip.write(MANIFEST_MAPPER.writeValueAsBytes(manifest));
                zip.closeEntry();
            }
            Files.move(partial, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("backup created at {}: {} items, database {} bytes", output, manifest.getFilesCount(), manifest.getDatabaseSize());
            return manifest;
        } catch (IOException e) {
            discard(partial);
            meterRegistry.counter(BACKUP_ERROR_METRIC, ACTION_TAG, "create", EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
            throw new BackupException("failed to create backup " + output, e);
        } catch (RuntimeException e) {
            discard(partial);
            meterRegistry.counter(BACKUP_ERROR_METRIC, ACTION_TAG, "create", EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
            throw e;
        }
    }

    private long addFile(ZipOutputStream zip, String entryName, Path file) throws IOException {
        zip.putNextEntry(new ZipEntry(entryName));
        long size = Files.copy(file, zip);
        zip.closeEntry();
        return size;
    }

    private List<Path> listFiles(Path filesRoot) throws IOException {
        if (filesRoot == null || !Files.isDirectory(filesRoot)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(filesRoot)) {
            return walk.filter(Files::isRegularFile).sorted().toList();
        }
    }

    /**
     * Checks an archive without changing anything outside a temporary directory.
     *
     * @return the manifest of a valid archive
     * @throws IntegrityValidationException describing the first check that failed
     */
    public BackupManifest verify(Path archive) {
        if (archive == null || !Files.isRegularFile(archive)) {
            throw new IntegrityValidationException(ValidationFailure.MISSING_ARCHIVE, "backup archive not found: " + archive);
        }
        Path workDir;
        try {
            workDir = Files.createTempDirectory("arkive-verify");
        } catch (IOException e) {
            throw new BackupException("cannot create a working directory to verify " + archive, e);
        }
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            ZipEntry databaseEntry = requireEntry(zip, DATABASE_ENTRY);
            BackupManifest manifest = readManifest(zip, requireEntry(zip, MANIFEST_ENTRY));
            checkEntries(zip, manifest);
            Path snapshot = workDir.resolve(DATABASE_ENTRY);
            try (InputStream in = zip.getInputStream(databaseEntry)) {
                Files.copy(in, snapshot);
            }
            checkDatabase(snapshot);
            log.debug("backup {} verified", archive);
            return manifest;
        } catch (ZipException e) {
            throw new IntegrityValidationException(ValidationFailure.INVALID_ARCHIVE, "not a readable archive: " + archive, e);
        } catch (IOException e) {
            throw new IntegrityValidationException(ValidationFailure.INVALID_ARCHIVE, "failed to read archive " + archive + ": " + e.getMessage(), e);
        } finally {
            deleteWorkDir(workDir);
        }
    }

    private ZipEntry requireEntry(ZipFile zip, String name) {
        ZipEntry entry = zip.getEntry(name);
        if (entry == null) {
            throw new IntegrityValidationException(ValidationFailure.MISSING_ENTRY, "archive has no " + name);
        }
        return entry;
    }

    private BackupManifest readManifest(ZipFile zip, ZipEntry entry) throws IOException {
        BackupManifest manifest;
        try (InputStream in = zip.getInputStream(entry)) {
            manifest = MANIFEST_MAPPER.readValue(in, BackupManifest.class);
        } catch (JsonProcessingException e) {
            throw new IntegrityValidationException(ValidationFailure.INVALID_MANIFEST, "unreadable " + MANIFEST_ENTRY + ": " + e.getOriginalMessage(), e);
        }
        if (manifest == null || manifest.getCreatedAt() == null || manifest.getChecksum() == null) {
            throw new IntegrityValidationException(ValidationFailure.INVALID_MANIFEST, MANIFEST_ENTRY + " lacks created_at or checksum");
        }
        return manifest;
    }

    private void checkEntries(ZipFile zip, BackupManifest manifest) {
        List<Long> sizes = new ArrayList<>();
        long databaseSize = -1;
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            String name = entry.getName();
            if (entry.isDirectory() || MANIFEST_ENTRY.equals(name)) {
                continue;
            }
            if (DATABASE_ENTRY.equals(name)) {
                databaseSize = entry.getSize();
            } else if (name.startsWith(FILES_PREFIX)) {
                requireSafe(name);
            } else {
                continue;
            }
            sizes.add(entry.getSize());
        }
        if (databaseSize != manifest.getDatabaseSize()) {
            throw new IntegrityValidationException(ValidationFailure.CHECKSUM_MISMATCH,
                    "database size " + databaseSize + " differs from manifest " + manifest.getDatabaseSize());
        }
        if (sizes.size() != manifest.getFilesCount()) {
            throw new IntegrityValidationException(ValidationFailure.CHECKSUM_MISMATCH,
                    "archive holds " + sizes.size() + " items, manifest lists " + manifest.getFilesCount());
        }
        if (!lengthChecksum(sizes).equals(manifest.getChecksum())) {
            throw new IntegrityValidationException(ValidationFailure.CHECKSUM_MISMATCH, "checksum differs from manifest");
        }
    }

    private static String requireSafe(String entryName) {
        String relative = entryName.substring(FILES_PREFIX.length());
        String normalized = FilenameUtils.normalize(relative, true);
        if (relative.isEmpty() || normalized == null || normalized.startsWith("/") || FilenameUtils.getPrefixLength(relative) != 0) {
            throw new IntegrityValidationException(ValidationFailure.UNSAFE_ENTRY, "entry escapes the files root: " + entryName);
        }
        return normalized;
    }

    private void checkDatabase(Path database) {
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + database);
                Statement statement = connection.createStatement()) {
            List<String> problems = new ArrayList<>();
            try (ResultSet resultSet = statement.executeQuery("PRAGMA integrity_check")) {
                while (resultSet.next()) {
                    problems.add(resultSet.getString(1));
                }
            }
            if (!List.of("ok").equals(problems)) {
                throw new IntegrityValidationException(ValidationFailure.CORRUPT_DATABASE, "integrity check failed: " + problems);
            }
            Set<String> tables = new HashSet<>();
            try (ResultSet resultSet = statement.executeQuery("SELECT name FROM sqlite_master WHERE type = 'table'")) {
                while (resultSet.next()) {
                    tables.add(resultSet.getString(1));
                }
            }
            for (String required : StoreSchema.REQUIRED_TABLES) {
                if (!tables.contains(required)) {
                    throw new IntegrityValidationException(ValidationFailure.MISSING_TABLE, "database has no table " + required);
                }
            }
        } catch (SQLException e) {
            throw new IntegrityValidationException(ValidationFailure.CORRUPT_DATABASE, "not a readable database: " + e.getMessage(), e);
        }
    }

    /**
     * Restores the live store. Its connection is closed during the swap and reopened afterwards.
     */
    public BackupManifest restore(SqliteStore store, Path archive, Path targetFilesRoot) {
        BackupManifest manifest = verify(archive);
        store.runDetached(storeFile -> restore(archive, storeFile, targetFilesRoot));
        return manifest;
    }

    /**
     * Replaces the database at {@code targetStore} and the content of {@code targetFilesRoot} with the archived
     * state. Files under the root that the archive does not hold are removed. The archive is verified first;
     * nothing is touched when verification fails.
     */
    public BackupManifest restore(Path archive, Path targetStore, Path targetFilesRoot) {
        BackupManifest manifest = verify(archive);
        Path storeDir = targetStore.toAbsolutePath().getParent();
        Path staged = null;
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Files.createDirectories(storeDir);
            staged = Files.createTempFile(storeDir, ".restore-", ".db");
            try (InputStream in = zip.getInputStream(zip.getEntry(DATABASE_ENTRY))) {
                Files.copy(in, staged, StandardCopyOption.REPLACE_EXISTING);
            }
            Files.deleteIfExists(sideFile(targetStore, "-wal"));
            Files.deleteIfExists(sideFile(targetStore, "-shm"));
            Files.move(staged, targetStore, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            int extracted = extractFiles(zip, targetFilesRoot);
            checkDatabase(targetStore);
            log.info("restored {} from {} with {} files", targetStore, archive, extracted);
            return manifest;
        } catch (IOException e) {
            meterRegistry.counter(BACKUP_ERROR_METRIC, ACTION_TAG, "restore", EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
            throw new BackupException("failed to restore " + archive, e);
        } finally {
            if (staged != null) {
                discard(staged);
            }
        }
    }

    private int extractFiles(ZipFile zip, Path targetFilesRoot) throws IOException {
        Path root = targetFilesRoot.toAbsolutePath().normalize();
        if (Files.isDirectory(root)) {
            PathUtils.deleteDirectory(root);
        }
        Files.createDirectories(root);
        int extracted = 0;
        Enumeration<? extends ZipEntry> entries = zip.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            if (entry.isDirectory() || !entry.getName().startsWith(FILES_PREFIX)) {
                continue;
            }
            Path target = root.resolve(requireSafe(entry.getName())).normalize();
            if (!target.startsWith(root)) {
                throw new IntegrityValidationException(ValidationFailure.UNSAFE_ENTRY, "entry escapes the files root: " + entry.getName());
            }
            Files.createDirectories(target.getParent());
            try (InputStream in = zip.getInputStream(entry)) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            extracted++;
        }
        return extracted;
    }

    /**
     * Verified archives in {@code backupDir}, newest first. Archives failing verification are skipped.
     */
    public List<BackupListing> list(Path backupDir) {
        if (backupDir == null || !Files.isDirectory(backupDir)) {
            return List.of();
        }
        List<Path> archives;
        try (Stream<Path> children = Files.list(backupDir)) {
            archives = children
                    .filter(Files::isRegularFile)
                    .filter(path -> FilenameUtils.isExtension(path.getFileName().toString(), ARCHIVE_EXTENSION))
                    .toList();
        } catch (IOException e) {
            throw new BackupException("failed to list backups in " + backupDir, e);
        }
        List<BackupListing> listings = new ArrayList<>();
        for (Path archive : archives) {
            try {
                listings.add(new BackupListing(archive, verify(archive)));
            } catch (IntegrityValidationException | BackupException e) {
                log.warn("skipping backup {}: {}", archive, e.getMessage());
            }
        }
        listings.sort(Comparator.comparing((BackupListing listing) -> listing.manifest().getCreatedAt())
                .thenComparing(listing -> listing.path().getFileName().toString())
                .reversed());
        return listings;
    }

    /**
     * Deletes all but the {@code keepCount} most recent verified backups. Archives that fail verification are
     * left alone.
     *
     * @return number of archives deleted
     */
    public int cleanup(Path backupDir, int keepCount) {
        if (keepCount < 0) {
            throw new IllegalArgumentException("keepCount must not be negative: " + keepCount);
        }
        List<BackupListing> listings = list(backupDir);
        int removed = 0;
        for (BackupListing listing : listings.subList(Math.min(keepCount, listings.size()), listings.size())) {
            try {
                Files.delete(listing.path());
                removed++;
                log.info("deleted old backup {}", listing.path());
            } catch (IOException e) {
                meterRegistry.counter(BACKUP_ERROR_METRIC, ACTION_TAG, "cleanup", EXCEPTION_TAG, e.getClass().getSimpleName()).increment();
                throw new BackupException("failed to delete backup " + listing.path(), e);
            }
        }
        return removed;
    }

    static String lengthChecksum(List<Long> sizes) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        ByteBuffer buffer = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (long size : sizes) {
            buffer.clear();
            buffer.putLong(size);
            digest.update(buffer.array());
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static Path sideFile(Path database, String suffix) {
        return database.resolveSibling(database.getFileName() + suffix);
    }

    private void discard(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("failed to delete {}", file, e);
        }
    }

    private void deleteWorkDir(Path workDir) {
        try {
            PathUtils.deleteDirectory(workDir);
        } catch (IOException e) {
            log.warn("failed to delete working directory {}", workDir, e);
        }
    }
}
