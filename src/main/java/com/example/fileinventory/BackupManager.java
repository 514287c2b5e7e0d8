package com.example.fileinventory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the two kinds of backup next to an inventory file: a single rolling {@code <file>.bak} and up to
 * {@code maxRotating} timestamped {@code <file>.bak.<yyyyMMdd_HHmmss>} copies.
 */
public final class BackupManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(BackupManager.class);
    static final String ROLLING_SUFFIX = ".bak";
    static final String ROTATING_INFIX = ".bak.";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final int maxRotating;
    private final Clock clock;

    public BackupManager(int maxRotating) {
        this(maxRotating, Clock.systemDefaultZone());
    }

    BackupManager(int maxRotating, Clock clock) {
        this.maxRotating = maxRotating;
        this.clock = clock;
    }

    public static Path rollingBackupFor(Path location) {
        return location.resolveSibling(location.getFileName() + ROLLING_SUFFIX);
    }

    /**
     * Overwrites the rolling backup with the current content of {@code location}.
     */
    public Path writeRollingBackup(Path location) throws IOException {
        Path backup = rollingBackupFor(location);
        Files.copy(location, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return backup;
    }

    /**
     * Copies {@code location} to a new timestamped backup, first evicting the oldest ones (by creation time)
     * so the count never exceeds the cap. Returns empty when rotation is disabled.
     */
    public Optional<Path> writeRotatingBackup(Path location) throws IOException {
        if (maxRotating <= 0) {
            return Optional.empty();
        }
        Path backup = location.resolveSibling(
                location.getFileName() + ROTATING_INFIX + LocalDateTime.now(clock).format(STAMP));
        if (!Files.exists(backup)) {
            List<Path> existing = rotatingBackups(location);
            int index = 0;
            while (existing.size() - index >= maxRotating) {
                Path oldest = existing.get(index++);
                Files.deleteIfExists(oldest);
                LOGGER.debug("Evicted backup {}", oldest);
            }
        }
        Files.copy(location, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        LOGGER.info("Created backup {}", backup);
        return Optional.of(backup);
    }

    /**
     * Timestamped backups of {@code location}, oldest first.
     */
    public List<Path> rotatingBackups(Path location) throws IOException {
        Path directory = location.toAbsolutePath().getParent();
        String prefix = location.getFileName() + ROTATING_INFIX;
        List<Path> backups = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, entry ->
                entry.getFileName().toString().startsWith(prefix) && Files.isRegularFile(entry))) {
            stream.forEach(backups::add);
        }
        backups.sort(Comparator.comparing(BackupManager::creationTime)
                .thenComparing(path -> path.getFileName().toString()));
        return backups;
    }

    private static FileTime creationTime(Path path) {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class).creationTime();
        } catch (IOException ex) {
            LOGGER.warn("Failed to read creation time for {}", path, ex);
            return FileTime.fromMillis(0L);
        }
    }
}
