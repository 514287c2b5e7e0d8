package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Loads and saves the inventory table of one tracked folder.
 *
 * <p>A save never destroys the previous table before its replacement is proven readable: the rows are
 * written to a temporary sibling, re-read, and only then moved over the old file. Calls for the same
 * location are serialised by an in-process lock.
 */
public final class InventoryStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(InventoryStore.class);
    static final String TEMP_SUFFIX = "_temp";
    static final String LEGACY_TEMP_SUFFIX = ".tmp";
    private static final ConcurrentHashMap<Path, LocationLock> LOCKS = new ConcurrentHashMap<>();

    private final InventoryTableCodec codec;
    private final BackupManager backups;

    public InventoryStore(InventoryTableCodec codec, BackupManager backups) {
        this.codec = codec;
        this.backups = backups;
    }

    public static InventoryStore from(InventoryConfig config) {
        return new InventoryStore(new InventoryTableCodec(), new BackupManager(config.maxRotatingBackups()));
    }

    /**
     * Temporary sibling a save writes to, e.g. {@code inventory.csv_temp.csv}.
     */
    public static Path tempFileFor(Path location) {
        String name = location.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot > 0 ? name.substring(dot) : "";
        return location.resolveSibling(name + TEMP_SUFFIX + extension);
    }

    static Path legacyTempFileFor(Path location) {
        return location.resolveSibling(location.getFileName() + LEGACY_TEMP_SUFFIX);
    }

    /**
     * True when {@code fileName} is one of the backup or temp artifacts kept next to {@code inventory}.
     */
    public static boolean isCompanionOf(Path inventory, String fileName) {
        String base = inventory.getFileName().toString();
        return fileName.equals(base + BackupManager.ROLLING_SUFFIX)
                || fileName.startsWith(base + BackupManager.ROTATING_INFIX)
                || fileName.equals(tempFileFor(inventory).getFileName().toString())
                || fileName.equals(legacyTempFileFor(inventory).getFileName().toString());
    }

    public LoadResult load(Path location) {
        return withLock(location, () -> doLoad(location));
    }

    public SaveResult save(List<FileRecord> records, Path location) {
        return withLock(location, () -> doSave(records, location));
    }

    /**
     * True when the table is missing or zero-length and a recovery attempt is worthwhile.
     */
    public boolean needsRecovery(Path location) {
        try {
            return !Files.exists(location) || Files.size(location) == 0L;
        } catch (IOException ex) {
            LOGGER.warn("Failed to read size of {}", location, ex);
            return true;
        }
    }

    /**
     * Restores a missing or empty table from a leftover temp file, or failing that from the rolling backup.
     * Returns whether a file was restored.
     */
    public boolean recover(Path location) {
        return withLock(location, () -> doRecover(location));
    }

    /**
     * Takes a timestamped backup of the current table, if there is one.
     */
    public Optional<Path> backup(Path location) {
        return withLock(location, () -> {
            if (!Files.exists(location)) {
                return Optional.empty();
            }
            try {
                return backups.writeRotatingBackup(location);
            } catch (IOException ex) {
                LOGGER.warn("Backup creation failed for {}", location, ex);
                return Optional.empty();
            }
        });
    }

    private LoadResult doLoad(Path location) {
        if (!Files.exists(location)) {
            LOGGER.info("Inventory file '{}' not found. New one will be created.", location);
            return LoadResult.missing();
        }
        InventoryTableCodec.Table table;
        try {
            table = codec.read(location);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Could not parse inventory '{}'. Inventory will be rebuilt.", location, ex);
            return LoadResult.corrupt(new InventoryWarning(InventoryError.LOAD_CORRUPT, location, ex.getMessage()));
        }
        if (!table.hasColumn(InventoryTableCodec.FULL_PATH)) {
            String message = "'" + InventoryTableCodec.FULL_PATH + "' column missing";
            LOGGER.warn("{} in '{}'. Inventory will be rebuilt.", message, location);
            return LoadResult.corrupt(new InventoryWarning(InventoryError.LOAD_CORRUPT, location, message));
        }
        for (String column : InventoryTableCodec.COLUMNS) {
            if (!table.hasColumn(column)) {
                LOGGER.info("Column '{}' not found in '{}'. Using defaults.", column, location);
            }
        }

        List<InventoryWarning> warnings = new ArrayList<>();
        Map<String, FileRecord> records = new LinkedHashMap<>();
        int rowNumber = 1;
        for (Map<String, String> row : table.rows()) {
            rowNumber++;
            String fullPath = row.getOrDefault(InventoryTableCodec.FULL_PATH, "");
            if (fullPath.isBlank()) {
                warnings.add(new InventoryWarning(InventoryError.LOAD_CORRUPT, location,
                        "Row " + rowNumber + " has no " + InventoryTableCodec.FULL_PATH));
                continue;
            }
            records.put(fullPath, codec.toRecord(row));
        }
        LOGGER.info("Inventory loaded. {} records from '{}'.", records.size(), location);
        return LoadResult.loaded(new ArrayList<>(records.values()), warnings);
    }

    private SaveResult doSave(List<FileRecord> records, Path location) {
        List<InventoryWarning> warnings = new ArrayList<>();
        List<FileRecord> output = protectNotes(records, location, warnings);

        if (Files.exists(location)) {
            try {
                backups.writeRollingBackup(location);
            } catch (IOException ex) {
                LOGGER.warn("Rolling backup failed for {}", location, ex);
                warnings.add(new InventoryWarning(InventoryError.BACKUP_FAILED, location, ex.getMessage()));
            }
            try {
                backups.writeRotatingBackup(location);
            } catch (IOException ex) {
                LOGGER.warn("Rotating backup failed for {}", location, ex);
                warnings.add(new InventoryWarning(InventoryError.BACKUP_FAILED, location, ex.getMessage()));
            }
        }

        Path temp = tempFileFor(location);
        try {
            Path parent = location.toAbsolutePath().getParent();
            if (parent != null && !Files.isDirectory(parent)) {
                Files.createDirectories(parent);
            }
            codec.write(output, temp);
            Optional<String> problem = verify(temp, output.size());
            if (problem.isPresent()) {
                LOGGER.warn("Save of '{}' aborted: {}", location, problem.get());
                return SaveResult.failure(InventoryError.SAVE_VERIFICATION_FAILED, problem.get(), warnings);
            }
            replace(temp, location);
            LOGGER.info("Inventory saved successfully: {} entries to '{}'", output.size(), location);
            return SaveResult.success(output.size(), warnings);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Failed to save inventory to '{}'", location, ex);
            return SaveResult.failure(InventoryError.SAVE_WRITE_FAILED, String.valueOf(ex.getMessage()), warnings);
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * Backfills blank notes from the table currently on disk so a blank edit never erases a saved note.
     */
    private List<FileRecord> protectNotes(List<FileRecord> records, Path location, List<InventoryWarning> warnings) {
        if (!Files.exists(location)) {
            return records;
        }
        Map<String, String> existingNotes = new HashMap<>();
        try {
            InventoryTableCodec.Table existing = codec.read(location);
            if (!existing.hasColumn(InventoryTableCodec.FULL_PATH) || !existing.hasColumn(InventoryTableCodec.MANUAL_NOTES)) {
                return records;
            }
            for (Map<String, String> row : existing.rows()) {
                String note = row.getOrDefault(InventoryTableCodec.MANUAL_NOTES, "");
                String key = row.getOrDefault(InventoryTableCodec.FULL_PATH, "");
                if (!note.isBlank() && !key.isBlank()) {
                    existingNotes.put(key, note);
                }
            }
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Error merging existing notes from '{}'", location, ex);
            warnings.add(new InventoryWarning(InventoryError.LOAD_CORRUPT, location, "Notes not merged: " + ex.getMessage()));
            return records;
        }
        List<FileRecord> merged = new ArrayList<>(records.size());
        for (FileRecord record : records) {
            String saved = existingNotes.get(record.fullPath());
            merged.add(!record.hasNotes() && saved != null ? record.withManualNotes(saved) : record);
        }
        return merged;
    }

    private Optional<String> verify(Path temp, int expectedRows) throws IOException {
        if (!Files.exists(temp) || Files.size(temp) == 0L) {
            return Optional.of("temporary file is empty");
        }
        InventoryTableCodec.Table table;
        try {
            table = codec.read(temp);
        } catch (IOException | RuntimeException ex) {
            return Optional.of("temporary file is unreadable: " + ex.getMessage());
        }
        if (!table.hasColumn(InventoryTableCodec.FULL_PATH)) {
            return Optional.of("temporary file has no " + InventoryTableCodec.FULL_PATH + " column");
        }
        if (table.rows().size() != expectedRows) {
            return Optional.of("temporary file has " + table.rows().size() + " rows, expected " + expectedRows);
        }
        return Optional.empty();
    }

    private boolean doRecover(Path location) {
        if (!needsRecovery(location)) {
            return false;
        }
        try {
            for (Path temp : List.of(tempFileFor(location), legacyTempFileFor(location))) {
                if (isUsable(temp)) {
                    replace(temp, location);
                    LOGGER.info("Recovered {} from temporary save file {}", location, temp);
                    return true;
                }
                deleteQuietly(temp);
            }
            Path rolling = BackupManager.rollingBackupFor(location);
            if (isUsable(rolling)) {
                Files.copy(rolling, location, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                LOGGER.info("Recovered {} from backup file {}", location, rolling);
                return true;
            }
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Recovery attempt failed for {}", location, ex);
            return false;
        }
        LOGGER.info("No usable temporary or backup file to recover {}", location);
        return false;
    }

    /**
     * A candidate is usable when it is non-empty, parses, has the key column and at least one row.
     */
    private boolean isUsable(Path candidate) {
        try {
            if (!Files.exists(candidate) || Files.size(candidate) == 0L) {
                return false;
            }
            InventoryTableCodec.Table table = codec.read(candidate);
            return table.hasColumn(InventoryTableCodec.FULL_PATH) && !table.rows().isEmpty();
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Ignoring unreadable recovery candidate {}", candidate, ex);
            return false;
        }
    }

    private void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            LOGGER.warn("Failed to delete temporary file {}", path, ex);
        }
    }

    /**
     * Runs {@code action} holding the lock of {@code location}. A lock entry is dropped once no caller holds or
     * waits for it.
     */
    private <T> T withLock(Path location, Supplier<T> action) {
        Path key = location.toAbsolutePath().normalize();
        LocationLock entry = LOCKS.compute(key, (ignored, existing) -> {
            LocationLock current = existing == null ? new LocationLock() : existing;
            current.users++;
            return current;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            LOCKS.computeIfPresent(key, (ignored, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    static int trackedLocations() {
        return LOCKS.size();
    }

    // users is only read and written inside ConcurrentHashMap.compute for its key.
    private static final class LocationLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
