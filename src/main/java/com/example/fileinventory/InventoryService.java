package com.example.fileinventory;

import com.example.fileinventory.model.DisplayRow;
import com.example.fileinventory.model.FileRecord;
import com.example.fileinventory.model.InventorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Library boundary used by a front end: scan a folder into its inventory, save note edits, filter rows.
 * Each call runs to completion on the calling thread.
 */
public final class InventoryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(InventoryService.class);
    private static final DateTimeFormatter SAVED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final InventoryConfig config;
    private final InventoryScanner scanner;
    private final Reconciler reconciler;
    private final InventoryStore store;
    private final InventoryFilter filter;
    private final Clock clock;

    public InventoryService(InventoryConfig config) {
        this(config,
                new InventoryScanner(config, ContentHintExtractor.from(config)),
                new Reconciler(),
                InventoryStore.from(config),
                new InventoryFilter(),
                Clock.systemDefaultZone());
    }

    InventoryService(InventoryConfig config,
                     InventoryScanner scanner,
                     Reconciler reconciler,
                     InventoryStore store,
                     InventoryFilter filter,
                     Clock clock) {
        this.config = config;
        this.scanner = scanner;
        this.reconciler = reconciler;
        this.store = store;
        this.filter = filter;
        this.clock = clock;
    }

    /**
     * Inventory table kept for {@code folder}.
     */
    public Path inventoryLocationFor(Path folder) {
        return InventoryScanner.canonical(folder).resolve(config.inventoryFileName());
    }

    /**
     * Scans {@code folder}, reconciles the result with the stored inventory and saves the merged table.
     */
    public ScanReport scan(Path folder) {
        if (folder == null || !Files.isDirectory(folder)) {
            String message = "Error: Start folder '" + folder + "' not found.";
            LOGGER.warn(message);
            List<InventoryWarning> warnings = List.of(
                    new InventoryWarning(InventoryError.FOLDER_NOT_FOUND, folder, message));
            return ScanReport.failed(InventorySnapshot.empty(folder, null), InventoryError.FOLDER_NOT_FOUND,
                    message, warnings);
        }
        Path root = InventoryScanner.canonical(folder);
        Path location = inventoryLocationFor(root);
        LOGGER.info("Starting scan: {}. Inventory: {}", root, location);

        List<InventoryWarning> warnings = new ArrayList<>();
        InventorySnapshot previous = loadPrevious(root, location, warnings);

        ScanResult scanned = scanner.scan(root, location);
        warnings.addAll(scanned.getWarnings());
        if (!scanned.isSuccess()) {
            InventoryError error = scanned.getError().orElse(InventoryError.FOLDER_NOT_FOUND);
            return ScanReport.failed(InventorySnapshot.empty(root, location), error,
                    "Error: Start folder '" + root + "' not found.", warnings);
        }

        ReconcileResult result = reconciler.reconcile(scanned.getRecords(), previous);
        SaveResult saveResult = null;
        if (!result.merged().isEmpty() || Files.exists(location)) {
            saveResult = store.save(result.merged(), location);
            warnings.addAll(saveResult.getWarnings());
        }

        String message = String.format("Scan Complete. Found %d files. (%d new, %d updated, %d removed-kept-with-notes).",
                scanned.getRecords().size(), result.added(), result.updated(), result.removedWithNotes());
        if (saveResult != null && !saveResult.isSuccess()) {
            message += " Error: inventory could not be saved (" + saveResult.getMessage() + ").";
        }
        LOGGER.info(message);
        return new ScanReport(
                new InventorySnapshot(root, location, result.merged()),
                scanned.getRecords().size(),
                result.added(),
                result.updated(),
                result.removedWithNotes(),
                message,
                saveResult,
                null,
                warnings
        );
    }

    /**
     * Reads the stored inventory of {@code folder} without scanning, recovering it first if needed.
     */
    public InventorySnapshot loadSnapshot(Path folder) {
        Path root = InventoryScanner.canonical(folder);
        return loadPrevious(root, inventoryLocationFor(root), new ArrayList<>());
    }

    /**
     * Applies note edits keyed by full path and persists the snapshot. Unknown keys are ignored.
     */
    public NoteSaveReport saveNotes(InventorySnapshot snapshot, Map<String, String> edits) {
        if (snapshot == null || snapshot.isEmpty()) {
            return new NoteSaveReport(snapshot, false, "Cannot save: Master data is empty.", "Last saved: Never", null);
        }
        if (snapshot.location() == null) {
            return new NoteSaveReport(snapshot, false, "Error: Inventory file path not set.", "Last saved: Error", null);
        }
        List<FileRecord> updated = new ArrayList<>(snapshot.size());
        for (FileRecord record : snapshot.records()) {
            if (edits != null && edits.containsKey(record.fullPath())) {
                updated.add(record.withManualNotes(edits.get(record.fullPath())));
            } else {
                updated.add(record);
            }
        }

        SaveResult saveResult = store.save(updated, snapshot.location());
        String timestamp = LocalDateTime.now(clock).format(SAVED_AT);
        if (!saveResult.isSuccess()) {
            return new NoteSaveReport(snapshot.withRecords(updated), false,
                    "Error: Failed to save notes to file.", "Last saved: Error", saveResult);
        }
        LoadResult persisted = store.load(snapshot.location());
        List<FileRecord> current = persisted.failure().isPresent() ? updated : persisted.records();
        return new NoteSaveReport(
                snapshot.withRecords(current),
                true,
                "Notes saved successfully to " + snapshot.location().getFileName() + ". (at " + timestamp + ")",
                "Last saved: " + timestamp,
                saveResult
        );
    }

    /**
     * Filters the snapshot and projects the rows to the presentation columns.
     */
    public List<DisplayRow> filter(InventorySnapshot snapshot, String statusFilter, String topicQuery, String textQuery) {
        if (snapshot == null) {
            return List.of();
        }
        List<DisplayRow> rows = new ArrayList<>();
        for (FileRecord record : filter.filter(snapshot, statusFilter, topicQuery, textQuery)) {
            rows.add(DisplayRow.from(record));
        }
        return rows;
    }

    /**
     * Takes an on-demand timestamped backup of the snapshot's table, e.g. before the host shuts down.
     */
    public Optional<Path> backup(InventorySnapshot snapshot) {
        if (snapshot == null || snapshot.location() == null) {
            return Optional.empty();
        }
        return store.backup(snapshot.location());
    }

    private InventorySnapshot loadPrevious(Path folder, Path location, List<InventoryWarning> warnings) {
        if (store.needsRecovery(location)) {
            boolean recovered = store.recover(location);
            if (!recovered && Files.exists(location)) {
                warnings.add(new InventoryWarning(InventoryError.RECOVERY_EXHAUSTED, location,
                        "Inventory file is empty and no usable temp or backup file was found"));
            }
        }
        LoadResult loaded = store.load(location);
        warnings.addAll(loaded.warnings());
        return new InventorySnapshot(folder, location, loaded.records());
    }
}
