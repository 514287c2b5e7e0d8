package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;
import com.example.fileinventory.model.InventorySnapshot;
import com.example.fileinventory.model.RecordStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges a fresh scan with the previously persisted snapshot. Notes are carried forward by full path;
 * a record missing from disk is kept as a {@code Removed} tombstone only while it has a note.
 */
public final class Reconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(Reconciler.class);

    public ReconcileResult reconcile(List<FileRecord> currentScan, InventorySnapshot previous) {
        Map<String, FileRecord> previousByPath = previous.byFullPath();
        Set<String> unmatched = new LinkedHashSet<>(previousByPath.keySet());
        List<FileRecord> merged = new ArrayList<>(currentScan.size() + unmatched.size());
        int added = 0;
        int updated = 0;

        for (FileRecord current : currentScan) {
            FileRecord old = previousByPath.get(current.fullPath());
            if (old == null) {
                merged.add(current.withStatus(RecordStatus.ADDED).withManualNotes(""));
                added++;
                continue;
            }
            RecordStatus status = changed(old, current) ? RecordStatus.UPDATED : RecordStatus.ACTIVE;
            if (status == RecordStatus.UPDATED) {
                updated++;
            }
            merged.add(current.withStatus(status).withManualNotes(old.manualNotes()));
            unmatched.remove(current.fullPath());
        }

        int removedWithNotes = 0;
        for (String path : unmatched) {
            FileRecord old = previousByPath.get(path);
            if (old.hasNotes()) {
                merged.add(old.withStatus(RecordStatus.REMOVED));
                removedWithNotes++;
            }
        }

        LOGGER.debug("Reconciled {} current against {} previous: {} added, {} updated, {} removed with notes",
                currentScan.size(), previousByPath.size(), added, updated, removedWithNotes);
        return new ReconcileResult(merged, added, updated, removedWithNotes);
    }

    /**
     * A stored value that is unknown (null size, blank timestamp) never counts as a change on its own.
     */
    private boolean changed(FileRecord old, FileRecord current) {
        boolean sizeChanged = old.sizeBytes() != null && !Objects.equals(old.sizeBytes(), current.sizeBytes());
        boolean timeChanged = !old.lastModified().isBlank() && !old.lastModified().equals(current.lastModified());
        return sizeChanged || timeChanged;
    }
}
