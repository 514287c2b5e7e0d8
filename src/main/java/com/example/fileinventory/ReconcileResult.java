package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;

import java.util.List;

/**
 * Merged records of a reconciliation pass and the counts reported in the scan summary.
 */
public record ReconcileResult(
        List<FileRecord> merged,
        int added,
        int updated,
        int removedWithNotes
) {
    public ReconcileResult {
        merged = List.copyOf(merged);
    }

    /**
     * Number of merged records that exist on disk.
     */
    public int presentCount() {
        return merged.size() - removedWithNotes;
    }
}
