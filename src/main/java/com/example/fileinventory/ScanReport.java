package com.example.fileinventory;

import com.example.fileinventory.model.InventorySnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Everything a caller gets back from one scan: the reconciled snapshot, the summary counts and text, the
 * outcome of the save and any accumulated warnings.
 */
public record ScanReport(
        InventorySnapshot snapshot,
        int fileCount,
        int added,
        int updated,
        int removedWithNotes,
        String statusMessage,
        SaveResult saveResult,
        InventoryError error,
        List<InventoryWarning> warnings
) {
    public ScanReport {
        warnings = List.copyOf(warnings);
    }

    static ScanReport failed(InventorySnapshot snapshot, InventoryError error, String message,
                             List<InventoryWarning> warnings) {
        return new ScanReport(snapshot, 0, 0, 0, 0, message, null, error, warnings);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Empty when nothing needed saving.
     */
    public Optional<SaveResult> save() {
        return Optional.ofNullable(saveResult);
    }

    public boolean saveFailed() {
        return saveResult != null && !saveResult.isSuccess();
    }
}
