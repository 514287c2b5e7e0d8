package com.example.fileinventory;

import com.example.fileinventory.model.InventorySnapshot;

/**
 * Result of applying note edits and persisting them.
 */
public record NoteSaveReport(
        InventorySnapshot snapshot,
        boolean saved,
        String statusMessage,
        String lastSavedIndicator,
        SaveResult saveResult
) {
}
