package com.example.fileinventory.model;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered records of one tracked folder together with the table they are persisted to.
 */
public record InventorySnapshot(
        Path sourceFolder,
        Path location,
        List<FileRecord> records
) {
    public InventorySnapshot {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static InventorySnapshot empty(Path sourceFolder, Path location) {
        return new InventorySnapshot(sourceFolder, location, List.of());
    }

    /**
     * Records keyed by full path in snapshot order. A later record replaces an earlier one with the same key
     * but keeps the earlier position.
     */
    public Map<String, FileRecord> byFullPath() {
        Map<String, FileRecord> lookup = new LinkedHashMap<>();
        for (FileRecord record : records) {
            lookup.put(record.fullPath(), record);
        }
        return lookup;
    }

    public InventorySnapshot withRecords(List<FileRecord> replacement) {
        return new InventorySnapshot(sourceFolder, location, replacement);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
