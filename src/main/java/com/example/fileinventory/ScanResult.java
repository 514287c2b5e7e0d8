package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;

import java.util.List;
import java.util.Optional;

public class ScanResult {
    private final List<FileRecord> records;
    private final List<InventoryWarning> warnings;
    private final InventoryError error;

    private ScanResult(List<FileRecord> records, List<InventoryWarning> warnings, InventoryError error) {
        this.records = List.copyOf(records);
        this.warnings = List.copyOf(warnings);
        this.error = error;
    }

    public static ScanResult success(List<FileRecord> records, List<InventoryWarning> warnings) {
        return new ScanResult(records, warnings, null);
    }

    public static ScanResult failure(InventoryError error, List<InventoryWarning> warnings) {
        return new ScanResult(List.of(), warnings, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public List<FileRecord> getRecords() {
        return records;
    }

    public List<InventoryWarning> getWarnings() {
        return warnings;
    }

    public Optional<InventoryError> getError() {
        return Optional.ofNullable(error);
    }
}
