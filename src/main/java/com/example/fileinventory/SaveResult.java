package com.example.fileinventory;

import java.util.List;
import java.util.Optional;

public class SaveResult {
    private final boolean success;
    private final int rowsWritten;
    private final InventoryError error;
    private final String message;
    private final List<InventoryWarning> warnings;

    private SaveResult(boolean success, int rowsWritten, InventoryError error, String message,
                       List<InventoryWarning> warnings) {
        this.success = success;
        this.rowsWritten = rowsWritten;
        this.error = error;
        this.message = message;
        this.warnings = List.copyOf(warnings);
    }

    public static SaveResult success(int rowsWritten, List<InventoryWarning> warnings) {
        return new SaveResult(true, rowsWritten, null, "Saved " + rowsWritten + " entries", warnings);
    }

    public static SaveResult failure(InventoryError error, String message, List<InventoryWarning> warnings) {
        return new SaveResult(false, 0, error, message, warnings);
    }

    public boolean isSuccess() {
        return success;
    }

    public int getRowsWritten() {
        return rowsWritten;
    }

    public Optional<InventoryError> getError() {
        return Optional.ofNullable(error);
    }

    public String getMessage() {
        return message;
    }

    /**
     * Non-fatal problems met along the way, such as a backup that could not be written.
     */
    public List<InventoryWarning> getWarnings() {
        return warnings;
    }
}
