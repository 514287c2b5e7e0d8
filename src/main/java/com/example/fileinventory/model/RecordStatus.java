package com.example.fileinventory.model;

import java.util.Optional;

/**
 * Outcome of the latest reconciliation pass for a single record.
 */
public enum RecordStatus {
    ACTIVE("Active"),
    UPDATED("Updated"),
    ADDED("Added"),
    REMOVED("Removed (Not Found)");

    private final String label;

    RecordStatus(String label) {
        this.label = label;
    }

    /**
     * Text written to the persisted table and shown to callers.
     */
    public String label() {
        return label;
    }

    /**
     * Resolves a stored or user-supplied status string. Both the label and the enum name are accepted,
     * case-insensitively.
     */
    public static Optional<RecordStatus> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (RecordStatus status : values()) {
            if (status.label.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
