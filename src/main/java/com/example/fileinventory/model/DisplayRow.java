package com.example.fileinventory.model;

/**
 * Presentation projection of a record handed to the caller after filtering.
 */
public record DisplayRow(
        String action,
        String fileName,
        String status,
        String lastModified,
        String identifiedTopics,
        String contentHint,
        String manualNotes,
        String fullPath
) {
    public static final String OPEN_FOLDER_ACTION = "📂";

    public static DisplayRow from(FileRecord record) {
        return new DisplayRow(
                OPEN_FOLDER_ACTION,
                nullToEmpty(record.fileName()),
                record.status().label(),
                record.lastModified(),
                record.topics().render(),
                nullToEmpty(record.contentHint()),
                record.manualNotes(),
                record.fullPath()
        );
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
