package com.example.fileinventory.model;

/**
 * One row of the inventory: a file on disk, or a retained tombstone for a removed file that still carries a note.
 * {@code fullPath} is the primary key.
 */
public record FileRecord(
        String folderPath,
        String fileName,
        String extension,
        Long sizeBytes,
        String lastModified,
        String fullPath,
        String contentHint,
        TopicTags topics,
        RecordStatus status,
        String manualNotes
) {
    public FileRecord {
        if (fullPath == null || fullPath.isBlank()) {
            throw new IllegalArgumentException("fullPath is required");
        }
        lastModified = lastModified == null ? "" : lastModified;
        topics = topics == null ? TopicTags.notApplicable() : topics;
        status = status == null ? RecordStatus.ADDED : status;
        manualNotes = manualNotes == null ? "" : manualNotes;
    }

    public boolean hasNotes() {
        return !manualNotes.isBlank();
    }

    public FileRecord withStatus(RecordStatus newStatus) {
        return new FileRecord(folderPath, fileName, extension, sizeBytes, lastModified, fullPath,
                contentHint, topics, newStatus, manualNotes);
    }

    public FileRecord withManualNotes(String notes) {
        return new FileRecord(folderPath, fileName, extension, sizeBytes, lastModified, fullPath,
                contentHint, topics, status, notes);
    }
}
