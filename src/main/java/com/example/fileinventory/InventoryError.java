package com.example.fileinventory;

/**
 * Kinds of failure the inventory engine reports instead of throwing.
 */
public enum InventoryError {
    FOLDER_NOT_FOUND,
    RECORD_READ_FAILURE,
    LOAD_CORRUPT,
    SAVE_VERIFICATION_FAILED,
    SAVE_WRITE_FAILED,
    RECOVERY_EXHAUSTED,
    BACKUP_FAILED
}
