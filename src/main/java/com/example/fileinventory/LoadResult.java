package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;

import java.util.List;
import java.util.Optional;

/**
 * Records read from a persisted table. A corrupt or unusable table yields no records and
 * {@link InventoryError#LOAD_CORRUPT}.
 */
public record LoadResult(
        List<FileRecord> records,
        InventoryError error,
        List<InventoryWarning> warnings
) {
    public LoadResult {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
    }

    public static LoadResult loaded(List<FileRecord> records, List<InventoryWarning> warnings) {
        return new LoadResult(records, null, warnings);
    }

    public static LoadResult missing() {
        return new LoadResult(List.of(), null, List.of());
    }

    public static LoadResult corrupt(InventoryWarning warning) {
        return new LoadResult(List.of(), InventoryError.LOAD_CORRUPT, List.of(warning));
    }

    public Optional<InventoryError> failure() {
        return Optional.ofNullable(error);
    }
}
