package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;
import com.example.fileinventory.model.InventorySnapshot;
import com.example.fileinventory.model.RecordStatus;
import com.example.fileinventory.model.TopicTags;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconcilerTest {
    private final Reconciler reconciler = new Reconciler();

    @Test
    void firstRunMarksEverythingAdded() {
        List<FileRecord> scan = List.of(record("/data/a.txt", 10L, "2024-01-01T10:00:00", ""),
                record("/data/b.txt", 20L, "2024-01-01T10:00:00", ""));

        ReconcileResult result = reconciler.reconcile(scan, previous());

        assertEquals(2, result.added());
        assertEquals(0, result.updated());
        assertEquals(0, result.removedWithNotes());
        assertTrue(result.merged().stream().allMatch(r -> r.status() == RecordStatus.ADDED));
    }

    @Test
    void unchangedFilesAreActiveAndKeepNotes() {
        FileRecord stored = record("/data/a.txt", 10L, "2024-01-01T10:00:00", "check figures").withStatus(RecordStatus.ADDED);
        List<FileRecord> scan = List.of(record("/data/a.txt", 10L, "2024-01-01T10:00:00", ""));

        ReconcileResult result = reconciler.reconcile(scan, previous(stored));

        FileRecord merged = result.merged().get(0);
        assertEquals(RecordStatus.ACTIVE, merged.status());
        assertEquals("check figures", merged.manualNotes());
        assertEquals(0, result.added() + result.updated() + result.removedWithNotes());
    }

    @Test
    void reconcilingTheSameScanTwiceIsIdempotent() {
        List<FileRecord> scan = List.of(record("/data/a.txt", 10L, "2024-01-01T10:00:00", ""),
                record("/data/b.txt", 20L, "2024-01-02T10:00:00", ""));
        ReconcileResult first = reconciler.reconcile(scan, previous());

        ReconcileResult second = reconciler.reconcile(scan, previous(first.merged().toArray(FileRecord[]::new)));
        ReconcileResult third = reconciler.reconcile(scan, previous(second.merged().toArray(FileRecord[]::new)));

        assertEquals(second.merged(), third.merged());
        assertTrue(third.merged().stream().allMatch(r -> r.status() == RecordStatus.ACTIVE));
        assertEquals(0, third.added() + third.updated() + third.removedWithNotes());
    }

    @Test
    void sizeOrTimestampChangeIsUpdated() {
        FileRecord a = record("/data/a.txt", 10L, "2024-01-01T10:00:00", "");
        FileRecord b = record("/data/b.txt", 20L, "2024-01-01T10:00:00", "");
        List<FileRecord> scan = List.of(record("/data/a.txt", 11L, "2024-01-01T10:00:00", ""),
                record("/data/b.txt", 20L, "2024-01-03T09:00:00", ""));

        ReconcileResult result = reconciler.reconcile(scan, previous(a, b));

        assertEquals(2, result.updated());
        assertEquals(RecordStatus.UPDATED, result.merged().get(0).status());
        assertEquals(RecordStatus.UPDATED, result.merged().get(1).status());
    }

    @Test
    void unknownStoredValuesDoNotCountAsChanges() {
        FileRecord stored = record("/data/a.txt", null, "", "");

        ReconcileResult result = reconciler.reconcile(
                List.of(record("/data/a.txt", 10L, "2024-01-01T10:00:00", "")), previous(stored));

        assertEquals(RecordStatus.ACTIVE, result.merged().get(0).status());
    }

    @Test
    void removedFileWithNoteBecomesTombstoneAndWithoutNoteIsDropped() {
        FileRecord kept = record("/data/kept.txt", 10L, "2024-01-01T10:00:00", "");
        FileRecord noted = record("/data/noted.docx", 30L, "2024-01-01T10:00:00", "Reviewer 2 draft");
        FileRecord silent = record("/data/silent.txt", 40L, "2024-01-01T10:00:00", "   ");

        ReconcileResult result = reconciler.reconcile(
                List.of(record("/data/kept.txt", 10L, "2024-01-01T10:00:00", "")), previous(kept, noted, silent));

        assertEquals(2, result.merged().size());
        FileRecord tombstone = result.merged().get(1);
        assertEquals("/data/noted.docx", tombstone.fullPath());
        assertEquals(RecordStatus.REMOVED, tombstone.status());
        assertEquals("Reviewer 2 draft", tombstone.manualNotes());
        assertEquals(30L, tombstone.sizeBytes());
        assertEquals(1, result.removedWithNotes());
    }

    @Test
    void emptyScanKeepsOnlyNotedRecordsInPreviousOrder() {
        FileRecord first = record("/data/1.txt", 1L, "2024-01-01T10:00:00", "one");
        FileRecord second = record("/data/2.txt", 2L, "2024-01-01T10:00:00", "");
        FileRecord third = record("/data/3.txt", 3L, "2024-01-01T10:00:00", "three");

        ReconcileResult result = reconciler.reconcile(List.of(), previous(first, second, third));

        assertEquals(List.of("/data/1.txt", "/data/3.txt"),
                result.merged().stream().map(FileRecord::fullPath).toList());
        assertEquals(2, result.removedWithNotes());
    }

    @Test
    void outputIsScanOrderFollowedByTombstones() {
        FileRecord gone = record("/data/gone.txt", 1L, "2024-01-01T10:00:00", "keep me");
        FileRecord z = record("/data/z.txt", 1L, "2024-01-01T10:00:00", "");
        List<FileRecord> scan = List.of(record("/data/z.txt", 1L, "2024-01-01T10:00:00", ""),
                record("/data/a.txt", 1L, "2024-01-01T10:00:00", ""));

        ReconcileResult result = reconciler.reconcile(scan, previous(gone, z));

        assertEquals(List.of("/data/z.txt", "/data/a.txt", "/data/gone.txt"),
                result.merged().stream().map(FileRecord::fullPath).toList());
    }

    private static InventorySnapshot previous(FileRecord... records) {
        return new InventorySnapshot(Path.of("/data"), Path.of("/data/inventory.csv"), List.of(records));
    }

    private static FileRecord record(String fullPath, Long size, String lastModified, String notes) {
        Path path = Path.of(fullPath);
        return new FileRecord(
                path.getParent().toString(),
                path.getFileName().toString(),
                InventoryScanner.extensionOf(path.getFileName().toString()),
                size,
                lastModified,
                fullPath,
                "N/A",
                TopicTags.notApplicable(),
                RecordStatus.ADDED,
                notes
        );
    }
}
