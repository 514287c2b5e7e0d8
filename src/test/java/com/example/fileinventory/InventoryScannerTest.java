package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;
import com.example.fileinventory.model.RecordStatus;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InventoryScannerTest {
    private final InventoryConfig config = ConfigLoader.defaults();
    private final InventoryScanner scanner =
            new InventoryScanner(config, ContentHintExtractor.from(config), ZoneOffset.UTC);

    @Test
    void listsFilesBeforeDescendingIntoSortedSubfolders() throws Exception {
        Path root = Files.createTempDirectory("scan-order");
        Files.createDirectories(root.resolve("b"));
        Files.createDirectories(root.resolve("a/nested"));
        Files.writeString(root.resolve("z.txt"), "z");
        Files.writeString(root.resolve("m.txt"), "m");
        Files.writeString(root.resolve("a/one.txt"), "1");
        Files.writeString(root.resolve("a/nested/deep.txt"), "d");
        Files.writeString(root.resolve("b/two.txt"), "2");

        ScanResult result = scanner.scan(root, root.resolve("inventory.csv"));

        List<String> names = result.getRecords().stream().map(FileRecord::fileName).toList();
        assertTrue(result.isSuccess());
        assertEquals(List.of("m.txt", "z.txt", "one.txt", "deep.txt", "two.txt"), names);
    }

    @Test
    void skipsExcludedFoldersTransientFilesAndInventoryArtifacts() throws Exception {
        Path root = Files.createTempDirectory("scan-exclusions");
        Path inventory = root.resolve("inventory.csv");
        Files.createDirectories(root.resolve(".git"));
        Files.createDirectories(root.resolve("__pycache__"));
        Files.createDirectories(root.resolve("sub"));
        Files.writeString(root.resolve(".git/config"), "x");
        Files.writeString(root.resolve("__pycache__/mod.pyc"), "x");
        Files.writeString(root.resolve("~$draft.docx"), "lock");
        Files.writeString(inventory, "FullPath\n");
        Files.writeString(root.resolve("inventory.csv.bak"), "FullPath\n");
        Files.writeString(root.resolve("inventory.csv.bak.20240101_000000"), "FullPath\n");
        Files.writeString(root.resolve("inventory.csv_temp.csv"), "FullPath\n");
        Files.writeString(root.resolve("sub/inventory.csv"), "FullPath\n");
        Files.writeString(root.resolve(".DS_Store"), "finder");
        Files.writeString(root.resolve("keep.md"), "# Heading");

        ScanResult result = scanner.scan(root, inventory);

        List<String> names = result.getRecords().stream().map(FileRecord::fileName).toList();
        assertEquals(List.of("keep.md"), names);
    }

    @Test
    void buildsRecordWithMetadataAndHint() throws Exception {
        Path root = Files.createTempDirectory("scan-record");
        Path file = Files.writeString(root.resolve("Notes.TXT"), "first line\nsecond line");
        Files.setLastModifiedTime(file, FileTime.from(LocalDateTime.of(2024, 2, 3, 4, 5, 6).toInstant(ZoneOffset.UTC)));

        FileRecord record = scanner.scan(root, null).getRecords().get(0);

        assertEquals(root.toRealPath().toString(), record.folderPath());
        assertEquals("Notes.TXT", record.fileName());
        assertEquals(".txt", record.extension());
        assertEquals(Long.valueOf(Files.size(file)), record.sizeBytes());
        assertEquals("2024-02-03T04:05:06", record.lastModified());
        assertEquals(file.toRealPath().toString(), record.fullPath());
        assertEquals("First 2 lines: first line second line...", record.contentHint());
        assertEquals(RecordStatus.ADDED, record.status());
        assertFalse(record.hasNotes());
    }

    @Test
    void missingRootFolderIsReported() throws Exception {
        Path root = Files.createTempDirectory("scan-missing").resolve("gone");

        ScanResult result = scanner.scan(root, null);

        assertFalse(result.isSuccess());
        assertEquals(InventoryError.FOLDER_NOT_FOUND, result.getError().orElseThrow());
        assertTrue(result.getRecords().isEmpty());
    }

    @Test
    void extensionIsLowerCasedAndEmptyWithoutDot() {
        assertEquals(".docx", InventoryScanner.extensionOf("Report.DOCX"));
        assertEquals("", InventoryScanner.extensionOf("Makefile"));
        assertEquals("", InventoryScanner.extensionOf(".profile"));
        assertEquals(".gz", InventoryScanner.extensionOf("archive.tar.gz"));
    }

    @Test
    void linkedFilesAreListedButLinkedFoldersAreNotDescended() throws Exception {
        Path outside = Files.createTempDirectory("scan-link-target");
        Path target = Files.writeString(outside.resolve("shared.txt"), "shared content");
        Path root = Files.createTempDirectory("scan-links");
        Files.createSymbolicLink(root.resolve("link.txt"), target);
        Files.createSymbolicLink(root.resolve("linked-folder"), outside);

        List<FileRecord> records = scanner.scan(root, null).getRecords();

        assertEquals(1, records.size());
        FileRecord linked = records.get(0);
        assertEquals("link.txt", linked.fileName());
        assertEquals(Long.valueOf(Files.size(target)), linked.sizeBytes());
        assertEquals(root.toRealPath().resolve("link.txt").toString(), linked.fullPath());
    }

    @Test
    void rootReachedThroughLinkYieldsRealPathKeys() throws Exception {
        Path real = Files.createTempDirectory("scan-real");
        Path file = Files.writeString(real.resolve("a.txt"), "alpha");
        Path link = Files.createSymbolicLink(Files.createTempDirectory("scan-alias").resolve("alias"), real);

        ScanResult viaLink = scanner.scan(link, link.resolve("inventory.csv"));
        ScanResult viaReal = scanner.scan(real, real.resolve("inventory.csv"));

        assertEquals(file.toRealPath().toString(), viaLink.getRecords().get(0).fullPath());
        assertEquals(viaReal.getRecords(), viaLink.getRecords());
    }

    @Test
    void fileNamesWithEdgeSpacesKeepTheirKey() throws Exception {
        Path root = Files.createTempDirectory("scan-spaces");
        Path file = Files.writeString(root.resolve("draft.txt "), "text");

        FileRecord record = scanner.scan(root, null).getRecords().get(0);

        assertEquals("draft.txt ", record.fileName());
        assertEquals(file.toRealPath().toString(), record.fullPath());
    }
}
