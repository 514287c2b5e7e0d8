package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;
import com.example.fileinventory.model.InventorySnapshot;
import com.example.fileinventory.model.RecordStatus;
import com.example.fileinventory.model.TopicTags;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InventoryFilterTest {
    private final InventoryFilter filter = new InventoryFilter();

    private final InventorySnapshot snapshot = new InventorySnapshot(Path.of("/p"), Path.of("/p/inventory.csv"), List.of(
            record("/p/2023/old", "manuscript_v1.docx", RecordStatus.ACTIVE, List.of("PET"), ""),
            record("/p/2024/new", "manuscript_v2.docx", RecordStatus.UPDATED, List.of("PET", "AD"), "submitted"),
            record("/p/2024/new", "figures.xlsx", RecordStatus.ADDED, List.of(), "manuscript figures"),
            record("/p/archive", "draft.txt", RecordStatus.REMOVED, List.of("DID"), "lost draft")
    ));

    @Test
    void blankQueriesReturnEverythingInOrder() {
        assertEquals(snapshot.records(), filter.filter(snapshot, "All", "", null));
        assertEquals(snapshot.records(), filter.filter(snapshot, null, "  ", "  "));
    }

    @Test
    void statusFilterMatchesLabelOrName() {
        assertEquals(List.of("draft.txt"), names(filter.filter(snapshot, "Removed (Not Found)", null, null)));
        assertEquals(List.of("manuscript_v2.docx"), names(filter.filter(snapshot, "updated", null, null)));
        assertTrue(filter.filter(snapshot, "Archived", null, null).isEmpty());
    }

    @Test
    void folderExclusionCombinesWithSearchTerm() {
        List<FileRecord> rows = filter.filter(snapshot, "All", null, "manuscript, folder:old");

        assertEquals(List.of("manuscript_v2.docx", "figures.xlsx"), names(rows));
    }

    @Test
    void folderInclusionKeepsOnlyMatchingFolders() {
        List<FileRecord> rows = filter.filter(snapshot, "All", null, "incfolder:2023, incfolder:ARCHIVE");

        assertEquals(List.of("manuscript_v1.docx", "draft.txt"), names(rows));
    }

    @Test
    void topicTermsMustAllMatch() {
        assertEquals(List.of("manuscript_v2.docx"), names(filter.filter(snapshot, "All", "pet, ad", null)));
        assertEquals(List.of("manuscript_v1.docx", "manuscript_v2.docx"),
                names(filter.filter(snapshot, "All", "PET", null)));
    }

    @Test
    void searchTermsAreCaseInsensitivePatterns() {
        assertEquals(List.of("manuscript_v1.docx", "manuscript_v2.docx"),
                names(filter.filter(snapshot, "All", null, "MANUSCRIPT_V\\d")));
        assertEquals(List.of("figures.xlsx"), names(filter.filter(snapshot, "All", null, "figures, manuscript")));
    }

    @Test
    void invalidPatternFallsBackToLiteralText() {
        FileRecord bracketed = record("/p", "notes[1.txt", RecordStatus.ACTIVE, List.of(), "");
        InventorySnapshot withBracket = snapshot.withRecords(List.of(bracketed));

        assertEquals(List.of("notes[1.txt"), names(filter.filter(withBracket, "All", null, "notes[1")));
    }

    @Test
    void pathLikeTermsMatchLiterally() {
        assertTrue(InventoryFilter.isPathLike("2024/new"));
        assertFalse(InventoryFilter.isPathLike("manuscript.*"));
        assertEquals(List.of("manuscript_v2.docx", "figures.xlsx"),
                names(filter.filter(snapshot, "All", null, "/p/2024/NEW")));
    }

    @Test
    void searchableTextCoversNotesAndTopics() {
        FileRecord record = snapshot.records().get(1);

        String text = InventoryFilter.searchableText(record);

        assertTrue(text.contains("submitted"));
        assertTrue(text.contains("PET, AD"));
        assertTrue(text.contains(record.fullPath()));
    }

    private static List<String> names(List<FileRecord> rows) {
        return rows.stream().map(FileRecord::fileName).toList();
    }

    private static FileRecord record(String folder, String name, RecordStatus status, List<String> topics, String notes) {
        return new FileRecord(folder, name, InventoryScanner.extensionOf(name), 10L, "2024-01-01T00:00:00",
                folder + "/" + name, "N/A", TopicTags.of(topics), status, notes);
    }
}
