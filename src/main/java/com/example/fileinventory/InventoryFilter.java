package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;
import com.example.fileinventory.model.InventorySnapshot;
import com.example.fileinventory.model.RecordStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Narrows a snapshot for presentation. Status is applied first, then folder inclusions and exclusions from
 * the text query, then its free-text terms, then topic terms. Blank queries do nothing.
 *
 * <p>Text query syntax, comma separated: {@code folder:x} drops rows whose folder path contains {@code x},
 * {@code incfolder:x} keeps only rows whose folder path contains one of the inclusion terms, anything else is
 * a search term that must occur in the row's searchable text.
 */
public final class InventoryFilter {
    public static final String ALL_STATUSES = "All";
    static final String EXCLUDE_FOLDER_MARKER = "folder:";
    static final String INCLUDE_FOLDER_MARKER = "incfolder:";
    private static final String FIELD_SEPARATOR = " || ";

    public List<FileRecord> filter(InventorySnapshot snapshot, String statusFilter, String topicQuery, String textQuery) {
        List<FileRecord> rows = new ArrayList<>(snapshot.records());
        if (statusFilter != null && !statusFilter.isBlank() && !ALL_STATUSES.equalsIgnoreCase(statusFilter.trim())) {
            Optional<RecordStatus> status = RecordStatus.fromLabel(statusFilter);
            if (status.isEmpty()) {
                return List.of();
            }
            rows = retain(rows, record -> record.status() == status.get());
        }

        if (textQuery != null && !textQuery.isBlank()) {
            TextQuery query = TextQuery.parse(textQuery);
            if (!query.folderIncludes().isEmpty()) {
                rows = retain(rows, record -> containsAny(folderOf(record), query.folderIncludes()));
            }
            if (!query.folderExcludes().isEmpty()) {
                rows = retain(rows, record -> !containsAny(folderOf(record), query.folderExcludes()));
            }
            for (String term : query.searchTerms()) {
                Predicate<String> matcher = termMatcher(term);
                rows = retain(rows, record -> matcher.test(searchableText(record)));
            }
        }

        if (topicQuery != null && !topicQuery.isBlank()) {
            for (String term : splitTerms(topicQuery)) {
                String lowered = term.toLowerCase(Locale.ROOT);
                rows = retain(rows, record -> record.topics().render().toLowerCase(Locale.ROOT).contains(lowered));
            }
        }
        return rows;
    }

    /**
     * File name, notes, hint, topics, full path and timestamp joined into one string.
     */
    static String searchableText(FileRecord record) {
        return String.join(FIELD_SEPARATOR,
                nullToEmpty(record.fileName()),
                record.manualNotes(),
                nullToEmpty(record.contentHint()),
                record.topics().render(),
                record.fullPath(),
                record.lastModified());
    }

    /**
     * Path-like terms match literally; other terms are case-insensitive patterns, or literal text when
     * they do not compile.
     */
    static Predicate<String> termMatcher(String term) {
        String lowered = term.toLowerCase(Locale.ROOT);
        if (!isPathLike(term)) {
            try {
                Pattern pattern = Pattern.compile(term, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                return text -> pattern.matcher(text).find();
            } catch (PatternSyntaxException ex) {
                return text -> text.toLowerCase(Locale.ROOT).contains(lowered);
            }
        }
        return text -> text.toLowerCase(Locale.ROOT).contains(lowered);
    }

    static boolean isPathLike(String term) {
        return term.indexOf('/') >= 0 || term.indexOf('\\') >= 0 || term.indexOf(':') >= 0;
    }

    private static List<FileRecord> retain(List<FileRecord> rows, Predicate<FileRecord> keep) {
        List<FileRecord> kept = new ArrayList<>(rows.size());
        for (FileRecord row : rows) {
            if (keep.test(row)) {
                kept.add(row);
            }
        }
        return kept;
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static String folderOf(FileRecord record) {
        return nullToEmpty(record.folderPath()).toLowerCase(Locale.ROOT);
    }

    private static List<String> splitTerms(String query) {
        List<String> terms = new ArrayList<>();
        for (String token : query.split(",")) {
            String term = token.strip();
            if (!term.isEmpty()) {
                terms.add(term);
            }
        }
        return terms;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * Text query split into its three kinds of token. Folder terms are lower-cased.
     */
    record TextQuery(List<String> folderIncludes, List<String> folderExcludes, List<String> searchTerms) {
        static TextQuery parse(String query) {
            List<String> includes = new ArrayList<>();
            List<String> excludes = new ArrayList<>();
            List<String> terms = new ArrayList<>();
            for (String token : splitTerms(query)) {
                String lowered = token.toLowerCase(Locale.ROOT);
                if (lowered.startsWith(EXCLUDE_FOLDER_MARKER)) {
                    addIfPresent(excludes, lowered.substring(EXCLUDE_FOLDER_MARKER.length()));
                } else if (lowered.startsWith(INCLUDE_FOLDER_MARKER)) {
                    addIfPresent(includes, lowered.substring(INCLUDE_FOLDER_MARKER.length()));
                } else {
                    terms.add(token);
                }
            }
            return new TextQuery(includes, excludes, terms);
        }

        private static void addIfPresent(List<String> target, String value) {
            String term = value.strip();
            if (!term.isEmpty()) {
                target.add(term);
            }
        }
    }
}
