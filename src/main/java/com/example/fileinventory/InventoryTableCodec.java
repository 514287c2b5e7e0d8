package com.example.fileinventory;

import com.example.fileinventory.model.FileRecord;
import com.example.fileinventory.model.RecordStatus;
import com.example.fileinventory.model.TopicTags;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the inventory table: a UTF-8 CSV sheet whose first row is the header.
 */
public class InventoryTableCodec {
    public static final String FOLDER_PATH = "FolderPath";
    public static final String FILE_NAME = "FileName";
    public static final String EXTENSION = "Extension";
    public static final String SIZE_BYTES = "SizeBytes";
    public static final String LAST_MODIFIED = "LastModified";
    public static final String FULL_PATH = "FullPath";
    public static final String CONTENT_HINT = "ContentHint";
    public static final String IDENTIFIED_TOPICS = "IdentifiedTopics";
    public static final String STATUS = "Status";
    public static final String MANUAL_NOTES = "ManualNotes";

    /**
     * Canonical column set, in persisted order.
     */
    public static final List<String> COLUMNS = List.of(
            FOLDER_PATH,
            FILE_NAME,
            EXTENSION,
            SIZE_BYTES,
            LAST_MODIFIED,
            FULL_PATH,
            CONTENT_HINT,
            IDENTIFIED_TOPICS,
            STATUS,
            MANUAL_NOTES
    );

    private final CsvMapper mapper;
    private final CsvSchema schema;

    public InventoryTableCodec() {
        mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        CsvSchema.Builder builder = CsvSchema.builder();
        COLUMNS.forEach(builder::addColumn);
        schema = builder.build().withoutHeader();
    }

    /**
     * Writes the header and one row per record to {@code target}, replacing any existing content.
     */
    public void write(List<FileRecord> records, Path target) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             SequenceWriter rows = mapper.writer(schema).writeValues(writer)) {
            Map<String, String> header = new LinkedHashMap<>();
            COLUMNS.forEach(column -> header.put(column, column));
            rows.write(header);
            for (FileRecord record : records) {
                rows.write(toRow(record));
            }
        }
    }

    /**
     * Parses the whole table. Rows shorter than the header are padded with empty cells.
     */
    public Table read(Path source) throws IOException {
        List<String[]> lines;
        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
             MappingIterator<String[]> iterator = mapper.readerFor(String[].class).readValues(reader)) {
            lines = iterator.readAll();
        }
        if (lines.isEmpty()) {
            return new Table(List.of(), List.of());
        }
        List<String> columns = new ArrayList<>();
        for (String name : lines.get(0)) {
            columns.add(name == null ? "" : name.trim());
        }
        List<Map<String, String>> rows = new ArrayList<>(lines.size() - 1);
        for (String[] line : lines.subList(1, lines.size())) {
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), i < line.length && line[i] != null ? line[i] : "");
            }
            rows.add(row);
        }
        return new Table(columns, rows);
    }

    /**
     * Rehydrates a stored row. Columns the stored header lacks are backfilled with defaults. The key is
     * kept exactly as stored since file names may begin or end with spaces.
     */
    public FileRecord toRecord(Map<String, String> row) {
        return new FileRecord(
                cell(row, FOLDER_PATH),
                cell(row, FILE_NAME),
                cell(row, EXTENSION),
                parseSize(cell(row, SIZE_BYTES)),
                cell(row, LAST_MODIFIED).trim(),
                cell(row, FULL_PATH),
                cell(row, CONTENT_HINT),
                TopicTags.parse(cell(row, IDENTIFIED_TOPICS)),
                RecordStatus.fromLabel(cell(row, STATUS)).orElse(RecordStatus.ACTIVE),
                cell(row, MANUAL_NOTES)
        );
    }

    Map<String, String> toRow(FileRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(FOLDER_PATH, nullToEmpty(record.folderPath()));
        row.put(FILE_NAME, nullToEmpty(record.fileName()));
        row.put(EXTENSION, nullToEmpty(record.extension()));
        row.put(SIZE_BYTES, record.sizeBytes() == null ? "" : Long.toString(record.sizeBytes()));
        row.put(LAST_MODIFIED, record.lastModified());
        row.put(FULL_PATH, record.fullPath());
        row.put(CONTENT_HINT, nullToEmpty(record.contentHint()));
        row.put(IDENTIFIED_TOPICS, record.topics().render());
        row.put(STATUS, record.status().label());
        row.put(MANUAL_NOTES, record.manualNotes());
        return row;
    }

    private static Long parseSize(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException ex) {
            try {
                return (long) Double.parseDouble(trimmed);
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
    }

    private static String cell(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null ? "" : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * Parsed table: header names in stored order and one map per data row.
     */
    public record Table(List<String> columns, List<Map<String, String>> rows) {
        public boolean hasColumn(String name) {
            return columns.contains(name);
        }
    }
}
