package com.example.fileinventory;

import com.example.fileinventory.model.TopicRule;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class ConfigLoader {
    static final String DEFAULT_INVENTORY_FILE_NAME = "inventory.csv";
    static final int DEFAULT_MAX_ROTATING_BACKUPS = 5;
    private static final List<String> DEFAULT_EXCLUDED_DIRECTORIES = List.of(
            ".git",
            "__pycache__",
            ".ipynb_checkpoints"
    );
    private static final List<String> DEFAULT_EXCLUDED_FILE_NAMES = List.of(".DS_Store");
    private static final List<String> DEFAULT_TRANSIENT_PREFIXES = List.of("~$");
    private static final List<String> DEFAULT_TEXT_EXTENSIONS = List.of(".txt", ".py", ".r", ".md");
    private static final List<String> DEFAULT_SPREADSHEET_EXTENSIONS = List.of(".xlsx", ".csv", ".prism");
    private static final List<TopicRule> DEFAULT_TOPIC_RULES = List.of(
            new TopicRule("PET", List.of("pet"), List.of("scan", "imaging", "tracer")),
            new TopicRule("DID", List.of("did"), List.of("dementia", "cognitive", "decline")),
            new TopicRule("AD", List.of("alzheimer"), List.of("disease", "dementia", "ad"))
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Settings used when no configuration file is supplied.
     */
    public static InventoryConfig defaults() {
        return new ConfigLoader().fromRaw(new RawConfig());
    }

    public InventoryConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
        return fromRaw(raw);
    }

    private InventoryConfig fromRaw(RawConfig raw) {
        String inventoryFileName = optionalString(raw.inventoryFileName, DEFAULT_INVENTORY_FILE_NAME);
        if (inventoryFileName.contains("/") || inventoryFileName.contains("\\")) {
            throw new IllegalArgumentException("inventoryFileName must be a plain file name: " + inventoryFileName);
        }
        int maxRotatingBackups = raw.maxRotatingBackups != null && raw.maxRotatingBackups >= 0
                ? raw.maxRotatingBackups
                : DEFAULT_MAX_ROTATING_BACKUPS;
        boolean followLinks = raw.followLinks != null && raw.followLinks;

        List<String> excludedDirectories = mergePatterns(DEFAULT_EXCLUDED_DIRECTORIES, raw.excludedDirectories);
        List<String> excludedFileNames = mergePatterns(DEFAULT_EXCLUDED_FILE_NAMES, raw.excludedFileNames);
        List<String> transientPrefixes = mergePatterns(DEFAULT_TRANSIENT_PREFIXES, raw.transientFilePrefixes);
        List<String> textExtensions = normalizeExtensions(
                raw.textExtensions == null ? DEFAULT_TEXT_EXTENSIONS : raw.textExtensions);
        List<String> spreadsheetExtensions = normalizeExtensions(
                raw.spreadsheetExtensions == null ? DEFAULT_SPREADSHEET_EXTENSIONS : raw.spreadsheetExtensions);
        List<TopicRule> topicRules = raw.topicRules == null ? DEFAULT_TOPIC_RULES : toRules(raw.topicRules);

        return new InventoryConfig(
                inventoryFileName,
                excludedDirectories,
                excludedFileNames,
                transientPrefixes,
                followLinks,
                maxRotatingBackups,
                textExtensions,
                spreadsheetExtensions,
                topicRules
        );
    }

    private List<TopicRule> toRules(List<RawTopicRule> rawRules) {
        List<TopicRule> rules = new ArrayList<>();
        for (RawTopicRule rawRule : rawRules) {
            if (rawRule == null) {
                continue;
            }
            rules.add(new TopicRule(rawRule.name, rawRule.requiredKeywords, rawRule.optionalAnyOf));
        }
        return List.copyOf(rules);
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private List<String> normalizeExtensions(List<String> extensions) {
        List<String> normalized = new ArrayList<>();
        for (String extension : extensions) {
            if (extension == null || extension.isBlank()) {
                continue;
            }
            String value = extension.trim().toLowerCase(Locale.ROOT);
            value = value.startsWith(".") ? value : "." + value;
            if (!normalized.contains(value)) {
                normalized.add(value);
            }
        }
        return List.copyOf(normalized);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }

    private static class RawConfig {
        public String inventoryFileName;
        public List<String> excludedDirectories;
        public List<String> excludedFileNames;
        public List<String> transientFilePrefixes;
        public Boolean followLinks;
        public Integer maxRotatingBackups;
        public List<String> textExtensions;
        public List<String> spreadsheetExtensions;
        public List<RawTopicRule> topicRules;
    }

    private static class RawTopicRule {
        public String name;
        public List<String> requiredKeywords;
        public List<String> optionalAnyOf;
    }
}
