package com.example.fileinventory;

import com.example.fileinventory.model.TopicRule;

import java.util.List;

/**
 * Immutable runtime settings for scanning and persisting an inventory.
 */
public record InventoryConfig(
        String inventoryFileName,
        List<String> excludedDirectories,
        List<String> excludedFileNames,
        List<String> transientFilePrefixes,
        boolean followLinks,
        int maxRotatingBackups,
        List<String> textExtensions,
        List<String> spreadsheetExtensions,
        List<TopicRule> topicRules
) {
}
