package com.example.fileinventory.model;

import java.util.List;

/**
 * Tags a document with {@code name} when every required keyword occurs and, if any optional keywords are
 * given, at least one of them occurs too.
 */
public record TopicRule(
        String name,
        List<String> requiredKeywords,
        List<String> optionalAnyOf
) {
    public TopicRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Topic rule name is required.");
        }
        requiredKeywords = requiredKeywords == null ? List.of() : List.copyOf(requiredKeywords);
        optionalAnyOf = optionalAnyOf == null ? List.of() : List.copyOf(optionalAnyOf);
    }
}
