package com.example.fileinventory.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered topic names matched for a document, or a marker explaining why there are none.
 */
public record TopicTags(
        List<String> names,
        String marker
) {
    public static final String NO_MATCH = "N/A";
    public static final String EMPTY_DOCUMENT = "DOCX Empty";
    public static final String READ_ERROR = "N/A (Error reading DOCX)";

    private static final String SEPARATOR = ", ";

    public TopicTags {
        names = names == null ? List.of() : List.copyOf(names);
        if (!names.isEmpty()) {
            marker = null;
        } else if (marker == null || marker.isBlank()) {
            marker = NO_MATCH;
        }
    }

    public static TopicTags of(List<String> names) {
        return new TopicTags(names, null);
    }

    public static TopicTags marker(String marker) {
        return new TopicTags(List.of(), marker);
    }

    public static TopicTags notApplicable() {
        return marker(NO_MATCH);
    }

    public boolean matched() {
        return !names.isEmpty();
    }

    /**
     * Persisted form: names joined with ", " or the marker.
     */
    public String render() {
        return matched() ? String.join(SEPARATOR, names) : marker;
    }

    /**
     * Reverses {@link #render()}. Anything starting with the no-match marker, and the empty-document marker,
     * is kept as a marker.
     */
    public static TopicTags parse(String value) {
        if (value == null || value.isBlank()) {
            return notApplicable();
        }
        String trimmed = value.trim();
        if (trimmed.startsWith(NO_MATCH) || trimmed.equals(EMPTY_DOCUMENT)) {
            return marker(trimmed);
        }
        List<String> names = new ArrayList<>();
        for (String part : trimmed.split(",")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names.isEmpty() ? notApplicable() : of(names);
    }
}
