package com.example.fileinventory;

import com.example.fileinventory.model.TopicRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class TopicClassifier {
    private final List<TopicRule> rules;

    public TopicClassifier(List<TopicRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Returns the names of all rules matched by {@code text}, in rule declaration order. Matching is
     * case-insensitive substring containment.
     */
    public List<String> classify(String text) {
        String haystack = text == null ? "" : text.toLowerCase(Locale.ROOT);
        List<String> matched = new ArrayList<>();
        for (TopicRule rule : rules) {
            if (matches(rule, haystack)) {
                matched.add(rule.name());
            }
        }
        return matched;
    }

    private boolean matches(TopicRule rule, String haystack) {
        for (String keyword : rule.requiredKeywords()) {
            if (!haystack.contains(keyword.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        if (rule.optionalAnyOf().isEmpty()) {
            return true;
        }
        for (String keyword : rule.optionalAnyOf()) {
            if (haystack.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
