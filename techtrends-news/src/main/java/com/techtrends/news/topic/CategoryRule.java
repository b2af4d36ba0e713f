package com.techtrends.news.topic;

import java.util.List;
import java.util.Locale;

/**
 * A category label and the keyword phrases that select it.
 */
public record CategoryRule(
    String label,               // e.g., "DevOps"
    List<String> keywords       // Lowercase phrases, checked in order
) {
    public CategoryRule {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Category label must not be blank");
        }
        keywords = keywords == null ? List.of() : keywords.stream()
            .filter(k -> k != null && !k.isBlank())
            .map(k -> k.toLowerCase(Locale.ROOT))
            .toList();
    }

    public static CategoryRule of(String label, String... keywords) {
        return new CategoryRule(label, List.of(keywords));
    }

    /**
     * Check if already-lowercased text contains any keyword phrase.
     */
    public boolean matches(String lowerText) {
        if (lowerText == null) return false;
        return keywords.stream().anyMatch(lowerText::contains);
    }
}
