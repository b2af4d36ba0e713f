package com.techtrends.news.topic;

import com.techtrends.news.model.Article;

import java.util.List;
import java.util.Locale;

/**
 * Keyword categorizer. Rules are scanned in order and the first rule with a matching
 * phrase wins, even if a later rule would match more phrases.
 */
public final class Categorizer {

    private Categorizer() {
    }

    /**
     * Return the article with its category set, or cleared when no rule matches.
     */
    public static Article categorize(Article article, List<CategoryRule> rules) {
        return article.withCategory(classify(article.title(), article.description(), rules));
    }

    /**
     * Label of the first rule matching title + description, or null.
     */
    public static String classify(String title, String description, List<CategoryRule> rules) {
        String text = ((title != null ? title : "") + " " + (description != null ? description : ""))
            .toLowerCase(Locale.ROOT);
        for (CategoryRule rule : rules) {
            if (rule.matches(text)) {
                return rule.label();
            }
        }
        return null;
    }
}
