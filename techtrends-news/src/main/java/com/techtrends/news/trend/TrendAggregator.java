package com.techtrends.news.trend;

import com.techtrends.news.model.Article;
import com.techtrends.news.model.Engagement;
import com.techtrends.news.model.TimeWindow;
import com.techtrends.news.store.ArticleStore;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Trend statistics over the stored corpus. Holds no state between calls: every call
 * reads the articles of its window from the store and recomputes.
 */
public class TrendAggregator {

    public static final int DEFAULT_MIN_TOKEN_LENGTH = 3;

    static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
        "of", "with", "by", "from", "as", "is", "was", "are", "were", "be",
        "been", "being", "have", "has", "had", "do", "does", "did", "will",
        "would", "should", "could", "may", "might", "can", "this", "that",
        "these", "those", "i", "you", "he", "she", "it", "we", "they"
    );

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{Alnum}]+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Comparator<KeywordCount> RANKING = Comparator
        .comparingInt(KeywordCount::frequency).reversed()
        .thenComparing(KeywordCount::keyword);

    private final ArticleStore store;
    private final int minTokenLength;

    public TrendAggregator(ArticleStore store) {
        this(store, DEFAULT_MIN_TOKEN_LENGTH);
    }

    /**
     * @param minTokenLength tokens shorter than this are ignored
     */
    public TrendAggregator(ArticleStore store, int minTokenLength) {
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("minTokenLength must be positive: " + minTokenLength);
        }
        this.store = store;
        this.minTokenLength = minTokenLength;
    }

    /**
     * Most frequent title keywords in the window, by frequency descending then keyword
     * ascending.
     */
    public List<KeywordCount> trendingKeywords(TimeWindow window, int topN) {
        return rankKeywords(titles(store.findPublishedBetween(window)), topN);
    }

    /**
     * Article count and engagement per category. Articles without a category are
     * reported under {@link Article#UNCATEGORIZED}. Ordered by count, then label.
     */
    public Map<String, CategoryStats> categoryBreakdown(TimeWindow window) {
        Map<String, CategoryStats> stats = new HashMap<>();
        for (Article article : store.findPublishedBetween(window)) {
            stats.merge(article.categoryOrDefault(),
                new CategoryStats(1, article.engagement().total()),
                (a, b) -> a.add(b.totalEngagement()));
        }

        Map<String, CategoryStats> ordered = new LinkedHashMap<>();
        stats.entrySet().stream()
            .sorted(Map.Entry.<String, CategoryStats>comparingByValue(
                    Comparator.comparingInt(CategoryStats::articleCount).reversed())
                .thenComparing(Map.Entry::getKey))
            .forEach(e -> ordered.put(e.getKey(), e.getValue()));
        return ordered;
    }

    public EngagementSummary engagementSummary(TimeWindow window) {
        List<Article> articles = store.findPublishedBetween(window);
        if (articles.isEmpty()) return EngagementSummary.EMPTY;

        long points = 0, comments = 0, reactions = 0;
        int maxPoints = 0, maxComments = 0, maxReactions = 0;
        for (Article article : articles) {
            Engagement e = article.engagement();
            points += e.points();
            comments += e.comments();
            reactions += e.reactions();
            maxPoints = Math.max(maxPoints, e.points());
            maxComments = Math.max(maxComments, e.comments());
            maxReactions = Math.max(maxReactions, e.reactions());
        }

        double n = articles.size();
        return new EngagementSummary(articles.size(), points, comments, reactions,
            points / n, comments / n, reactions / n, maxPoints, maxComments, maxReactions);
    }

    /**
     * Rank keywords across the given texts. Pure; exposed for callers that already hold
     * the texts.
     */
    public List<KeywordCount> rankKeywords(List<String> texts, int topN) {
        if (topN <= 0) return List.of();

        Map<String, Integer> counts = new HashMap<>();
        for (String text : texts) {
            if (text == null) continue;
            for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
                if (token.length() < minTokenLength || STOP_WORDS.contains(token)) continue;
                counts.merge(token, 1, Integer::sum);
            }
        }

        return counts.entrySet().stream()
            .map(e -> new KeywordCount(e.getKey(), e.getValue()))
            .sorted(RANKING)
            .limit(topN)
            .toList();
    }

    private static List<String> titles(List<Article> articles) {
        return articles.stream().map(Article::title).toList();
    }
}
