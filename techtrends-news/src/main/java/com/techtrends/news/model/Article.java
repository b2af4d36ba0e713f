package com.techtrends.news.model;

import java.time.Instant;
import java.util.List;

/**
 * Canonical news article. One row per identity in the corpus.
 */
public record Article(
    String id,                          // SHA-256(source key + native id), see ArticleNormalizer
    NewsSource source,
    String title,                       // Trimmed, HTML-unescaped, never empty
    String url,                         // Empty for self-posts
    String author,                      // May be null
    Instant publishedAt,
    boolean publishedAtApproximate,     // True when the source gave no usable publish time
    Engagement engagement,
    String description,                 // Empty for Hacker News
    List<String> tags,
    int readingTimeMinutes,
    String category,                    // Null until categorized, or when nothing matched
    Instant ingestedAt                  // First persistence, never updated
) {
    public static final String UNCATEGORIZED = "Uncategorized";

    public Article {
        tags = tags != null ? List.copyOf(tags) : List.of();
        engagement = engagement != null ? engagement : Engagement.NONE;
        description = description != null ? description : "";
        url = url != null ? url : "";
    }

    /**
     * Category label for display and aggregation, never null.
     */
    public String categoryOrDefault() {
        return category != null ? category : UNCATEGORIZED;
    }

    public Article withCategory(String category) {
        return new Article(id, source, title, url, author, publishedAt, publishedAtApproximate,
            engagement, description, tags, readingTimeMinutes, category, ingestedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private NewsSource source;
        private String title;
        private String url = "";
        private String author;
        private Instant publishedAt;
        private boolean publishedAtApproximate;
        private Engagement engagement = Engagement.NONE;
        private String description = "";
        private List<String> tags = List.of();
        private int readingTimeMinutes;
        private String category;
        private Instant ingestedAt;

        public Builder id(String id) { this.id = id; return this; }
        public Builder source(NewsSource source) { this.source = source; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder publishedAt(Instant publishedAt) { this.publishedAt = publishedAt; return this; }
        public Builder publishedAtApproximate(boolean approximate) { this.publishedAtApproximate = approximate; return this; }
        public Builder engagement(Engagement engagement) { this.engagement = engagement; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder readingTimeMinutes(int minutes) { this.readingTimeMinutes = minutes; return this; }
        public Builder category(String category) { this.category = category; return this; }
        public Builder ingestedAt(Instant ingestedAt) { this.ingestedAt = ingestedAt; return this; }

        public Article build() {
            return new Article(id, source, title, url, author, publishedAt, publishedAtApproximate,
                engagement, description, tags, readingTimeMinutes, category, ingestedAt);
        }
    }
}
