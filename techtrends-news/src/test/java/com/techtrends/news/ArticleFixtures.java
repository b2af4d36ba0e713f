package com.techtrends.news;

import com.techtrends.news.model.Article;
import com.techtrends.news.model.Engagement;
import com.techtrends.news.model.NewsSource;

import java.time.Instant;

/**
 * Article fixtures shared by store, trend and ingestion tests.
 */
public final class ArticleFixtures {

    public static final Instant BASE_TIME = Instant.parse("2024-03-01T00:00:00Z");

    private ArticleFixtures() {
    }

    public static Article.Builder article(String id, String title) {
        return Article.builder()
            .id(id)
            .source(NewsSource.HACKER_NEWS)
            .title(title)
            .url("https://example.com/" + id)
            .publishedAt(BASE_TIME)
            .ingestedAt(BASE_TIME);
    }

    public static Article withPoints(String id, String title, int points) {
        return article(id, title)
            .engagement(new Engagement(points, 0, 0))
            .build();
    }

    public static Article publishedAt(String id, String title, Instant publishedAt) {
        return article(id, title)
            .publishedAt(publishedAt)
            .build();
    }
}
