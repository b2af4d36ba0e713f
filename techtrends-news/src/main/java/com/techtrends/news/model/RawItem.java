package com.techtrends.news.model;

import java.time.Instant;
import java.util.List;

/**
 * Source-specific shape of a fetched item, before normalization.
 * Each variant is produced by exactly one fetcher and consumed by the normalizer.
 */
public sealed interface RawItem {

    NewsSource source();

    /**
     * Hacker News story record (Firebase item API).
     * @param time publish time, null when the record has none
     */
    record HackerNewsItem(
        long id,
        String title,
        String url,
        String by,
        int score,
        int descendants,
        Instant time
    ) implements RawItem {
        @Override
        public NewsSource source() {
            return NewsSource.HACKER_NEWS;
        }
    }

    /**
     * Dev.to article record (articles API).
     * @param id source id, null if the payload omitted it
     * @param publishedAt raw ISO-8601 text as sent by the API, may be null or malformed
     */
    record DevToItem(
        Long id,
        String title,
        String url,
        String description,
        String author,
        int reactions,
        int comments,
        int readingTimeMinutes,
        List<String> tags,
        String publishedAt
    ) implements RawItem {
        @Override
        public NewsSource source() {
            return NewsSource.DEV_TO;
        }
    }
}
