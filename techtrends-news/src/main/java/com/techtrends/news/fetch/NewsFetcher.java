package com.techtrends.news.fetch;

import com.techtrends.news.model.NewsSource;

import java.time.Duration;

/**
 * Interface for news source fetchers.
 */
public interface NewsFetcher {

    /**
     * Source this fetcher reads from.
     */
    NewsSource getSource();

    /**
     * Whether this fetcher is enabled.
     */
    boolean isEnabled();

    /**
     * Fetch up to {@code maxItems} raw items. Malformed individual records are skipped and
     * counted in the returned batch; only failures of the call as a whole are thrown.
     *
     * @param timeout limit for each HTTP call made by this fetch
     */
    FetchBatch fetch(int maxItems, Duration timeout) throws FetchException;
}
