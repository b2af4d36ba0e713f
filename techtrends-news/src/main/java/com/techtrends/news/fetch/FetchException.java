package com.techtrends.news.fetch;

import com.techtrends.news.model.NewsSource;

/**
 * A fetcher call failed as a whole. Scoped to one source; other sources are unaffected.
 */
public class FetchException extends Exception {

    private final NewsSource source;
    private final FetchFailure failure;

    public FetchException(NewsSource source, FetchFailure failure, String message) {
        super(message);
        this.source = source;
        this.failure = failure;
    }

    public FetchException(NewsSource source, FetchFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.failure = failure;
    }

    public NewsSource getSource() {
        return source;
    }

    public FetchFailure getFailure() {
        return failure;
    }
}
