package com.techtrends.news.ingest;

import com.techtrends.news.fetch.FetchFailure;
import com.techtrends.news.model.NewsSource;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of one ingestion run. Always returned, even when every source failed.
 *
 * @param fetched          raw items returned by all fetchers that succeeded
 * @param skippedRecords   malformed or unretrievable records dropped before storage
 * @param storageFailures  articles the store could not write (I/O, corruption)
 */
public record IngestionReport(
    int inserted,
    int skippedDuplicate,
    Map<NewsSource, SourceFailure> failedSources,
    int fetched,
    int skippedRecords,
    int storageFailures,
    Duration duration
) {
    public IngestionReport {
        failedSources = Map.copyOf(failedSources);
    }

    public boolean hasFailures() {
        return !failedSources.isEmpty() || storageFailures > 0;
    }

    /**
     * Why a source contributed nothing to the run.
     */
    public record SourceFailure(FetchFailure failure, String message) {}
}
