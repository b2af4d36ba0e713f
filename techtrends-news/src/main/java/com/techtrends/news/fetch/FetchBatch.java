package com.techtrends.news.fetch;

import com.techtrends.news.model.NewsSource;
import com.techtrends.news.model.RawItem;

import java.util.List;

/**
 * Items returned by one fetcher call.
 *
 * @param skippedRecords records that were malformed or could not be retrieved individually
 */
public record FetchBatch(
    NewsSource source,
    List<RawItem> items,
    int skippedRecords
) {
    public FetchBatch {
        items = List.copyOf(items);
    }
}
