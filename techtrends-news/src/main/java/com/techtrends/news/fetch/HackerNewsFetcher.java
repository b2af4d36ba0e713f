package com.techtrends.news.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.techtrends.news.model.NewsSource;
import com.techtrends.news.model.RawItem;
import com.techtrends.news.model.RawItem.HackerNewsItem;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetches top stories from the Hacker News item API.
 * One request for the ranked id list, then one paced request per story.
 */
public class HackerNewsFetcher extends AbstractJsonFetcher {

    private static final Logger log = LoggerFactory.getLogger(HackerNewsFetcher.class);

    public static final String DEFAULT_BASE_URL = "https://hacker-news.firebaseio.com/v0";

    public HackerNewsFetcher(String baseUrl, RateLimiter rateLimiter) {
        this(baseUrl, HttpClientFactory.getClient(), rateLimiter, true);
    }

    public HackerNewsFetcher(String baseUrl, OkHttpClient client, RateLimiter rateLimiter, boolean enabled) {
        super(NewsSource.HACKER_NEWS, baseUrl, client, rateLimiter, enabled);
    }

    @Override
    public FetchBatch fetch(int maxItems, Duration timeout) throws FetchException {
        JsonNode ids = getJson(url("topstories.json").build(), timeout);
        if (!ids.isArray()) {
            throw new FetchException(getSource(), FetchFailure.PARSE,
                "Expected an array of story ids, got " + ids.getNodeType());
        }

        List<RawItem> items = new ArrayList<>();
        int skipped = 0;
        int attempted = 0;
        int networkFailures = 0;

        for (JsonNode idNode : ids) {
            if (attempted >= maxItems) break;
            attempted++;

            if (!idNode.canConvertToLong()) {
                log.warn("Skipping non-numeric story id: {}", idNode);
                skipped++;
                continue;
            }
            long storyId = idNode.asLong();

            JsonNode storyNode;
            try {
                storyNode = getJson(url("item/" + storyId + ".json").build(), timeout);
            } catch (FetchException e) {
                if (e.getFailure() == FetchFailure.RATE_LIMITED) {
                    throw e;
                }
                if (e.getFailure() == FetchFailure.NETWORK) {
                    networkFailures++;
                }
                log.warn("Skipping story {}: {}", storyId, e.getMessage());
                skipped++;
                continue;
            }

            Optional<HackerNewsItem> item = parseItem(storyNode);
            if (item.isPresent()) {
                items.add(item.get());
            } else {
                log.warn("Skipping malformed story record {}", storyId);
                skipped++;
            }
        }

        if (attempted > 0 && networkFailures == attempted) {
            throw new FetchException(getSource(), FetchFailure.NETWORK,
                "All " + attempted + " story requests failed");
        }

        log.info("Fetched {} stories from Hacker News ({} skipped)", items.size(), skipped);
        return new FetchBatch(getSource(), items, skipped);
    }

    /**
     * Map one item record. Empty for null, deleted or dead items and for records without
     * an id or title.
     */
    static Optional<HackerNewsItem> parseItem(JsonNode node) {
        if (node == null || !node.isObject()) return Optional.empty();
        if (node.path("deleted").asBoolean(false) || node.path("dead").asBoolean(false)) {
            return Optional.empty();
        }

        JsonNode idNode = node.get("id");
        String title = text(node, "title");
        if (idNode == null || !idNode.canConvertToLong() || title == null || title.isBlank()) {
            return Optional.empty();
        }

        JsonNode timeNode = node.get("time");
        Instant time = timeNode != null && timeNode.canConvertToLong()
            ? Instant.ofEpochSecond(timeNode.asLong())
            : null;

        return Optional.of(new HackerNewsItem(
            idNode.asLong(),
            title,
            text(node, "url"),
            text(node, "by"),
            count(node, "score"),
            count(node, "descendants"),
            time
        ));
    }
}
