package com.techtrends.news.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.techtrends.news.model.NewsSource;
import com.techtrends.news.model.RawItem;
import com.techtrends.news.model.RawItem.DevToItem;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Fetches articles from the Dev.to articles API, filtered by tag and paged until
 * enough items are collected.
 */
public class DevToFetcher extends AbstractJsonFetcher {

    private static final Logger log = LoggerFactory.getLogger(DevToFetcher.class);

    public static final String DEFAULT_BASE_URL = "https://dev.to/api";
    static final int MAX_PAGE_SIZE = 100;

    private final String tag;
    private final int topDays;

    public DevToFetcher(String baseUrl, String tag, RateLimiter rateLimiter) {
        this(baseUrl, tag, 0, HttpClientFactory.getClient(), rateLimiter, true);
    }

    /**
     * @param tag     tag filter, null or blank for all articles
     * @param topDays when positive, request the most popular articles of the last N days
     */
    public DevToFetcher(String baseUrl, String tag, int topDays, OkHttpClient client,
                        RateLimiter rateLimiter, boolean enabled) {
        super(NewsSource.DEV_TO, baseUrl, client, rateLimiter, enabled);
        this.tag = tag;
        this.topDays = topDays;
    }

    @Override
    public FetchBatch fetch(int maxItems, Duration timeout) throws FetchException {
        int perPage = Math.max(1, Math.min(maxItems, MAX_PAGE_SIZE));
        List<RawItem> items = new ArrayList<>();
        int skipped = 0;
        int page = 1;

        while (items.size() < maxItems) {
            JsonNode articles;
            try {
                articles = getJson(pageUrl(perPage, page), timeout);
                if (!articles.isArray()) {
                    throw new FetchException(getSource(), FetchFailure.PARSE,
                        "Expected an array of articles, got " + articles.getNodeType());
                }
            } catch (FetchException e) {
                if (page == 1) throw e;
                // Keep what earlier pages returned
                log.warn("Stopped paging Dev.to at page {}: {}", page, e.getMessage());
                break;
            }

            if (articles.isEmpty()) break;

            for (JsonNode node : articles) {
                if (items.size() >= maxItems) break;
                Optional<DevToItem> item = parseArticle(node);
                if (item.isPresent()) {
                    items.add(item.get());
                } else {
                    log.warn("Skipping malformed Dev.to record on page {}", page);
                    skipped++;
                }
            }

            if (articles.size() < perPage) break;
            page++;
        }

        log.info("Fetched {} articles from Dev.to (tag: {}, {} skipped)",
            items.size(), tag != null ? tag : "-", skipped);
        return new FetchBatch(getSource(), items, skipped);
    }

    private HttpUrl pageUrl(int perPage, int page) {
        HttpUrl.Builder builder = url("articles")
            .addQueryParameter("per_page", String.valueOf(perPage))
            .addQueryParameter("page", String.valueOf(page));
        if (tag != null && !tag.isBlank()) {
            builder.addQueryParameter("tag", tag);
        }
        if (topDays > 0) {
            builder.addQueryParameter("top", String.valueOf(topDays));
        }
        return builder.build();
    }

    /**
     * Map one article record. Empty when the title is missing or the record has neither
     * an id nor a url.
     */
    static Optional<DevToItem> parseArticle(JsonNode node) {
        if (node == null || !node.isObject()) return Optional.empty();

        String title = text(node, "title");
        if (title == null || title.isBlank()) return Optional.empty();

        JsonNode idNode = node.get("id");
        Long id = idNode != null && idNode.canConvertToLong() ? idNode.asLong() : null;
        String url = text(node, "url");
        if (id == null && (url == null || url.isBlank())) return Optional.empty();

        int reactions = node.has("positive_reactions_count")
            ? count(node, "positive_reactions_count")
            : count(node, "public_reactions_count");

        JsonNode user = node.get("user");
        String author = user != null && user.isObject() ? text(user, "name") : null;

        return Optional.of(new DevToItem(
            id,
            title,
            url,
            text(node, "description"),
            author,
            reactions,
            count(node, "comments_count"),
            count(node, "reading_time_minutes"),
            parseTags(node.get("tag_list")),
            text(node, "published_at")
        ));
    }

    // List endpoint sends an array, single-article endpoint a comma separated string
    private static List<String> parseTags(JsonNode tags) {
        if (tags == null) return List.of();
        if (tags.isArray()) {
            List<String> result = new ArrayList<>();
            for (JsonNode t : tags) {
                if (t.isTextual() && !t.asText().isBlank()) {
                    result.add(t.asText().trim());
                }
            }
            return result;
        }
        if (tags.isTextual()) {
            return Arrays.stream(tags.asText().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        }
        return List.of();
    }
}
