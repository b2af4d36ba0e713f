package com.techtrends.news.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.techtrends.news.model.NewsSource;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;

/**
 * Base for fetchers that read JSON APIs. Every request passes through the rate limiter
 * and is classified into a {@link FetchFailure} on error.
 */
public abstract class AbstractJsonFetcher implements NewsFetcher {

    static final String USER_AGENT = "TechTrends/1.0";
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final NewsSource source;
    private final HttpUrl baseUrl;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final RateLimiter rateLimiter;
    private final boolean enabled;

    protected AbstractJsonFetcher(NewsSource source, String baseUrl, OkHttpClient client,
                                  RateLimiter rateLimiter, boolean enabled) {
        this.source = source;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.client = client;
        this.mapper = HttpClientFactory.getMapper();
        this.rateLimiter = rateLimiter;
        this.enabled = enabled;
    }

    @Override
    public NewsSource getSource() {
        return source;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    protected HttpUrl.Builder url(String pathSegments) {
        return baseUrl.newBuilder().addPathSegments(pathSegments);
    }

    /**
     * Perform a paced GET and parse the body as a JSON tree.
     */
    protected JsonNode getJson(HttpUrl url, Duration timeout) throws FetchException {
        rateLimiter.acquire();

        Request request = new Request.Builder()
            .url(url)
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT)
            .build();

        OkHttpClient timedClient = client.newBuilder()
            .callTimeout(timeout)
            .build();

        try (Response response = timedClient.newCall(request).execute()) {
            if (response.code() == HTTP_TOO_MANY_REQUESTS) {
                throw new FetchException(source, FetchFailure.RATE_LIMITED,
                    "Rate limited (429): " + url);
            }
            if (!response.isSuccessful()) {
                throw new FetchException(source, FetchFailure.NETWORK,
                    "HTTP error " + response.code() + ": " + url);
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new FetchException(source, FetchFailure.PARSE, "Empty response body: " + url);
            }
            return parse(body.string(), url);

        } catch (IOException e) {
            throw new FetchException(source, FetchFailure.NETWORK,
                "Request failed for " + url + ": " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String body, HttpUrl url) throws FetchException {
        try {
            JsonNode node = mapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new FetchException(source, FetchFailure.PARSE, "Empty JSON document: " + url);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new FetchException(source, FetchFailure.PARSE,
                "Malformed JSON from " + url + ": " + e.getOriginalMessage(), e);
        }
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    protected static int count(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToInt() ? value.asInt() : 0;
    }
}
