package com.techtrends.news.fetch;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Shared HTTP client and JSON mapper for the source fetchers.
 * Per-call timeouts are applied on top of this client by each fetch.
 */
public final class HttpClientFactory {

    private static final OkHttpClient SHARED_CLIENT = new OkHttpClient.Builder()
        .connectionPool(new ConnectionPool(4, 5, TimeUnit.MINUTES))
        .connectTimeout(30, TimeUnit.SECONDS)
        .readTimeout(30, TimeUnit.SECONDS)
        .retryOnConnectionFailure(false)
        .build();

    private static final ObjectMapper SHARED_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private HttpClientFactory() {
    }

    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
