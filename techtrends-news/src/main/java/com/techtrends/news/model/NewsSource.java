package com.techtrends.news.model;

import java.util.Arrays;

public enum NewsSource {
    HACKER_NEWS("hackernews", "HackerNews"),
    DEV_TO("devto", "Dev.to");

    private final String key;
    private final String displayName;

    NewsSource(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    /**
     * Stable key used in the database and in identity hashing. Never change it.
     */
    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    public static NewsSource fromKey(String key) {
        return Arrays.stream(values())
            .filter(s -> s.key.equals(key))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown news source: " + key));
    }
}
