package com.techtrends.news.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.techtrends.news.fetch.DevToFetcher;
import com.techtrends.news.fetch.HackerNewsFetcher;
import com.techtrends.news.topic.CategoryRules;
import com.techtrends.news.trend.TrendAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for TechTrends.
 * Stored in ~/.techtrends/config.yaml, written with defaults on first load.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TechTrendsConfig {

    private static final Logger log = LoggerFactory.getLogger(TechTrendsConfig.class);

    public static final Path DEFAULT_DIR = Path.of(System.getProperty("user.home"), ".techtrends");
    public static final Path DEFAULT_PATH = DEFAULT_DIR.resolve("config.yaml");

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    // Storage
    private String databasePath = DEFAULT_DIR.resolve("techtrends.db").toString();

    // Ingestion
    private int maxItemsPerSource = 50;
    private long requestDelayMillis = 1000;
    private int timeoutSeconds = 10;
    private boolean hackerNewsEnabled = true;
    private String hackerNewsBaseUrl = HackerNewsFetcher.DEFAULT_BASE_URL;
    private boolean devToEnabled = true;
    private String devToBaseUrl = DevToFetcher.DEFAULT_BASE_URL;
    private String devToTag = "programming";
    private int devToTopDays = 0;

    // Trends
    private int minTokenLength = TrendAggregator.DEFAULT_MIN_TOKEN_LENGTH;

    // Ordered: the first matching category wins
    private LinkedHashMap<String, List<String>> categories = new LinkedHashMap<>(CategoryRules.defaultMapping());

    public TechTrendsConfig() {
        // Default constructor for YAML
    }

    // ==================== Storage ====================

    public String getDatabasePath() {
        return databasePath;
    }

    public void setDatabasePath(String databasePath) {
        this.databasePath = databasePath;
    }

    // ==================== Ingestion ====================

    public int getMaxItemsPerSource() {
        return maxItemsPerSource;
    }

    public void setMaxItemsPerSource(int maxItemsPerSource) {
        this.maxItemsPerSource = maxItemsPerSource;
    }

    public long getRequestDelayMillis() {
        return requestDelayMillis;
    }

    public void setRequestDelayMillis(long requestDelayMillis) {
        this.requestDelayMillis = requestDelayMillis;
    }

    @JsonIgnore
    public Duration getRequestDelay() {
        return Duration.ofMillis(requestDelayMillis);
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @JsonIgnore
    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public boolean isHackerNewsEnabled() {
        return hackerNewsEnabled;
    }

    public void setHackerNewsEnabled(boolean hackerNewsEnabled) {
        this.hackerNewsEnabled = hackerNewsEnabled;
    }

    public String getHackerNewsBaseUrl() {
        return hackerNewsBaseUrl;
    }

    public void setHackerNewsBaseUrl(String hackerNewsBaseUrl) {
        this.hackerNewsBaseUrl = hackerNewsBaseUrl;
    }

    public boolean isDevToEnabled() {
        return devToEnabled;
    }

    public void setDevToEnabled(boolean devToEnabled) {
        this.devToEnabled = devToEnabled;
    }

    public String getDevToBaseUrl() {
        return devToBaseUrl;
    }

    public void setDevToBaseUrl(String devToBaseUrl) {
        this.devToBaseUrl = devToBaseUrl;
    }

    public String getDevToTag() {
        return devToTag;
    }

    public void setDevToTag(String devToTag) {
        this.devToTag = devToTag;
    }

    public int getDevToTopDays() {
        return devToTopDays;
    }

    public void setDevToTopDays(int devToTopDays) {
        this.devToTopDays = devToTopDays;
    }

    // ==================== Trends ====================

    public int getMinTokenLength() {
        return minTokenLength;
    }

    public void setMinTokenLength(int minTokenLength) {
        this.minTokenLength = minTokenLength;
    }

    // ==================== Categories ====================

    public Map<String, List<String>> getCategories() {
        return categories;
    }

    public void setCategories(Map<String, List<String>> categories) {
        this.categories = categories != null ? new LinkedHashMap<>(categories) : new LinkedHashMap<>();
    }

    @JsonIgnore
    public CategoryRules getCategoryRules() {
        return CategoryRules.fromMap(categories);
    }

    /**
     * Check values that would make ingestion misbehave.
     *
     * @return problems found, empty when the config is usable
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (maxItemsPerSource <= 0) problems.add("maxItemsPerSource must be positive");
        if (requestDelayMillis < 0) problems.add("requestDelayMillis must not be negative");
        if (timeoutSeconds <= 0) problems.add("timeoutSeconds must be positive");
        if (minTokenLength <= 0) problems.add("minTokenLength must be positive");
        if (databasePath == null || databasePath.isBlank()) problems.add("databasePath is required");
        return problems;
    }

    // ==================== Persistence ====================

    public void save(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            YAML.writeValue(path.toFile(), this);
        } catch (IOException e) {
            log.error("Failed to save config to {}: {}", path, e.getMessage());
        }
    }

    /**
     * Load from the default location, creating it with defaults if missing.
     */
    public static TechTrendsConfig load() {
        return load(DEFAULT_PATH);
    }

    /**
     * Load from a file. A missing file is created with defaults; an unreadable file is
     * left alone and defaults are used.
     */
    public static TechTrendsConfig load(Path path) {
        if (Files.exists(path)) {
            try {
                TechTrendsConfig config = YAML.readValue(path.toFile(), TechTrendsConfig.class);
                List<String> problems = config.validate();
                if (problems.isEmpty()) {
                    return config;
                }
                log.error("Invalid config {}: {}. Using defaults.", path, problems);
            } catch (IOException e) {
                log.error("Failed to load config {}: {}. Using defaults.", path, e.getMessage());
            }
            return new TechTrendsConfig();
        }

        TechTrendsConfig config = new TechTrendsConfig();
        config.save(path);
        log.info("Wrote default config to {}", path);
        return config;
    }
}
