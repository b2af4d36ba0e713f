package com.techtrends.news;

import com.techtrends.news.config.TechTrendsConfig;
import com.techtrends.news.fetch.DevToFetcher;
import com.techtrends.news.fetch.HackerNewsFetcher;
import com.techtrends.news.fetch.HttpClientFactory;
import com.techtrends.news.fetch.NewsFetcher;
import com.techtrends.news.fetch.RateLimiter;
import com.techtrends.news.ingest.IngestionReport;
import com.techtrends.news.ingest.IngestionService;
import com.techtrends.news.model.Article;
import com.techtrends.news.model.TimeWindow;
import com.techtrends.news.store.ArticleStore;
import com.techtrends.news.store.ArticleStore.ArticleQuery;
import com.techtrends.news.store.ArticleStore.CorpusStats;
import com.techtrends.news.store.SqliteArticleStore;
import com.techtrends.news.topic.CategoryRules;
import com.techtrends.news.trend.CategoryStats;
import com.techtrends.news.trend.EngagementSummary;
import com.techtrends.news.trend.KeywordCount;
import com.techtrends.news.trend.TrendAggregator;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Entry point for callers: ingestion on the write side, queries and trends on the read side.
 * Category rules are fixed for the lifetime of the service; {@link #recategorize()} applies
 * them to articles stored under older rules.
 */
public class TechTrendsService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TechTrendsService.class);

    private final ArticleStore store;
    private final IngestionService ingestion;
    private final TrendAggregator aggregator;
    private final CategoryRules rules;

    public TechTrendsService(ArticleStore store, IngestionService ingestion, TrendAggregator aggregator) {
        this.store = store;
        this.ingestion = ingestion;
        this.aggregator = aggregator;
        this.rules = ingestion.getRules();
    }

    /**
     * Wire the default components from a loaded config.
     */
    public static TechTrendsService create(TechTrendsConfig config) {
        ArticleStore store = new SqliteArticleStore(Path.of(config.getDatabasePath()));
        CategoryRules rules = config.getCategoryRules();
        OkHttpClient client = HttpClientFactory.getClient();

        // Each source gets its own limiter so one slow API does not pace the other
        List<NewsFetcher> fetchers = List.of(
            new HackerNewsFetcher(config.getHackerNewsBaseUrl(), client,
                RateLimiter.fixedDelay(config.getRequestDelay()), config.isHackerNewsEnabled()),
            new DevToFetcher(config.getDevToBaseUrl(), config.getDevToTag(), config.getDevToTopDays(), client,
                RateLimiter.fixedDelay(config.getRequestDelay()), config.isDevToEnabled())
        );

        IngestionService ingestion = new IngestionService(fetchers, store, rules, config.getTimeout());
        TrendAggregator aggregator = new TrendAggregator(store, config.getMinTokenLength());
        log.info("TechTrends ready: database {}, {} categories", config.getDatabasePath(), rules.labels().size());
        return new TechTrendsService(store, ingestion, aggregator);
    }

    public IngestionReport runIngestion(int maxItemsPerSource) {
        return ingestion.runIngestion(maxItemsPerSource);
    }

    public List<Article> query(ArticleQuery query) {
        return store.query(query);
    }

    public CorpusStats stats() {
        return store.stats();
    }

    public List<KeywordCount> trendingKeywords(TimeWindow window, int topN) {
        return aggregator.trendingKeywords(window, topN);
    }

    public Map<String, CategoryStats> categoryBreakdown(TimeWindow window) {
        return aggregator.categoryBreakdown(window);
    }

    public EngagementSummary engagementSummary(TimeWindow window) {
        return aggregator.engagementSummary(window);
    }

    /**
     * Re-apply the configured category rules to every stored article.
     *
     * @return number of articles whose category changed
     */
    public int recategorize() {
        return store.recategorize(rules.asList());
    }

    public ArticleStore getStore() {
        return store;
    }

    @Override
    public void close() {
        ingestion.close();
    }
}
