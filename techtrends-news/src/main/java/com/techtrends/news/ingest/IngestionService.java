package com.techtrends.news.ingest;

import com.techtrends.news.fetch.FetchBatch;
import com.techtrends.news.fetch.FetchException;
import com.techtrends.news.fetch.FetchFailure;
import com.techtrends.news.fetch.NewsFetcher;
import com.techtrends.news.ingest.IngestionReport.SourceFailure;
import com.techtrends.news.model.Article;
import com.techtrends.news.model.NewsSource;
import com.techtrends.news.model.RawItem;
import com.techtrends.news.normalize.ArticleNormalizer;
import com.techtrends.news.store.ArticleStore;
import com.techtrends.news.store.ArticleStore.UpsertResult;
import com.techtrends.news.topic.Categorizer;
import com.techtrends.news.topic.CategoryRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one ingestion: fetch all enabled sources concurrently, normalize, categorize and
 * store. Never throws for source or storage problems; they are reported instead.
 * There is no retry; the caller decides whether to run again.
 */
public class IngestionService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final List<NewsFetcher> fetchers;
    private final ArticleStore store;
    private final CategoryRules rules;
    private final Duration timeout;
    private final Clock clock;
    private final ExecutorService fetchExecutor;

    public IngestionService(List<NewsFetcher> fetchers, ArticleStore store,
                            CategoryRules rules, Duration timeout) {
        this(fetchers, store, rules, timeout, Clock.systemUTC());
    }

    public IngestionService(List<NewsFetcher> fetchers, ArticleStore store,
                            CategoryRules rules, Duration timeout, Clock clock) {
        this.fetchers = List.copyOf(fetchers);
        this.store = store;
        this.rules = rules;
        this.timeout = timeout;
        this.clock = clock;

        AtomicInteger threadCount = new AtomicInteger();
        this.fetchExecutor = Executors.newFixedThreadPool(Math.max(1, fetchers.size()), r -> {
            Thread t = new Thread(r, "techtrends-fetch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public List<NewsFetcher> getEnabledFetchers() {
        return fetchers.stream()
            .filter(NewsFetcher::isEnabled)
            .toList();
    }

    public CategoryRules getRules() {
        return rules;
    }

    /**
     * Run a single ingestion cycle.
     */
    public IngestionReport runIngestion(int maxItemsPerSource) {
        Instant startTime = clock.instant();
        List<NewsFetcher> enabled = getEnabledFetchers();
        log.info("Ingesting up to {} items from {} sources", maxItemsPerSource, enabled.size());

        // Sources are independent; fetch them side by side
        Map<NewsFetcher, Future<FetchBatch>> pending = new LinkedHashMap<>();
        for (NewsFetcher fetcher : enabled) {
            pending.put(fetcher, fetchExecutor.submit(() -> fetcher.fetch(maxItemsPerSource, timeout)));
        }

        Map<NewsSource, SourceFailure> failedSources = new LinkedHashMap<>();
        List<RawItem> rawItems = new ArrayList<>();
        int skippedRecords = 0;

        for (Map.Entry<NewsFetcher, Future<FetchBatch>> entry : pending.entrySet()) {
            NewsSource source = entry.getKey().getSource();
            try {
                FetchBatch batch = entry.getValue().get();
                rawItems.addAll(batch.items());
                skippedRecords += batch.skippedRecords();
            } catch (ExecutionException e) {
                SourceFailure failure = describe(e.getCause());
                log.error("Fetch from {} failed ({}): {}",
                    source.displayName(), failure.failure(), failure.message());
                failedSources.put(source, failure);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failedSources.put(source, new SourceFailure(FetchFailure.NETWORK, "Interrupted"));
            }
        }

        List<Article> articles = new ArrayList<>();
        for (RawItem item : rawItems) {
            try {
                Article article = ArticleNormalizer.normalize(item, startTime);
                articles.add(Categorizer.categorize(article, rules.asList()));
            } catch (RuntimeException e) {
                log.warn("Skipping {} item that could not be normalized: {}",
                    item.source().displayName(), e.getMessage());
                skippedRecords++;
            }
        }

        UpsertResult result = articles.isEmpty() ? UpsertResult.EMPTY : store.upsertBatch(articles);

        Duration duration = Duration.between(startTime, clock.instant());
        IngestionReport report = new IngestionReport(
            result.inserted(),
            result.skippedDuplicate(),
            failedSources,
            rawItems.size(),
            skippedRecords,
            result.failed(),
            duration);

        log.info("Ingestion complete: {} new, {} duplicates, {} skipped, {} storage errors, {} failed sources ({}ms)",
            report.inserted(), report.skippedDuplicate(), report.skippedRecords(),
            report.storageFailures(), failedSources.size(), duration.toMillis());

        return report;
    }

    private static SourceFailure describe(Throwable cause) {
        if (cause instanceof FetchException fe) {
            return new SourceFailure(fe.getFailure(), fe.getMessage());
        }
        // A fetcher bug or an unexpected payload shape that slipped past parsing
        log.error("Unexpected fetcher error", cause);
        return new SourceFailure(FetchFailure.PARSE, String.valueOf(cause));
    }

    @Override
    public void close() {
        fetchExecutor.shutdown();
        try {
            if (!fetchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                fetchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
