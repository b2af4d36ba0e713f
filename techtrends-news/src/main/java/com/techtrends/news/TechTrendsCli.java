package com.techtrends.news;

import com.techtrends.news.config.TechTrendsConfig;
import com.techtrends.news.ingest.IngestionReport;
import com.techtrends.news.model.Article;
import com.techtrends.news.model.NewsSource;
import com.techtrends.news.model.TimeWindow;
import com.techtrends.news.store.ArticleStore.ArticleQuery;
import com.techtrends.news.store.ArticleStore.CorpusStats;
import com.techtrends.news.store.ArticleStore.SortDirection;
import com.techtrends.news.store.ArticleStore.SortField;
import com.techtrends.news.trend.CategoryStats;
import com.techtrends.news.trend.EngagementSummary;
import com.techtrends.news.trend.KeywordCount;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

public class TechTrendsCli {

    public static void main(String[] args) {
        String configArg = getArg(args, "--config", null);
        TechTrendsConfig config = configArg != null
            ? TechTrendsConfig.load(Path.of(configArg))
            : TechTrendsConfig.load();

        boolean ingest = hasArg(args, "--ingest");
        boolean stats = hasArg(args, "--stats");
        boolean trends = hasArg(args, "--trends");
        boolean recategorize = hasArg(args, "--recategorize");
        boolean top = hasArg(args, "--top");
        if (!ingest && !stats && !trends && !recategorize && !top) {
            printUsage();
            return;
        }

        ArticleQuery topQuery = null;
        if (top) {
            try {
                topQuery = parseTopQuery(args);
            } catch (IllegalArgumentException e) {
                System.out.println("Invalid option: " + e.getMessage() + "\n");
                printUsage();
                return;
            }
        }

        try (TechTrendsService service = TechTrendsService.create(config)) {
            if (ingest) {
                int max = getIntArg(args, "--max", config.getMaxItemsPerSource());
                printReport(service.runIngestion(max));
            }
            if (recategorize) {
                System.out.println("Articles re-categorized: " + service.recategorize());
            }
            if (stats) {
                printStats(service.stats());
            }
            if (topQuery != null) {
                printTop(service, topQuery);
            }
            if (trends) {
                int days = getIntArg(args, "--days", 7);
                int topN = getIntArg(args, "--keywords", 20);
                printTrends(service, TimeWindow.last(Duration.ofDays(days), Clock.systemUTC()), topN);
            }
        }
    }

    private static void printReport(IngestionReport report) {
        System.out.println("\n" + "═".repeat(70));
        System.out.println("INGESTION");
        System.out.println("═".repeat(70));
        System.out.println("Fetched:           " + report.fetched());
        System.out.println("New articles:      " + report.inserted());
        System.out.println("Already existed:   " + report.skippedDuplicate());
        System.out.println("Skipped records:   " + report.skippedRecords());
        System.out.println("Storage failures:  " + report.storageFailures());
        System.out.println("Duration:          " + report.duration().toMillis() + "ms");
        report.failedSources().forEach((source, failure) ->
            System.out.printf("  ✗ %-10s %s: %s%n", source.displayName(), failure.failure(), failure.message()));
    }

    private static void printStats(CorpusStats stats) {
        System.out.println("\n" + "═".repeat(70));
        System.out.println("CORPUS");
        System.out.println("═".repeat(70));
        System.out.println("Total articles:    " + stats.totalCount());
        System.out.println("Earliest:          " + (stats.earliestPublishedAt() != null ? stats.earliestPublishedAt() : "-"));
        System.out.println("Latest:            " + (stats.latestPublishedAt() != null ? stats.latestPublishedAt() : "-"));
        System.out.println("\nSOURCES:");
        stats.countBySource().forEach((source, count) ->
            System.out.printf("  %-25s %d%n", source.displayName(), count));
        System.out.println("\nCATEGORIES:");
        stats.countByCategory().forEach((category, count) ->
            System.out.printf("  %-25s %d%n", category, count));
    }

    /**
     * Build the ranking query from the {@code --top} options.
     *
     * @throws IllegalArgumentException for an unknown sort field or source, or a negative limit
     */
    static ArticleQuery parseTopQuery(String[] args) {
        String sortName = getArg(args, "--sort", "points").toUpperCase(Locale.ROOT);
        SortField sort;
        try {
            sort = SortField.valueOf(sortName);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sort field: " + sortName.toLowerCase(Locale.ROOT), e);
        }
        ArticleQuery query = ArticleQuery.sortedBy(sort, SortDirection.DESC, getIntArg(args, "--limit", 10));

        String source = getArg(args, "--source", null);
        if (source != null) query = query.withSource(NewsSource.fromKey(source));
        String category = getArg(args, "--category", null);
        if (category != null) query = query.withCategory(category);
        String search = getArg(args, "--search", null);
        if (search != null) query = query.withTextSearch(search);
        return query;
    }

    private static void printTop(TechTrendsService service, ArticleQuery query) {
        System.out.println("\n" + "═".repeat(70));
        System.out.println("TOP BY " + query.sortField());
        System.out.println("═".repeat(70));
        for (Article a : service.query(query)) {
            System.out.printf("  %5d pts %4d cmt %4d rx  [%-8s] %s%n",
                a.engagement().points(), a.engagement().comments(), a.engagement().reactions(),
                a.source().displayName(), truncate(a.title(), 60));
        }
    }

    private static void printTrends(TechTrendsService service, TimeWindow window, int topN) {
        System.out.println("\n" + "═".repeat(70));
        System.out.println("TRENDS " + window.from() + " .. " + window.to());
        System.out.println("═".repeat(70));

        System.out.println("\nKEYWORDS:");
        for (KeywordCount kc : service.trendingKeywords(window, topN)) {
            System.out.printf("  %-25s %d%n", kc.keyword(), kc.frequency());
        }

        System.out.println("\nCATEGORIES:");
        for (Map.Entry<String, CategoryStats> e : service.categoryBreakdown(window).entrySet()) {
            System.out.printf("  %-25s %4d articles %8d engagement%n",
                e.getKey(), e.getValue().articleCount(), e.getValue().totalEngagement());
        }

        EngagementSummary summary = service.engagementSummary(window);
        System.out.printf("%nENGAGEMENT: %d articles, avg %.1f points, avg %.1f comments, avg %.1f reactions%n",
            summary.articleCount(), summary.avgPoints(), summary.avgComments(), summary.avgReactions());
    }

    private static void printUsage() {
        System.out.println("Usage: techtrends [--config FILE] COMMAND...");
        System.out.println("  --ingest [--max N]          fetch new items from all enabled sources");
        System.out.println("  --recategorize              re-apply configured category rules");
        System.out.println("  --stats                     corpus totals per source and category");
        System.out.println("  --top [--sort points|comments|reactions|published_at] [--limit N]");
        System.out.println("        [--source hackernews|devto] [--category NAME] [--search TEXT]");
        System.out.println("  --trends [--days N] [--keywords N]");
    }

    private static boolean hasArg(String[] args, String flag) {
        for (String arg : args) {
            if (arg.equals(flag)) return true;
        }
        return false;
    }

    private static String getArg(String[] args, String flag, String defaultValue) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(flag)) return args[i + 1];
        }
        return defaultValue;
    }

    private static int getIntArg(String[] args, String flag, int defaultValue) {
        String value = getArg(args, flag, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String truncate(String s, int width) {
        if (s.length() <= width) return s;
        return s.substring(0, width - 1) + "…";
    }
}
