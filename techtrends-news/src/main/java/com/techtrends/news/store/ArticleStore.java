package com.techtrends.news.store;

import com.techtrends.news.model.Article;
import com.techtrends.news.model.NewsSource;
import com.techtrends.news.model.TimeWindow;
import com.techtrends.news.topic.CategoryRule;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage interface for the article corpus.
 */
public interface ArticleStore {

    /**
     * Insert each article unless its id already exists. Existing rows are never touched.
     * Each article is committed on its own; a failing article does not affect the others.
     */
    UpsertResult upsertBatch(List<Article> articles);

    Optional<Article> getArticle(String id);

    boolean articleExists(String id);

    List<Article> query(ArticleQuery query);

    /**
     * Articles whose publish time falls inside the window, in no particular order.
     */
    List<Article> findPublishedBetween(TimeWindow window);

    CorpusStats stats();

    int count();

    /**
     * Re-run the categorizer over every stored article and overwrite the category column
     * where the label changed.
     *
     * @return number of rows whose category changed
     */
    int recategorize(List<CategoryRule> rules);

    // Query records

    enum SortField {
        POINTS("points"),
        COMMENTS("comments"),
        REACTIONS("reactions"),
        PUBLISHED_AT("published_at");

        private final String column;

        SortField(String column) {
            this.column = column;
        }

        public String column() {
            return column;
        }
    }

    enum SortDirection { ASC, DESC }

    /**
     * @param source     null for all sources
     * @param category   null for all; {@link Article#UNCATEGORIZED} selects articles without one
     * @param textSearch case-insensitive substring of title or description, null for none
     */
    record ArticleQuery(
        NewsSource source,
        String category,
        String textSearch,
        SortField sortField,
        SortDirection direction,
        int limit,
        int offset
    ) {
        public ArticleQuery {
            sortField = sortField != null ? sortField : SortField.PUBLISHED_AT;
            direction = direction != null ? direction : SortDirection.DESC;
            if (limit < 0 || offset < 0) {
                throw new IllegalArgumentException("limit and offset must not be negative");
            }
        }

        public static ArticleQuery all(int limit) {
            return new ArticleQuery(null, null, null, SortField.PUBLISHED_AT, SortDirection.DESC, limit, 0);
        }

        public static ArticleQuery sortedBy(SortField field, SortDirection direction, int limit) {
            return new ArticleQuery(null, null, null, field, direction, limit, 0);
        }

        public ArticleQuery withSource(NewsSource source) {
            return new ArticleQuery(source, category, textSearch, sortField, direction, limit, offset);
        }

        public ArticleQuery withCategory(String category) {
            return new ArticleQuery(source, category, textSearch, sortField, direction, limit, offset);
        }

        public ArticleQuery withTextSearch(String textSearch) {
            return new ArticleQuery(source, category, textSearch, sortField, direction, limit, offset);
        }

        public ArticleQuery withPage(int limit, int offset) {
            return new ArticleQuery(source, category, textSearch, sortField, direction, limit, offset);
        }
    }

    record UpsertResult(int inserted, int skippedDuplicate, int failed) {
        public static final UpsertResult EMPTY = new UpsertResult(0, 0, 0);
    }

    /**
     * Counts read from one consistent snapshot.
     */
    record CorpusStats(
        int totalCount,
        Map<NewsSource, Integer> countBySource,
        Map<String, Integer> countByCategory,
        Instant earliestPublishedAt,
        Instant latestPublishedAt
    ) {}
}
