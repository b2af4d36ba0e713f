package com.techtrends.news.store;

import com.techtrends.news.model.Article;
import com.techtrends.news.model.Engagement;
import com.techtrends.news.model.NewsSource;
import com.techtrends.news.model.TimeWindow;
import com.techtrends.news.topic.Categorizer;
import com.techtrends.news.topic.CategoryRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.Function;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * SQLite implementation of ArticleStore.
 * Opens a connection per operation; WAL mode lets readers run while a writer commits.
 * The primary key on {@code id} decides which of two racing inserts wins.
 */
public class SqliteArticleStore implements ArticleStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteArticleStore.class);

    // Primary SQLite result codes
    private static final int SQLITE_CORRUPT = 11;
    private static final int SQLITE_CONSTRAINT = 19;
    private static final int SQLITE_NOTADB = 26;

    private static final int BUSY_TIMEOUT_MS = 5000;
    private static final String FOLD_FUNCTION = "fold";
    private static final Instant MAX_MILLIS = Instant.ofEpochMilli(Long.MAX_VALUE);
    private static final Instant MIN_MILLIS = Instant.ofEpochMilli(Long.MIN_VALUE);

    private static final String COLUMNS = """
        id, source, title, url, author, description, tags, reading_time,
        points, comments, reactions, published_at, published_at_approx, category, ingested_at""";

    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final Clock clock;

    public SqliteArticleStore(Path dbPath) {
        this(dbPath, Clock.systemUTC());
    }

    public SqliteArticleStore(Path dbPath, Clock clock) {
        this.clock = clock;
        this.jdbcUrl = "jdbc:sqlite:" + dbPath;

        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        this.connectionProperties = config.toProperties();

        try {
            Path parent = dbPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Connection conn = connect()) {
                initSchema(conn);
            }
            log.info("Opened article database at {}", dbPath);
        } catch (SQLException e) {
            throw storageError("open database " + dbPath, e);
        } catch (IOException e) {
            throw new StorageException(StorageFailure.IO, "Failed to open database: " + dbPath, e);
        }
    }

    private Connection connect() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl, connectionProperties);
        try {
            Function.create(conn, FOLD_FUNCTION, new UnicodeFold());
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    /**
     * SQLite's lower() and LIKE only fold ASCII; this folds the full Unicode range the same
     * way the search text is folded.
     */
    private static final class UnicodeFold extends Function {
        @Override
        protected void xFunc() throws SQLException {
            String value = value_text(0);
            if (value == null) {
                result();
            } else {
                result(fold(value));
            }
        }
    }

    static String fold(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    private void initSchema(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS articles (
                    id TEXT PRIMARY KEY NOT NULL,
                    source TEXT NOT NULL,
                    title TEXT NOT NULL CHECK (length(title) > 0),
                    url TEXT NOT NULL DEFAULT '',
                    author TEXT,
                    description TEXT NOT NULL DEFAULT '',
                    tags TEXT NOT NULL DEFAULT '',
                    reading_time INTEGER NOT NULL DEFAULT 0,
                    points INTEGER NOT NULL DEFAULT 0,
                    comments INTEGER NOT NULL DEFAULT 0,
                    reactions INTEGER NOT NULL DEFAULT 0,
                    published_at INTEGER NOT NULL,
                    published_at_approx INTEGER NOT NULL DEFAULT 0,
                    category TEXT,
                    ingested_at INTEGER NOT NULL
                )
                """);

            // Sort and filter indexes
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_articles_points ON articles(points)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_articles_comments ON articles(comments)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_articles_reactions ON articles(reactions)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_articles_published ON articles(published_at)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_articles_source ON articles(source)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_articles_category ON articles(category)");
        }
    }

    // === Writes ===

    @Override
    public UpsertResult upsertBatch(List<Article> articles) {
        int inserted = 0;
        int duplicates = 0;
        int failed = 0;

        for (Article article : articles) {
            try {
                if (insertIfAbsent(article)) {
                    inserted++;
                } else {
                    duplicates++;
                }
            } catch (StorageException e) {
                log.error("Failed to store article {} ({}): {}",
                    article.id(), e.getFailure(), e.getMessage());
                failed++;
            }
        }

        log.info("Upserted batch: {} inserted, {} duplicates, {} failed", inserted, duplicates, failed);
        return new UpsertResult(inserted, duplicates, failed);
    }

    /**
     * @return true if a new row was written, false if the id already existed
     */
    boolean insertIfAbsent(Article article) {
        String sql = "INSERT INTO articles (" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT(id) DO NOTHING";

        Instant ingestedAt = article.ingestedAt() != null ? article.ingestedAt() : clock.instant();

        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, article.id());
            ps.setString(2, article.source() != null ? article.source().key() : null);
            ps.setString(3, article.title());
            ps.setString(4, article.url());
            ps.setString(5, article.author());
            ps.setString(6, article.description());
            ps.setString(7, String.join(",", article.tags()));
            ps.setInt(8, article.readingTimeMinutes());
            ps.setInt(9, article.engagement().points());
            ps.setInt(10, article.engagement().comments());
            ps.setInt(11, article.engagement().reactions());
            ps.setObject(12, article.publishedAt() != null ? epochMillis(article.publishedAt()) : null);
            ps.setInt(13, article.publishedAtApproximate() ? 1 : 0);
            ps.setString(14, article.category());
            ps.setLong(15, epochMillis(ingestedAt));
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw storageError("insert article " + article.id(), e);
        }
    }

    @Override
    public int recategorize(List<CategoryRule> rules) {
        int changed = 0;
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (PreparedStatement select = conn.prepareStatement(
                     "SELECT id, title, description, category FROM articles");
                 PreparedStatement update = conn.prepareStatement(
                     "UPDATE articles SET category = ? WHERE id = ?")) {

                try (ResultSet rs = select.executeQuery()) {
                    while (rs.next()) {
                        String current = rs.getString("category");
                        String next = Categorizer.classify(
                            rs.getString("title"), rs.getString("description"), rules);
                        if (!Objects.equals(current, next)) {
                            update.setString(1, next);
                            update.setString(2, rs.getString("id"));
                            update.addBatch();
                            changed++;
                        }
                    }
                }
                update.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw storageError("recategorize articles", e);
        }

        log.info("Re-categorized corpus: {} articles changed category", changed);
        return changed;
    }

    // === Reads ===

    @Override
    public Optional<Article> getArticle(String id) {
        String sql = "SELECT " + COLUMNS + " FROM articles WHERE id = ?";
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapArticle(rs));
                }
            }
        } catch (SQLException e) {
            throw storageError("get article " + id, e);
        }
        return Optional.empty();
    }

    @Override
    public boolean articleExists(String id) {
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM articles WHERE id = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw storageError("check article " + id, e);
        }
    }

    @Override
    public List<Article> query(ArticleQuery query) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM articles WHERE 1=1");
        List<Object> params = new ArrayList<>();

        if (query.source() != null) {
            sql.append(" AND source = ?");
            params.add(query.source().key());
        }

        if (query.category() != null) {
            if (Article.UNCATEGORIZED.equals(query.category())) {
                sql.append(" AND category IS NULL");
            } else {
                sql.append(" AND category = ?");
                params.add(query.category());
            }
        }

        if (query.textSearch() != null && !query.textSearch().isBlank()) {
            sql.append(" AND (fold(title) LIKE ? ESCAPE '\\' OR fold(description) LIKE ? ESCAPE '\\')");
            String pattern = "%" + escapeLike(fold(query.textSearch().trim())) + "%";
            params.add(pattern);
            params.add(pattern);
        }

        sql.append(" ORDER BY ").append(query.sortField().column())
            .append(query.direction() == SortDirection.ASC ? " ASC" : " DESC")
            .append(", id ASC");

        // LIMIT -1 is unbounded in SQLite
        sql.append(" LIMIT ? OFFSET ?");
        params.add(query.limit() > 0 ? query.limit() : -1);
        params.add(query.offset());

        List<Article> articles = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    articles.add(mapArticle(rs));
                }
            }
        } catch (SQLException e) {
            throw storageError("query articles", e);
        }
        return articles;
    }

    @Override
    public List<Article> findPublishedBetween(TimeWindow window) {
        String sql = "SELECT " + COLUMNS + " FROM articles WHERE published_at >= ? AND published_at < ?";
        List<Article> articles = new ArrayList<>();
        try (Connection conn = connect();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, epochMillis(window.from()));
            ps.setLong(2, epochMillis(window.to()));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    articles.add(mapArticle(rs));
                }
            }
        } catch (SQLException e) {
            throw storageError("read articles in " + window, e);
        }
        return articles;
    }

    @Override
    public CorpusStats stats() {
        try (Connection conn = connect()) {
            // One read transaction so every count below sees the same snapshot
            conn.setAutoCommit(false);
            try (Statement stmt = conn.createStatement()) {
                int total;
                Instant earliest = null;
                Instant latest = null;
                try (ResultSet rs = stmt.executeQuery(
                        "SELECT COUNT(*), MIN(published_at), MAX(published_at) FROM articles")) {
                    rs.next();
                    total = rs.getInt(1);
                    if (total > 0) {
                        earliest = Instant.ofEpochMilli(rs.getLong(2));
                        latest = Instant.ofEpochMilli(rs.getLong(3));
                    }
                }

                Map<NewsSource, Integer> bySource = new LinkedHashMap<>();
                Arrays.stream(NewsSource.values()).forEach(s -> bySource.put(s, 0));
                try (ResultSet rs = stmt.executeQuery(
                        "SELECT source, COUNT(*) FROM articles GROUP BY source")) {
                    while (rs.next()) {
                        bySource.put(NewsSource.fromKey(rs.getString(1)), rs.getInt(2));
                    }
                }

                Map<String, Integer> byCategory = new LinkedHashMap<>();
                try (ResultSet rs = stmt.executeQuery(
                        "SELECT category, COUNT(*) AS cnt FROM articles GROUP BY category ORDER BY cnt DESC, category")) {
                    while (rs.next()) {
                        String category = rs.getString(1);
                        byCategory.merge(category != null ? category : Article.UNCATEGORIZED,
                            rs.getInt(2), Integer::sum);
                    }
                }

                conn.commit();
                return new CorpusStats(total, bySource, byCategory, earliest, latest);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw storageError("compute corpus stats", e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM articles")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw storageError("count articles", e);
        }
    }

    private Article mapArticle(ResultSet rs) throws SQLException {
        String tags = rs.getString("tags");
        return Article.builder()
            .id(rs.getString("id"))
            .source(NewsSource.fromKey(rs.getString("source")))
            .title(rs.getString("title"))
            .url(rs.getString("url"))
            .author(rs.getString("author"))
            .description(rs.getString("description"))
            .tags(tags == null || tags.isEmpty() ? List.of() : List.of(tags.split(",")))
            .readingTimeMinutes(rs.getInt("reading_time"))
            .engagement(new Engagement(rs.getInt("points"), rs.getInt("comments"), rs.getInt("reactions")))
            .publishedAt(Instant.ofEpochMilli(rs.getLong("published_at")))
            .publishedAtApproximate(rs.getInt("published_at_approx") == 1)
            .category(rs.getString("category"))
            .ingestedAt(Instant.ofEpochMilli(rs.getLong("ingested_at")))
            .build();
    }

    static StorageException storageError(String operation, SQLException e) {
        StorageFailure failure = switch (e.getErrorCode() & 0xff) {
            case SQLITE_CORRUPT, SQLITE_NOTADB -> StorageFailure.CORRUPTION;
            case SQLITE_CONSTRAINT -> StorageFailure.CONSTRAINT_VIOLATION;
            default -> StorageFailure.IO;
        };
        return new StorageException(failure, "Failed to " + operation + ": " + e.getMessage(), e);
    }

    private static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static long epochMillis(Instant instant) {
        if (instant.isAfter(MAX_MILLIS)) return Long.MAX_VALUE;
        if (instant.isBefore(MIN_MILLIS)) return Long.MIN_VALUE;
        return instant.toEpochMilli();
    }
}
