package com.techtrends.news.normalize;

import com.techtrends.news.model.Article;
import com.techtrends.news.model.Engagement;
import com.techtrends.news.model.NewsSource;
import com.techtrends.news.model.RawItem;
import com.techtrends.news.model.RawItem.DevToItem;
import com.techtrends.news.model.RawItem.HackerNewsItem;
import org.jsoup.parser.Parser;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import java.util.List;

/**
 * Maps source-specific raw items onto the canonical {@link Article}.
 * Pure: the same raw item and ingestion time always give the same article.
 */
public final class ArticleNormalizer {

    static final String UNTITLED = "Untitled";
    private static final int ID_LENGTH = 32;

    private ArticleNormalizer() {
    }

    /**
     * Normalize a raw item. Never throws; missing optional fields get their defaults.
     *
     * @param ingestionTime used as publish time when the source has none
     */
    public static Article normalize(RawItem item, Instant ingestionTime) {
        if (item instanceof HackerNewsItem hn) {
            return fromHackerNews(hn, ingestionTime);
        } else if (item instanceof DevToItem devTo) {
            return fromDevTo(devTo, ingestionTime);
        }
        throw new IllegalArgumentException("Unsupported raw item: " + item);
    }

    private static Article fromHackerNews(HackerNewsItem item, Instant ingestionTime) {
        String url = clean(item.url());
        boolean approximate = item.time() == null;

        return Article.builder()
            .id(identity(NewsSource.HACKER_NEWS, String.valueOf(item.id())))
            .source(NewsSource.HACKER_NEWS)
            .title(titleOrFallback(item.title(), url))
            .url(url)
            .author(blankToNull(clean(item.by())))
            .publishedAt(approximate ? ingestionTime : item.time())
            .publishedAtApproximate(approximate)
            .engagement(new Engagement(item.score(), item.descendants(), 0))
            .description("")
            .tags(List.of())
            .readingTimeMinutes(0)
            .build();
    }

    private static Article fromDevTo(DevToItem item, Instant ingestionTime) {
        String url = clean(item.url());
        Instant published = parseTimestamp(item.publishedAt());
        boolean approximate = published == null;
        String nativeId = item.id() != null ? String.valueOf(item.id()) : url;

        return Article.builder()
            .id(identity(NewsSource.DEV_TO, nativeId))
            .source(NewsSource.DEV_TO)
            .title(titleOrFallback(item.title(), url))
            .url(url)
            .author(blankToNull(clean(item.author())))
            .publishedAt(approximate ? ingestionTime : published)
            .publishedAtApproximate(approximate)
            .engagement(new Engagement(0, item.comments(), item.reactions()))
            .description(clean(item.description()))
            .tags(item.tags() != null ? item.tags() : List.of())
            .readingTimeMinutes(Math.max(item.readingTimeMinutes(), 0))
            .build();
    }

    /**
     * Deterministic dedup key: depends only on the source and the source-native id.
     */
    public static String identity(NewsSource source, String nativeId) {
        String key = source.key() + ":" + nativeId.trim();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Trim and HTML-unescape. Null becomes empty.
     */
    static String clean(String text) {
        if (text == null) return "";
        return Parser.unescapeEntities(text, false)
            .replace('\u00a0', ' ')
            .trim();
    }

    private static String titleOrFallback(String rawTitle, String cleanUrl) {
        String title = clean(rawTitle).replaceAll("\\s+", " ");
        if (!title.isEmpty()) return title;
        if (!cleanUrl.isEmpty()) return cleanUrl;
        return UNTITLED;
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text;
    }

    private static Instant parseTimestamp(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return OffsetDateTime.parse(text.trim()).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(text.trim());
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
