package com.techtrends.news.fetch;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.techtrends.news.model.RawItem.DevToItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.StringJoiner;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.*;

class DevToFetcherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private WireMockServer wireMockServer;
    private FakeTicker ticker;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
        ticker = new FakeTicker();
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    private DevToFetcher fetcher(String tag, int topDays) {
        return new DevToFetcher("http://localhost:" + wireMockServer.port() + "/api", tag, topDays,
            HttpClientFactory.getClient(), ticker.recording(RateLimiter.fixedDelay(Duration.ofMillis(500), ticker)), true);
    }

    private void stubPage(int page, String body) {
        wireMockServer.stubFor(get(urlPathEqualTo("/api/articles"))
            .withQueryParam("page", equalTo(String.valueOf(page)))
            .willReturn(okJson(body)));
    }

    private static String article(long id, String title) {
        return """
            {"id": %d, "title": "%s", "description": "About %s",
             "url": "https://dev.to/writer/post-%d", "published_at": "2024-02-10T08:30:00Z",
             "positive_reactions_count": 25, "comments_count": 3, "reading_time_minutes": 4,
             "tag_list": ["java", "testing"], "user": {"name": "Writer", "username": "writer"}}
            """.formatted(id, title, title, id);
    }

    private static String page(long fromId, int count) {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (long id = fromId; id < fromId + count; id++) {
            joiner.add(article(id, "Post " + id));
        }
        return joiner.toString();
    }

    @Nested
    @DisplayName("Paging")
    class PagingTests {

        @Test
        @DisplayName("Single page when the limit fits in one page")
        void singlePage() throws Exception {
            // Given
            stubPage(1, page(1, 3));

            // When
            FetchBatch batch = fetcher("programming", 0).fetch(3, TIMEOUT);

            // Then
            assertEquals(3, batch.items().size());
            wireMockServer.verify(1, getRequestedFor(urlPathEqualTo("/api/articles"))
                .withQueryParam("per_page", equalTo("3"))
                .withQueryParam("tag", equalTo("programming")));
        }

        @Test
        @DisplayName("Pages until the limit is reached")
        void multiplePages() throws Exception {
            // Given
            stubPage(1, page(1, 100));
            stubPage(2, page(101, 100));

            // When
            FetchBatch batch = fetcher(null, 0).fetch(150, TIMEOUT);

            // Then
            assertEquals(150, batch.items().size());
            assertEquals(101L, ((DevToItem) batch.items().get(100)).id());
            wireMockServer.verify(2, getRequestedFor(urlPathEqualTo("/api/articles")));
            wireMockServer.verify(0, getRequestedFor(urlPathEqualTo("/api/articles"))
                .withQueryParam("tag", matching(".*")));
        }

        @Test
        @DisplayName("A short page ends paging")
        void shortPageStops() throws Exception {
            stubPage(1, page(1, 2));

            FetchBatch batch = fetcher("java", 0).fetch(10, TIMEOUT);

            assertEquals(2, batch.items().size());
            wireMockServer.verify(1, getRequestedFor(urlPathEqualTo("/api/articles")));
        }

        @Test
        @DisplayName("Failure after the first page keeps earlier results")
        void laterPageFailureKeepsResults() throws Exception {
            // Given
            stubPage(1, page(1, 100));
            wireMockServer.stubFor(get(urlPathEqualTo("/api/articles"))
                .withQueryParam("page", equalTo("2"))
                .willReturn(aResponse().withStatus(500)));

            // When
            FetchBatch batch = fetcher(null, 0).fetch(200, TIMEOUT);

            // Then
            assertEquals(100, batch.items().size());
        }

        @Test
        @DisplayName("Top-days parameter is sent when configured")
        void topDays() throws Exception {
            stubPage(1, page(1, 1));

            fetcher(null, 7).fetch(1, TIMEOUT);

            wireMockServer.verify(getRequestedFor(urlPathEqualTo("/api/articles"))
                .withQueryParam("top", equalTo("7")));
        }

        @Test
        @DisplayName("Consecutive page requests are paced")
        void pagesArePaced() throws Exception {
            stubPage(1, page(1, 100));
            stubPage(2, page(101, 100));

            fetcher(null, 0).fetch(200, TIMEOUT);

            List<Long> times = ticker.acquiredAt();
            assertTrue(times.size() >= 2);
            assertTrue(times.get(1) - times.get(0) >= Duration.ofMillis(500).toNanos());
        }
    }

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @Test
        @DisplayName("Article fields are mapped")
        void mapsFields() throws Exception {
            stubPage(1, "[" + article(42, "Records &amp; sealed types") + "]");

            DevToItem item = (DevToItem) fetcher(null, 0).fetch(1, TIMEOUT).items().get(0);

            assertEquals(42L, item.id());
            assertEquals("Records &amp; sealed types", item.title());
            assertEquals("Writer", item.author());
            assertEquals(25, item.reactions());
            assertEquals(3, item.comments());
            assertEquals(4, item.readingTimeMinutes());
            assertEquals(List.of("java", "testing"), item.tags());
            assertEquals("2024-02-10T08:30:00Z", item.publishedAt());
        }

        @Test
        @DisplayName("Comma separated tag string and public reactions are accepted")
        void alternativeShapes() throws Exception {
            var node = HttpClientFactory.getMapper().readTree("""
                {"id": 1, "title": "T", "tag_list": "go, rust ,", "public_reactions_count": 9}
                """);

            DevToItem item = DevToFetcher.parseArticle(node).orElseThrow();

            assertEquals(List.of("go", "rust"), item.tags());
            assertEquals(9, item.reactions());
            assertNull(item.author());
        }

        @Test
        @DisplayName("Records without a title or without id and url are skipped")
        void skipsMalformed() throws Exception {
            // Given
            stubPage(1, "[" + article(1, "Good") + ", {\"id\": 2}, {\"title\": \"Orphan\"}, 17]");

            // When
            FetchBatch batch = fetcher(null, 0).fetch(10, TIMEOUT);

            // Then
            assertEquals(1, batch.items().size());
            assertEquals(3, batch.skippedRecords());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("429 on the first page is a rate-limit failure")
        void rateLimited() {
            wireMockServer.stubFor(get(urlPathEqualTo("/api/articles")).willReturn(aResponse().withStatus(429)));

            FetchException e = assertThrows(FetchException.class, () -> fetcher(null, 0).fetch(10, TIMEOUT));

            assertEquals(FetchFailure.RATE_LIMITED, e.getFailure());
        }

        @Test
        @DisplayName("Non-JSON first page is a parse failure")
        void notJson() {
            wireMockServer.stubFor(get(urlPathEqualTo("/api/articles"))
                .willReturn(aResponse().withStatus(200).withBody("<html>maintenance</html>")));

            FetchException e = assertThrows(FetchException.class, () -> fetcher(null, 0).fetch(10, TIMEOUT));

            assertEquals(FetchFailure.PARSE, e.getFailure());
        }
    }
}
