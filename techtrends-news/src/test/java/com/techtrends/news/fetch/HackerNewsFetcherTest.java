package com.techtrends.news.fetch;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import com.techtrends.news.model.RawItem;
import com.techtrends.news.model.RawItem.HackerNewsItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.*;

class HackerNewsFetcherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DELAY = Duration.ofSeconds(1);

    private WireMockServer wireMockServer;
    private FakeTicker ticker;
    private HackerNewsFetcher fetcher;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();

        ticker = new FakeTicker();
        RateLimiter limiter = ticker.recording(RateLimiter.fixedDelay(DELAY, ticker));
        fetcher = new HackerNewsFetcher("http://localhost:" + wireMockServer.port() + "/v0",
            HttpClientFactory.getClient(), limiter, true);
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    private void stubTopStories(String body) {
        wireMockServer.stubFor(get(urlEqualTo("/v0/topstories.json")).willReturn(okJson(body)));
    }

    private void stubItem(long id, String body) {
        wireMockServer.stubFor(get(urlEqualTo("/v0/item/" + id + ".json")).willReturn(okJson(body)));
    }

    private static String story(long id, String title) {
        return """
            {"id": %d, "type": "story", "title": "%s", "by": "alice", "score": %d,
             "descendants": 12, "time": 1709294400, "url": "https://example.com/%d"}
            """.formatted(id, title, id * 10, id);
    }

    @Nested
    @DisplayName("Fetching stories")
    class FetchTests {

        @Test
        @DisplayName("Fetches the top stories up to the limit in ranked order")
        void fetchesTopStories() throws Exception {
            // Given
            stubTopStories("[3, 1, 2, 4]");
            stubItem(3, story(3, "Third"));
            stubItem(1, story(1, "First"));
            stubItem(2, story(2, "Second"));

            // When
            FetchBatch batch = fetcher.fetch(3, TIMEOUT);

            // Then
            List<Long> ids = batch.items().stream().map(i -> ((HackerNewsItem) i).id()).toList();
            assertEquals(List.of(3L, 1L, 2L), ids);
            assertEquals(0, batch.skippedRecords());
            wireMockServer.verify(0, getRequestedFor(urlEqualTo("/v0/item/4.json")));

            HackerNewsItem first = (HackerNewsItem) batch.items().get(0);
            assertEquals("Third", first.title());
            assertEquals(30, first.score());
            assertEquals(12, first.descendants());
            assertEquals("alice", first.by());
            assertEquals(Instant.ofEpochSecond(1709294400), first.time());
        }

        @Test
        @DisplayName("Requests are paced by the rate limiter")
        void requestsArePaced() throws Exception {
            // Given
            stubTopStories("[1, 2, 3]");
            stubItem(1, story(1, "One"));
            stubItem(2, story(2, "Two"));
            stubItem(3, story(3, "Three"));

            // When
            fetcher.fetch(3, TIMEOUT);

            // Then
            List<Long> times = ticker.acquiredAt();
            assertEquals(4, times.size());
            for (int i = 1; i < times.size(); i++) {
                assertTrue(times.get(i) - times.get(i - 1) >= DELAY.toNanos());
            }
        }

        @Test
        @DisplayName("Malformed, deleted and missing records are skipped and counted")
        void skipsBadRecords() throws Exception {
            // Given
            stubTopStories("[1, 2, 3, 4, 5]");
            stubItem(1, story(1, "Good"));
            stubItem(2, "{\"id\": 2, \"deleted\": true}");
            stubItem(3, "null");
            stubItem(4, "{\"id\": 4, \"type\": \"story\"}");
            wireMockServer.stubFor(get(urlEqualTo("/v0/item/5.json")).willReturn(aResponse().withStatus(500)));

            // When
            FetchBatch batch = fetcher.fetch(5, TIMEOUT);

            // Then
            assertEquals(1, batch.items().size());
            assertEquals(4, batch.skippedRecords());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("429 on the story list is a rate-limit failure")
        void rateLimitedList() {
            wireMockServer.stubFor(get(urlEqualTo("/v0/topstories.json")).willReturn(aResponse().withStatus(429)));

            FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(5, TIMEOUT));

            assertEquals(FetchFailure.RATE_LIMITED, e.getFailure());
        }

        @Test
        @DisplayName("429 on an item aborts the whole fetch")
        void rateLimitedItem() {
            stubTopStories("[1, 2]");
            stubItem(1, story(1, "One"));
            wireMockServer.stubFor(get(urlEqualTo("/v0/item/2.json")).willReturn(aResponse().withStatus(429)));

            FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(5, TIMEOUT));

            assertEquals(FetchFailure.RATE_LIMITED, e.getFailure());
        }

        @Test
        @DisplayName("Malformed story list is a parse failure")
        void malformedList() {
            stubTopStories("[1, 2,");

            FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(5, TIMEOUT));

            assertEquals(FetchFailure.PARSE, e.getFailure());
        }

        @Test
        @DisplayName("Story list that is not an array is a parse failure")
        void listNotArray() {
            stubTopStories("{\"ids\": []}");

            FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(5, TIMEOUT));

            assertEquals(FetchFailure.PARSE, e.getFailure());
        }

        @Test
        @DisplayName("Server error on the story list is a network failure")
        void serverError() {
            wireMockServer.stubFor(get(urlEqualTo("/v0/topstories.json")).willReturn(aResponse().withStatus(503)));

            FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(5, TIMEOUT));

            assertEquals(FetchFailure.NETWORK, e.getFailure());
        }

        @Test
        @DisplayName("Every item request failing is a network failure")
        void allItemsFail() {
            stubTopStories("[1, 2]");
            wireMockServer.stubFor(get(urlMatching("/v0/item/.*"))
                .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

            FetchException e = assertThrows(FetchException.class, () -> fetcher.fetch(5, TIMEOUT));

            assertEquals(FetchFailure.NETWORK, e.getFailure());
        }
    }

    @Test
    @DisplayName("Items without a title are rejected by the parser")
    void parseItemRequiresTitle() throws Exception {
        var node = HttpClientFactory.getMapper().readTree("{\"id\": 9, \"title\": \"  \"}");

        assertTrue(HackerNewsFetcher.parseItem(node).isEmpty());
    }

    @Test
    @DisplayName("Dead items are rejected by the parser")
    void parseItemSkipsDead() throws Exception {
        var node = HttpClientFactory.getMapper().readTree("{\"id\": 9, \"title\": \"x\", \"dead\": true}");

        assertTrue(HackerNewsFetcher.parseItem(node).isEmpty());
    }

    @Test
    @DisplayName("Fetched items are tagged with their source")
    void itemsCarrySource() throws Exception {
        stubTopStories("[1]");
        stubItem(1, story(1, "One"));

        RawItem item = fetcher.fetch(1, TIMEOUT).items().get(0);

        assertEquals(fetcher.getSource(), item.source());
    }
}
