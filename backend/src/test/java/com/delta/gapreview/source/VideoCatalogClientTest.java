package com.delta.gapreview.source;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.QuotaExhaustedException;
import com.delta.gapreview.error.UpstreamUnavailableException;
import com.delta.gapreview.http.GatewayHttpClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VideoCatalogClientTest {
    private MockWebServer server;
    private VideoCatalogClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        ReviewProperties properties = new ReviewProperties();
        properties.getCatalog().setBaseUrl(server.url("/v3/").toString());
        properties.getCatalog().setApiKey("test-key");
        properties.getCatalog().setRequestTimeoutSeconds(5);
        GatewayHttpClient httpClient = new GatewayHttpClient(HttpClient.newHttpClient(), properties, Clock.systemUTC());
        client = new VideoCatalogClient(httpClient, new ObjectMapper(), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void searchParsesListingItems() throws Exception {
        server.enqueue(json(200, """
            {"items": [
              {"id": {"kind": "youtube#video", "videoId": "abc"},
               "snippet": {"title": "Docker Tutorial", "channelTitle": "freeCodeCamp.org",
                           "channelId": "UC1", "publishedAt": "2023-01-02T03:04:05Z"}},
              {"id": {"kind": "youtube#channel"}, "snippet": {"title": "skipped"}}
            ]}
            """));

        List<RawCatalogItem> items = client.search("docker tutorial", 8);

        assertThat(items).hasSize(1);
        RawCatalogItem item = items.get(0);
        assertThat(item.id()).isEqualTo("abc");
        assertThat(item.channelTitle()).isEqualTo("freeCodeCamp.org");
        assertThat(item.publishedAt()).isEqualTo(Instant.parse("2023-01-02T03:04:05Z"));
        assertThat(item.url()).isEqualTo("https://www.youtube.com/watch?v=abc");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).startsWith("/v3/search?part=snippet&type=video&maxResults=8");
        assertThat(request.getPath()).contains("q=docker+tutorial").contains("key=test-key");
    }

    @Test
    void detailsParseStatisticsAndDuration() throws Exception {
        server.enqueue(json(200, """
            {"items": [
              {"id": "abc",
               "snippet": {"title": "Docker Tutorial", "channelTitle": "freeCodeCamp.org"},
               "statistics": {"viewCount": "12000", "likeCount": "800"},
               "contentDetails": {"duration": "PT1H2M"}}
            ]}
            """));

        List<RawCatalogItem> items = client.fetchDetails(List.of("abc", "def"));

        assertThat(items).hasSize(1);
        assertThat(items.get(0).viewCount()).isEqualTo(12000L);
        assertThat(items.get(0).likeCount()).isEqualTo(800L);
        assertThat(items.get(0).commentCount()).isNull();
        assertThat(items.get(0).toCandidate().durationSeconds()).isEqualTo(3720L);
        assertThat(server.takeRequest().getPath()).contains("id=abc%2Cdef");
    }

    @Test
    void quotaErrorBecomesQuotaExhausted() {
        server.enqueue(json(403, """
            {"error": {"code": 403, "errors": [{"reason": "quotaExceeded"}]}}
            """));

        assertThatThrownBy(() -> client.search("go", 5)).isInstanceOf(QuotaExhaustedException.class);
    }

    @Test
    void serverErrorIsRetryableUpstreamFailure() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> client.search("go", 5))
            .isInstanceOfSatisfying(UpstreamUnavailableException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    @Test
    void forbiddenWithoutQuotaReasonIsFinal() {
        server.enqueue(json(403, "{\"error\": {\"errors\": [{\"reason\": \"forbidden\"}]}}"));

        assertThatThrownBy(() -> client.search("go", 5))
            .isInstanceOfSatisfying(UpstreamUnavailableException.class, e -> assertThat(e.isRetryable()).isFalse());
    }

    @Test
    void emptyIdListSkipsCall() {
        assertThat(client.fetchDetails(List.of())).isEmpty();
        assertThat(server.getRequestCount()).isZero();
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
