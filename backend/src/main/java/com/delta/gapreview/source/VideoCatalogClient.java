package com.delta.gapreview.source;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.QuotaExhaustedException;
import com.delta.gapreview.error.UpstreamUnavailableException;
import com.delta.gapreview.http.GatewayHttpClient;
import com.delta.gapreview.http.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for a video catalog speaking the YouTube Data API v3 shape ({@code /search} and
 * {@code /videos}).
 */
@Service
public class VideoCatalogClient implements CandidateSourceClient {
    private static final Logger log = LoggerFactory.getLogger(VideoCatalogClient.class);
    private static final String WATCH_URL = "https://www.youtube.com/watch?v=";

    private final GatewayHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ReviewProperties.Catalog catalog;

    public VideoCatalogClient(GatewayHttpClient httpClient, ObjectMapper objectMapper, ReviewProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.catalog = properties.getCatalog();
    }

    @Override
    public String resourceName() {
        return catalog.getResourceName();
    }

    @Override
    public List<RawCatalogItem> search(String query, int maxResults) {
        String url = baseUrl() + "/search?part=snippet&type=video"
            + "&maxResults=" + Math.max(1, Math.min(50, maxResults))
            + "&q=" + encode(query)
            + keyParam();
        JsonNode root = fetch(url, "search");
        List<RawCatalogItem> items = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String id = text(item.path("id"), "videoId");
            if (id == null) {
                continue;
            }
            items.add(fromSnippet(id, item.path("snippet"), null, null));
        }
        log.debug("Catalog search returned {} items for query={}", items.size(), query);
        return items;
    }

    @Override
    public List<RawCatalogItem> fetchDetails(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        String url = baseUrl() + "/videos?part=snippet,statistics,contentDetails"
            + "&id=" + encode(String.join(",", ids))
            + keyParam();
        JsonNode root = fetch(url, "details");
        List<RawCatalogItem> items = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String id = text(item, "id");
            if (id == null) {
                continue;
            }
            items.add(fromSnippet(id, item.path("snippet"), item.path("statistics"), item.path("contentDetails")));
        }
        return items;
    }

    private JsonNode fetch(String url, String operation) {
        HttpFetchResult result = httpClient.get(
            url,
            "application/json",
            Duration.ofSeconds(catalog.getRequestTimeoutSeconds()),
            Map.of()
        );
        if (!result.isSuccessful()) {
            if (result.statusCode() == 403 && isQuotaError(result.body())) {
                throw new QuotaExhaustedException(resourceName(), "catalog reported quota exceeded on " + operation);
            }
            throw new UpstreamUnavailableException(
                "catalog " + operation + " failed: " + result.describe(),
                result.isRetryable()
            );
        }
        try {
            return objectMapper.readTree(result.body() == null ? "{}" : result.body());
        } catch (JsonProcessingException e) {
            throw new UpstreamUnavailableException("catalog " + operation + " returned malformed JSON", false, e);
        }
    }

    private boolean isQuotaError(String body) {
        if (body == null || body.isBlank()) {
            return false;
        }
        try {
            JsonNode errors = objectMapper.readTree(body).path("error").path("errors");
            for (JsonNode error : errors) {
                String reason = error.path("reason").asText("");
                if ("quotaExceeded".equals(reason) || "dailyLimitExceeded".equals(reason)) {
                    return true;
                }
            }
            return false;
        } catch (JsonProcessingException e) {
            log.debug("Unparseable catalog error body: {}", e.getOriginalMessage());
            return false;
        }
    }

    private RawCatalogItem fromSnippet(String id, JsonNode snippet, JsonNode statistics, JsonNode contentDetails) {
        return new RawCatalogItem(
            id,
            text(snippet, "title"),
            text(snippet, "description"),
            text(snippet, "channelTitle"),
            text(snippet, "channelId"),
            instant(text(snippet, "publishedAt")),
            contentDetails == null ? null : text(contentDetails, "duration"),
            statistics == null ? null : count(statistics, "viewCount"),
            statistics == null ? null : count(statistics, "likeCount"),
            statistics == null ? null : count(statistics, "commentCount"),
            WATCH_URL + id
        );
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    // the catalog reports counts as decimal strings
    private static Long count(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Instant instant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private String baseUrl() {
        String base = catalog.getBaseUrl() == null ? "" : catalog.getBaseUrl().trim();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private String keyParam() {
        String key = catalog.getApiKey();
        return key == null || key.isBlank() ? "" : "&key=" + encode(key);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
