package com.delta.gapreview.collab;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.DocumentNotFoundException;
import com.delta.gapreview.error.UpstreamUnavailableException;
import com.delta.gapreview.http.GatewayHttpClient;
import com.delta.gapreview.http.HttpFetchResult;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

@Service
public class TargetSpecService implements TargetSpecResolver {
    private static final Logger log = LoggerFactory.getLogger(TargetSpecService.class);

    private final GatewayHttpClient httpClient;
    private final ReviewProperties.Ingestion ingestion;

    public TargetSpecService(GatewayHttpClient httpClient, ReviewProperties properties) {
        this.httpClient = httpClient;
        this.ingestion = properties.getIngestion();
    }

    @Override
    public String fetchTargetSpec(String targetRef, String inlineText) {
        if (inlineText != null && !inlineText.isBlank()) {
            return truncate(inlineText.trim());
        }
        if (targetRef == null || targetRef.isBlank()) {
            throw new DocumentNotFoundException("no target specification supplied");
        }
        HttpFetchResult fetch = httpClient.get(
            targetRef,
            "text/html,text/plain;q=0.9,*/*;q=0.5",
            Duration.ofSeconds(ingestion.getFetchTimeoutSeconds()),
            Map.of()
        );
        if (!fetch.isSuccessful()) {
            if (fetch.isRetryable()) {
                throw new UpstreamUnavailableException("target spec fetch failed: " + fetch.describe(), true);
            }
            throw new DocumentNotFoundException("target spec not retrievable from " + targetRef + ": " + fetch.describe());
        }
        String body = fetch.body() == null ? "" : fetch.body();
        String text = isHtml(fetch.contentType(), body) ? Jsoup.parse(body, targetRef).text() : body.trim();
        if (text.isBlank()) {
            throw new DocumentNotFoundException("target spec at " + targetRef + " is empty");
        }
        log.debug("Fetched target spec from {} ({} chars)", targetRef, text.length());
        return truncate(text);
    }

    private boolean isHtml(String contentType, String body) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("html")) {
            return true;
        }
        String head = body.stripLeading().toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html");
    }

    private String truncate(String text) {
        int limit = ingestion.getMaxTargetSpecChars();
        return text.length() <= limit ? text : text.substring(0, limit);
    }
}
