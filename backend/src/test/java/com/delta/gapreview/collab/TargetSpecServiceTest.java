package com.delta.gapreview.collab;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.DocumentNotFoundException;
import com.delta.gapreview.error.UpstreamUnavailableException;
import com.delta.gapreview.http.GatewayHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetSpecServiceTest {
    private MockWebServer server;
    private TargetSpecService service;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        ReviewProperties properties = new ReviewProperties();
        properties.getIngestion().setMaxTargetSpecChars(40);
        properties.getIngestion().setFetchTimeoutSeconds(5);
        GatewayHttpClient httpClient = new GatewayHttpClient(HttpClient.newHttpClient(), properties, Clock.systemUTC());
        service = new TargetSpecService(httpClient, properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void inlineTextWinsWithoutFetching() {
        String text = service.fetchTargetSpec(server.url("/job").toString(), "  Platform engineer  ");

        assertThat(text).isEqualTo("Platform engineer");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void htmlIsReducedToText() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/html; charset=utf-8")
            .setBody("<html><body><h1>SRE</h1><p>Kubernetes and Go</p></body></html>"));

        String text = service.fetchTargetSpec(server.url("/job").toString(), null);

        assertThat(text).isEqualTo("SRE Kubernetes and Go");
    }

    @Test
    void longTextIsTruncated() {
        server.enqueue(new MockResponse().setHeader("Content-Type", "text/plain").setBody("x".repeat(100)));

        assertThat(service.fetchTargetSpec(server.url("/job").toString(), null)).hasSize(40);
    }

    @Test
    void missingPageIsNotFound() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> service.fetchTargetSpec(server.url("/gone").toString(), null))
            .isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    void serverErrorIsUpstreamFailure() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> service.fetchTargetSpec(server.url("/job").toString(), null))
            .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    void neitherReferenceNorTextIsNotFound() {
        assertThatThrownBy(() -> service.fetchTargetSpec(" ", null))
            .isInstanceOf(DocumentNotFoundException.class);
    }
}
