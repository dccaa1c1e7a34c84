package com.delta.gapreview.collab;

import com.delta.gapreview.config.ReviewConfig;
import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.SchemaViolationException;
import com.delta.gapreview.error.UpstreamUnavailableException;
import com.delta.gapreview.http.GatewayHttpClient;
import com.delta.gapreview.workflow.model.AlignmentAnalysis;
import com.delta.gapreview.workflow.model.AlignmentScore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpStructuredTaskClientTest {
    private final ObjectMapper objectMapper = new ReviewConfig().objectMapper();
    private MockWebServer server;
    private HttpStructuredTaskClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        ReviewProperties properties = new ReviewProperties();
        properties.getTasks().setBaseUrl(server.url("/").toString());
        properties.getTasks().setApiKey("secret");
        properties.getTasks().setRequestTimeoutSeconds(5);
        GatewayHttpClient httpClient = new GatewayHttpClient(HttpClient.newHttpClient(), properties, Clock.systemUTC());
        client = new HttpStructuredTaskClient(httpClient, objectMapper, properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void postsInputsAndBindsOutput() throws Exception {
        server.enqueue(json(200, """
            {"output": {"hardSkills": ["Kubernetes", "Go"], "missingSkills": ["Go"], "jobTitle": "SRE"}}
            """));

        AlignmentAnalysis analysis = client.invoke(
            "analyze_target", Map.of("sourceText", "resume"), AlignmentAnalysis.class);

        assertThat(analysis.hardSkills()).containsExactly("Kubernetes", "Go");
        assertThat(analysis.missingSkills()).containsExactly("Go");
        assertThat(analysis.jobTitle()).isEqualTo("SRE");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/tasks/analyze_target");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("inputs").path("sourceText").asText()).isEqualTo("resume");
    }

    @Test
    void snakeCaseOutputIsAccepted() {
        server.enqueue(json(200, """
            {"hard_skills": ["SQL"], "missing_skills": [], "job_title": "Analyst"}
            """));

        AlignmentAnalysis analysis = client.invoke("analyze_target", Map.of(), AlignmentAnalysis.class);

        assertThat(analysis.hardSkills()).containsExactly("SQL");
        assertThat(analysis.jobTitle()).isEqualTo("Analyst");
    }

    @Test
    void missingRequiredFieldIsSchemaViolation() {
        server.enqueue(json(200, "{\"rationale\": \"no score here\"}"));

        assertThatThrownBy(() -> client.invoke("score_alignment", Map.of(), AlignmentScore.class))
            .isInstanceOf(SchemaViolationException.class);
    }

    @Test
    void nonObjectResponseIsSchemaViolation() {
        server.enqueue(json(200, "[1, 2, 3]"));

        assertThatThrownBy(() -> client.invoke("score_alignment", Map.of(), AlignmentScore.class))
            .isInstanceOf(SchemaViolationException.class);
    }

    @Test
    void unprocessableInputIsSchemaViolation() {
        server.enqueue(json(422, "{\"detail\": \"bad inputs\"}"));

        assertThatThrownBy(() -> client.invoke("score_alignment", Map.of(), AlignmentScore.class))
            .isInstanceOf(SchemaViolationException.class);
    }

    @Test
    void serverErrorIsRetryableUpstreamFailure() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> client.invoke("score_alignment", Map.of(), AlignmentScore.class))
            .isInstanceOfSatisfying(UpstreamUnavailableException.class, e -> assertThat(e.isRetryable()).isTrue());
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
