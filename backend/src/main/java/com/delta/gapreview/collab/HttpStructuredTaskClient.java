package com.delta.gapreview.collab;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.SchemaViolationException;
import com.delta.gapreview.error.UpstreamUnavailableException;
import com.delta.gapreview.http.GatewayHttpClient;
import com.delta.gapreview.http.HttpFetchResult;
import com.delta.gapreview.util.JsonKeys;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;

/**
 * Calls {@code POST {baseUrl}/tasks/{taskName}} with {@code {"inputs": {...}}} and binds the JSON
 * response. Schema records mark mandatory fields with {@code @JsonProperty(required = true)}. A
 * response that only fits after snake_case keys are camelized is accepted.
 */
@Service
public class HttpStructuredTaskClient implements StructuredTaskClient {
    private static final Logger log = LoggerFactory.getLogger(HttpStructuredTaskClient.class);

    private final GatewayHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ObjectMapper strictMapper;
    private final ReviewProperties.Tasks tasks;

    public HttpStructuredTaskClient(GatewayHttpClient httpClient, ObjectMapper objectMapper, ReviewProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.strictMapper = objectMapper.copy()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
        this.tasks = properties.getTasks();
    }

    @Override
    public <T> T invoke(String taskName, Map<String, Object> inputs, Class<T> schema) {
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("inputs", inputs == null ? Map.of() : inputs));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("task inputs are not serializable for " + taskName, e);
        }
        HttpFetchResult result = httpClient.postJson(
            taskUrl(taskName),
            body,
            Duration.ofSeconds(tasks.getRequestTimeoutSeconds()),
            authHeaders()
        );
        if (!result.isSuccessful()) {
            if (result.statusCode() == 422) {
                throw new SchemaViolationException("task " + taskName + " rejected its inputs: " + result.describe());
            }
            throw new UpstreamUnavailableException("task " + taskName + " failed: " + result.describe(), result.isRetryable());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(result.body() == null ? "" : result.body());
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("task " + taskName + " returned malformed JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SchemaViolationException("task " + taskName + " did not return a JSON object");
        }
        JsonNode payload = root.has("output") && root.get("output").isObject() ? root.get("output") : root;
        return bind(taskName, payload, schema);
    }

    private <T> T bind(String taskName, JsonNode payload, Class<T> schema) {
        try {
            return strictMapper.treeToValue(payload, schema);
        } catch (JsonProcessingException first) {
            log.debug("Task {} output did not bind as-is, retrying with camelized keys: {}", taskName, first.getOriginalMessage());
            try {
                return strictMapper.treeToValue(JsonKeys.camelize(payload), schema);
            } catch (JsonProcessingException second) {
                throw new SchemaViolationException(
                    "task " + taskName + " output does not match " + schema.getSimpleName() + ": " + second.getOriginalMessage(),
                    second
                );
            }
        }
    }

    private String taskUrl(String taskName) {
        String base = tasks.getBaseUrl() == null ? "" : tasks.getBaseUrl().trim();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/tasks/" + taskName;
    }

    private Map<String, String> authHeaders() {
        String key = tasks.getApiKey();
        return key == null || key.isBlank() ? Map.of() : Map.of("Authorization", "Bearer " + key);
    }
}
