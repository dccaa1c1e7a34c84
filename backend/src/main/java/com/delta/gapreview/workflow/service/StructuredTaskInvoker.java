package com.delta.gapreview.workflow.service;

import com.delta.gapreview.collab.StructuredTaskClient;
import com.delta.gapreview.error.SchemaViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured-task calls with the workflow's error policy: upstream outages are retried with backoff,
 * a schema violation gets exactly one corrective retry carrying a {@code correctionHint} input.
 */
@Component
public class StructuredTaskInvoker {
    private static final Logger log = LoggerFactory.getLogger(StructuredTaskInvoker.class);
    static final String CORRECTION_HINT = "correctionHint";

    private final StructuredTaskClient client;
    private final RetryPolicy retryPolicy;

    public StructuredTaskInvoker(StructuredTaskClient client, RetryPolicy retryPolicy) {
        this.client = client;
        this.retryPolicy = retryPolicy;
    }

    public <T> T invoke(String taskName, Map<String, Object> inputs, Class<T> schema) {
        try {
            return retryPolicy.execute("task " + taskName, () -> client.invoke(taskName, inputs, schema));
        } catch (SchemaViolationException first) {
            log.warn("Task {} violated {}; retrying once with a correction hint: {}",
                taskName, schema.getSimpleName(), first.getMessage());
            Map<String, Object> corrected = new LinkedHashMap<>(inputs);
            corrected.put(
                CORRECTION_HINT,
                "The previous response was rejected (" + first.getMessage() + "). "
                    + "Return only a JSON object with the fields of " + schema.getSimpleName() + "."
            );
            return retryPolicy.execute("task " + taskName, () -> client.invoke(taskName, corrected, schema));
        }
    }
}
