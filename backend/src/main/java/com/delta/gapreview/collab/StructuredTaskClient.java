package com.delta.gapreview.collab;

import java.util.Map;

/**
 * Gateway to the analysis, scoring and planning tasks. Results are bound to {@code schema}.
 *
 * @throws com.delta.gapreview.error.SchemaViolationException when the response does not fit the schema
 * @throws com.delta.gapreview.error.UpstreamUnavailableException when the gateway cannot be reached
 */
public interface StructuredTaskClient {

    <T> T invoke(String taskName, Map<String, Object> inputs, Class<T> schema);
}
