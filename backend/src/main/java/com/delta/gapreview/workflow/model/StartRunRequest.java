package com.delta.gapreview.workflow.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record StartRunRequest(
    String documentRef,
    String targetRef,
    String targetText,
    String targetTitle,
    Map<String, Double> preferredSources
) {
    public StartRunRequest {
        if (preferredSources != null) {
            Map<String, Double> sorted = new TreeMap<>();
            preferredSources.forEach((name, boost) -> {
                if (name != null) {
                    sorted.put(name, boost);
                }
            });
            preferredSources = Collections.unmodifiableMap(sorted);
        }
    }
}
