package com.delta.gapreview.workflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ImprovementPlan(
    @JsonProperty(value = "insertions", required = true) List<String> insertions,
    @JsonProperty("summary") String summary
) {
    public ImprovementPlan {
        insertions = insertions == null ? List.of() : List.copyOf(insertions);
    }
}
