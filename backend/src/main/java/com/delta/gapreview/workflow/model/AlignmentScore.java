package com.delta.gapreview.workflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AlignmentScore(
    @JsonProperty(value = "score", required = true) double score,
    @JsonProperty("rationale") String rationale
) {
}
