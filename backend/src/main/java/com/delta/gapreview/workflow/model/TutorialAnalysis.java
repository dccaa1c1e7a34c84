package com.delta.gapreview.workflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What a tutorial teaches, either from the analysis task or derived from catalog metadata.
 */
public record TutorialAnalysis(
    @JsonProperty(value = "summary", required = true) String summary,
    @JsonProperty(value = "keyPoints", required = true) List<String> keyPoints,
    @JsonProperty("difficultyLevel") String difficultyLevel,
    @JsonProperty("prerequisites") List<String> prerequisites,
    @JsonProperty("practicalTakeaways") List<String> practicalTakeaways
) {
    public TutorialAnalysis {
        keyPoints = clean(keyPoints);
        prerequisites = clean(prerequisites);
        practicalTakeaways = clean(practicalTakeaways);
    }

    /**
     * Summary-only analysis built from the catalog description, or null when there is none.
     */
    public static TutorialAnalysis fromMetadata(String description, int maxChars) {
        if (description == null || description.isBlank()) {
            return null;
        }
        String flat = description.replaceAll("\\s+", " ").trim();
        String summary = flat.length() <= maxChars ? flat : flat.substring(0, maxChars - 3) + "...";
        return new TutorialAnalysis(summary, List.of(), null, List.of(), List.of());
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(v -> v != null && !v.isBlank())
            .map(String::trim)
            .toList();
    }
}
