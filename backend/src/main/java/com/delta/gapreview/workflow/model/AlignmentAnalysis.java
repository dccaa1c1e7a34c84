package com.delta.gapreview.workflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of the {@code analyze_target} task.
 */
public record AlignmentAnalysis(
    @JsonProperty(value = "hardSkills", required = true) List<String> hardSkills,
    @JsonProperty("missingSkills") List<String> missingSkills,
    @JsonProperty("jobTitle") String jobTitle,
    @JsonProperty("summary") String summary
) {
    public AlignmentAnalysis {
        hardSkills = hardSkills == null ? List.of() : List.copyOf(hardSkills);
        missingSkills = missingSkills == null ? List.of() : List.copyOf(missingSkills);
    }
}
