package com.delta.gapreview.workflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A buildable project that exercises several missing skills at once, anchored on one found tutorial.
 */
public record MvpProject(
    @JsonProperty(value = "tutorialTitle", required = true) String tutorialTitle,
    @JsonProperty("tutorialUrl") String tutorialUrl,
    @JsonProperty(value = "skillsCombined", required = true) List<String> skillsCombined,
    @JsonProperty("personalizationTip") String personalizationTip,
    @JsonProperty("documentBlurb") String documentBlurb,
    @JsonProperty("estimatedBuildTime") String estimatedBuildTime,
    @JsonProperty("roleFitNote") String roleFitNote
) {
    public MvpProject {
        skillsCombined = skillsCombined == null ? List.of() : List.copyOf(skillsCombined);
    }
}
