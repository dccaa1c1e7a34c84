package com.delta.gapreview.workflow.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MvpPlan(
    @JsonProperty(value = "mvpProjects", required = true) List<MvpProject> mvpProjects
) {
    public MvpPlan {
        mvpProjects = mvpProjects == null ? List.of() : List.copyOf(mvpProjects);
    }
}
