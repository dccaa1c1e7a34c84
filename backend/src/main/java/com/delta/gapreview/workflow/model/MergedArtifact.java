package com.delta.gapreview.workflow.model;

import java.util.List;

/**
 * Barrier output. Sections are in gap-id order and every gap has one, failed or empty ones included.
 */
public record MergedArtifact(
    List<GapSection> sections,
    int succeededBranches,
    int failedBranches,
    String summary,
    List<MvpProject> mvpProjects
) {
    public MergedArtifact {
        sections = sections == null ? List.of() : List.copyOf(sections);
        mvpProjects = mvpProjects == null ? List.of() : List.copyOf(mvpProjects);
    }

    public MergedArtifact withMvpProjects(List<MvpProject> projects) {
        return new MergedArtifact(sections, succeededBranches, failedBranches, summary, projects);
    }
}
