package com.delta.gapreview.workflow.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Accumulated working data of a run. Immutable; every step returns a new copy, which is what gets
 * checkpointed. Maps are kept key-sorted so a snapshot serializes the same way in every process.
 */
public record RunContext(
    StartRunRequest input,
    String sourceText,
    String targetSpecText,
    Map<String, Double> sourceBoosts,
    AlignmentAnalysis analysis,
    AlignmentScore alignmentScore,
    ImprovementPlan plan,
    List<Gap> gaps,
    List<GapBranch> branches,
    MergedArtifact artifact,
    String approvalMessageRef,
    ApprovalDecision approvalDecision,
    Instant approvalDecidedAt,
    Finalization finalization
) {
    public RunContext {
        sourceBoosts = sourceBoosts == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(sourceBoosts));
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
        branches = branches == null ? List.of() : List.copyOf(branches);
    }

    public static RunContext initial(StartRunRequest input) {
        return new RunContext(input, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public RunContext withSourceBoosts(Map<String, Double> sourceBoosts) {
        return new RunContext(input, sourceText, targetSpecText, sourceBoosts, analysis, alignmentScore, plan, gaps,
            branches, artifact, approvalMessageRef, approvalDecision, approvalDecidedAt, finalization);
    }

    public RunContext withSource(String sourceText, String targetSpecText) {
        return new RunContext(input, sourceText, targetSpecText, sourceBoosts, analysis, alignmentScore, plan, gaps,
            branches, artifact, approvalMessageRef, approvalDecision, approvalDecidedAt, finalization);
    }

    public RunContext withAnalysis(AlignmentAnalysis analysis, List<Gap> gaps) {
        return new RunContext(input, sourceText, targetSpecText, sourceBoosts, analysis, alignmentScore, plan, gaps,
            branches, artifact, approvalMessageRef, approvalDecision, approvalDecidedAt, finalization);
    }

    public RunContext withScoring(AlignmentScore alignmentScore, ImprovementPlan plan) {
        return new RunContext(input, sourceText, targetSpecText, sourceBoosts, analysis, alignmentScore, plan, gaps,
            branches, artifact, approvalMessageRef, approvalDecision, approvalDecidedAt, finalization);
    }

    public RunContext withBranches(List<GapBranch> branches) {
        return new RunContext(input, sourceText, targetSpecText, sourceBoosts, analysis, alignmentScore, plan, gaps,
            branches, artifact, approvalMessageRef, approvalDecision, approvalDecidedAt, finalization);
    }

    public RunContext withArtifact(List<GapBranch> branches, MergedArtifact artifact) {
        return new RunContext(input, sourceText, targetSpecText, sourceBoosts, analysis, alignmentScore, plan, gaps,
            branches, artifact, approvalMessageRef, approvalDecision, approvalDecidedAt, finalization);
    }

    public RunContext withApprovalRequested(String messageRef) {
        return new RunContext(input, sourceText, targetSpecText, sourceBoosts, analysis, alignmentScore, plan, gaps,
            branches, artifact, messageRef, approvalDecision, approvalDecidedAt, finalization);
    }

    public RunContext withDecision(ApprovalDecision decision, Instant decidedAt) {
        return new RunContext(input, sourceText, targetSpecText, sourceBoosts, analysis, alignmentScore, plan, gaps,
            branches, artifact, approvalMessageRef, decision, decidedAt, finalization);
    }

    public RunContext withFinalization(Finalization finalization) {
        return new RunContext(input, sourceText, targetSpecText, sourceBoosts, analysis, alignmentScore, plan, gaps,
            branches, artifact, approvalMessageRef, approvalDecision, approvalDecidedAt, finalization);
    }
}
