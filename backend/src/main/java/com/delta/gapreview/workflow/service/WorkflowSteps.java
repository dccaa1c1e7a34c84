package com.delta.gapreview.workflow.service;

import com.delta.gapreview.collab.DocumentEditResult;
import com.delta.gapreview.collab.DocumentRewriter;
import com.delta.gapreview.collab.DocumentSource;
import com.delta.gapreview.collab.NotificationClient;
import com.delta.gapreview.collab.PreferredSourceDefaults;
import com.delta.gapreview.collab.TargetSpecResolver;
import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.AllBranchesFailedException;
import com.delta.gapreview.error.InvalidRunInputException;
import com.delta.gapreview.error.ReviewWorkflowException;
import com.delta.gapreview.workflow.model.AlignmentAnalysis;
import com.delta.gapreview.workflow.model.AlignmentScore;
import com.delta.gapreview.workflow.model.BranchStatus;
import com.delta.gapreview.workflow.model.Finalization;
import com.delta.gapreview.workflow.model.Gap;
import com.delta.gapreview.workflow.model.GapBranch;
import com.delta.gapreview.workflow.model.GapResult;
import com.delta.gapreview.workflow.model.GapSection;
import com.delta.gapreview.workflow.model.ImprovementPlan;
import com.delta.gapreview.workflow.model.MergedArtifact;
import com.delta.gapreview.workflow.model.MvpPlan;
import com.delta.gapreview.workflow.model.MvpProject;
import com.delta.gapreview.workflow.model.RunContext;
import com.delta.gapreview.workflow.model.StartRunRequest;
import com.delta.gapreview.workflow.model.WorkflowRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Step bodies referenced by {@link WorkflowStepTable}. Steps are pure with respect to the run: they
 * read the snapshot they are given and return the next context; persistence is the runner's job.
 */
@Component
public class WorkflowSteps {
    private static final Logger log = LoggerFactory.getLogger(WorkflowSteps.class);

    static final String TASK_ANALYZE = "analyze_target";
    static final String TASK_SCORE = "score_alignment";
    static final String TASK_PLAN = "improvement_plan";
    static final String TASK_MVP = "mvp_projects";
    static final int MVP_SKILL_LIMIT = 8;
    static final int MVP_TUTORIALS_PER_GAP = 3;
    static final String EFFECT_APPROVAL = "approval_request";
    static final String EFFECT_EDITS = "apply_edits";
    static final String EFFECT_COMPLETION = "completion_notice";
    static final String UNKNOWN_MESSAGE_REF = "unknown";

    private final PreferredSourceDefaults preferredSources;
    private final DocumentSource documentSource;
    private final DocumentRewriter documentRewriter;
    private final TargetSpecResolver targetSpecResolver;
    private final StructuredTaskInvoker taskInvoker;
    private final RetryPolicy retryPolicy;
    private final GapPlanner gapPlanner;
    private final BranchCoordinator branchCoordinator;
    private final NotificationClient notificationClient;
    private final IdempotencyGuard idempotencyGuard;
    private final ReviewProperties properties;
    private final Clock clock;

    public WorkflowSteps(
        PreferredSourceDefaults preferredSources,
        DocumentSource documentSource,
        DocumentRewriter documentRewriter,
        TargetSpecResolver targetSpecResolver,
        StructuredTaskInvoker taskInvoker,
        RetryPolicy retryPolicy,
        GapPlanner gapPlanner,
        BranchCoordinator branchCoordinator,
        NotificationClient notificationClient,
        IdempotencyGuard idempotencyGuard,
        ReviewProperties properties,
        Clock clock
    ) {
        this.preferredSources = preferredSources;
        this.documentSource = documentSource;
        this.documentRewriter = documentRewriter;
        this.targetSpecResolver = targetSpecResolver;
        this.taskInvoker = taskInvoker;
        this.retryPolicy = retryPolicy;
        this.gapPlanner = gapPlanner;
        this.branchCoordinator = branchCoordinator;
        this.notificationClient = notificationClient;
        this.idempotencyGuard = idempotencyGuard;
        this.properties = properties;
        this.clock = clock;
    }

    public static void validate(StartRunRequest input) {
        if (input == null) {
            throw new InvalidRunInputException("request body is required");
        }
        if (input.documentRef() == null || input.documentRef().isBlank()) {
            throw new InvalidRunInputException("documentRef is required");
        }
        boolean hasTarget = (input.targetRef() != null && !input.targetRef().isBlank())
            || (input.targetText() != null && !input.targetText().isBlank());
        if (!hasTarget) {
            throw new InvalidRunInputException("targetRef or targetText is required");
        }
    }

    StepResult accept(WorkflowRun run) {
        RunContext context = run.context();
        validate(context.input());
        Map<String, Double> boosts = preferredSources.resolve(context.input().preferredSources());
        return StepResult.advance(context.withSourceBoosts(boosts));
    }

    StepResult ingestSource(WorkflowRun run) {
        RunContext context = run.context();
        if (context.sourceText() != null && context.targetSpecText() != null) {
            return StepResult.skipped(context);
        }
        StartRunRequest input = context.input();
        String sourceText = documentSource.fetchSourceText(input.documentRef());
        String targetSpec = retryPolicy.execute(
            "target spec",
            () -> targetSpecResolver.fetchTargetSpec(input.targetRef(), input.targetText())
        );
        log.info("run {} ingested source ({} chars) and target ({} chars)",
            run.runId(), sourceText.length(), targetSpec.length());
        return StepResult.advance(context.withSource(sourceText, targetSpec));
    }

    StepResult analyzeTarget(WorkflowRun run) {
        RunContext context = run.context();
        if (context.analysis() != null && !context.gaps().isEmpty()) {
            return StepResult.skipped(context);
        }
        Map<String, Object> inputs = baseInputs(context);
        if (context.input().targetTitle() != null) {
            inputs.put("targetTitle", context.input().targetTitle());
        }
        AlignmentAnalysis analysis = taskInvoker.invoke(TASK_ANALYZE, inputs, AlignmentAnalysis.class);
        List<Gap> gaps = gapPlanner.plan(analysis, context.input().targetTitle());
        log.info("run {} analysis found {} gaps: {}", run.runId(), gaps.size(),
            gaps.stream().map(Gap::skill).collect(Collectors.joining(", ")));
        return StepResult.advance(context.withAnalysis(analysis, gaps));
    }

    StepResult scoreAlignment(WorkflowRun run) {
        RunContext context = run.context();
        if (context.alignmentScore() != null && context.plan() != null) {
            return StepResult.skipped(context);
        }
        AlignmentScore score = context.alignmentScore() != null
            ? context.alignmentScore()
            : taskInvoker.invoke(TASK_SCORE, baseInputs(context), AlignmentScore.class);
        Map<String, Object> planInputs = baseInputs(context);
        planInputs.put("missingSkills", context.gaps().stream().map(Gap::skill).toList());
        planInputs.put("alignmentScore", score.score());
        ImprovementPlan plan = taskInvoker.invoke(TASK_PLAN, planInputs, ImprovementPlan.class);
        return StepResult.advance(context.withScoring(score, plan));
    }

    StepResult spawnBranches(WorkflowRun run) {
        BranchCollector collector = branchCoordinator.spawn(run);
        return StepResult.advance(run.context().withBranches(collector.snapshot()));
    }

    StepResult collectBranches(WorkflowRun run) {
        BranchCollector collector = branchCoordinator.collectorFor(run.runId())
            .orElseGet(() -> {
                log.info("run {} has no live branches; respawning", run.runId());
                return branchCoordinator.spawn(run);
            });
        Duration timeout = Duration.ofSeconds(properties.getFanOut().getBarrierTimeoutSeconds());
        boolean complete;
        try {
            complete = collector.await(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for branches of run " + run.runId(), e);
        }
        if (!complete && collector.isCancelled()) {
            throw new BranchCancelledException("run " + run.runId() + " was cancelled while collecting");
        }
        if (!complete) {
            log.warn("run {} barrier timed out after {}s", run.runId(), timeout.toSeconds());
            collector.expireOutstanding(clock.instant());
        }
        branchCoordinator.release(run.runId());

        List<GapBranch> branches = new ArrayList<>(collector.snapshot());
        branches.sort(Comparator.comparing(GapBranch::gapId));
        long failed = branches.stream().filter(b -> b.status() == BranchStatus.FAILED).count();
        if (!branches.isEmpty() && failed == branches.size()) {
            String reasons = branches.stream()
                .map(b -> b.gapId() + "=" + b.errorCode())
                .collect(Collectors.joining(", "));
            throw new AllBranchesFailedException("all " + branches.size() + " branches failed: " + reasons);
        }
        MergedArtifact merged = merge(run.context().gaps(), branches);
        MergedArtifact artifact = merged.withMvpProjects(planProjects(run, merged));
        log.info("run {} merged {} branches ({} failed), {} project plans",
            run.runId(), branches.size(), failed, artifact.mvpProjects().size());
        return StepResult.advance(run.context().withArtifact(branches, artifact));
    }

    StepResult requestApproval(WorkflowRun run) {
        RunContext context = run.context();
        if (context.approvalMessageRef() != null) {
            return StepResult.suspend(context);
        }
        String summary = approvalSummary(context);
        String messageRef = idempotencyGuard
            .once(run.runId(), EFFECT_APPROVAL, String.class,
                () -> notificationClient.sendApprovalRequest(run.runId(), summary))
            .orElse(UNKNOWN_MESSAGE_REF);
        return StepResult.suspend(context.withApprovalRequested(messageRef));
    }

    StepResult applyEdits(WorkflowRun run) {
        RunContext context = run.context();
        String documentRef = context.input().documentRef();
        List<String> insertions = insertions(context);
        DocumentEditResult edit = idempotencyGuard
            .once(run.runId(), EFFECT_EDITS, DocumentEditResult.class,
                () -> documentRewriter.applyEdits(documentRef, insertions))
            .orElse(null);

        String updatedText = documentSource.fetchSourceText(documentRef);
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("sourceText", updatedText);
        inputs.put("targetSpec", context.targetSpecText());
        AlignmentScore finalScore = taskInvoker.invoke(TASK_SCORE, inputs, AlignmentScore.class);

        String completion = "final alignment score " + format(finalScore.score())
            + " (was " + (context.alignmentScore() == null ? "n/a" : format(context.alignmentScore().score())) + ")";
        idempotencyGuard.once(run.runId(), EFFECT_COMPLETION, String.class, () -> {
            notificationClient.sendCompletion(run.runId(), completion);
            return completion;
        });

        Finalization finalization = new Finalization(
            edit == null ? -1 : edit.revision(),
            edit == null ? 0 : edit.insertionsApplied(),
            finalScore.score(),
            clock.instant()
        );
        return StepResult.advance(context.withFinalization(finalization));
    }

    static MergedArtifact merge(List<Gap> gaps, List<GapBranch> branches) {
        Map<String, GapBranch> byGap = new LinkedHashMap<>();
        for (GapBranch branch : branches) {
            byGap.put(branch.gapId(), branch);
        }
        List<Gap> ordered = new ArrayList<>(gaps);
        ordered.sort(Comparator.comparing(Gap::gapId));
        List<GapSection> sections = new ArrayList<>();
        int succeeded = 0;
        int failed = 0;
        for (Gap gap : ordered) {
            GapBranch branch = byGap.get(gap.gapId());
            BranchStatus status = branch == null ? BranchStatus.FAILED : branch.status();
            List<GapResult> results = branch == null || branch.results() == null ? List.of() : branch.results();
            String note = null;
            if (status == BranchStatus.DONE) {
                succeeded++;
                if (results.isEmpty()) {
                    note = GapSection.NO_RESULTS;
                }
            } else {
                failed++;
                String reason = branch == null ? "missing" : branch.errorCode();
                note = GapSection.NO_RESULTS + " (" + reason + ")";
            }
            sections.add(new GapSection(gap.gapId(), gap.skill(), gap.query(), status, results, note));
        }
        String summary = sections.size() + " gaps researched, " + succeeded + " succeeded, " + failed + " failed";
        return new MergedArtifact(List.copyOf(sections), succeeded, failed, summary, List.of());
    }

    /**
     * Asks for project plans that combine several missing skills around the tutorials found. Best
     * effort: a failed task leaves the artifact without plans.
     */
    List<MvpProject> planProjects(WorkflowRun run, MergedArtifact artifact) {
        RunContext context = run.context();
        List<String> skills = context.gaps().stream()
            .map(Gap::skill)
            .filter(skill -> !GapPlanner.GENERAL_SKILL.equals(skill))
            .limit(MVP_SKILL_LIMIT)
            .toList();
        List<Map<String, Object>> catalog = new ArrayList<>();
        for (GapSection section : artifact.sections()) {
            for (GapResult result : section.results().stream().limit(MVP_TUTORIALS_PER_GAP).toList()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("skill", section.skill());
                entry.put("tutorialTitle", result.title());
                entry.put("tutorialUrl", result.url());
                entry.put("personalizationTip", result.personalizationTip());
                catalog.add(entry);
            }
        }
        if (skills.isEmpty() || catalog.isEmpty()) {
            log.info("run {} skipping project plans; nothing to combine", run.runId());
            return List.of();
        }
        Map<String, Object> inputs = baseInputs(context);
        inputs.put("missingSkills", skills);
        inputs.put("tutorialCatalog", catalog);
        try {
            MvpPlan plan = taskInvoker.invoke(TASK_MVP, inputs, MvpPlan.class);
            return plan == null ? List.of() : plan.mvpProjects();
        } catch (ReviewWorkflowException e) {
            log.warn("run {} project plans unavailable [{}]: {}", run.runId(), e.reasonCode(), e.getMessage());
            return List.of();
        }
    }

    private Map<String, Object> baseInputs(RunContext context) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("sourceText", context.sourceText());
        inputs.put("targetSpec", context.targetSpecText());
        return inputs;
    }

    private String approvalSummary(RunContext context) {
        StringBuilder summary = new StringBuilder();
        if (context.alignmentScore() != null) {
            summary.append("alignment score ").append(format(context.alignmentScore().score())).append("; ");
        }
        if (context.artifact() != null) {
            summary.append(context.artifact().summary());
            if (!context.artifact().mvpProjects().isEmpty()) {
                summary.append("; ").append(context.artifact().mvpProjects().size()).append(" project plans");
            }
        }
        return summary.toString();
    }

    private List<String> insertions(RunContext context) {
        List<String> lines = new ArrayList<>();
        if (context.plan() != null) {
            lines.addAll(context.plan().insertions());
        }
        if (context.artifact() != null) {
            for (GapSection section : context.artifact().sections()) {
                if (!section.results().isEmpty()) {
                    lines.add(section.results().get(0).personalizationTip());
                }
            }
            for (MvpProject project : context.artifact().mvpProjects()) {
                if (project.documentBlurb() != null && !project.documentBlurb().isBlank()) {
                    lines.add(project.documentBlurb().trim());
                }
            }
        }
        return lines;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
