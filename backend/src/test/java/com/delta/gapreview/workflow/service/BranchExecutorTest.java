package com.delta.gapreview.workflow.service;

import com.delta.gapreview.cache.LocalCacheTier;
import com.delta.gapreview.cache.ResultCache;
import com.delta.gapreview.collab.StructuredTaskClient;
import com.delta.gapreview.config.ReviewConfig;
import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.QuotaExhaustedException;
import com.delta.gapreview.error.SchemaViolationException;
import com.delta.gapreview.error.UpstreamUnavailableException;
import com.delta.gapreview.quota.InMemoryQuotaLedger;
import com.delta.gapreview.quota.QuotaPolicy;
import com.delta.gapreview.ranking.RankingEngine;
import com.delta.gapreview.ranking.RankingWeights;
import com.delta.gapreview.source.CandidateSourceClient;
import com.delta.gapreview.source.RawCatalogItem;
import com.delta.gapreview.support.MutableClock;
import com.delta.gapreview.workflow.model.Gap;
import com.delta.gapreview.workflow.model.GapResult;
import com.delta.gapreview.workflow.model.TutorialAnalysis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BranchExecutorTest {
    private static final Instant CREATED = Instant.parse("2024-06-01T00:00:00Z");
    private static final Gap GAP = new Gap("gap-01", "Kubernetes", "Kubernetes tutorial project for SRE");

    @Mock
    private CandidateSourceClient source;

    @Mock
    private StructuredTaskClient tasks;

    private final MutableClock clock = new MutableClock(CREATED);
    private ReviewProperties properties;
    private InMemoryQuotaLedger ledger;
    private BranchExecutor executor;

    @BeforeEach
    void setUp() {
        properties = new ReviewProperties();
        properties.getRetry().setBaseDelayMs(0);
        properties.getFanOut().setTopResults(2);
        properties.getQuota().setCosts(Map.of("search", 100, "details", 1));
        properties.getQuota().setCeilings(Map.of("catalog", 1000));
        lenient().when(source.resourceName()).thenReturn("catalog");

        QuotaPolicy policy = new QuotaPolicy(properties, clock);
        ledger = new InMemoryQuotaLedger(policy);
        ResultCache cache = new ResultCache(
            List.of(new LocalCacheTier(properties, clock)), clock, new ReviewConfig().objectMapper());
        executor = new BranchExecutor(
            source,
            ledger,
            policy,
            cache,
            new RankingEngine(RankingWeights.defaults()),
            new RetryPolicy(properties),
            new StructuredTaskInvoker(tasks, new RetryPolicy(properties)),
            properties
        );
    }

    @Test
    void ranksDetailedCandidatesAndAddsTips() {
        when(source.search(anyString(), anyInt())).thenReturn(List.of(listing("a"), listing("b"), listing("c")));
        when(source.fetchDetails(anyList())).thenReturn(List.of(
            detail("a", 100, 10_000),
            detail("b", 900, 10_000),
            detail("c", 10, 10_000)
        ));

        List<GapResult> results = executor.execute(GAP, context(false));

        assertThat(results).extracting(GapResult::itemId).containsExactly("b", "a");
        assertThat(results).extracting(GapResult::rank).containsExactly(1, 2);
        assertThat(results.get(0).personalizationTip())
            .isEqualTo("Build a highlight around Kubernetes referencing Channel b; "
                + "cite metrics from the tutorial to prove hands-on experience.");
        assertThat(results.get(0).url()).isEqualTo("https://video.test/b");
        assertThat(ledger.snapshot("catalog").consumed()).isEqualTo(101);
    }

    @Test
    void cachedLookupsConsumeNoQuota() {
        when(source.search(anyString(), anyInt())).thenReturn(List.of(listing("a")));
        when(source.fetchDetails(anyList())).thenReturn(List.of(detail("a", 100, 10_000)));

        List<GapResult> first = executor.execute(GAP, context(false));
        List<GapResult> second = executor.execute(
            new Gap("gap-02", "Kubernetes", "project Kubernetes  tutorial for SRE"), context(false));

        assertThat(second).isEqualTo(first);
        verify(source, times(1)).search(anyString(), anyInt());
        verify(source, times(1)).fetchDetails(anyList());
        assertThat(ledger.snapshot("catalog").consumed()).isEqualTo(101);
    }

    @Test
    void exhaustedQuotaBlocksTheCall() {
        properties.getQuota().setCeilings(Map.of("catalog", 50));

        assertThatThrownBy(() -> executor.execute(GAP, context(false)))
            .isInstanceOf(QuotaExhaustedException.class);
        verify(source, never()).search(anyString(), anyInt());
    }

    @Test
    void eachRetryConsumesQuota() {
        when(source.search(anyString(), anyInt()))
            .thenThrow(new UpstreamUnavailableException("503", true))
            .thenReturn(List.of());

        assertThat(executor.execute(GAP, context(false))).isEmpty();
        assertThat(ledger.snapshot("catalog").consumed()).isEqualTo(200);
        verify(source, never()).fetchDetails(anyList());
    }

    @Test
    void cancelledBranchStopsBeforeAnyCall() {
        assertThatThrownBy(() -> executor.execute(GAP, context(true)))
            .isInstanceOf(BranchCancelledException.class);
        verify(source, never()).search(anyString(), anyInt());
        assertThat(ledger.snapshot("catalog").consumed()).isZero();
    }

    @Test
    void tutorialAnalysisIsAttachedAndCachedPerItem() {
        TutorialAnalysis analysis = new TutorialAnalysis(
            "Deploys a service to a kind cluster", List.of("pods", "helm charts"), "intermediate",
            List.of("docker"), List.of("ship a chart"));
        when(source.search(anyString(), anyInt())).thenReturn(List.of(listing("a")));
        when(source.fetchDetails(anyList())).thenReturn(List.of(detail("a", 100, 10_000)));
        when(tasks.invoke(eq(BranchExecutor.TASK_TUTORIAL), anyMap(), eq(TutorialAnalysis.class)))
            .thenReturn(analysis);

        GapResult first = executor.execute(GAP, context(false)).get(0);
        GapResult second = executor.execute(new Gap("gap-02", "Kubernetes", "helm tutorial"), context(false)).get(0);

        assertThat(first.analysis()).isEqualTo(analysis);
        assertThat(first.summary()).isEqualTo("Deploys a service to a kind cluster");
        assertThat(second.analysis()).isEqualTo(analysis);
        verify(tasks, times(1)).invoke(eq(BranchExecutor.TASK_TUTORIAL), anyMap(), eq(TutorialAnalysis.class));
    }

    @Test
    void failedTutorialAnalysisFallsBackToDescription() {
        when(source.search(anyString(), anyInt())).thenReturn(List.of(listing("a")));
        when(source.fetchDetails(anyList())).thenReturn(List.of(detail("a", 100, 10_000)));
        when(tasks.invoke(eq(BranchExecutor.TASK_TUTORIAL), anyMap(), eq(TutorialAnalysis.class)))
            .thenThrow(new SchemaViolationException("summary missing"));

        GapResult result = executor.execute(GAP, context(false)).get(0);

        assertThat(result.summary()).isEqualTo("Learn k8s");
        assertThat(result.analysis().keyPoints()).isEmpty();
        verify(tasks, times(2)).invoke(eq(BranchExecutor.TASK_TUTORIAL), anyMap(), eq(TutorialAnalysis.class));
    }

    @Test
    void disabledTutorialAnalysisNeverCallsTheTask() {
        properties.getFanOut().setTutorialAnalysisEnabled(false);
        when(source.search(anyString(), anyInt())).thenReturn(List.of(listing("a")));
        when(source.fetchDetails(anyList())).thenReturn(List.of(detail("a", 100, 10_000)));

        GapResult result = executor.execute(GAP, context(false)).get(0);

        assertThat(result.summary()).isEqualTo("Learn k8s");
        verify(tasks, never()).invoke(anyString(), anyMap(), eq(TutorialAnalysis.class));
    }

    private static BranchContext context(boolean cancelled) {
        return new BranchContext("run-1", CREATED, Map.of(), () -> cancelled);
    }

    private static RawCatalogItem listing(String id) {
        return new RawCatalogItem(id, "Kubernetes tutorial " + id, "Learn k8s", "Channel " + id, "ch-" + id,
            CREATED.minusSeconds(86_400L * 30), null, null, null, null, "https://video.test/" + id);
    }

    private static RawCatalogItem detail(String id, long likes, long views) {
        return new RawCatalogItem(id, null, null, null, null, null, "PT45M", views, likes, 3L, null);
    }
}
