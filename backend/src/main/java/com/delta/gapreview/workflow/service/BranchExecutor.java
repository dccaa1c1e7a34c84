package com.delta.gapreview.workflow.service;

import com.delta.gapreview.cache.CacheKey;
import com.delta.gapreview.cache.ResultCache;
import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.error.QuotaExhaustedException;
import com.delta.gapreview.error.ReviewWorkflowException;
import com.delta.gapreview.quota.QuotaLedger;
import com.delta.gapreview.quota.QuotaPolicy;
import com.delta.gapreview.ranking.Candidate;
import com.delta.gapreview.ranking.RankedCandidate;
import com.delta.gapreview.ranking.RankingEngine;
import com.delta.gapreview.ranking.RankingPreferences;
import com.delta.gapreview.source.CandidateSourceClient;
import com.delta.gapreview.source.RawCatalogItem;
import com.delta.gapreview.workflow.model.Gap;
import com.delta.gapreview.workflow.model.GapResult;
import com.delta.gapreview.workflow.model.TutorialAnalysis;
import com.fasterxml.jackson.databind.JavaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One gap's research: search, fetch details, rank, enrich. Every catalog call goes through the
 * result cache first and the quota ledger second; a cache hit never consumes quota. Tutorial
 * analysis is best effort and falls back to the catalog description.
 */
@Component
public class BranchExecutor {
    private static final Logger log = LoggerFactory.getLogger(BranchExecutor.class);
    static final String SEARCH = "search";
    static final String DETAILS = "details";
    static final String TASK_TUTORIAL = "analyze_tutorial";
    private static final String ANALYSIS_NAMESPACE = "tutorial-analysis";
    private static final int DETAILS_BATCH = 50;
    private static final int SUMMARY_CHARS = 280;

    private final CandidateSourceClient source;
    private final QuotaLedger quotaLedger;
    private final QuotaPolicy quotaPolicy;
    private final ResultCache cache;
    private final RankingEngine rankingEngine;
    private final RetryPolicy retryPolicy;
    private final StructuredTaskInvoker taskInvoker;
    private final ReviewProperties properties;

    public BranchExecutor(
        CandidateSourceClient source,
        QuotaLedger quotaLedger,
        QuotaPolicy quotaPolicy,
        ResultCache cache,
        RankingEngine rankingEngine,
        RetryPolicy retryPolicy,
        StructuredTaskInvoker taskInvoker,
        ReviewProperties properties
    ) {
        this.source = source;
        this.quotaLedger = quotaLedger;
        this.quotaPolicy = quotaPolicy;
        this.cache = cache;
        this.rankingEngine = rankingEngine;
        this.retryPolicy = retryPolicy;
        this.taskInvoker = taskInvoker;
        this.properties = properties;
    }

    public List<GapResult> execute(Gap gap, BranchContext context) {
        checkCancelled(context);
        List<RawCatalogItem> listing = search(gap.query(), context);
        if (listing.isEmpty()) {
            log.info("No candidates for gap {} query={}", gap.gapId(), gap.query());
            return List.of();
        }
        Map<String, RawCatalogItem> details = details(listing, context);

        List<Candidate> candidates = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (RawCatalogItem item : listing) {
            if (!seen.add(item.id())) {
                continue;
            }
            RawCatalogItem detail = details.get(item.id());
            RawCatalogItem merged = detail == null ? item : detail.mergeListing(item);
            candidates.add(merged.toCandidate());
        }

        checkCancelled(context);
        RankingPreferences preferences = new RankingPreferences(
            context.sourceBoosts(),
            gap.skill(),
            context.referenceTime(),
            properties.getFanOut().getTopResults()
        );
        List<RankedCandidate> ranked = rankingEngine.rank(candidates, preferences);
        log.info("Gap {} ranked {} of {} candidates", gap.gapId(), ranked.size(), candidates.size());
        return ranked.stream().map(r -> enrich(gap, r)).toList();
    }

    private List<RawCatalogItem> search(String query, BranchContext context) {
        int maxResults = properties.getFanOut().getMaxCandidatesPerQuery();
        CacheKey key = CacheKey.of(SEARCH + ":" + source.resourceName(), query, Map.of("max", maxResults));
        JavaType listType = cache.listType(RawCatalogItem.class);
        Optional<List<RawCatalogItem>> cached = cache.getJson(key, listType);
        if (cached.isPresent()) {
            log.debug("Search cache hit {}", key.value());
            return cached.get();
        }
        List<RawCatalogItem> items = retryPolicy.execute("search " + query, () -> {
            checkCancelled(context);
            consume(SEARCH);
            return source.search(query, maxResults);
        });
        List<RawCatalogItem> safe = items == null ? List.of() : List.copyOf(items);
        cache.setJson(key, safe, Duration.ofSeconds(properties.getCache().getSearchTtlSeconds()));
        return safe;
    }

    private Map<String, RawCatalogItem> details(List<RawCatalogItem> listing, BranchContext context) {
        Map<String, RawCatalogItem> found = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (RawCatalogItem item : listing) {
            if (item.id() == null || found.containsKey(item.id()) || missing.contains(item.id())) {
                continue;
            }
            Optional<RawCatalogItem> cached = cache.getJson(detailKey(item.id()), cache.typeFor(RawCatalogItem.class));
            if (cached.isPresent()) {
                found.put(item.id(), cached.get());
            } else {
                missing.add(item.id());
            }
        }
        Duration ttl = Duration.ofSeconds(properties.getCache().getDetailsTtlSeconds());
        for (int start = 0; start < missing.size(); start += DETAILS_BATCH) {
            List<String> batch = missing.subList(start, Math.min(missing.size(), start + DETAILS_BATCH));
            List<RawCatalogItem> fetched = retryPolicy.execute("details", () -> {
                checkCancelled(context);
                consume(DETAILS);
                return source.fetchDetails(batch);
            });
            if (fetched == null) {
                continue;
            }
            for (RawCatalogItem item : fetched) {
                if (item == null || item.id() == null) {
                    continue;
                }
                found.put(item.id(), item);
                cache.setJson(detailKey(item.id()), item, ttl);
            }
        }
        return found;
    }

    private CacheKey detailKey(String itemId) {
        return CacheKey.of(DETAILS + ":" + source.resourceName(), itemId);
    }

    private void consume(String operation) {
        String resource = source.resourceName();
        long cost = quotaPolicy.costOf(resource, operation);
        if (!quotaLedger.tryConsume(resource, cost)) {
            throw new QuotaExhaustedException(
                resource,
                "quota exhausted for " + resource + " " + operation + " (" + cost + " units)"
            );
        }
    }

    private void checkCancelled(BranchContext context) {
        if (context.cancelled() != null && context.cancelled().getAsBoolean()) {
            throw new BranchCancelledException("run " + context.runId() + " was cancelled");
        }
    }

    private GapResult enrich(Gap gap, RankedCandidate ranked) {
        Candidate candidate = ranked.candidate();
        String sourceName = candidate.sourceName() == null ? "the source" : candidate.sourceName();
        String tip = "Build a highlight around " + gap.skill() + " referencing " + sourceName
            + "; cite metrics from the tutorial to prove hands-on experience.";
        TutorialAnalysis analysis = analyze(gap, candidate);
        return new GapResult(
            ranked.rank(),
            ranked.score(),
            candidate.id(),
            candidate.title(),
            candidate.sourceName(),
            candidate.url(),
            candidate.durationSeconds(),
            candidate.publishedAt(),
            analysis == null ? null : analysis.summary(),
            tip,
            analysis
        );
    }

    private TutorialAnalysis analyze(Gap gap, Candidate candidate) {
        TutorialAnalysis fallback = TutorialAnalysis.fromMetadata(candidate.description(), SUMMARY_CHARS);
        if (!properties.getFanOut().isTutorialAnalysisEnabled()) {
            return fallback;
        }
        CacheKey key = CacheKey.of(ANALYSIS_NAMESPACE + ":" + source.resourceName(), candidate.id());
        Optional<TutorialAnalysis> cached = cache.getJson(key, cache.typeFor(TutorialAnalysis.class));
        if (cached.isPresent()) {
            return cached.get();
        }
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("url", candidate.url());
        inputs.put("title", candidate.title());
        inputs.put("description", candidate.description());
        inputs.put("skill", gap.skill());
        TutorialAnalysis analysis;
        try {
            analysis = taskInvoker.invoke(TASK_TUTORIAL, inputs, TutorialAnalysis.class);
        } catch (BranchCancelledException e) {
            throw e;
        } catch (ReviewWorkflowException e) {
            log.warn("Tutorial analysis for {} failed [{}]; using catalog metadata", candidate.id(), e.reasonCode());
            return fallback;
        }
        if (analysis == null) {
            return fallback;
        }
        cache.setJson(key, analysis, Duration.ofSeconds(properties.getCache().getDetailsTtlSeconds()));
        return analysis;
    }
}
