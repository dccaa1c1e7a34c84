package com.delta.gapreview.config;

import com.delta.gapreview.quota.QuotaPeriod;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "review")
public class ReviewProperties {
    private static final String DEFAULT_USER_AGENT = "gap-review/0.1 (+contact)";

    private String userAgent;
    private Runs runs = new Runs();
    private FanOut fanOut = new FanOut();
    private Quota quota = new Quota();
    private Cache cache = new Cache();
    private Retry retry = new Retry();
    private Approval approval = new Approval();
    private Recovery recovery = new Recovery();
    private Ingestion ingestion = new Ingestion();
    private Ranking ranking = new Ranking();
    private Catalog catalog = new Catalog();
    private Tasks tasks = new Tasks();
    private Notification notification = new Notification();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public Runs getRuns() {
        return runs;
    }

    public void setRuns(Runs runs) {
        this.runs = runs;
    }

    public FanOut getFanOut() {
        return fanOut;
    }

    public void setFanOut(FanOut fanOut) {
        this.fanOut = fanOut;
    }

    public Quota getQuota() {
        return quota;
    }

    public void setQuota(Quota quota) {
        this.quota = quota;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Approval getApproval() {
        return approval;
    }

    public void setApproval(Approval approval) {
        this.approval = approval;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public void setIngestion(Ingestion ingestion) {
        this.ingestion = ingestion;
    }

    public Ranking getRanking() {
        return ranking;
    }

    public void setRanking(Ranking ranking) {
        this.ranking = ranking;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Tasks getTasks() {
        return tasks;
    }

    public void setTasks(Tasks tasks) {
        this.tasks = tasks;
    }

    public Notification getNotification() {
        return notification;
    }

    public void setNotification(Notification notification) {
        this.notification = notification;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Runs {
        private int executorThreads = 2;
        private int defaultListLimit = 50;
        private int maxListLimit = 200;

        public int getExecutorThreads() {
            return Math.max(1, executorThreads);
        }

        public void setExecutorThreads(int executorThreads) {
            this.executorThreads = Math.max(1, executorThreads);
        }

        public int getDefaultListLimit() {
            return Math.max(1, defaultListLimit);
        }

        public void setDefaultListLimit(int defaultListLimit) {
            this.defaultListLimit = Math.max(1, defaultListLimit);
        }

        public int getMaxListLimit() {
            return Math.max(getDefaultListLimit(), maxListLimit);
        }

        public void setMaxListLimit(int maxListLimit) {
            this.maxListLimit = Math.max(1, maxListLimit);
        }
    }

    public static class FanOut {
        public static final int MAX_GAP_IDS = 99;

        private int maxConcurrency = 4;
        private int maxGaps = 10;
        private int maxCandidatesPerQuery = 8;
        private int topResults = 3;
        private int barrierTimeoutSeconds = 300;
        private boolean tutorialAnalysisEnabled = true;

        public int getMaxConcurrency() {
            return Math.max(1, maxConcurrency);
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = Math.max(1, maxConcurrency);
        }

        /**
         * Gap ids are two-digit ({@code gap-01} .. {@code gap-99}) so they sort in analysis order.
         */
        public int getMaxGaps() {
            return Math.max(1, Math.min(maxGaps, MAX_GAP_IDS));
        }

        public void setMaxGaps(int maxGaps) {
            this.maxGaps = Math.max(1, Math.min(maxGaps, MAX_GAP_IDS));
        }

        public int getMaxCandidatesPerQuery() {
            return Math.max(1, Math.min(maxCandidatesPerQuery, 50));
        }

        public void setMaxCandidatesPerQuery(int maxCandidatesPerQuery) {
            this.maxCandidatesPerQuery = maxCandidatesPerQuery;
        }

        public int getTopResults() {
            return Math.max(1, topResults);
        }

        public void setTopResults(int topResults) {
            this.topResults = Math.max(1, topResults);
        }

        public int getBarrierTimeoutSeconds() {
            return Math.max(1, barrierTimeoutSeconds);
        }

        public void setBarrierTimeoutSeconds(int barrierTimeoutSeconds) {
            this.barrierTimeoutSeconds = Math.max(1, barrierTimeoutSeconds);
        }

        public boolean isTutorialAnalysisEnabled() {
            return tutorialAnalysisEnabled;
        }

        public void setTutorialAnalysisEnabled(boolean tutorialAnalysisEnabled) {
            this.tutorialAnalysisEnabled = tutorialAnalysisEnabled;
        }
    }

    public static class Quota {
        private String store = "jdbc";
        private QuotaPeriod period = QuotaPeriod.DAILY;
        private String zone = "UTC";
        private int defaultCeiling = 10000;
        private int defaultCost = 1;
        private Map<String, Integer> ceilings = new LinkedHashMap<>();
        private Map<String, Integer> costs = new LinkedHashMap<>();

        public String getStore() {
            return store == null || store.isBlank() ? "jdbc" : store.trim();
        }

        public void setStore(String store) {
            this.store = store;
        }

        public QuotaPeriod getPeriod() {
            return period == null ? QuotaPeriod.DAILY : period;
        }

        public void setPeriod(QuotaPeriod period) {
            this.period = period;
        }

        public String getZone() {
            return zone == null || zone.isBlank() ? "UTC" : zone.trim();
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public int getDefaultCeiling() {
            return Math.max(0, defaultCeiling);
        }

        public void setDefaultCeiling(int defaultCeiling) {
            this.defaultCeiling = Math.max(0, defaultCeiling);
        }

        public int getDefaultCost() {
            return Math.max(0, defaultCost);
        }

        public void setDefaultCost(int defaultCost) {
            this.defaultCost = Math.max(0, defaultCost);
        }

        public Map<String, Integer> getCeilings() {
            return ceilings;
        }

        public void setCeilings(Map<String, Integer> ceilings) {
            this.ceilings = ceilings == null ? new LinkedHashMap<>() : new LinkedHashMap<>(ceilings);
        }

        public Map<String, Integer> getCosts() {
            return costs;
        }

        public void setCosts(Map<String, Integer> costs) {
            this.costs = costs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(costs);
        }
    }

    public static class Cache {
        private int localMaxSize = 10000;
        private int searchTtlSeconds = 3600;
        private int detailsTtlSeconds = 2592000;
        private int durableMinTtlSeconds = 86400;
        private boolean durableEnabled = true;
        private boolean sharedEnabled = false;
        private String sharedKeyPrefix = "gapreview:cache:";

        public int getLocalMaxSize() {
            return Math.max(1, localMaxSize);
        }

        public void setLocalMaxSize(int localMaxSize) {
            this.localMaxSize = Math.max(1, localMaxSize);
        }

        public int getSearchTtlSeconds() {
            return Math.max(1, searchTtlSeconds);
        }

        public void setSearchTtlSeconds(int searchTtlSeconds) {
            this.searchTtlSeconds = Math.max(1, searchTtlSeconds);
        }

        public int getDetailsTtlSeconds() {
            return Math.max(1, detailsTtlSeconds);
        }

        public void setDetailsTtlSeconds(int detailsTtlSeconds) {
            this.detailsTtlSeconds = Math.max(1, detailsTtlSeconds);
        }

        public int getDurableMinTtlSeconds() {
            return Math.max(0, durableMinTtlSeconds);
        }

        public void setDurableMinTtlSeconds(int durableMinTtlSeconds) {
            this.durableMinTtlSeconds = Math.max(0, durableMinTtlSeconds);
        }

        public boolean isDurableEnabled() {
            return durableEnabled;
        }

        public void setDurableEnabled(boolean durableEnabled) {
            this.durableEnabled = durableEnabled;
        }

        public boolean isSharedEnabled() {
            return sharedEnabled;
        }

        public void setSharedEnabled(boolean sharedEnabled) {
            this.sharedEnabled = sharedEnabled;
        }

        public String getSharedKeyPrefix() {
            return sharedKeyPrefix == null ? "" : sharedKeyPrefix;
        }

        public void setSharedKeyPrefix(String sharedKeyPrefix) {
            this.sharedKeyPrefix = sharedKeyPrefix;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private int baseDelayMs = 500;
        private int maxDelayMs = 8000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Approval {
        private int staleAfterHours = 72;
        private boolean sweepEnabled = true;
        private int sweepIntervalSeconds = 900;

        public int getStaleAfterHours() {
            return Math.max(1, staleAfterHours);
        }

        public void setStaleAfterHours(int staleAfterHours) {
            this.staleAfterHours = Math.max(1, staleAfterHours);
        }

        public boolean isSweepEnabled() {
            return sweepEnabled;
        }

        public void setSweepEnabled(boolean sweepEnabled) {
            this.sweepEnabled = sweepEnabled;
        }

        public int getSweepIntervalSeconds() {
            return Math.max(1, sweepIntervalSeconds);
        }

        public void setSweepIntervalSeconds(int sweepIntervalSeconds) {
            this.sweepIntervalSeconds = Math.max(1, sweepIntervalSeconds);
        }
    }

    public static class Recovery {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Ingestion {
        private int maxSourceChars = 200000;
        private int maxTargetSpecChars = 100000;
        private int fetchTimeoutSeconds = 20;

        public int getMaxSourceChars() {
            return Math.max(1, maxSourceChars);
        }

        public void setMaxSourceChars(int maxSourceChars) {
            this.maxSourceChars = Math.max(1, maxSourceChars);
        }

        public int getMaxTargetSpecChars() {
            return Math.max(1, maxTargetSpecChars);
        }

        public void setMaxTargetSpecChars(int maxTargetSpecChars) {
            this.maxTargetSpecChars = Math.max(1, maxTargetSpecChars);
        }

        public int getFetchTimeoutSeconds() {
            return Math.max(1, fetchTimeoutSeconds);
        }

        public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) {
            this.fetchTimeoutSeconds = Math.max(1, fetchTimeoutSeconds);
        }
    }

    public static class Ranking {
        private double confidenceZ = 1.96;
        private double priorRatio = 0.04;
        private double priorWeight = 500.0;
        private double qualityWeight = 1.0;
        private double velocityWeight = 0.15;
        private int recencyThresholdDays = 1095;
        private int recencyHalfLifeDays = 1460;
        private double recencyFloor = 0.3;
        private int minDurationSeconds = 900;
        private int idealDurationSeconds = 5400;
        private int durationSpanSeconds = 4200;
        private double durationBase = 0.95;
        private double durationBonus = 0.15;
        private double keywordBonusPerHit = 0.02;
        private double keywordBonusCap = 0.12;
        private double phraseBonusPerHit = 0.05;
        private double phraseBonusCap = 0.10;
        private double topicBonus = 0.10;
        private double comparisonPenalty = 0.05;
        private double minBoost = 0.5;
        private double maxBoost = 2.0;
        private List<String> keywords = new ArrayList<>(List.of(
            "tutorial",
            "course",
            "project",
            "hands-on",
            "beginner",
            "full course",
            "end to end",
            "from scratch",
            "hands on",
            "for beginners"
        ));

        public double getConfidenceZ() {
            return confidenceZ > 0 ? confidenceZ : 1.96;
        }

        public void setConfidenceZ(double confidenceZ) {
            this.confidenceZ = confidenceZ;
        }

        public double getPriorRatio() {
            return Math.max(0.0, Math.min(1.0, priorRatio));
        }

        public void setPriorRatio(double priorRatio) {
            this.priorRatio = priorRatio;
        }

        public double getPriorWeight() {
            return Math.max(0.0, priorWeight);
        }

        public void setPriorWeight(double priorWeight) {
            this.priorWeight = priorWeight;
        }

        public double getQualityWeight() {
            return Math.max(0.0, qualityWeight);
        }

        public void setQualityWeight(double qualityWeight) {
            this.qualityWeight = qualityWeight;
        }

        public double getVelocityWeight() {
            return Math.max(0.0, velocityWeight);
        }

        public void setVelocityWeight(double velocityWeight) {
            this.velocityWeight = velocityWeight;
        }

        public int getRecencyThresholdDays() {
            return Math.max(0, recencyThresholdDays);
        }

        public void setRecencyThresholdDays(int recencyThresholdDays) {
            this.recencyThresholdDays = recencyThresholdDays;
        }

        public int getRecencyHalfLifeDays() {
            return Math.max(1, recencyHalfLifeDays);
        }

        public void setRecencyHalfLifeDays(int recencyHalfLifeDays) {
            this.recencyHalfLifeDays = recencyHalfLifeDays;
        }

        public double getRecencyFloor() {
            return Math.max(0.01, Math.min(1.0, recencyFloor));
        }

        public void setRecencyFloor(double recencyFloor) {
            this.recencyFloor = recencyFloor;
        }

        public int getMinDurationSeconds() {
            return Math.max(0, minDurationSeconds);
        }

        public void setMinDurationSeconds(int minDurationSeconds) {
            this.minDurationSeconds = minDurationSeconds;
        }

        public int getIdealDurationSeconds() {
            return Math.max(1, idealDurationSeconds);
        }

        public void setIdealDurationSeconds(int idealDurationSeconds) {
            this.idealDurationSeconds = idealDurationSeconds;
        }

        public int getDurationSpanSeconds() {
            return Math.max(1, durationSpanSeconds);
        }

        public void setDurationSpanSeconds(int durationSpanSeconds) {
            this.durationSpanSeconds = durationSpanSeconds;
        }

        public double getDurationBase() {
            return durationBase > 0 ? durationBase : 1.0;
        }

        public void setDurationBase(double durationBase) {
            this.durationBase = durationBase;
        }

        public double getDurationBonus() {
            return Math.max(0.0, durationBonus);
        }

        public void setDurationBonus(double durationBonus) {
            this.durationBonus = durationBonus;
        }

        public double getKeywordBonusPerHit() {
            return Math.max(0.0, keywordBonusPerHit);
        }

        public void setKeywordBonusPerHit(double keywordBonusPerHit) {
            this.keywordBonusPerHit = keywordBonusPerHit;
        }

        public double getKeywordBonusCap() {
            return Math.max(0.0, keywordBonusCap);
        }

        public void setKeywordBonusCap(double keywordBonusCap) {
            this.keywordBonusCap = keywordBonusCap;
        }

        public double getPhraseBonusPerHit() {
            return Math.max(0.0, phraseBonusPerHit);
        }

        public void setPhraseBonusPerHit(double phraseBonusPerHit) {
            this.phraseBonusPerHit = phraseBonusPerHit;
        }

        public double getPhraseBonusCap() {
            return Math.max(0.0, phraseBonusCap);
        }

        public void setPhraseBonusCap(double phraseBonusCap) {
            this.phraseBonusCap = phraseBonusCap;
        }

        public double getTopicBonus() {
            return Math.max(0.0, topicBonus);
        }

        public void setTopicBonus(double topicBonus) {
            this.topicBonus = topicBonus;
        }

        public double getComparisonPenalty() {
            return Math.max(0.0, comparisonPenalty);
        }

        public void setComparisonPenalty(double comparisonPenalty) {
            this.comparisonPenalty = comparisonPenalty;
        }

        public double getMinBoost() {
            return minBoost > 0 ? minBoost : 0.5;
        }

        public void setMinBoost(double minBoost) {
            this.minBoost = minBoost;
        }

        public double getMaxBoost() {
            return Math.max(getMinBoost(), maxBoost);
        }

        public void setMaxBoost(double maxBoost) {
            this.maxBoost = maxBoost;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords == null ? new ArrayList<>() : new ArrayList<>(keywords);
        }
    }

    public static class Catalog {
        private String baseUrl = "https://www.googleapis.com/youtube/v3";
        private String apiKey;
        private String resourceName = "video-catalog";
        private int requestTimeoutSeconds = 20;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getResourceName() {
            return resourceName == null || resourceName.isBlank() ? "video-catalog" : resourceName.trim();
        }

        public void setResourceName(String resourceName) {
            this.resourceName = resourceName;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Tasks {
        private String baseUrl = "http://localhost:8090";
        private String apiKey;
        private int requestTimeoutSeconds = 60;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }
    }

    public static class Notification {
        private String reviewBaseUrl = "http://localhost:8001/review";

        public String getReviewBaseUrl() {
            return reviewBaseUrl;
        }

        public void setReviewBaseUrl(String reviewBaseUrl) {
            this.reviewBaseUrl = reviewBaseUrl;
        }
    }
}
