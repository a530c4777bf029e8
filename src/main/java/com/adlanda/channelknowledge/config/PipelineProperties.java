package com.adlanda.channelknowledge.config;

import com.adlanda.channelknowledge.model.Tier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the ingestion and retrieval pipeline.
 *
 * Maps to properties prefixed with 'pipeline' in application.properties.
 * Invalid values fail application startup.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * Minimum quality score a post needs to be indexed.
     */
    @DecimalMin("0.0")
    @DecimalMax("10.0")
    private double ingestionThreshold = 7.0;

    /**
     * Poll interval per tier. Tiers missing here fall back to their defaults.
     */
    private Map<Tier, Duration> pollIntervalsByTier = new EnumMap<>(Tier.class);

    /**
     * Days until a post expires, keyed by index category.
     */
    private Map<String, Integer> expiryDaysByCategory = defaultExpiryDays();

    /**
     * Expiry used for categories missing from expiryDaysByCategory.
     */
    @Min(1)
    private int defaultExpiryDays = 120;

    /**
     * Maps a channel's style category onto an index category.
     */
    private Map<String, String> categoryMapping = defaultCategoryMapping();

    @NotBlank
    private String defaultCategory = "training";

    /**
     * Failed indexing attempts after which a post is parked as INDEX_FAILED.
     */
    @Min(1)
    private int maxIndexAttempts = 5;

    @Valid
    private final Scheduler scheduler = new Scheduler();

    @Valid
    private final Fetch fetch = new Fetch();

    @Valid
    private final Scoring scoring = new Scoring();

    @Valid
    private final Chunk chunk = new Chunk();

    @Valid
    private final Search search = new Search();

    @Valid
    private final Index index = new Index();

    @Valid
    private final MaxBatchPerTick maxBatchPerTick = new MaxBatchPerTick();

    @Valid
    private final Retrieval retrieval = new Retrieval();

    @Valid
    private final Source source = new Source();

    @Valid
    private final KnowledgeBase knowledgeBase = new KnowledgeBase();

    /**
     * Channels registered at startup when not yet known.
     */
    @Valid
    private List<ChannelSeed> channels = new ArrayList<>();

    public Duration intervalFor(Tier tier) {
        Duration configured = pollIntervalsByTier.get(tier);
        return configured != null ? configured : tier.defaultInterval();
    }

    public int expiryDaysFor(String category) {
        Integer days = category == null ? null : expiryDaysByCategory.get(category);
        return days != null ? days : defaultExpiryDays;
    }

    @AssertTrue(message = "poll intervals must be positive")
    public boolean isPollIntervalsPositive() {
        return pollIntervalsByTier.values().stream().allMatch(d -> d != null && !d.isNegative() && !d.isZero());
    }

    @AssertTrue(message = "expiry days must be positive")
    public boolean isExpiryDaysPositive() {
        return expiryDaysByCategory.values().stream().allMatch(d -> d != null && d > 0);
    }

    private static Map<String, Integer> defaultExpiryDays() {
        Map<String, Integer> days = new LinkedHashMap<>();
        days.put("products", 90);
        days.put("motivation", 180);
        days.put("business", 120);
        days.put("success_stories", 365);
        days.put("training", 120);
        days.put("news", 30);
        days.put("promo", 14);
        return days;
    }

    private static Map<String, String> defaultCategoryMapping() {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("motivation", "motivation");
        mapping.put("product", "products");
        mapping.put("business", "business");
        mapping.put("lifestyle", "success_stories");
        mapping.put("general", "training");
        mapping.put("training", "training");
        mapping.put("news", "news");
        mapping.put("success_stories", "success_stories");
        return mapping;
    }

    public double getIngestionThreshold() {
        return ingestionThreshold;
    }

    public void setIngestionThreshold(double ingestionThreshold) {
        this.ingestionThreshold = ingestionThreshold;
    }

    public int getMaxIndexAttempts() {
        return maxIndexAttempts;
    }

    public void setMaxIndexAttempts(int maxIndexAttempts) {
        this.maxIndexAttempts = maxIndexAttempts;
    }

    public Map<Tier, Duration> getPollIntervalsByTier() {
        return pollIntervalsByTier;
    }

    public void setPollIntervalsByTier(Map<Tier, Duration> pollIntervalsByTier) {
        this.pollIntervalsByTier = pollIntervalsByTier;
    }

    public Map<String, Integer> getExpiryDaysByCategory() {
        return expiryDaysByCategory;
    }

    public void setExpiryDaysByCategory(Map<String, Integer> expiryDaysByCategory) {
        this.expiryDaysByCategory = expiryDaysByCategory;
    }

    public int getDefaultExpiryDays() {
        return defaultExpiryDays;
    }

    public void setDefaultExpiryDays(int defaultExpiryDays) {
        this.defaultExpiryDays = defaultExpiryDays;
    }

    public Map<String, String> getCategoryMapping() {
        return categoryMapping;
    }

    public void setCategoryMapping(Map<String, String> categoryMapping) {
        this.categoryMapping = categoryMapping;
    }

    public String getDefaultCategory() {
        return defaultCategory;
    }

    public void setDefaultCategory(String defaultCategory) {
        this.defaultCategory = defaultCategory;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public Chunk getChunk() {
        return chunk;
    }

    public Search getSearch() {
        return search;
    }

    public Index getIndex() {
        return index;
    }

    public MaxBatchPerTick getMaxBatchPerTick() {
        return maxBatchPerTick;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Source getSource() {
        return source;
    }

    public KnowledgeBase getKnowledgeBase() {
        return knowledgeBase;
    }

    public List<ChannelSeed> getChannels() {
        return channels;
    }

    public void setChannels(List<ChannelSeed> channels) {
        this.channels = channels;
    }

    /**
     * The background sync loop.
     */
    public static class Scheduler {

        private boolean enabled = true;

        @NotNull
        private Duration tickInterval = Duration.ofSeconds(30);

        @NotNull
        private Duration initialDelay = Duration.ofSeconds(5);

        /**
         * Run expiry and channel statistics every N ticks.
         */
        @Min(1)
        private int housekeepingEveryTicks = 10;

        @NotNull
        private Duration shutdownGrace = Duration.ofSeconds(20);

        @Min(1)
        @Max(64)
        private int workerThreads = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public int getHousekeepingEveryTicks() {
            return housekeepingEveryTicks;
        }

        public void setHousekeepingEveryTicks(int housekeepingEveryTicks) {
            this.housekeepingEveryTicks = housekeepingEveryTicks;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    public static class Fetch {

        /**
         * Maximum posts requested per poll.
         */
        @Min(1)
        @Max(500)
        private int limit = 50;

        /**
         * Posts older than this are never fetched.
         */
        @Min(1)
        private int lookbackDays = 30;

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public int getLookbackDays() {
            return lookbackDays;
        }

        public void setLookbackDays(int lookbackDays) {
            this.lookbackDays = lookbackDays;
        }
    }

    public static class Scoring {

        /**
         * Posts below this view count get a zero views sub-score.
         */
        @Min(0)
        private int minViews = 500;

        @NotNull
        private Duration averageViewsTtl = Duration.ofHours(1);

        public int getMinViews() {
            return minViews;
        }

        public void setMinViews(int minViews) {
            this.minViews = minViews;
        }

        public Duration getAverageViewsTtl() {
            return averageViewsTtl;
        }

        public void setAverageViewsTtl(Duration averageViewsTtl) {
            this.averageViewsTtl = averageViewsTtl;
        }
    }

    public static class Chunk {

        @Min(100)
        private int maxSize = 2000;

        @Min(0)
        private int overlap = 300;

        @AssertTrue(message = "chunk overlap must be smaller than chunk max-size")
        public boolean isOverlapSmallerThanMaxSize() {
            return overlap < maxSize;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    public static class Search {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minSimilarity = 0.4;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double freshnessBonusCap = 0.1;

        /**
         * Age at which the freshness bonus reaches zero.
         */
        @Min(1)
        private int freshnessHorizonDays = 365;

        public double getMinSimilarity() {
            return minSimilarity;
        }

        public void setMinSimilarity(double minSimilarity) {
            this.minSimilarity = minSimilarity;
        }

        public double getFreshnessBonusCap() {
            return freshnessBonusCap;
        }

        public void setFreshnessBonusCap(double freshnessBonusCap) {
            this.freshnessBonusCap = freshnessBonusCap;
        }

        public int getFreshnessHorizonDays() {
            return freshnessHorizonDays;
        }

        public void setFreshnessHorizonDays(int freshnessHorizonDays) {
            this.freshnessHorizonDays = freshnessHorizonDays;
        }
    }

    public static class Index {

        /**
         * Backing store: "pgvector" or "memory".
         */
        @NotBlank
        private String store = "pgvector";

        @Min(1)
        @Max(16000)
        private int dimensions = 1536;

        private boolean initializeSchema = true;

        @NotBlank
        private String tableName = "index_entries";

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }

        public boolean isInitializeSchema() {
            return initializeSchema;
        }

        public void setInitializeSchema(boolean initializeSchema) {
            this.initializeSchema = initializeSchema;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }
    }

    public static class MaxBatchPerTick {

        @Min(1)
        private int score = 100;

        @Min(1)
        private int sync = 20;

        public int getScore() {
            return score;
        }

        public void setScore(int score) {
            this.score = score;
        }

        public int getSync() {
            return sync;
        }

        public void setSync(int sync) {
            this.sync = sync;
        }
    }

    public static class Retrieval {

        /**
         * Regular expressions for snippets never handed to the consumer.
         * Empty means the built-in list.
         */
        private List<String> denylistPatterns = new ArrayList<>();

        public List<String> getDenylistPatterns() {
            return denylistPatterns;
        }

        public void setDenylistPatterns(List<String> denylistPatterns) {
            this.denylistPatterns = denylistPatterns;
        }
    }

    /**
     * HTTP bridge exposing channel history. Fetching is skipped when no base URL is set.
     */
    public static class Source {

        private String baseUrl;

        private String apiToken;

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class KnowledgeBase {

        /**
         * Whether curated documents are loaded at startup.
         */
        private boolean enabled = true;

        /**
         * Skip files whose content hash has not changed since the last load.
         */
        private boolean incremental = true;

        @NotBlank
        private String path = "./knowledge_base";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isIncremental() {
            return incremental;
        }

        public void setIncremental(boolean incremental) {
            this.incremental = incremental;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class ChannelSeed {

        @Min(1)
        private long channelId;

        private String username;

        private String title;

        @Min(1)
        @Max(10)
        private int priority = 5;

        private String styleCategory = "general";

        public long getChannelId() {
            return channelId;
        }

        public void setChannelId(long channelId) {
            this.channelId = channelId;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        public String getStyleCategory() {
            return styleCategory;
        }

        public void setStyleCategory(String styleCategory) {
            this.styleCategory = styleCategory;
        }
    }
}
