package com.adlanda.channelknowledge.config;

import com.adlanda.channelknowledge.repository.FreshnessRanker;
import com.adlanda.channelknowledge.repository.InMemoryVectorIndex;
import com.adlanda.channelknowledge.repository.PgVectorIndex;
import com.adlanda.channelknowledge.repository.VectorIndex;
import com.adlanda.channelknowledge.service.retrieval.PatternRelevanceFilter;
import com.adlanda.channelknowledge.service.retrieval.RelevanceFilter;
import com.adlanda.channelknowledge.service.scoring.KeywordToneClassifier;
import com.adlanda.channelknowledge.service.scoring.ToneClassifier;
import com.adlanda.channelknowledge.source.ChannelSource;
import com.adlanda.channelknowledge.source.HttpChannelSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wires the pipeline's pluggable parts: clock, vector index, heuristics,
 * channel source and the sync worker pool.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FreshnessRanker freshnessRanker(PipelineProperties properties) {
        PipelineProperties.Search search = properties.getSearch();
        return new FreshnessRanker(search.getMinSimilarity(), search.getFreshnessBonusCap(),
                search.getFreshnessHorizonDays());
    }

    @Bean
    @ConditionalOnProperty(name = "pipeline.index.store", havingValue = "memory")
    public VectorIndex inMemoryVectorIndex(FreshnessRanker ranker, Clock clock) {
        log.info("Using in-memory vector index");
        return new InMemoryVectorIndex(ranker, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "pipeline.index.store", havingValue = "pgvector", matchIfMissing = true)
    public VectorIndex pgVectorIndex(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
                                     FreshnessRanker ranker, Clock clock, PipelineProperties properties) {
        PipelineProperties.Index index = properties.getIndex();
        PgVectorIndex vectorIndex = new PgVectorIndex(jdbcTemplate, objectMapper, ranker, clock,
                index.getTableName(), index.getDimensions());
        if (index.isInitializeSchema()) {
            vectorIndex.initializeSchema();
        }
        log.info("Using pgvector index table '{}' ({} dimensions)", index.getTableName(), index.getDimensions());
        return vectorIndex;
    }

    @Bean
    public ToneClassifier toneClassifier() {
        return new KeywordToneClassifier();
    }

    @Bean
    public RelevanceFilter relevanceFilter(PipelineProperties properties) {
        List<String> patterns = properties.getRetrieval().getDenylistPatterns();
        if (patterns == null || patterns.isEmpty()) {
            return new PatternRelevanceFilter();
        }
        log.info("Using {} configured denylist patterns", patterns.size());
        return new PatternRelevanceFilter(patterns);
    }

    /**
     * Only created when a bridge URL is configured; without it the fetch phase is skipped.
     */
    @Bean
    @ConditionalOnProperty(name = "pipeline.source.base-url")
    public ChannelSource httpChannelSource(RestClient.Builder builder, PipelineProperties properties) {
        PipelineProperties.Source source = properties.getSource();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(source.getConnectTimeout());
        requestFactory.setReadTimeout(source.getReadTimeout());

        RestClient restClient = builder
                .baseUrl(source.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeaders(headers -> {
                    if (source.getApiToken() != null && !source.getApiToken().isBlank()) {
                        headers.setBearerAuth(source.getApiToken());
                    }
                })
                .build();
        log.info("Channel source: {}", source.getBaseUrl());
        return new HttpChannelSource(restClient);
    }

    /**
     * Bounded pool for the Sync phase. A full queue makes the loop thread run the task itself.
     */
    @Bean(name = "syncWorkerExecutor")
    public ThreadPoolTaskExecutor syncWorkerExecutor(PipelineProperties properties) {
        int threads = properties.getScheduler().getWorkerThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getMaxBatchPerTick().getSync());
        executor.setThreadNamePrefix("sync-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getScheduler().getShutdownGrace().toSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        return executor;
    }
}
