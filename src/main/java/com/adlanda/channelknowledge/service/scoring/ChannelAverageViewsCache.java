package com.adlanda.channelknowledge.service.scoring;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.repository.StagedItemRepository;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Per-channel average view counts, cached with an expire-after-write TTL.
 *
 * The cache ticker reads the injected {@link Clock}, so expiry follows the same
 * time source as the rest of the pipeline.
 */
@Component
public class ChannelAverageViewsCache {

    private static final Logger log = LoggerFactory.getLogger(ChannelAverageViewsCache.class);

    private final StagedItemRepository stagedItemRepository;
    private final LoadingCache<Long, Double> averages;

    public ChannelAverageViewsCache(StagedItemRepository stagedItemRepository, PipelineProperties properties, Clock clock) {
        this.stagedItemRepository = stagedItemRepository;
        this.averages = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(properties.getScoring().getAverageViewsTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build(this::load);
    }

    /**
     * @return average views of the channel's posts with views, or 0 when there are none
     */
    public double averageViews(long channelId) {
        Double average = averages.get(channelId);
        return average != null ? average : 0.0;
    }

    public void invalidate(long channelId) {
        averages.invalidate(channelId);
    }

    private Double load(Long channelId) {
        Double average = stagedItemRepository.averageViews(channelId);
        log.debug("Loaded average views {} for channel {}", average, channelId);
        return average != null ? average : 0.0;
    }
}
