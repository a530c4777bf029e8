package com.adlanda.channelknowledge.service.sync;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.entity.ChannelRecord;
import com.adlanda.channelknowledge.entity.ItemStatus;
import com.adlanda.channelknowledge.entity.StagedItem;
import com.adlanda.channelknowledge.exception.ChannelFetchException;
import com.adlanda.channelknowledge.exception.EmbeddingException;
import com.adlanda.channelknowledge.exception.IndexUnavailableException;
import com.adlanda.channelknowledge.exception.ScoringException;
import com.adlanda.channelknowledge.model.ChannelRef;
import com.adlanda.channelknowledge.model.ContentItem;
import com.adlanda.channelknowledge.model.PollResult;
import com.adlanda.channelknowledge.model.PollState;
import com.adlanda.channelknowledge.model.QualityAssessment;
import com.adlanda.channelknowledge.model.TickReport;
import com.adlanda.channelknowledge.repository.StagedItemRepository;
import com.adlanda.channelknowledge.repository.VectorIndex;
import com.adlanda.channelknowledge.service.ChannelFetcher;
import com.adlanda.channelknowledge.service.ChannelRecordService;
import com.adlanda.channelknowledge.service.IndexingService;
import com.adlanda.channelknowledge.service.scoring.QualityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives one pass of the pipeline: Fetch, Score, Sync and, every few ticks, Housekeeping.
 *
 * Every phase persists its progress before the next one starts, so a restart
 * resumes where the previous process stopped: channels whose watermark already
 * advanced are not re-polled early, and scored items are picked up by Sync.
 */
@Service
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final ChannelRecordService channelService;
    private final ChannelFetcher fetcher;
    private final StagedItemRepository stagedItems;
    private final QualityScorer scorer;
    private final IndexingService indexingService;
    private final VectorIndex vectorIndex;
    private final PipelineProperties properties;
    private final AsyncTaskExecutor workerExecutor;
    private final Clock clock;
    private final AtomicLong tickCounter = new AtomicLong();

    public SyncOrchestrator(ChannelRecordService channelService,
                            ChannelFetcher fetcher,
                            StagedItemRepository stagedItems,
                            QualityScorer scorer,
                            IndexingService indexingService,
                            VectorIndex vectorIndex,
                            PipelineProperties properties,
                            @Qualifier("syncWorkerExecutor") AsyncTaskExecutor workerExecutor,
                            Clock clock) {
        this.channelService = channelService;
        this.fetcher = fetcher;
        this.stagedItems = stagedItems;
        this.scorer = scorer;
        this.indexingService = indexingService;
        this.vectorIndex = vectorIndex;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
        this.clock = clock;
    }

    /**
     * Runs one tick.
     */
    public synchronized TickReport tick() {
        long tick = tickCounter.incrementAndGet();
        Instant started = clock.instant();

        FetchSummary fetch = runFetchPhase(started, false, null);
        ScoreSummary score = runScorePhase();
        SyncSummary sync = runSyncPhase();
        Integer expired = null;
        if (tick % properties.getScheduler().getHousekeepingEveryTicks() == 0) {
            expired = runHousekeeping();
        }

        TickReport report = new TickReport(tick,
                fetch.polled(), fetch.staged(), fetch.failures(),
                score.scored(), score.accepted(),
                sync.indexed(), sync.failures(), sync.aborted(),
                expired,
                Duration.between(started, clock.instant()));
        log.info("Tick {} finished: polled={}, staged={}, fetchFailures={}, scored={}, accepted={}, indexed={}, syncFailures={}{}",
                tick, report.channelsPolled(), report.itemsStaged(), report.fetchFailures(), report.scored(),
                report.accepted(), report.indexed(), report.syncFailures(),
                report.syncAborted() ? " (sync aborted)" : "");
        return report;
    }

    /**
     * Polls channels regardless of their tier interval.
     *
     * @param channelId external id of one channel, or null for every active channel
     */
    public synchronized FetchSummary forceFetch(Long channelId) {
        log.info("Forced fetch requested for {}", channelId != null ? "channel " + channelId : "all channels");
        return runFetchPhase(clock.instant(), true, channelId);
    }

    FetchSummary runFetchPhase(Instant now, boolean force, Long onlyChannelId) {
        if (!fetcher.isEnabled()) {
            log.debug("No channel source configured, fetch phase skipped");
            return new FetchSummary(0, 0, 0);
        }

        int polled = 0;
        int staged = 0;
        int failures = 0;
        for (ChannelRecord channel : channelService.activeChannels()) {
            if (onlyChannelId != null && channel.getChannelId() != onlyChannelId) {
                continue;
            }
            PollState state = channel.pollState(now, properties.intervalFor(channel.tier()));
            if (!force && !state.isDue()) {
                continue;
            }

            polled++;
            try {
                PollResult poll = fetcher.poll(channel);
                int newItems = channelService.recordPollSuccess(channel.getId(), poll, now);
                staged += newItems;
                if (newItems > 0) {
                    log.info("Channel {} ({}): staged {} new posts", channel.getChannelId(), channel.tier(), newItems);
                }
            } catch (ChannelFetchException e) {
                failures++;
                log.warn("Fetch failed for channel {} ({}): {}", channel.getChannelId(),
                        e.isRetryable() ? "transient" : "permanent", e.getMessage());
                channelService.recordPollFailure(channel.getId(), e);
            }
        }
        return new FetchSummary(polled, staged, failures);
    }

    ScoreSummary runScorePhase() {
        double threshold = properties.getIngestionThreshold();
        List<StagedItem> pending = stagedItems.findByStatusOrderByPostedAtAscMessageIdAsc(
                ItemStatus.PENDING, PageRequest.of(0, properties.getMaxBatchPerTick().getScore()));

        int scored = 0;
        int accepted = 0;
        for (StagedItem item : pending) {
            Instant now = clock.instant();
            try {
                QualityAssessment assessment = scorer.score(item.toContentItem());
                item.applyAssessment(assessment, threshold, now);
                scored++;
                if (item.getStatus() == ItemStatus.ACCEPTED) {
                    accepted++;
                }
            } catch (ScoringException e) {
                log.warn("Scoring failed for message {} of channel {}: {}", item.getMessageId(), item.getChannelId(), e.getMessage());
                item.markScoringFailed(e.getMessage(), now);
            }
            stagedItems.save(item);
        }
        if (!pending.isEmpty()) {
            log.debug("Scored {} posts, {} accepted at threshold {}", scored, accepted, threshold);
        }
        return new ScoreSummary(scored, accepted);
    }

    SyncSummary runSyncPhase() {
        List<StagedItem> batch = stagedItems.findByStatusAndQualityScoreGreaterThanEqualOrderByAttemptsAscPostedAtAscMessageIdAsc(
                ItemStatus.ACCEPTED, properties.getIngestionThreshold(),
                PageRequest.of(0, properties.getMaxBatchPerTick().getSync()));
        if (batch.isEmpty()) {
            return new SyncSummary(0, 0, false);
        }

        Map<Long, ChannelRecord> channels = channelService.byChannelId(
                batch.stream().map(StagedItem::getChannelId).distinct().toList());

        List<Pending> submitted = new ArrayList<>(batch.size());
        for (StagedItem item : batch) {
            ChannelRecord channel = channels.get(item.getChannelId());
            ChannelRef ref = channel != null
                    ? channel.toRef()
                    : new ChannelRef(item.getChannelId(), null, null, null);
            ContentItem content = item.toContentItem();
            Double qualityScore = item.getQualityScore();
            String tone = item.getTone() != null ? item.getTone().name().toLowerCase(Locale.ROOT) : null;
            Future<List<UUID>> future = workerExecutor.submit(
                    () -> indexingService.indexPost(content, ref, qualityScore, tone));
            submitted.add(new Pending(item, future));
        }

        int indexed = 0;
        int failures = 0;
        boolean aborted = false;
        for (Pending pending : submitted) {
            StagedItem item = pending.item();
            if (aborted && pending.future().cancel(true)) {
                continue;
            }
            try {
                List<UUID> ids = pending.future().get();
                item.markIndexed(ids.size(), clock.instant());
                indexed++;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof IndexUnavailableException) {
                    if (!aborted) {
                        log.error("Vector index unavailable, aborting sync phase: {}", cause.getMessage());
                    }
                    aborted = true;
                    continue;
                }
                failures++;
                item.recordIndexingFailure(cause.getMessage(), properties.getMaxIndexAttempts());
                if (item.getStatus() == ItemStatus.INDEX_FAILED) {
                    log.error("Giving up on message {} of channel {} after {} attempts: {}",
                            item.getMessageId(), item.getChannelId(), item.getAttempts(), cause.getMessage());
                } else if (cause instanceof EmbeddingException) {
                    log.warn("Embedding failed for message {} of channel {} (attempt {}): {}",
                            item.getMessageId(), item.getChannelId(), item.getAttempts(), cause.getMessage());
                } else {
                    log.error("Indexing failed for message {} of channel {}", item.getMessageId(), item.getChannelId(), cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Sync phase interrupted, remaining posts stay queued");
                aborted = true;
                continue;
            }
            stagedItems.save(item);
        }

        if (aborted) {
            log.warn("Sync phase stopped early: {} indexed, remaining posts stay ACCEPTED", indexed);
        }
        return new SyncSummary(indexed, failures, aborted);
    }

    /**
     * Expires outdated entries and recomputes channel statistics.
     *
     * @return number of expired entries removed, 0 when the index was unreachable
     */
    int runHousekeeping() {
        int expired = 0;
        try {
            expired = vectorIndex.expire();
        } catch (IndexUnavailableException e) {
            log.warn("Expiry sweep skipped: {}", e.getMessage());
        }
        int channels = channelService.recomputeStats(properties.getIngestionThreshold());
        log.info("Housekeeping: {} expired entries removed, stats refreshed for {} channels", expired, channels);
        return expired;
    }

    public long ticksRun() {
        return tickCounter.get();
    }

    public record FetchSummary(int polled, int staged, int failures) {}

    record ScoreSummary(int scored, int accepted) {}

    record SyncSummary(int indexed, int failures, boolean aborted) {}

    private record Pending(StagedItem item, Future<List<UUID>> future) {}
}
