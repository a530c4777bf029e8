package com.adlanda.channelknowledge.health;

import com.adlanda.channelknowledge.entity.ChannelRecord;
import com.adlanda.channelknowledge.model.TickReport;
import com.adlanda.channelknowledge.service.ChannelRecordService;
import com.adlanda.channelknowledge.service.KnowledgeBaseLoader.LoadSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the sync loop and the knowledge-base loader.
 *
 * Reports:
 * - the last tick and its counters
 * - channels flagged by permanent fetch errors, with their error counts
 * - posts parked after repeated indexing failures
 * - the last knowledge-base load
 * - DOWN once the sync loop has halted
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private final ChannelRecordService channelService;
    private final Clock clock;

    private final AtomicReference<SyncState> syncState = new AtomicReference<>(
            new SyncState(null, null, null, 0)
    );
    private final AtomicReference<LoadState> loadState = new AtomicReference<>(
            new LoadState(null, null, null)
    );

    public PipelineHealthIndicator(ChannelRecordService channelService, Clock clock) {
        this.channelService = channelService;
        this.clock = clock;
    }

    public void recordTick(TickReport report) {
        syncState.updateAndGet(s -> new SyncState(report, clock.instant(), s.haltReason(), s.failedTicks()));
    }

    /**
     * A tick threw before completing; the loop keeps running.
     */
    public void recordTickFailure() {
        syncState.updateAndGet(s -> new SyncState(s.lastTick(), s.lastTickAt(), s.haltReason(), s.failedTicks() + 1));
    }

    /**
     * The loop stopped for good.
     */
    public void recordHalt(String reason) {
        syncState.updateAndGet(s -> new SyncState(s.lastTick(), s.lastTickAt(), reason, s.failedTicks()));
    }

    public void recordKnowledgeBaseLoad(LoadSummary summary) {
        loadState.set(new LoadState(summary, null, clock.instant()));
    }

    public void recordKnowledgeBaseFailure(String error) {
        loadState.set(new LoadState(null, error, clock.instant()));
    }

    @Override
    public Health health() {
        SyncState sync = syncState.get();
        LoadState load = loadState.get();

        Health.Builder builder = sync.haltReason() != null ? Health.down().withDetail("syncHalted", sync.haltReason()) : Health.up();

        builder.withDetail("lastTickAt", sync.lastTickAt() != null ? sync.lastTickAt().toString() : "never")
                .withDetail("failedTicks", sync.failedTicks());
        if (sync.lastTick() != null) {
            TickReport t = sync.lastTick();
            builder.withDetail("lastTick", Map.of(
                    "tick", t.tick(),
                    "channelsPolled", t.channelsPolled(),
                    "itemsStaged", t.itemsStaged(),
                    "fetchFailures", t.fetchFailures(),
                    "scored", t.scored(),
                    "indexed", t.indexed(),
                    "syncFailures", t.syncFailures(),
                    "syncAborted", t.syncAborted()
            ));
        }

        List<ChannelRecord> flagged = channelService.flaggedChannels();
        Map<String, Object> flaggedDetails = new LinkedHashMap<>();
        for (ChannelRecord channel : flagged) {
            flaggedDetails.put(String.valueOf(channel.getChannelId()), Map.of(
                    "username", channel.getUsername() != null ? channel.getUsername() : "",
                    "errorCount", channel.getErrorCount(),
                    "consecutiveErrors", channel.getConsecutiveErrors(),
                    "lastError", channel.getLastError() != null ? channel.getLastError() : ""
            ));
        }
        builder.withDetail("flaggedChannels", flaggedDetails)
                .withDetail("itemsIndexFailed", channelService.indexFailedCount());

        if (load.summary() != null) {
            builder.withDetail("knowledgeBase", Map.of(
                    "lastRun", load.timestamp().toString(),
                    "filesProcessed", load.summary().processedFiles(),
                    "filesSkipped", load.summary().skippedFiles(),
                    "filesDeleted", load.summary().deletedFiles(),
                    "filesFailed", load.summary().failedFiles(),
                    "entriesIndexed", load.summary().totalEntries()
            ));
        } else if (load.error() != null) {
            builder.withDetail("knowledgeBase", Map.of(
                    "error", load.error(),
                    "lastAttempt", load.timestamp().toString()
            ));
        }
        return builder.build();
    }

    /**
     * Internal state holders for thread-safe health updates.
     */
    private record SyncState(TickReport lastTick, Instant lastTickAt, String haltReason, int failedTicks) {}

    private record LoadState(LoadSummary summary, String error, Instant timestamp) {}
}
