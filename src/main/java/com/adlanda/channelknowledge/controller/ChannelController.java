package com.adlanda.channelknowledge.controller;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.entity.ChannelRecord;
import com.adlanda.channelknowledge.service.ChannelRecordService;
import com.adlanda.channelknowledge.service.sync.SyncOrchestrator;
import com.adlanda.channelknowledge.service.sync.SyncOrchestrator.FetchSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints for monitored channels.
 */
@RestController
@RequestMapping("/api/v1/channels")
public class ChannelController {

    private final ChannelRecordService channelService;
    private final SyncOrchestrator orchestrator;
    private final PipelineProperties properties;
    private final Clock clock;

    public ChannelController(ChannelRecordService channelService, SyncOrchestrator orchestrator,
                             PipelineProperties properties, Clock clock) {
        this.channelService = channelService;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> channels() {
        Instant now = clock.instant();
        return ResponseEntity.ok(channelService.activeChannels().stream()
                .map(channel -> describe(channel, now))
                .toList());
    }

    /**
     * Polls channels immediately, ignoring their tier interval.
     *
     * @param channelId external id of a single channel; all active channels when omitted
     */
    @PostMapping("/fetch")
    public ResponseEntity<FetchSummary> fetch(@RequestParam(required = false) Long channelId) {
        return ResponseEntity.ok(orchestrator.forceFetch(channelId));
    }

    private Map<String, Object> describe(ChannelRecord channel, Instant now) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("channelId", channel.getChannelId());
        view.put("username", channel.getUsername());
        view.put("title", channel.getTitle());
        view.put("priority", channel.getPriority());
        view.put("tier", channel.tier());
        view.put("pollState", channel.pollState(now, properties.intervalFor(channel.tier())));
        view.put("lastFetchedAt", channel.getLastFetchedAt());
        view.put("lastMessageId", channel.getLastMessageId());
        view.put("postsCount", channel.getPostsCount());
        view.put("avgQualityScore", channel.getAvgQualityScore());
        view.put("highQualityCount", channel.getHighQualityCount());
        view.put("errorCount", channel.getErrorCount());
        view.put("flagged", channel.isFlagged());
        return view;
    }
}
