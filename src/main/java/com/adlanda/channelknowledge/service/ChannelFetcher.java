package com.adlanda.channelknowledge.service;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.entity.ChannelRecord;
import com.adlanda.channelknowledge.exception.ChannelFetchException;
import com.adlanda.channelknowledge.exception.TransientFetchException;
import com.adlanda.channelknowledge.model.ContentItem;
import com.adlanda.channelknowledge.model.PollResult;
import com.adlanda.channelknowledge.source.ChannelSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pulls new posts of one channel from the configured {@link ChannelSource}.
 *
 * Only posts above the channel's watermark, inside the lookback window and with
 * text are returned, oldest first. The result also carries the newest message the
 * source returned at all, so the watermark moves past pages that were filtered out
 * entirely. Polling again before the watermark moves yields nothing new from the
 * same source state.
 */
@Service
public class ChannelFetcher {

    private static final Logger log = LoggerFactory.getLogger(ChannelFetcher.class);

    private final ChannelSource channelSource;
    private final PipelineProperties properties;
    private final Clock clock;

    public ChannelFetcher(Optional<ChannelSource> channelSource, PipelineProperties properties, Clock clock) {
        this.channelSource = channelSource.orElse(null);
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Whether a channel source is configured. Without one, fetching is skipped.
     */
    public boolean isEnabled() {
        return channelSource != null;
    }

    /**
     * @throws ChannelFetchException when the source fails; unexpected errors are reported as transient
     */
    public PollResult poll(ChannelRecord channel) {
        if (channelSource == null) {
            return PollResult.empty();
        }
        long channelId = channel.getChannelId();
        Long watermark = channel.getLastMessageId();
        Instant oldestAllowed = clock.instant().minus(Duration.ofDays(properties.getFetch().getLookbackDays()));

        List<ContentItem> fetched;
        try {
            fetched = channelSource.fetch(channelId, watermark, properties.getFetch().getLimit());
        } catch (ChannelFetchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransientFetchException(channelId, "Unexpected channel source failure: " + e.getMessage(), e);
        }

        List<ContentItem> ownPosts = fetched.stream()
                .filter(item -> item.channelId() == channelId)
                .toList();
        Long newestSeenId = ownPosts.stream()
                .map(ContentItem::messageId)
                .max(Comparator.naturalOrder())
                .orElse(null);
        Instant newestSeenDate = ownPosts.stream()
                .map(ContentItem::postedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        List<ContentItem> accepted = ownPosts.stream()
                .filter(item -> watermark == null || item.messageId() > watermark)
                .filter(item -> item.postedAt() == null || !item.postedAt().isBefore(oldestAllowed))
                .filter(ContentItem::hasText)
                .sorted(Comparator.comparingLong(ContentItem::messageId))
                .toList();

        log.debug("Channel {}: {} fetched, {} new since watermark {}", channelId, fetched.size(), accepted.size(), watermark);
        return new PollResult(accepted, newestSeenId, newestSeenDate);
    }
}
