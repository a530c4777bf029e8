package com.adlanda.channelknowledge.service;

import com.adlanda.channelknowledge.config.PipelineProperties.ChannelSeed;
import com.adlanda.channelknowledge.entity.ChannelRecord;
import com.adlanda.channelknowledge.entity.ItemStatus;
import com.adlanda.channelknowledge.entity.StagedItem;
import com.adlanda.channelknowledge.exception.ChannelFetchException;
import com.adlanda.channelknowledge.model.ContentItem;
import com.adlanda.channelknowledge.model.PollResult;
import com.adlanda.channelknowledge.repository.ChannelRecordRepository;
import com.adlanda.channelknowledge.repository.StagedItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Channel bookkeeping: registration, poll outcomes and aggregate statistics.
 */
@Service
public class ChannelRecordService {

    private static final Logger log = LoggerFactory.getLogger(ChannelRecordService.class);

    private final ChannelRecordRepository channelRepository;
    private final StagedItemRepository stagedItemRepository;

    public ChannelRecordService(ChannelRecordRepository channelRepository, StagedItemRepository stagedItemRepository) {
        this.channelRepository = channelRepository;
        this.stagedItemRepository = stagedItemRepository;
    }

    @Transactional(readOnly = true)
    public List<ChannelRecord> activeChannels() {
        return channelRepository.findByActiveTrueOrderByPriorityDesc();
    }

    @Transactional(readOnly = true)
    public Map<Long, ChannelRecord> byChannelId(Collection<Long> channelIds) {
        return channelRepository.findByChannelIdIn(channelIds).stream()
                .collect(Collectors.toMap(ChannelRecord::getChannelId, Function.identity()));
    }

    /**
     * Registers a channel unless one with the same external id exists.
     *
     * @return true when a new record was created
     */
    @Transactional
    public boolean register(ChannelSeed seed) {
        if (channelRepository.findByChannelId(seed.getChannelId()).isPresent()) {
            return false;
        }
        channelRepository.save(new ChannelRecord(seed.getChannelId(), seed.getUsername(), seed.getTitle(),
                seed.getPriority(), seed.getStyleCategory()));
        log.info("Registered channel {} (@{}, priority {})", seed.getChannelId(), seed.getUsername(), seed.getPriority());
        return true;
    }

    /**
     * Stages the polled items and advances the channel's watermark in one transaction.
     * Items already staged are skipped. The watermark follows the newest message the
     * source returned, including posts the fetcher filtered out, and
     * {@code lastFetchedAt} moves even when nothing was new.
     *
     * @return number of newly staged items
     */
    @Transactional
    public int recordPollSuccess(UUID channelRecordId, PollResult poll, Instant fetchedAt) {
        ChannelRecord channel = channelRepository.findById(channelRecordId)
                .orElseThrow(() -> new IllegalStateException("Unknown channel record " + channelRecordId));

        int staged = 0;
        Long newestMessageId = poll.newestSeenId();
        Instant newestPostDate = poll.newestSeenDate();
        for (ContentItem item : poll.items()) {
            if (newestMessageId == null || item.messageId() > newestMessageId) {
                newestMessageId = item.messageId();
            }
            if (item.postedAt() != null && (newestPostDate == null || item.postedAt().isAfter(newestPostDate))) {
                newestPostDate = item.postedAt();
            }
            if (stagedItemRepository.existsByChannelIdAndMessageId(item.channelId(), item.messageId())) {
                continue;
            }
            stagedItemRepository.save(StagedItem.from(item, fetchedAt));
            staged++;
        }

        channel.recordPollSuccess(fetchedAt, newestMessageId, newestPostDate, staged);
        channelRepository.save(channel);
        return staged;
    }

    @Transactional
    public void recordPollFailure(UUID channelRecordId, ChannelFetchException error) {
        channelRepository.findById(channelRecordId).ifPresent(channel -> {
            channel.recordPollFailure(error.getMessage(), !error.isRetryable());
            channelRepository.save(channel);
            if (!error.isRetryable()) {
                log.error("Channel {} flagged for operator attention: {}", channel.getChannelId(), error.getMessage());
            }
        });
    }

    /**
     * Recomputes average quality and high-quality post counts for every active channel.
     *
     * @return number of channels updated
     */
    @Transactional
    public int recomputeStats(double highQualityThreshold) {
        List<ChannelRecord> channels = channelRepository.findByActiveTrueOrderByPriorityDesc();
        for (ChannelRecord channel : channels) {
            Double average = stagedItemRepository.averageQualityScore(channel.getChannelId());
            long highQuality = stagedItemRepository.countByChannelIdAndQualityScoreGreaterThanEqual(
                    channel.getChannelId(), highQualityThreshold);
            channel.updateQualityStats(average, highQuality);
        }
        channelRepository.saveAll(channels);
        return channels.size();
    }

    @Transactional(readOnly = true)
    public List<ChannelRecord> flaggedChannels() {
        return channelRepository.findByFlaggedTrue();
    }

    /**
     * Posts parked after exhausting their indexing attempts.
     */
    @Transactional(readOnly = true)
    public long indexFailedCount() {
        return stagedItemRepository.countByStatus(ItemStatus.INDEX_FAILED);
    }

    @Transactional(readOnly = true)
    public long activeCount() {
        return channelRepository.countByActiveTrue();
    }
}
