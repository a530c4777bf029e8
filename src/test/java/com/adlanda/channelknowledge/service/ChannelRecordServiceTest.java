package com.adlanda.channelknowledge.service;

import com.adlanda.channelknowledge.config.PipelineProperties.ChannelSeed;
import com.adlanda.channelknowledge.entity.ChannelRecord;
import com.adlanda.channelknowledge.entity.ItemStatus;
import com.adlanda.channelknowledge.entity.StagedItem;
import com.adlanda.channelknowledge.exception.PermanentFetchException;
import com.adlanda.channelknowledge.exception.TransientFetchException;
import com.adlanda.channelknowledge.model.ContentItem;
import com.adlanda.channelknowledge.model.LengthClass;
import com.adlanda.channelknowledge.model.PollResult;
import com.adlanda.channelknowledge.model.QualityAssessment;
import com.adlanda.channelknowledge.model.StyleTags;
import com.adlanda.channelknowledge.model.SubScores;
import com.adlanda.channelknowledge.model.Tone;
import com.adlanda.channelknowledge.repository.ChannelRecordRepository;
import com.adlanda.channelknowledge.repository.StagedItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class ChannelRecordServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-17T12:00:00Z");

    @Autowired
    private ChannelRecordRepository channelRepository;

    @Autowired
    private StagedItemRepository stagedItemRepository;

    private ChannelRecordService service;

    @BeforeEach
    void setUp() {
        service = new ChannelRecordService(channelRepository, stagedItemRepository);
    }

    @Test
    void register_isIdempotentPerExternalId() {
        assertThat(service.register(seed(42L, 9))).isTrue();
        assertThat(service.register(seed(42L, 3))).isFalse();

        assertThat(channelRepository.findAll()).singleElement()
                .satisfies(c -> assertThat(c.getPriority()).isEqualTo(9));
        assertThat(service.activeCount()).isEqualTo(1);
    }

    @Test
    void activeChannels_highestPriorityFirst() {
        service.register(seed(1L, 3));
        service.register(seed(2L, 10));
        service.register(seed(3L, 6));

        assertThat(service.activeChannels()).extracting(ChannelRecord::getChannelId).containsExactly(2L, 3L, 1L);
        assertThat(service.byChannelId(List.of(1L, 3L))).containsOnlyKeys(1L, 3L);
    }

    @Test
    void recordPollSuccess_stagesNewItemsAndAdvancesWatermark() {
        service.register(seed(42L, 5));
        ChannelRecord channel = channelRepository.findByChannelId(42L).orElseThrow();

        int first = service.recordPollSuccess(channel.getId(), poll(post(10L, 800), post(11L, 1200)), NOW);
        int again = service.recordPollSuccess(channel.getId(), poll(post(11L, 1300)), NOW.plusSeconds(60));

        ChannelRecord updated = channelRepository.findByChannelId(42L).orElseThrow();
        assertThat(first).isEqualTo(2);
        assertThat(again).isZero();
        assertThat(stagedItemRepository.count()).isEqualTo(2);
        assertThat(updated.getLastMessageId()).isEqualTo(11L);
        assertThat(updated.getLastFetchedAt()).isEqualTo(NOW.plusSeconds(60));
        assertThat(updated.getPostsCount()).isEqualTo(2);
    }

    @Test
    void recordPollSuccess_emptyPollStillMovesLastFetchedAt() {
        service.register(seed(42L, 5));
        ChannelRecord channel = channelRepository.findByChannelId(42L).orElseThrow();

        service.recordPollSuccess(channel.getId(), PollResult.empty(), NOW);

        ChannelRecord updated = channelRepository.findByChannelId(42L).orElseThrow();
        assertThat(updated.getLastFetchedAt()).isEqualTo(NOW);
        assertThat(updated.getLastMessageId()).isNull();
    }

    @Test
    void recordPollSuccess_filteredOutPage_stillAdvancesWatermark() {
        service.register(seed(42L, 5));
        ChannelRecord channel = channelRepository.findByChannelId(42L).orElseThrow();
        Instant newestSeen = NOW.minusSeconds(600);

        int staged = service.recordPollSuccess(channel.getId(), new PollResult(List.of(), 30L, newestSeen), NOW);

        ChannelRecord updated = channelRepository.findByChannelId(42L).orElseThrow();
        assertThat(staged).isZero();
        assertThat(updated.getLastMessageId()).isEqualTo(30L);
        assertThat(updated.getLastPostDate()).isEqualTo(newestSeen);
        assertThat(stagedItemRepository.count()).isZero();
    }

    @Test
    void recordPollFailure_permanentErrorFlagsChannel() {
        service.register(seed(42L, 5));
        service.register(seed(43L, 5));
        ChannelRecord gone = channelRepository.findByChannelId(42L).orElseThrow();
        ChannelRecord flaky = channelRepository.findByChannelId(43L).orElseThrow();

        service.recordPollFailure(gone.getId(), new PermanentFetchException(42L, "channel is private"));
        service.recordPollFailure(flaky.getId(), new TransientFetchException(43L, "timeout"));

        assertThat(service.flaggedChannels()).extracting(ChannelRecord::getChannelId).containsExactly(42L);
        assertThat(channelRepository.findByChannelId(43L).orElseThrow().getConsecutiveErrors()).isEqualTo(1);
        assertThat(service.activeCount()).isEqualTo(2);
    }

    @Test
    void recomputeStats_averagesScoredItems() {
        service.register(seed(42L, 5));
        stagedItemRepository.save(scored(1L, 8.0));
        stagedItemRepository.save(scored(2L, 6.0));
        stagedItemRepository.save(StagedItem.from(post(3L, 500), NOW));

        int updated = service.recomputeStats(7.0);

        ChannelRecord channel = channelRepository.findByChannelId(42L).orElseThrow();
        assertThat(updated).isEqualTo(1);
        assertThat(channel.getAvgQualityScore()).isEqualTo(7.0);
        assertThat(channel.getHighQualityCount()).isEqualTo(1);
    }

    @Test
    void acceptedQueue_retriedItemsWaitBehindUntriedOnes() {
        StagedItem retried = scored(2L, 8.0);
        retried.recordIndexingFailure("input rejected", 5);
        StagedItem fresh = scored(1L, 8.0);
        StagedItem parked = scored(3L, 8.0);
        parked.recordIndexingFailure("input rejected", 1);
        stagedItemRepository.saveAll(List.of(retried, fresh, parked));

        List<StagedItem> batch = stagedItemRepository
                .findByStatusAndQualityScoreGreaterThanEqualOrderByAttemptsAscPostedAtAscMessageIdAsc(
                        ItemStatus.ACCEPTED, 7.0, PageRequest.of(0, 10));

        assertThat(batch).extracting(StagedItem::getMessageId).containsExactly(1L, 2L);
        assertThat(service.indexFailedCount()).isEqualTo(1);
    }

    private static PollResult poll(ContentItem... items) {
        long newest = 0;
        for (ContentItem item : items) {
            newest = Math.max(newest, item.messageId());
        }
        return new PollResult(List.of(items), newest, NOW);
    }

    private static StagedItem scored(long messageId, double score) {
        StagedItem item = StagedItem.from(post(messageId, 1000), NOW);
        item.applyAssessment(new QualityAssessment(score, new SubScores(score, score, score, score, score),
                new StyleTags(Tone.INFORMATIONAL, LengthClass.OPTIMAL, 0, false, false, 1), "test"), 7.0, NOW);
        return item;
    }

    private static ContentItem post(long messageId, int views) {
        return new ContentItem(42L, messageId, "Post " + messageId, NOW.minusSeconds(messageId * 60), views, 5, 1, null);
    }

    private static ChannelSeed seed(long channelId, int priority) {
        ChannelSeed seed = new ChannelSeed();
        seed.setChannelId(channelId);
        seed.setUsername("channel_" + channelId);
        seed.setPriority(priority);
        return seed;
    }
}
