package com.adlanda.channelknowledge.service.sync;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.config.PipelineProperties.ChannelSeed;
import com.adlanda.channelknowledge.entity.ChannelRecord;
import com.adlanda.channelknowledge.entity.ItemStatus;
import com.adlanda.channelknowledge.entity.StagedItem;
import com.adlanda.channelknowledge.model.ContentItem;
import com.adlanda.channelknowledge.model.MediaType;
import com.adlanda.channelknowledge.model.TickReport;
import com.adlanda.channelknowledge.repository.ChannelRecordRepository;
import com.adlanda.channelknowledge.repository.FreshnessRanker;
import com.adlanda.channelknowledge.repository.InMemoryVectorIndex;
import com.adlanda.channelknowledge.repository.StagedItemRepository;
import com.adlanda.channelknowledge.service.CategoryPolicy;
import com.adlanda.channelknowledge.service.ChannelFetcher;
import com.adlanda.channelknowledge.service.ChannelRecordService;
import com.adlanda.channelknowledge.service.ContentHashService;
import com.adlanda.channelknowledge.service.Embedder;
import com.adlanda.channelknowledge.service.IndexingService;
import com.adlanda.channelknowledge.service.chunking.ChunkingEngine;
import com.adlanda.channelknowledge.service.scoring.ChannelAverageViewsCache;
import com.adlanda.channelknowledge.service.scoring.KeywordToneClassifier;
import com.adlanda.channelknowledge.service.scoring.QualityScorer;
import com.adlanda.channelknowledge.source.ChannelSource;
import com.adlanda.channelknowledge.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the orchestrator against the real staging tables and rebuilds every
 * in-process component between ticks, the way a process restart would.
 * The vector index instance survives, standing in for the external store.
 */
@DataJpaTest
@ActiveProfiles("test")
class RestartSafetyTest {

    private static final long CHANNEL_ID = 42L;

    private static final String GOOD_POST = """
            Three habits that helped our team close more deals this quarter.

            First, follow up within two days. Clients remember a quick answer.

            Second, write down every objection. Patterns show up after a week.

            Third, end each call with a concrete next step and a date. It keeps momentum.
            """;

    @Autowired
    private ChannelRecordRepository channelRepository;

    @Autowired
    private StagedItemRepository stagedItemRepository;

    private final MutableClock clock = MutableClock.at("2026-10-17T09:00:00Z");
    private final FakeChannelSource source = new FakeChannelSource();
    private PipelineProperties properties;
    private InMemoryVectorIndex vectorIndex;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.setIngestionThreshold(5.0);
        vectorIndex = new InMemoryVectorIndex(new FreshnessRanker(0.4, 0.1, 365), clock);

        ChannelSeed seed = new ChannelSeed();
        seed.setChannelId(CHANNEL_ID);
        seed.setUsername("sales_daily");
        seed.setTitle("Sales Daily");
        seed.setPriority(5);
        seed.setStyleCategory("business");
        new ChannelRecordService(channelRepository, stagedItemRepository).register(seed);

        Instant now = clock.instant();
        source.posts.add(new ContentItem(CHANNEL_ID, 7L, GOOD_POST, now.minus(Duration.ofHours(2)), 3000, 150, 30, null));
        source.posts.add(new ContentItem(CHANNEL_ID, 8L, "ok", now.minus(Duration.ofHours(1)), 0, 0, 0, null));
    }

    @Test
    void restartBetweenScoreAndSync_doesNotRefetchAndIndexesOnlyScoredItems() {
        SyncOrchestrator beforeCrash = newProcess();
        SyncOrchestrator.FetchSummary fetch = beforeCrash.runFetchPhase(clock.instant(), false, null);
        beforeCrash.runScorePhase();

        assertThat(fetch.staged()).isEqualTo(2);
        assertThat(status(7L)).isEqualTo(ItemStatus.ACCEPTED);
        assertThat(status(8L)).isEqualTo(ItemStatus.REJECTED);
        assertThat(vectorIndex.size()).isZero();

        clock.advance(Duration.ofMinutes(5));
        TickReport afterRestart = newProcess().tick();

        assertThat(source.calls.get()).isEqualTo(1);
        assertThat(afterRestart.channelsPolled()).isZero();
        assertThat(afterRestart.scored()).isZero();
        assertThat(afterRestart.indexed()).isEqualTo(1);
        assertThat(status(7L)).isEqualTo(ItemStatus.INDEXED);
        assertThat(status(8L)).isEqualTo(ItemStatus.REJECTED);
        assertThat(vectorIndex.findByMessage(CHANNEL_ID, 7L)).isNotEmpty();
        assertThat(vectorIndex.findByMessage(CHANNEL_ID, 8L)).isEmpty();
    }

    @Test
    void restartAfterFetch_keepsWatermarkAndDoesNotRestage() {
        newProcess().runFetchPhase(clock.instant(), false, null);
        ChannelRecord channel = channelRepository.findByChannelId(CHANNEL_ID).orElseThrow();
        assertThat(channel.getLastMessageId()).isEqualTo(8L);

        clock.advance(Duration.ofHours(2));
        TickReport tick = newProcess().tick();

        assertThat(tick.channelsPolled()).isEqualTo(1);
        assertThat(tick.itemsStaged()).isZero();
        assertThat(source.calls.get()).isEqualTo(2);
        assertThat(source.lastWatermark).isEqualTo(8L);
        assertThat(stagedItemRepository.count()).isEqualTo(2);
    }

    @Test
    void sameMessageIndexedTwiceAcrossTicks_leavesOneEntry() {
        SyncOrchestrator first = newProcess();
        first.runFetchPhase(clock.instant(), false, null);
        first.runScorePhase();

        StagedItem item = stagedItemRepository.findByChannelIdAndMessageId(CHANNEL_ID, 7L).orElseThrow();
        newIndexingService().indexPost(item.toContentItem(),
                channelRepository.findByChannelId(CHANNEL_ID).orElseThrow().toRef(), item.getQualityScore(), null);
        int entriesBeforeRetry = vectorIndex.findByMessage(CHANNEL_ID, 7L).size();

        clock.advance(Duration.ofMinutes(1));
        TickReport retry = newProcess().tick();

        assertThat(retry.indexed()).isEqualTo(1);
        assertThat(vectorIndex.findByMessage(CHANNEL_ID, 7L)).hasSize(entriesBeforeRetry);
        assertThat(vectorIndex.size()).isEqualTo(entriesBeforeRetry);
    }

    @Test
    void pageOfMediaOnlyPosts_doesNotStallTheWatermark() {
        Instant now = clock.instant();
        PagedChannelSource paged = new PagedChannelSource();
        for (long id = 1; id <= 3; id++) {
            paged.posts.add(new ContentItem(CHANNEL_ID, id, null, now.minus(Duration.ofHours(5 - id)), 900, 10, 1,
                    MediaType.PHOTO));
        }
        paged.posts.add(new ContentItem(CHANNEL_ID, 4L, GOOD_POST, now.minus(Duration.ofMinutes(30)), 3000, 150, 30, null));
        properties.getFetch().setLimit(3);

        SyncOrchestrator.FetchSummary first = newProcess(paged).runFetchPhase(clock.instant(), false, null);
        assertThat(first.staged()).isZero();
        assertThat(channelRepository.findByChannelId(CHANNEL_ID).orElseThrow().getLastMessageId()).isEqualTo(3L);

        clock.advance(Duration.ofHours(3));
        SyncOrchestrator.FetchSummary second = newProcess(paged).runFetchPhase(clock.instant(), false, null);

        assertThat(second.staged()).isEqualTo(1);
        assertThat(paged.requestedAfter).containsExactly(null, 3L);
        assertThat(stagedItemRepository.findByChannelIdAndMessageId(CHANNEL_ID, 4L)).isPresent();
        assertThat(channelRepository.findByChannelId(CHANNEL_ID).orElseThrow().getLastMessageId()).isEqualTo(4L);
    }

    private SyncOrchestrator newProcess() {
        return newProcess(source);
    }

    private SyncOrchestrator newProcess(ChannelSource channelSource) {
        ChannelRecordService channelService = new ChannelRecordService(channelRepository, stagedItemRepository);
        ChannelFetcher fetcher = new ChannelFetcher(Optional.of(channelSource), properties, clock);
        QualityScorer scorer = new QualityScorer(
                new ChannelAverageViewsCache(stagedItemRepository, properties, clock),
                new KeywordToneClassifier(), properties, clock);
        return new SyncOrchestrator(channelService, fetcher, stagedItemRepository, scorer, newIndexingService(),
                vectorIndex, properties, new TaskExecutorAdapter(Runnable::run), clock);
    }

    private IndexingService newIndexingService() {
        return new IndexingService(new ChunkingEngine(), new HashingEmbedder(), vectorIndex,
                new ContentHashService(), new CategoryPolicy(properties), properties);
    }

    private ItemStatus status(long messageId) {
        return stagedItemRepository.findByChannelIdAndMessageId(CHANNEL_ID, messageId).orElseThrow().getStatus();
    }

    /**
     * Serves a fixed history and ignores the watermark, like a bridge that always
     * returns the latest page.
     */
    private static class FakeChannelSource implements ChannelSource {

        private final List<ContentItem> posts = new ArrayList<>();
        private final AtomicInteger calls = new AtomicInteger();
        private volatile Long lastWatermark;

        @Override
        public List<ContentItem> fetch(long channelId, Long sinceMessageId, int limit) {
            calls.incrementAndGet();
            lastWatermark = sinceMessageId;
            return List.copyOf(posts);
        }
    }

    /**
     * Returns at most {@code limit} posts above {@code sinceMessageId}, oldest first.
     */
    private static class PagedChannelSource implements ChannelSource {

        private final List<ContentItem> posts = new ArrayList<>();
        private final List<Long> requestedAfter = new ArrayList<>();

        @Override
        public List<ContentItem> fetch(long channelId, Long sinceMessageId, int limit) {
            requestedAfter.add(sinceMessageId);
            return posts.stream()
                    .filter(post -> sinceMessageId == null || post.messageId() > sinceMessageId)
                    .sorted(Comparator.comparingLong(ContentItem::messageId))
                    .limit(limit)
                    .toList();
        }
    }

    /**
     * Deterministic non-zero vectors derived from the text's characters.
     */
    private static class HashingEmbedder implements Embedder {

        @Override
        public float[] embed(String text) {
            float[] vector = new float[16];
            for (int i = 0; i < text.length(); i++) {
                vector[i % vector.length] += text.charAt(i) % 31 + 1;
            }
            return vector;
        }
    }
}
