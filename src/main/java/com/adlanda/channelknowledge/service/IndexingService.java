package com.adlanda.channelknowledge.service;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.model.ChannelRef;
import com.adlanda.channelknowledge.model.Chunk;
import com.adlanda.channelknowledge.model.ContentItem;
import com.adlanda.channelknowledge.model.IndexMetadata;
import com.adlanda.channelknowledge.model.KnowledgeDocument;
import com.adlanda.channelknowledge.repository.VectorIndex;
import com.adlanda.channelknowledge.service.chunking.ChunkSpan;
import com.adlanda.channelknowledge.service.chunking.ChunkingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Chunk, embed and upsert for a single post or document.
 *
 * Embedding runs unlocked so workers can call the provider in parallel; all index
 * writes go through one process-wide lock. A failure part-way through leaves the
 * already-written chunks in place, and the retry merges into them.
 */
@Service
public class IndexingService {

    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private final ChunkingEngine chunkingEngine;
    private final Embedder embedder;
    private final VectorIndex vectorIndex;
    private final ContentHashService hashService;
    private final CategoryPolicy categoryPolicy;
    private final PipelineProperties properties;
    private final ReentrantLock writeLock = new ReentrantLock();

    public IndexingService(ChunkingEngine chunkingEngine, Embedder embedder, VectorIndex vectorIndex,
                           ContentHashService hashService, CategoryPolicy categoryPolicy,
                           PipelineProperties properties) {
        this.chunkingEngine = chunkingEngine;
        this.embedder = embedder;
        this.vectorIndex = vectorIndex;
        this.hashService = hashService;
        this.categoryPolicy = categoryPolicy;
        this.properties = properties;
    }

    /**
     * Indexes an accepted channel post.
     *
     * @return ids of the entries written or merged, one per chunk
     * @throws com.adlanda.channelknowledge.exception.EmbeddingException         if any chunk cannot be embedded
     * @throws com.adlanda.channelknowledge.exception.IndexUnavailableException if the index cannot be reached
     */
    public List<UUID> indexPost(ContentItem item, ChannelRef channel, Double qualityScore, String tone) {
        String text = PostTextCleaner.clean(item.text());
        if (text.isEmpty()) {
            log.debug("Message {} of channel {} has no indexable text after cleaning", item.messageId(), item.channelId());
            return List.of();
        }

        String category = categoryPolicy.categoryFor(channel.styleCategory());
        LocalDate created = item.postedAt() != null
                ? item.postedAt().atZone(ZoneOffset.UTC).toLocalDate()
                : LocalDate.now(ZoneOffset.UTC);
        LocalDate expires = categoryPolicy.expiresFor(category, created);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put(IndexMetadata.CHANNEL_ID, item.channelId());
        metadata.put(IndexMetadata.MESSAGE_ID, item.messageId());
        metadata.put(IndexMetadata.SOURCE_TITLE, channel.displayTitle());
        putIfPresent(metadata, IndexMetadata.CHANNEL_USERNAME, channel.username());
        metadata.put(IndexMetadata.VIEWS, item.viewsOrZero());
        metadata.put(IndexMetadata.REACTIONS, item.reactionsOrZero());
        metadata.put(IndexMetadata.FORWARDS, item.forwardsOrZero());
        putIfPresent(metadata, IndexMetadata.QUALITY_SCORE, qualityScore);
        putIfPresent(metadata, IndexMetadata.TONE, tone);
        putIfPresent(metadata, IndexMetadata.MEDIA_TYPE, item.hasMedia() ? item.mediaType().name() : null);
        putIfPresent(metadata, IndexMetadata.POSTED_AT, item.postedAt() != null ? item.postedAt().toString() : null);

        List<UUID> ids = write(channel.sourceId(), text, category, created, created, expires, metadata);
        log.debug("Indexed message {} of channel {} as {} entries", item.messageId(), item.channelId(), ids.size());
        return ids;
    }

    /**
     * Indexes a curated knowledge-base document.
     *
     * @return ids of the entries written or merged, one per chunk
     */
    public List<UUID> indexDocument(KnowledgeDocument document) {
        Map<String, Object> metadata = new HashMap<>(document.metadata());
        metadata.put(IndexMetadata.DOCUMENT_PATH, document.source());
        return write(document.source(), document.text(), document.category(),
                document.createdDate(), document.updatedDate(), document.expiresDate(), metadata);
    }

    private List<UUID> write(String sourceId, String text, String category, LocalDate created, LocalDate updated,
                             LocalDate expires, Map<String, Object> metadata) {
        List<ChunkSpan> spans = chunkingEngine.chunk(text,
                properties.getChunk().getMaxSize(), properties.getChunk().getOverlap());

        List<UUID> ids = new ArrayList<>(spans.size());
        for (ChunkSpan span : spans) {
            String content = span.content();
            Chunk chunk = new Chunk(span.index(), sourceId,
                    span.sectionTitle().isEmpty() ? null : span.sectionTitle(),
                    content, category, created, updated, expires, hashService.computeHash(content));

            float[] vector = embedder.embed(content);

            writeLock.lock();
            try {
                ids.add(vectorIndex.upsert(chunk, vector, metadata));
            } finally {
                writeLock.unlock();
            }
        }
        return ids;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, Object value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
