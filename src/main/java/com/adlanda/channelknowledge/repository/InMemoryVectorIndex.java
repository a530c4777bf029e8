package com.adlanda.channelknowledge.repository;

import com.adlanda.channelknowledge.model.Chunk;
import com.adlanda.channelknowledge.model.IndexEntry;
import com.adlanda.channelknowledge.model.IndexMetadata;
import com.adlanda.channelknowledge.model.IndexQuery;
import com.adlanda.channelknowledge.model.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Vector index held in memory.
 *
 * Used for local runs without PostgreSQL and in tests. Writes are synchronized;
 * reads work on a snapshot of the entry map.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private final Map<UUID, IndexEntry> entries = new ConcurrentHashMap<>();
    private final FreshnessRanker ranker;
    private final Clock clock;

    public InMemoryVectorIndex(FreshnessRanker ranker, Clock clock) {
        this.ranker = ranker;
        this.clock = clock;
    }

    @Override
    public synchronized UUID upsert(Chunk chunk, float[] vector, Map<String, Object> metadata) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Cannot store chunk without embedding");
        }
        Map<String, Object> safeMetadata = metadata == null ? Map.of() : metadata;

        Optional<IndexEntry> duplicate = findDuplicate(chunk, safeMetadata);
        if (duplicate.isPresent()) {
            IndexEntry existing = duplicate.get();
            Map<String, Object> merged = new HashMap<>(existing.metadata());
            merged.putAll(safeMetadata);
            Chunk kept = existing.chunk();
            if (chunk.updatedDate().isAfter(kept.updatedDate())) {
                kept = kept.withUpdatedDate(chunk.updatedDate());
            }
            entries.put(existing.id(), new IndexEntry(existing.id(), kept, existing.vector(), merged));
            log.debug("Merged duplicate chunk {} of {} into entry {}", chunk.index(), chunk.sourceId(), existing.id());
            return existing.id();
        }

        UUID id = UUID.randomUUID();
        entries.put(id, new IndexEntry(id, chunk, vector.clone(), safeMetadata));
        return id;
    }

    /**
     * Ranks stored entries against the query vector. Entries embedded with a different
     * dimension than the query are left out.
     */
    @Override
    public List<SearchHit> search(IndexQuery query) {
        int dimension = query.vector().length;
        List<IndexEntry> snapshot = List.copyOf(entries.values());
        List<IndexEntry> comparable = snapshot.stream()
                .filter(entry -> entry.vector().length == dimension)
                .toList();
        int skipped = snapshot.size() - comparable.size();
        if (skipped > 0) {
            log.warn("Skipped {} entries whose embedding dimension differs from the query ({})", skipped, dimension);
        }
        List<FreshnessRanker.Candidate> candidates = comparable.stream()
                .map(entry -> new FreshnessRanker.Candidate(entry.id(), entry.chunk(), entry.metadata(),
                        cosineSimilarity(query.vector(), entry.vector())))
                .toList();
        return ranker.rank(candidates, query, today());
    }

    @Override
    public synchronized int expire() {
        LocalDate today = today();
        List<UUID> expired = entries.values().stream()
                .filter(entry -> entry.chunk().isExpired(today))
                .map(IndexEntry::id)
                .toList();
        expired.forEach(entries::remove);
        if (!expired.isEmpty()) {
            log.info("Removed {} expired entries", expired.size());
        }
        return expired.size();
    }

    @Override
    public synchronized boolean delete(UUID id) {
        return entries.remove(id) != null;
    }

    @Override
    public synchronized int deleteBySource(String source) {
        List<UUID> matching = entries.values().stream()
                .filter(entry -> entry.chunk().sourceId().equals(source))
                .map(IndexEntry::id)
                .toList();
        matching.forEach(entries::remove);
        return matching.size();
    }

    @Override
    public long size() {
        return entries.size();
    }

    @Override
    public Map<String, Long> countByCategory() {
        Map<String, Long> counts = new TreeMap<>();
        for (IndexEntry entry : entries.values()) {
            String category = entry.chunk().category() != null ? entry.chunk().category() : "uncategorized";
            counts.merge(category, 1L, Long::sum);
        }
        return counts;
    }

    /**
     * Snapshot of one entry, for inspection.
     */
    public Optional<IndexEntry> get(UUID id) {
        return Optional.ofNullable(entries.get(id));
    }

    /**
     * Entries written for one channel post.
     */
    public List<IndexEntry> findByMessage(long channelId, long messageId) {
        return entries.values().stream()
                .filter(entry -> IndexMetadata.channelId(entry.metadata()).orElse(-1L) == channelId
                        && IndexMetadata.messageId(entry.metadata()).orElse(-1L) == messageId)
                .toList();
    }

    public void clear() {
        entries.clear();
    }

    private Optional<IndexEntry> findDuplicate(Chunk chunk, Map<String, Object> metadata) {
        if (chunk.contentHash() != null) {
            Optional<IndexEntry> byHash = entries.values().stream()
                    .filter(entry -> entry.chunk().sourceId().equals(chunk.sourceId())
                            && chunk.contentHash().equals(entry.chunk().contentHash()))
                    .findFirst();
            if (byHash.isPresent()) {
                return byHash;
            }
        }
        Optional<Long> channelId = IndexMetadata.channelId(metadata);
        Optional<Long> messageId = IndexMetadata.messageId(metadata);
        if (channelId.isEmpty() || messageId.isEmpty()) {
            return Optional.empty();
        }
        return entries.values().stream()
                .filter(entry -> entry.chunk().index() == chunk.index()
                        && Objects.equals(IndexMetadata.channelId(entry.metadata()), channelId)
                        && Objects.equals(IndexMetadata.messageId(entry.metadata()), messageId))
                .findFirst();
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Computes cosine similarity between two vectors.
     *
     * @return similarity in [-1, 1], 0 when either vector has no magnitude
     */
    static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have same dimension");
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) {
            return 0.0;
        }

        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
