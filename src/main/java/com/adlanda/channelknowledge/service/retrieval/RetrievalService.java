package com.adlanda.channelknowledge.service.retrieval;

import com.adlanda.channelknowledge.model.IndexQuery;
import com.adlanda.channelknowledge.model.RetrievalResponse;
import com.adlanda.channelknowledge.model.SearchHit;
import com.adlanda.channelknowledge.model.Snippet;
import com.adlanda.channelknowledge.repository.VectorIndex;
import com.adlanda.channelknowledge.service.Embedder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Service responsible for retrieving relevant context based on a query.
 *
 * Orchestrates the query flow:
 * 1. Embed the query
 * 2. Search the index for twice the requested number of hits
 * 3. Drop hits caught by the relevance denylist
 * 4. Return the best {@code topK} with attribution and freshness
 */
@Service
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final Embedder embedder;
    private final VectorIndex vectorIndex;
    private final RelevanceFilter relevanceFilter;
    private final Clock clock;

    public RetrievalService(Embedder embedder, VectorIndex vectorIndex, RelevanceFilter relevanceFilter, Clock clock) {
        this.embedder = embedder;
        this.vectorIndex = vectorIndex;
        this.relevanceFilter = relevanceFilter;
        this.clock = clock;
    }

    /**
     * @param question the text to search for
     * @param category optional category restriction
     * @param topK     maximum number of snippets
     * @throws com.adlanda.channelknowledge.exception.IndexUnavailableException when the index is down
     * @throws com.adlanda.channelknowledge.exception.EmbeddingException        when the query cannot be embedded
     */
    public RetrievalResponse query(String question, String category, int topK) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1");
        }
        long startTime = System.currentTimeMillis();

        float[] vector = embedder.embed(question);
        List<SearchHit> hits = vectorIndex.search(IndexQuery.of(vector, topK * 2).withCategory(category));

        LocalDate today = LocalDate.now(clock);
        List<Snippet> snippets = hits.stream()
                .filter(hit -> !relevanceFilter.isIrrelevant(hit.chunk().content()))
                .limit(topK)
                .map(hit -> Snippet.from(hit, today))
                .toList();

        long queryTimeMs = System.currentTimeMillis() - startTime;
        log.debug("Query '{}' returned {} snippets ({} candidates) in {}ms",
                truncate(question, 50), snippets.size(), hits.size(), queryTimeMs);

        return new RetrievalResponse(snippets, vectorIndex.size(), queryTimeMs);
    }

    public long getIndexSize() {
        return vectorIndex.size();
    }

    public Map<String, Long> getCategoryCounts() {
        return vectorIndex.countByCategory();
    }

    private String truncate(String s, int maxLen) {
        return s.length() <= maxLen ? s : s.substring(0, maxLen) + "...";
    }
}
