package com.adlanda.channelknowledge.model;

import java.time.LocalDate;

/**
 * A single retrieved piece of context with its attribution.
 *
 * @param content     chunk text
 * @param source      source id (channel or knowledge-base path)
 * @param sourceTitle display name of the source, when known
 * @param category    content category
 * @param chunkIndex  position of the chunk within its source
 * @param similarity  raw cosine similarity
 * @param score       ranking score including the freshness bonus
 * @param freshness   human-readable age, e.g. "3 days ago"
 * @param updatedDate last update date of the underlying content
 */
public record Snippet(
        String content,
        String source,
        String sourceTitle,
        String category,
        int chunkIndex,
        double similarity,
        double score,
        String freshness,
        LocalDate updatedDate
) {

    public static Snippet from(SearchHit hit, LocalDate today) {
        Chunk chunk = hit.chunk();
        return new Snippet(
                chunk.content(),
                chunk.sourceId(),
                IndexMetadata.sourceTitle(hit.metadata()).orElse(chunk.sourceId()),
                chunk.category(),
                chunk.index(),
                hit.similarity(),
                hit.score(),
                Freshness.describe(chunk.updatedDate(), hit.expired(), today),
                chunk.updatedDate()
        );
    }
}
