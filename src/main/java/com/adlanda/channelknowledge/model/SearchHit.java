package com.adlanda.channelknowledge.model;

import java.util.Map;
import java.util.UUID;

/**
 * One ranked search result.
 *
 * @param similarity raw cosine similarity
 * @param score      similarity plus freshness bonus when recency was preferred
 */
public record SearchHit(
        UUID id,
        Chunk chunk,
        Map<String, Object> metadata,
        double similarity,
        double score,
        boolean expired
) {
}
