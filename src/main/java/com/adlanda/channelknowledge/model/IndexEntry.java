package com.adlanda.channelknowledge.model;

import java.util.Map;
import java.util.UUID;

/**
 * A stored chunk with its embedding and free-form metadata.
 */
public record IndexEntry(UUID id, Chunk chunk, float[] vector, Map<String, Object> metadata) {

    public IndexEntry {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
