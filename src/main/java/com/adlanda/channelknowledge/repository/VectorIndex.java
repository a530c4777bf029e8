package com.adlanda.channelknowledge.repository;

import com.adlanda.channelknowledge.model.Chunk;
import com.adlanda.channelknowledge.model.IndexQuery;
import com.adlanda.channelknowledge.model.SearchHit;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Stores embedded chunks and answers similarity queries.
 *
 * <p>Implementations keep at most one entry per (source, content hash) and per
 * (channel id, message id, chunk index). Upserting a duplicate merges the new
 * metadata into the existing entry instead of inserting.</p>
 *
 * <p>Every operation throws {@link com.adlanda.channelknowledge.exception.IndexUnavailableException}
 * when the backing store cannot be reached. A search never hides an outage behind
 * an empty result.</p>
 */
public interface VectorIndex {

    /**
     * Inserts the chunk, or merges metadata into the entry it duplicates.
     *
     * @return id of the inserted or existing entry
     */
    UUID upsert(Chunk chunk, float[] vector, Map<String, Object> metadata);

    /**
     * Hits at or above the minimum similarity, ranked and limited to {@code query.topK()}.
     */
    List<SearchHit> search(IndexQuery query);

    /**
     * Removes every entry whose expiry date is before today.
     *
     * @return number of entries removed
     */
    int expire();

    boolean delete(UUID id);

    int deleteBySource(String source);

    long size();

    /**
     * Entry counts keyed by category. Entries without a category are reported as "uncategorized".
     */
    Map<String, Long> countByCategory();
}
