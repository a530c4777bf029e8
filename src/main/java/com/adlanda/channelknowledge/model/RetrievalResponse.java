package com.adlanda.channelknowledge.model;

import java.util.List;

/**
 * Response from the query endpoint.
 *
 * @param snippets     matched snippets, best first
 * @param totalEntries number of entries in the index
 * @param queryTimeMs  time taken to process the query in milliseconds
 */
public record RetrievalResponse(
        List<Snippet> snippets,
        long totalEntries,
        long queryTimeMs
) {}
