package com.adlanda.channelknowledge.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one channel poll.
 *
 * @param items          posts worth staging, oldest first
 * @param newestSeenId   highest message id the source returned before filtering, null when the page was empty
 * @param newestSeenDate latest post date the source returned before filtering
 */
public record PollResult(
        List<ContentItem> items,
        Long newestSeenId,
        Instant newestSeenDate
) {

    public PollResult {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static PollResult empty() {
        return new PollResult(List.of(), null, null);
    }
}
