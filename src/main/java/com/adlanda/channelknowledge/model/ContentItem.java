package com.adlanda.channelknowledge.model;

import java.time.Instant;

/**
 * One post fetched from a monitored channel.
 *
 * Engagement counters are nullable: a source that does not expose them reports null,
 * which scoring treats as zero.
 */
public record ContentItem(
        long channelId,
        long messageId,
        String text,
        Instant postedAt,
        Integer views,
        Integer reactions,
        Integer forwards,
        MediaType mediaType
) {

    public boolean hasMedia() {
        return mediaType != null;
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public int viewsOrZero() {
        return views == null ? 0 : views;
    }

    public int reactionsOrZero() {
        return reactions == null ? 0 : reactions;
    }

    public int forwardsOrZero() {
        return forwards == null ? 0 : forwards;
    }
}
