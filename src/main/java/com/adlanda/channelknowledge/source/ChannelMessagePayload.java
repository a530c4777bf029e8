package com.adlanda.channelknowledge.source;

import com.adlanda.channelknowledge.model.ContentItem;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * JSON shape of one message returned by the channel bridge.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChannelMessagePayload(
        long id,
        String text,
        Instant date,
        Integer views,
        Integer forwards,
        Integer reactions,
        MediaPayload media
) {

    public ContentItem toContentItem(long channelId) {
        return new ContentItem(channelId, id, text, date, views, reactions, forwards, MediaClassifier.classify(media));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MediaPayload(String type, String mimeType, boolean voice, boolean round) {}
}
