package com.adlanda.channelknowledge.model;

import java.util.Map;
import java.util.Optional;

/**
 * Metadata keys shared by the indexing and retrieval paths.
 */
public final class IndexMetadata {

    public static final String CHANNEL_ID = "channel_id";
    public static final String MESSAGE_ID = "message_id";
    public static final String SOURCE_TITLE = "source_title";
    public static final String CHANNEL_USERNAME = "channel_username";
    public static final String VIEWS = "views";
    public static final String REACTIONS = "reactions";
    public static final String FORWARDS = "forwards";
    public static final String QUALITY_SCORE = "quality_score";
    public static final String TONE = "tone";
    public static final String MEDIA_TYPE = "media_type";
    public static final String POSTED_AT = "posted_at";
    public static final String DOCUMENT_PATH = "document_path";

    private IndexMetadata() {
    }

    public static Optional<Long> channelId(Map<String, Object> metadata) {
        return asLong(metadata.get(CHANNEL_ID));
    }

    public static Optional<Long> messageId(Map<String, Object> metadata) {
        return asLong(metadata.get(MESSAGE_ID));
    }

    public static Optional<String> sourceTitle(Map<String, Object> metadata) {
        Object value = metadata.get(SOURCE_TITLE);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    private static Optional<Long> asLong(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
