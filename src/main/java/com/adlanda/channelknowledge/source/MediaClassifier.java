package com.adlanda.channelknowledge.source;

import com.adlanda.channelknowledge.model.MediaType;

import java.util.Locale;

/**
 * Maps the bridge's media descriptor onto {@link MediaType}. This is the only place
 * where raw media descriptors are inspected.
 */
public final class MediaClassifier {

    private MediaClassifier() {
    }

    /**
     * @return the media type, or null when the message carries no media
     */
    public static MediaType classify(ChannelMessagePayload.MediaPayload media) {
        if (media == null || media.type() == null || media.type().isBlank()) {
            return null;
        }
        String type = media.type().toLowerCase(Locale.ROOT);
        String mime = media.mimeType() != null ? media.mimeType().toLowerCase(Locale.ROOT) : "";

        if (type.contains("photo")) {
            return MediaType.PHOTO;
        }
        if (type.contains("document")) {
            if (media.voice() || mime.startsWith("audio/ogg")) {
                return MediaType.VOICE;
            }
            if (mime.startsWith("video/")) {
                return media.round() ? MediaType.VIDEO_NOTE : MediaType.VIDEO;
            }
            return MediaType.DOCUMENT;
        }
        if (type.contains("video")) {
            return media.round() ? MediaType.VIDEO_NOTE : MediaType.VIDEO;
        }
        if (type.contains("voice")) {
            return MediaType.VOICE;
        }
        return MediaType.OTHER;
    }
}
