package com.adlanda.channelknowledge.model;

/**
 * Immutable view of a channel handed to worker threads.
 */
public record ChannelRef(long channelId, String username, String title, String styleCategory) {

    public String sourceId() {
        return "channel:" + channelId;
    }

    public String displayTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return username != null ? "@" + username : sourceId();
    }
}
