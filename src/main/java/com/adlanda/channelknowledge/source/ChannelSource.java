package com.adlanda.channelknowledge.source;

import com.adlanda.channelknowledge.model.ContentItem;

import java.util.List;

/**
 * Pull access to a channel's post history.
 */
public interface ChannelSource {

    /**
     * Posts newer than {@code sinceMessageId}, at most {@code limit} of them.
     *
     * @param sinceMessageId watermark, or null to read from the latest posts backwards
     * @throws com.adlanda.channelknowledge.exception.TransientFetchException on network, rate-limit or server errors
     * @throws com.adlanda.channelknowledge.exception.PermanentFetchException when the channel is gone or private
     */
    List<ContentItem> fetch(long channelId, Long sinceMessageId, int limit);
}
