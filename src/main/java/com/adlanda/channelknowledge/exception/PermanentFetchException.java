package com.adlanda.channelknowledge.exception;

/**
 * The channel no longer exists or is not accessible. The channel is flagged for an
 * operator but stays active.
 */
public class PermanentFetchException extends ChannelFetchException {

    public PermanentFetchException(long channelId, String message) {
        super(channelId, message, null);
    }

    public PermanentFetchException(long channelId, String message, Throwable cause) {
        super(channelId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
