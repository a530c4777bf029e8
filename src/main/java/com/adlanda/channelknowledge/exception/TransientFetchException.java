package com.adlanda.channelknowledge.exception;

/**
 * Network trouble, rate limiting or a server-side error at the channel source.
 * The channel is retried on its next due poll.
 */
public class TransientFetchException extends ChannelFetchException {

    public TransientFetchException(long channelId, String message) {
        super(channelId, message, null);
    }

    public TransientFetchException(long channelId, String message, Throwable cause) {
        super(channelId, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
