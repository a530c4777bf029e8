package com.adlanda.channelknowledge.exception;

/**
 * Base type for failures while pulling posts from a channel source.
 *
 * <p>Subclasses tell the orchestrator whether the failure is worth retrying on the
 * next due poll or needs an operator.</p>
 */
public abstract class ChannelFetchException extends RuntimeException {

    private final long channelId;

    protected ChannelFetchException(long channelId, String message, Throwable cause) {
        super(message, cause);
        this.channelId = channelId;
    }

    public long getChannelId() {
        return channelId;
    }

    /**
     * Whether a later poll may succeed without operator action.
     */
    public abstract boolean isRetryable();
}
