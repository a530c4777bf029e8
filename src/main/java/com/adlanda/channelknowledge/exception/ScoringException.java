package com.adlanda.channelknowledge.exception;

/**
 * Raised when a post cannot be scored. The item is marked as failed and skipped.
 */
public class ScoringException extends RuntimeException {

    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ScoringException forItem(long channelId, long messageId, Throwable cause) {
        return new ScoringException(
                String.format("Failed to score message %d of channel %d: %s", messageId, channelId, cause.getMessage()),
                cause);
    }
}
