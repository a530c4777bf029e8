package com.adlanda.channelknowledge.exception;

/**
 * The vector index cannot be reached. Searches surface this instead of returning
 * an empty result, and the sync phase stops at the first occurrence.
 */
public class IndexUnavailableException extends RuntimeException {

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public static IndexUnavailableException during(String operation, Throwable cause) {
        return new IndexUnavailableException("Vector index unavailable during " + operation + ": " + cause.getMessage(), cause);
    }
}
