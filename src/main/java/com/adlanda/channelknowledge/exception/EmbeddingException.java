package com.adlanda.channelknowledge.exception;

/**
 * Signals that the embedding provider failed or returned an unusable vector.
 *
 * <p>Thrown instead of returning an empty or all-zero vector so that nothing
 * meaningless is ever written to the index.</p>
 */
public class EmbeddingException extends RuntimeException {

    /**
     * @param message explanation of the embedding failure
     */
    public EmbeddingException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the embedding failure
     * @param cause   underlying exception from the provider call
     */
    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
