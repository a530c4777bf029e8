package com.adlanda.channelknowledge.service;

/**
 * Turns text into an embedding vector.
 *
 * Implementations throw {@link com.adlanda.channelknowledge.exception.EmbeddingException}
 * rather than return an empty or all-zero vector.
 */
public interface Embedder {

    float[] embed(String text);
}
