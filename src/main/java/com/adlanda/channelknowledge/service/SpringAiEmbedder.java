package com.adlanda.channelknowledge.service;

import com.adlanda.channelknowledge.exception.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Embedder backed by Spring AI's {@link EmbeddingModel} (OpenAI in the default setup).
 */
@Service
public class SpringAiEmbedder implements Embedder {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbedder.class);

    private final EmbeddingModel embeddingModel;

    public SpringAiEmbedder(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    /**
     * Generates an embedding vector for the given text.
     *
     * @throws EmbeddingException if the text is blank, the provider call fails, or the
     *                            provider answers with an empty or all-zero vector
     */
    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text");
        }

        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(List.of(text));
        } catch (RuntimeException e) {
            log.warn("Embedding provider call failed: {}", e.getMessage());
            throw new EmbeddingException("Embedding provider call failed: " + e.getMessage(), e);
        }

        List<Embedding> results = response != null ? response.getResults() : List.of();
        float[] vector = results.isEmpty() || results.get(0) == null ? null : results.get(0).getOutput();
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding provider returned no vector");
        }
        if (isZero(vector)) {
            throw new EmbeddingException("Embedding provider returned an all-zero vector");
        }
        return vector;
    }

    private static boolean isZero(float[] vector) {
        for (float value : vector) {
            if (value != 0.0f) {
                return false;
            }
        }
        return true;
    }
}
