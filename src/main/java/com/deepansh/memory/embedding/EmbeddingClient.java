package com.deepansh.memory.embedding;

/**
 * text -> vector of fixed dimensionality.
 */
public interface EmbeddingClient {

    /**
     * @throws com.deepansh.memory.exception.EmbeddingUnavailableException when
     *         the provider cannot produce a vector after retries
     */
    float[] embed(String text);

    /** Identifier of the model producing vectors; reindex compares against it. */
    String modelName();
}
