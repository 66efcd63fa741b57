package com.deepansh.memory.support;

import com.deepansh.memory.embedding.EmbeddingClient;
import com.deepansh.memory.exception.EmbeddingUnavailableException;

import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deterministic embeddings for tests. Registered texts get the given vector
 * (padded to DIMENSIONS); anything else gets a pseudo-random unit-ish vector
 * seeded by the text, which is nearly orthogonal to everything else.
 */
public class FakeEmbeddingClient implements EmbeddingClient {

    public static final int DIMENSIONS = 64;
    public static final String MODEL = "test-embedding";

    private final Map<String, float[]> vectors = new ConcurrentHashMap<>();
    private volatile boolean unavailable;
    private volatile String model = MODEL;

    public FakeEmbeddingClient register(String text, float... leading) {
        vectors.put(text, pad(leading));
        return this;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public void setModel(String model) {
        this.model = model;
    }

    @Override
    public float[] embed(String text) {
        if (unavailable) {
            throw new EmbeddingUnavailableException("embedding provider down");
        }
        float[] known = vectors.get(text);
        return known != null ? known.clone() : random(text);
    }

    @Override
    public String modelName() {
        return model;
    }

    public static float[] pad(float... leading) {
        float[] v = new float[DIMENSIONS];
        System.arraycopy(leading, 0, v, 0, Math.min(leading.length, DIMENSIONS));
        return v;
    }

    private float[] random(String text) {
        Random random = new Random(text.hashCode());
        float[] v = new float[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) v[i] = (float) random.nextGaussian();
        return v;
    }
}
