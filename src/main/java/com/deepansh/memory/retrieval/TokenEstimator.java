package com.deepansh.memory.retrieval;

/**
 * Rough token count: four characters per token plus a fixed per-item overhead
 * for the framing around each entry.
 */
public final class TokenEstimator {

    static final int PER_ITEM_OVERHEAD = 4;

    private TokenEstimator() {}

    public static int estimate(String text) {
        int length = text == null ? 0 : text.length();
        return (int) Math.ceil(length / 4.0) + PER_ITEM_OVERHEAD;
    }
}
