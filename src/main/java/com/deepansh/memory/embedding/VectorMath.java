package com.deepansh.memory.embedding;

import java.util.ArrayList;
import java.util.List;

public final class VectorMath {

    private VectorMath() {}

    /** 0.0 for mismatched dimensions or zero vectors. */
    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot   += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        return (normA == 0 || normB == 0) ? 0.0 : dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static double cosineSimilarity(float[] a, List<Double> b) {
        return cosineSimilarity(a, toFloatArray(b));
    }

    public static float[] toFloatArray(List<Double> list) {
        if (list == null) return null;
        float[] arr = new float[list.size()];
        for (int i = 0; i < list.size(); i++) arr[i] = list.get(i).floatValue();
        return arr;
    }

    public static List<Double> toDoubleList(float[] arr) {
        if (arr == null) return null;
        List<Double> result = new ArrayList<>(arr.length);
        for (float v : arr) result.add((double) v);
        return result;
    }
}
