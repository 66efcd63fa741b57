package com.deepansh.memory.embedding;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VectorMathTest {

    @Test
    void cosineSimilarity_basicCases() {
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 2, 3}, new float[]{2, 4, 6})).isCloseTo(1.0, within(1e-6));
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 0}, new float[]{0, 1})).isEqualTo(0.0);
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 0}, new float[]{-1, 0})).isCloseTo(-1.0, within(1e-6));
    }

    @Test
    void cosineSimilarity_mismatchedOrDegenerateVectors_isZero() {
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 0}, new float[]{1, 0, 0})).isEqualTo(0.0);
        assertThat(VectorMath.cosineSimilarity(new float[]{0, 0}, new float[]{1, 0})).isEqualTo(0.0);
        assertThat(VectorMath.cosineSimilarity(new float[]{1, 0}, (List<Double>) null)).isEqualTo(0.0);
    }

    @Test
    void conversions_preserveValues() {
        List<Double> list = VectorMath.toDoubleList(new float[]{0.25f, -1f});

        assertThat(list).containsExactly(0.25, -1.0);
        assertThat(VectorMath.toFloatArray(list)).containsExactly(0.25f, -1f);
    }
}
