package com.reelindex.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EmbeddingUtilsTest {

    @Test
    void bytesAreLittleEndianFloats() {
        byte[] bytes = EmbeddingUtils.toBytes(new float[]{1.0f});

        // 1.0f = 0x3F800000
        assertThat(bytes).containsExactly(0x00, 0x00, (byte) 0x80, 0x3F);
        assertThat(EmbeddingUtils.fromBytes(bytes)).containsExactly(1.0f);
    }

    @Test
    void nullPassesThrough() {
        assertThat(EmbeddingUtils.toBytes(null)).isNull();
        assertThat(EmbeddingUtils.fromBytes(null)).isNull();
    }

    @Test
    void normalizesToUnitLength() {
        float[] v = EmbeddingUtils.l2Normalize(new float[]{3f, 4f});

        assertThat(v[0]).isCloseTo(0.6f, within(1e-6f));
        assertThat(v[1]).isCloseTo(0.8f, within(1e-6f));
    }

    @Test
    void zeroVectorStaysZero() {
        assertThat(EmbeddingUtils.l2Normalize(new float[]{0f, 0f})).containsExactly(0f, 0f);
    }

    @Test
    void dotRejectsDifferentLengths() {
        assertThatThrownBy(() -> EmbeddingUtils.dot(new float[]{1f}, new float[]{1f, 0f}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cosineDistanceOfOrthogonalUnitVectorsIsOne() {
        assertThat(EmbeddingUtils.cosineDistance(new float[]{1f, 0f}, new float[]{0f, 1f})).isEqualTo(1.0);
        assertThat(EmbeddingUtils.cosineDistance(new float[]{1f, 0f}, new float[]{1f, 0f})).isEqualTo(0.0);
    }

    @Test
    void centroidIsNormalizedMean() {
        float[] c = EmbeddingUtils.normalizedCentroid(List.of(new float[]{2f, 0f}, new float[]{0f, 2f}));

        assertThat(c[0]).isCloseTo((float) Math.sqrt(0.5), within(1e-6f));
        assertThat(c[1]).isCloseTo((float) Math.sqrt(0.5), within(1e-6f));
        assertThatThrownBy(() -> EmbeddingUtils.normalizedCentroid(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
