package com.reelindex.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ClusterRankingTest {

    @Test
    void largestClusterGetsIdZero() {
        List<float[]> vectors = List.of(
                new float[]{1f, 0f},
                new float[]{0f, 1f},
                new float[]{0f, 1f},
                new float[]{0f, 1f},
                new float[]{1f, 0f});
        // raw label 7 has two members, raw label 3 has three
        int[] raw = {7, 3, 3, 3, 7};

        List<ClusterRanking.Assignment> ranked = ClusterRanking.rank(vectors, raw);

        assertThat(ranked).extracting(ClusterRanking.Assignment::clusterId).containsExactly(1, 0, 0, 0, 1);
    }

    @Test
    void orderIsCosineDistanceToCentroid() {
        float s = (float) Math.sqrt(0.5);
        List<float[]> vectors = List.of(new float[]{1f, 0f}, new float[]{0f, 1f});

        List<ClusterRanking.Assignment> ranked = ClusterRanking.rank(vectors, new int[]{0, 0});

        // centroid is (s, s); both members sit at the same angle from it
        assertThat(ranked.get(0).order()).isCloseTo(1.0 - s, within(1e-6));
        assertThat(ranked.get(1).order()).isCloseTo(1.0 - s, within(1e-6));
    }

    @Test
    void noiseKeepsSentinelOrder() {
        List<ClusterRanking.Assignment> ranked = ClusterRanking.rank(
                List.of(new float[]{1f, 0f}), new int[]{Hdbscan.NOISE});

        assertThat(ranked.get(0).clusterId()).isEqualTo(Hdbscan.NOISE);
        assertThat(ranked.get(0).order()).isEqualTo(ClusterRanking.NOISE_ORDER);
    }

    @Test
    void equalSizesKeepRawLabelOrder() {
        List<float[]> vectors = List.of(
                new float[]{1f, 0f}, new float[]{1f, 0f}, new float[]{0f, 1f}, new float[]{0f, 1f});

        List<ClusterRanking.Assignment> ranked = ClusterRanking.rank(vectors, new int[]{5, 5, 2, 2});

        assertThat(ranked).extracting(ClusterRanking.Assignment::clusterId).containsExactly(1, 1, 0, 0);
    }

    @Test
    void rejectsMismatchedLabels() {
        assertThatThrownBy(() -> ClusterRanking.rank(List.of(new float[]{1f}), new int[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
