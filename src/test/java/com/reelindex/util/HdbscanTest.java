package com.reelindex.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HdbscanTest {

    private final Hdbscan hdbscan = new Hdbscan(2, 1);

    @Test
    void separatesTwoDenseGroupsAndMarksOutlierAsNoise() {
        List<float[]> points = List.of(
                new float[]{0f, 0f},
                new float[]{0f, 0.1f},
                new float[]{0.1f, 0f},
                new float[]{10f, 10f},
                new float[]{10f, 10.1f},
                new float[]{10.1f, 10f},
                new float[]{50f, -50f});

        int[] labels = hdbscan.cluster(points);

        assertThat(labels[0]).isNotEqualTo(Hdbscan.NOISE);
        assertThat(labels[1]).isEqualTo(labels[0]);
        assertThat(labels[2]).isEqualTo(labels[0]);
        assertThat(labels[3]).isNotEqualTo(Hdbscan.NOISE).isNotEqualTo(labels[0]);
        assertThat(labels[4]).isEqualTo(labels[3]);
        assertThat(labels[5]).isEqualTo(labels[3]);
        assertThat(labels[6]).isEqualTo(Hdbscan.NOISE);
    }

    @Test
    void singleDenseGroupIsNotReportedAsACluster() {
        int[] labels = hdbscan.cluster(List.of(
                new float[]{1.00f, 0.00f},
                new float[]{0.99f, 0.01f},
                new float[]{0.98f, 0.03f}));

        assertThat(labels).containsOnly(Hdbscan.NOISE);
    }

    @Test
    void fewerPointsThanMinimumClusterSizeAreAllNoise() {
        assertThat(hdbscan.cluster(List.of(new float[]{1f, 1f}))).containsExactly(Hdbscan.NOISE);
        assertThat(hdbscan.cluster(List.of())).isEmpty();
    }

    @Test
    void sameInputGivesSameLabels() {
        List<float[]> points = List.of(
                new float[]{0f, 0f}, new float[]{0f, 0.2f},
                new float[]{5f, 5f}, new float[]{5f, 5.2f});

        assertThat(hdbscan.cluster(points)).containsExactly(hdbscan.cluster(points));
    }

    @Test
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> new Hdbscan(1, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Hdbscan(2, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
