package com.reelindex.util;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw density-cluster labels into the persisted form: dense ids ranked
 * by descending cluster size, and a per-member cosine distance to the
 * cluster's normalized centroid.
 */
public final class ClusterRanking {

    /** Order value for noise; larger than any cosine distance between unit vectors. */
    public static final double NOISE_ORDER = 999.0;

    private ClusterRanking() {
    }

    public record Assignment(int clusterId, double order) {
    }

    public static List<Assignment> rank(List<float[]> vectors, int[] rawLabels) {
        if (vectors.size() != rawLabels.length) {
            throw new IllegalArgumentException("Expected one label per vector");
        }

        Map<Integer, List<Integer>> members = new LinkedHashMap<>();
        for (int i = 0; i < rawLabels.length; i++) {
            if (rawLabels[i] != Hdbscan.NOISE) {
                members.computeIfAbsent(rawLabels[i], k -> new ArrayList<>()).add(i);
            }
        }

        // largest first; equal sizes keep raw label order
        List<Integer> ranked = new ArrayList<>(members.keySet());
        ranked.sort(Comparator.<Integer>comparingInt(label -> members.get(label).size()).reversed()
                .thenComparingInt(label -> label));

        List<Assignment> out = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            out.add(new Assignment(Hdbscan.NOISE, NOISE_ORDER));
        }
        for (int newId = 0; newId < ranked.size(); newId++) {
            List<Integer> indexes = members.get(ranked.get(newId));
            List<float[]> clusterVectors = new ArrayList<>(indexes.size());
            for (int idx : indexes) {
                clusterVectors.add(vectors.get(idx));
            }
            float[] centroid = EmbeddingUtils.normalizedCentroid(clusterVectors);
            for (int idx : indexes) {
                out.set(idx, new Assignment(newId, EmbeddingUtils.cosineDistance(vectors.get(idx), centroid)));
            }
        }
        return out;
    }
}
