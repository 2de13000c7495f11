package com.reelindex.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Density-based hierarchical clustering (HDBSCAN) over euclidean distance
 * with excess-of-mass cluster selection.
 *
 * The algorithm builds a minimum spanning tree over mutual-reachability
 * distances, turns it into a single-linkage hierarchy, condenses that
 * hierarchy so that only splits producing at least {@code minClusterSize}
 * points on both sides open new clusters, and finally selects the most stable
 * clusters. Points that do not belong to any selected cluster are noise.
 *
 * The root of the hierarchy is never selected, so a data set that forms one
 * dense blob with no structure is labelled as noise.
 *
 * Output is deterministic for a given input order: ties in the spanning tree
 * are resolved by point index and edges of equal weight keep their discovery
 * order.
 */
public final class Hdbscan {

    public static final int NOISE = -1;

    private static final double MIN_DISTANCE = 1e-12;

    private final int minClusterSize;
    private final int minSamples;

    public Hdbscan(int minClusterSize, int minSamples) {
        if (minClusterSize < 2) {
            throw new IllegalArgumentException("minClusterSize must be at least 2");
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1");
        }
        this.minClusterSize = minClusterSize;
        this.minSamples = minSamples;
    }

    /**
     * Labels each point with a cluster index {@code 0..k-1} or {@link #NOISE}.
     */
    public int[] cluster(List<float[]> points) {
        int n = points.size();
        int[] labels = new int[n];
        Arrays.fill(labels, NOISE);
        if (n < minClusterSize) {
            return labels;
        }

        double[] core = coreDistances(points);
        List<double[]> edges = minimumSpanningTree(points, core);
        edges.sort(Comparator.comparingDouble(e -> e[2]));

        // single-linkage hierarchy: leaves 0..n-1, merges n..2n-2
        int nodes = 2 * n - 1;
        int[] left = new int[nodes];
        int[] right = new int[nodes];
        double[] mergeDistance = new double[nodes];
        int[] size = new int[nodes];
        Arrays.fill(size, 0, n, 1);
        int[] unionParent = new int[nodes];
        for (int i = 0; i < nodes; i++) {
            unionParent[i] = i;
        }
        for (int i = 0; i < edges.size(); i++) {
            double[] edge = edges.get(i);
            int a = find(unionParent, (int) edge[0]);
            int b = find(unionParent, (int) edge[1]);
            int node = n + i;
            left[node] = a;
            right[node] = b;
            mergeDistance[node] = edge[2];
            size[node] = size[a] + size[b];
            unionParent[a] = node;
            unionParent[b] = node;
        }

        Condensed tree = condense(n, nodes - 1, left, right, mergeDistance, size);
        boolean[] selected = selectClusters(tree);
        return label(n, tree, selected);
    }

    private double[] coreDistances(List<float[]> points) {
        int n = points.size();
        double[] core = new double[n];
        if (minSamples == 1) {
            // the point itself is its first neighbour
            return core;
        }
        int k = Math.min(minSamples, n) - 1;
        double[] distances = new double[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                distances[j] = EmbeddingUtils.euclidean(points.get(i), points.get(j));
            }
            double[] sorted = distances.clone();
            Arrays.sort(sorted);
            core[i] = sorted[k];
        }
        return core;
    }

    /** Prim's algorithm over the dense mutual-reachability graph. Edges are {a, b, weight}. */
    private List<double[]> minimumSpanningTree(List<float[]> points, double[] core) {
        int n = points.size();
        boolean[] inTree = new boolean[n];
        double[] best = new double[n];
        int[] bestFrom = new int[n];
        Arrays.fill(best, Double.POSITIVE_INFINITY);

        List<double[]> edges = new ArrayList<>(n - 1);
        int current = 0;
        inTree[0] = true;
        for (int added = 1; added < n; added++) {
            int next = -1;
            double nextDistance = Double.POSITIVE_INFINITY;
            float[] from = points.get(current);
            for (int j = 0; j < n; j++) {
                if (inTree[j]) {
                    continue;
                }
                double d = Math.max(EmbeddingUtils.euclidean(from, points.get(j)), Math.max(core[current], core[j]));
                if (d < best[j]) {
                    best[j] = d;
                    bestFrom[j] = current;
                }
                if (best[j] < nextDistance) {
                    nextDistance = best[j];
                    next = j;
                }
            }
            inTree[next] = true;
            edges.add(new double[] { bestFrom[next], next, nextDistance });
            current = next;
        }
        return edges;
    }

    private static int find(int[] parent, int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /**
     * Condensed tree. Cluster 0 is the root; children always get larger ids
     * than their parent.
     */
    private static final class Condensed {
        final List<Integer> clusterParent = new ArrayList<>();
        final List<Double> clusterBirth = new ArrayList<>();
        final List<Integer> clusterSize = new ArrayList<>();
        final int[] pointCluster;
        final double[] pointLambda;

        Condensed(int n) {
            pointCluster = new int[n];
            pointLambda = new double[n];
        }

        int newCluster(int parent, double birth, int size) {
            clusterParent.add(parent);
            clusterBirth.add(birth);
            clusterSize.add(size);
            return clusterParent.size() - 1;
        }

        int clusterCount() {
            return clusterParent.size();
        }
    }

    private Condensed condense(int n, int root, int[] left, int[] right, double[] mergeDistance, int[] size) {
        Condensed tree = new Condensed(n);
        int[] clusterOf = new int[left.length];
        clusterOf[root] = tree.newCluster(-1, 0.0, size[root]);

        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int node = queue.poll();
            int cluster = clusterOf[node];
            double lambda = 1.0 / Math.max(mergeDistance[node], MIN_DISTANCE);
            int l = left[node];
            int r = right[node];
            boolean bigLeft = size[l] >= minClusterSize;
            boolean bigRight = size[r] >= minClusterSize;

            if (bigLeft && bigRight) {
                clusterOf[l] = tree.newCluster(cluster, lambda, size[l]);
                clusterOf[r] = tree.newCluster(cluster, lambda, size[r]);
                queue.add(l);
                queue.add(r);
            } else if (bigLeft) {
                clusterOf[l] = cluster;
                queue.add(l);
                dropPoints(tree, r, n, left, right, cluster, lambda);
            } else if (bigRight) {
                clusterOf[r] = cluster;
                queue.add(r);
                dropPoints(tree, l, n, left, right, cluster, lambda);
            } else {
                dropPoints(tree, l, n, left, right, cluster, lambda);
                dropPoints(tree, r, n, left, right, cluster, lambda);
            }
        }
        return tree;
    }

    /** Every leaf under {@code node} leaves {@code cluster} at {@code lambda}. */
    private static void dropPoints(Condensed tree, int node, int n, int[] left, int[] right, int cluster,
            double lambda) {
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (current < n) {
                tree.pointCluster[current] = cluster;
                tree.pointLambda[current] = lambda;
            } else {
                stack.push(right[current]);
                stack.push(left[current]);
            }
        }
    }

    private static boolean[] selectClusters(Condensed tree) {
        int count = tree.clusterCount();
        double[] stability = new double[count];
        for (int p = 0; p < tree.pointCluster.length; p++) {
            int c = tree.pointCluster[p];
            stability[c] += tree.pointLambda[p] - tree.clusterBirth.get(c);
        }
        for (int c = 1; c < count; c++) {
            int parent = tree.clusterParent.get(c);
            stability[parent] += (tree.clusterBirth.get(c) - tree.clusterBirth.get(parent)) * tree.clusterSize.get(c);
        }

        boolean[] selected = new boolean[count];
        double[] subtree = new double[count];
        List<List<Integer>> children = new ArrayList<>(count);
        for (int c = 0; c < count; c++) {
            children.add(new ArrayList<>());
        }
        for (int c = 1; c < count; c++) {
            children.get(tree.clusterParent.get(c)).add(c);
        }

        // bottom-up; the root (cluster 0) is never a candidate
        for (int c = count - 1; c >= 1; c--) {
            double childSum = 0.0;
            for (int child : children.get(c)) {
                childSum += subtree[child];
            }
            if (!children.get(c).isEmpty() && childSum > stability[c]) {
                subtree[c] = childSum;
                selected[c] = false;
            } else {
                subtree[c] = stability[c];
                selected[c] = true;
                deselectDescendants(c, children, selected);
            }
        }
        return selected;
    }

    private static void deselectDescendants(int cluster, List<List<Integer>> children, boolean[] selected) {
        Deque<Integer> stack = new ArrayDeque<>(children.get(cluster));
        while (!stack.isEmpty()) {
            int c = stack.pop();
            selected[c] = false;
            stack.addAll(children.get(c));
        }
    }

    private static int[] label(int n, Condensed tree, boolean[] selected) {
        int[] dense = new int[selected.length];
        Arrays.fill(dense, NOISE);
        int next = 0;
        for (int c = 0; c < selected.length; c++) {
            if (selected[c]) {
                dense[c] = next++;
            }
        }

        int[] labels = new int[n];
        for (int p = 0; p < n; p++) {
            int c = tree.pointCluster[p];
            while (c > 0 && !selected[c]) {
                c = tree.clusterParent.get(c);
            }
            labels[p] = c > 0 ? dense[c] : NOISE;
        }
        return labels;
    }
}
