package com.reelindex.util;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Vector helpers shared by the enrichment stages, the cluster post-processor
 * and the search engine. Vectors are persisted as little-endian float32 BLOBs.
 */
public final class EmbeddingUtils {

    private EmbeddingUtils() {
    }

    /**
     * Converts a float array to a byte array (4 bytes per float, little-endian).
     */
    public static byte[] toBytes(float[] floats) {
        if (floats == null)
            return null;
        ByteBuffer buffer = ByteBuffer.allocate(floats.length * Float.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN);
        for (float f : floats) {
            buffer.putFloat(f);
        }
        return buffer.array();
    }

    /**
     * Converts a stored BLOB back to a float array.
     */
    public static float[] fromBytes(byte[] bytes) {
        if (bytes == null)
            return null;
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        float[] floats = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < floats.length; i++) {
            floats[i] = buffer.getFloat();
        }
        return floats;
    }

    /**
     * L2-normalizes a vector in place. A zero vector is returned unchanged.
     */
    public static float[] l2Normalize(float[] vector) {
        double sumOfSquares = 0.0;
        for (float v : vector) {
            sumOfSquares += (double) v * v;
        }
        double magnitude = Math.sqrt(sumOfSquares);
        if (magnitude < 1e-10) {
            return vector;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / magnitude);
        }
        return vector;
    }

    /**
     * Plain dot product. For unit vectors this is the cosine similarity, so
     * the result lies in [-1, 1].
     */
    public static double dot(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors must have the same length: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot;
    }

    /**
     * Cosine distance {@code 1 - dot(a, b)} for unit vectors, in [0, 2].
     */
    public static double cosineDistance(float[] a, float[] b) {
        return 1.0 - dot(a, b);
    }

    public static double euclidean(float[] a, float[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = (double) a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /**
     * Mean of the given vectors, re-normalized to unit length.
     */
    public static float[] normalizedCentroid(List<float[]> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute centroid of zero vectors");
        }
        int dim = vectors.get(0).length;
        double[] sum = new double[dim];
        for (float[] v : vectors) {
            for (int i = 0; i < dim; i++) {
                sum[i] += v[i];
            }
        }
        float[] centroid = new float[dim];
        for (int i = 0; i < dim; i++) {
            centroid[i] = (float) (sum[i] / vectors.size());
        }
        return l2Normalize(centroid);
    }
}
