package com.reelindex.service.inference;

/**
 * A face found on a still: its unit-length identity vector and its pixel
 * bounding box.
 */
public record DetectedFace(float[] embedding, int x, int y, int width, int height) {
}
