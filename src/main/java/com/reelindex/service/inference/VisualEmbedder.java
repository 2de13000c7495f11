package com.reelindex.service.inference;

import java.nio.file.Path;

/**
 * Joint image/text embedding space. Both methods return unit vectors of
 * {@link #modelInfo()}'s dimension, so an image and a text can be compared
 * with a plain dot product.
 */
public interface VisualEmbedder {

    boolean isAvailable();

    ModelInfo modelInfo();

    /** @throws InferenceException if the model is not loaded or the image cannot be read */
    float[] embedImage(Path image);

    /** @throws InferenceException if the model is not loaded */
    float[] embedText(String text);
}
