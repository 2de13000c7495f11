package com.reelindex.service.inference;

/**
 * Sentence embedding space for transcripts, separate from the visual space.
 */
public interface TranscriptEmbedder {

    boolean isAvailable();

    ModelInfo modelInfo();

    /** @throws InferenceException when the model cannot be reached */
    float[] embed(String text);
}
