package com.reelindex.service.inference;

import java.nio.file.Path;
import java.util.List;

public interface FaceAnalyzer {

    boolean isAvailable();

    /** @throws InferenceException when the model cannot be reached */
    List<DetectedFace> detectFaces(Path image);
}
