package com.reelindex.service.media;

import java.nio.file.Path;

public interface FrameExtractor {

    /**
     * Writes the frame at {@code timestampSeconds} to {@code target}.
     *
     * @return true when the image was written; false on any per-still failure
     */
    boolean extractStill(Path video, double timestampSeconds, Path target, StillFormat format);
}
