package com.reelindex.service.media;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface ShotDetector {

    /**
     * Returns the timestamps (seconds, ascending) at which a new shot starts.
     * An empty list means no cut was found.
     */
    List<Double> detectCuts(Path video, double threshold) throws IOException;
}
