package com.reelindex.service.media;

import com.reelindex.exception.MediaProbeException;

import java.nio.file.Path;

/**
 * Reads container and stream metadata without decoding the file.
 */
public interface MediaProbe {

    /**
     * @throws MediaProbeException when the file is unreadable or not a
     *                             decodable video
     */
    VideoMetadata probe(Path video) throws MediaProbeException;
}
