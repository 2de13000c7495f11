package com.reelindex.service.media;

import java.io.IOException;
import java.nio.file.Path;

public interface AudioExtractor {

    /** Decodes the first audio track to 16 kHz mono 16-bit PCM WAV. */
    void extractSpeechAudio(Path video, Path wavTarget) throws IOException;
}
