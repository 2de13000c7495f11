package com.reelindex.service.inference;

import java.nio.file.Path;
import java.util.List;

public interface SpeechTranscriber {

    boolean isAvailable();

    /**
     * Transcribes a 16 kHz mono WAV file.
     *
     * @throws InferenceException when the model cannot be reached
     */
    List<TranscriptSegment> transcribe(Path wav);
}
