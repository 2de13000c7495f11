package com.reelindex.service.inference;

import com.reelindex.config.AppConfig;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Whisper transcription through the inference sidecar. The WAV file is posted
 * as the raw request body to {@code /transcribe}; the answer is
 * {@code {"segments": [{"start": s, "end": s, "text": "..."}]}}.
 */
@Component
public class SidecarSpeechTranscriber implements SpeechTranscriber {

    private static final MediaType AUDIO_WAV = MediaType.parseMediaType("audio/wav");

    private final RestClient restClient;
    private final AppConfig appConfig;

    public SidecarSpeechTranscriber(RestClient inferenceRestClient, AppConfig appConfig) {
        this.restClient = inferenceRestClient;
        this.appConfig = appConfig;
    }

    record Segment(Double start, Double end, String text) {
    }

    record TranscribeResponse(List<Segment> segments) {
    }

    @Override
    public boolean isAvailable() {
        return appConfig.getInference().isEnabled();
    }

    @Override
    public List<TranscriptSegment> transcribe(Path wav) {
        if (!isAvailable()) {
            throw new InferenceException("Inference sidecar not configured");
        }
        TranscribeResponse response;
        try {
            response = restClient.post()
                    .uri("/transcribe")
                    .contentType(AUDIO_WAV)
                    .body(new FileSystemResource(wav))
                    .retrieve()
                    .body(TranscribeResponse.class);
        } catch (RestClientException e) {
            throw new InferenceException("Transcription request failed: " + e.getMessage(), e);
        }
        List<TranscriptSegment> segments = new ArrayList<>();
        if (response == null || response.segments() == null) {
            return segments;
        }
        for (Segment s : response.segments()) {
            if (s.start() == null || s.end() == null || s.text() == null || s.text().isBlank()) {
                continue;
            }
            segments.add(new TranscriptSegment(s.start(), s.end(), s.text().trim()));
        }
        return segments;
    }
}
