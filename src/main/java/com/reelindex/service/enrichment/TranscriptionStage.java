package com.reelindex.service.enrichment;

import com.reelindex.entity.SceneEntity;
import com.reelindex.service.SceneCatalogService;
import com.reelindex.service.inference.InferenceException;
import com.reelindex.service.inference.SpeechTranscriber;
import com.reelindex.service.inference.TranscriptSegment;
import com.reelindex.service.media.AudioExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Transcribes the file's speech once and gives every scene the text of the
 * segments overlapping its span. Files without an audio track are skipped.
 */
@Component
public class TranscriptionStage implements ModalityStage {

    private static final Logger log = LoggerFactory.getLogger(TranscriptionStage.class);

    private final AudioExtractor audioExtractor;
    private final SpeechTranscriber transcriber;
    private final SceneCatalogService sceneCatalog;

    public TranscriptionStage(AudioExtractor audioExtractor,
            SpeechTranscriber transcriber,
            SceneCatalogService sceneCatalog) {
        this.audioExtractor = audioExtractor;
        this.transcriber = transcriber;
        this.sceneCatalog = sceneCatalog;
    }

    @Override
    public Modality modality() {
        return Modality.TRANSCRIPTION;
    }

    @Override
    public boolean isAvailable() {
        return transcriber.isAvailable();
    }

    @Override
    public String name() {
        return "transcription";
    }

    @Override
    public void run(EnrichmentContext context) throws IOException {
        Integer audioTracks = context.getFile().getAudioTracks();
        if (audioTracks != null && audioTracks == 0) {
            log.info("{}: no audio track, skipping transcription", context.getFile().getFilename());
            return;
        }
        if (!transcriber.isAvailable()) {
            throw new InferenceException("Speech transcription service not configured");
        }

        List<TranscriptSegment> segments;
        Path wav = Files.createTempFile("reelindex-", ".wav");
        try {
            audioExtractor.extractSpeechAudio(context.getPath(), wav);
            segments = transcriber.transcribe(wav);
        } finally {
            Files.deleteIfExists(wav);
        }

        Map<Long, String> transcripts = assign(context.getScenes(), segments);
        sceneCatalog.saveTranscripts(transcripts);
        for (SceneEntity scene : context.getScenes()) {
            scene.setTranscript(transcripts.get(scene.getId()));
        }
        log.info("{}: {} segment(s) across {} scene(s)", context.getFile().getFilename(), segments.size(),
                transcripts.size());
    }

    /**
     * Joins with single spaces the text of every segment that overlaps each
     * scene. Scenes with no overlapping speech are left out.
     */
    static Map<Long, String> assign(List<SceneEntity> scenes, List<TranscriptSegment> segments) {
        Map<Long, String> result = new LinkedHashMap<>();
        for (SceneEntity scene : scenes) {
            String text = segments.stream()
                    .filter(s -> s.overlaps(scene.getStartTc(), scene.getEndTc()))
                    .map(s -> s.text() == null ? "" : s.text().trim())
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.joining(" "));
            if (!text.isEmpty()) {
                result.put(scene.getId(), text);
            }
        }
        return result;
    }
}
