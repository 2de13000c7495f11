package com.reelindex.service.enrichment;

import com.reelindex.entity.SceneEntity;
import com.reelindex.service.SceneCatalogService;
import com.reelindex.service.inference.InferenceException;
import com.reelindex.service.inference.TranscriptEmbedder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TranscriptEmbeddingStage implements ModalityStage {

    private static final Logger log = LoggerFactory.getLogger(TranscriptEmbeddingStage.class);

    private final TranscriptEmbedder embedder;
    private final SceneCatalogService sceneCatalog;

    public TranscriptEmbeddingStage(TranscriptEmbedder embedder, SceneCatalogService sceneCatalog) {
        this.embedder = embedder;
        this.sceneCatalog = sceneCatalog;
    }

    @Override
    public Modality modality() {
        return Modality.TRANSCRIPT_EMBEDDING;
    }

    @Override
    public boolean isAvailable() {
        return embedder.isAvailable();
    }

    @Override
    public String name() {
        return "transcript_embedding";
    }

    @Override
    public void run(EnrichmentContext context) {
        List<SceneEntity> withText = context.getScenes().stream()
                .filter(s -> s.getTranscript() != null && !s.getTranscript().isBlank())
                .toList();
        if (withText.isEmpty()) {
            return;
        }
        if (!embedder.isAvailable()) {
            throw new InferenceException("Transcript embedding service not configured");
        }
        int embedded = 0;
        for (SceneEntity scene : withText) {
            try {
                sceneCatalog.upsertEmbedding(scene.getId(), embedder.modelInfo(), embedder.embed(scene.getTranscript()));
                embedded++;
            } catch (RuntimeException e) {
                log.warn("Transcript embedding failed for scene {}: {}", scene.getId(), e.getMessage());
            }
        }
        log.info("{}: embedded {} of {} transcript(s)", context.getFile().getFilename(), embedded, withText.size());
    }
}
