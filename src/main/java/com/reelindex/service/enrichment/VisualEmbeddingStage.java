package com.reelindex.service.enrichment;

import com.reelindex.entity.SceneEntity;
import com.reelindex.service.SceneCatalogService;
import com.reelindex.service.inference.InferenceException;
import com.reelindex.service.inference.VisualEmbedder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;

/**
 * Embeds each scene's poster into the joint image/text space. A poster that
 * cannot be embedded is logged and skipped.
 */
@Component
public class VisualEmbeddingStage implements ModalityStage {

    private static final Logger log = LoggerFactory.getLogger(VisualEmbeddingStage.class);

    private final VisualEmbedder embedder;
    private final SceneCatalogService sceneCatalog;

    public VisualEmbeddingStage(VisualEmbedder embedder, SceneCatalogService sceneCatalog) {
        this.embedder = embedder;
        this.sceneCatalog = sceneCatalog;
    }

    @Override
    public Modality modality() {
        return Modality.VISUAL;
    }

    @Override
    public boolean isAvailable() {
        return embedder.isAvailable();
    }

    @Override
    public String name() {
        return "visual_embedding";
    }

    @Override
    public void run(EnrichmentContext context) {
        if (!embedder.isAvailable()) {
            throw new InferenceException("Visual embedding model not loaded");
        }
        int candidates = 0;
        int embedded = 0;
        for (SceneEntity scene : context.getScenes()) {
            if (scene.getPosterPath() == null) {
                continue;
            }
            candidates++;
            try {
                float[] vector = embedder.embedImage(Paths.get(scene.getPosterPath()));
                sceneCatalog.upsertEmbedding(scene.getId(), embedder.modelInfo(), vector);
                embedded++;
            } catch (RuntimeException e) {
                log.warn("Visual embedding failed for scene {}: {}", scene.getId(), e.getMessage());
            }
        }
        log.info("{}: embedded {} of {} poster(s)", context.getFile().getFilename(), embedded, candidates);
    }
}
