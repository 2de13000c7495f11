package com.reelindex.service.enrichment;

import com.reelindex.entity.SceneEntity;
import com.reelindex.service.SceneCatalogService;
import com.reelindex.service.inference.DetectedFace;
import com.reelindex.service.inference.FaceAnalyzer;
import com.reelindex.service.inference.InferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.List;

/**
 * Detects faces on every poster. The file's previous faces are removed first
 * so a re-run never duplicates them.
 */
@Component
public class FaceDetectionStage implements ModalityStage {

    private static final Logger log = LoggerFactory.getLogger(FaceDetectionStage.class);

    private final FaceAnalyzer analyzer;
    private final SceneCatalogService sceneCatalog;

    public FaceDetectionStage(FaceAnalyzer analyzer, SceneCatalogService sceneCatalog) {
        this.analyzer = analyzer;
        this.sceneCatalog = sceneCatalog;
    }

    @Override
    public Modality modality() {
        return Modality.FACES;
    }

    @Override
    public boolean isAvailable() {
        return analyzer.isAvailable();
    }

    @Override
    public String name() {
        return "face_detection";
    }

    @Override
    public void run(EnrichmentContext context) {
        if (!analyzer.isAvailable()) {
            throw new InferenceException("Face analysis service not configured");
        }
        sceneCatalog.deleteFacesForFile(context.fileId());
        int total = 0;
        for (SceneEntity scene : context.getScenes()) {
            if (scene.getPosterPath() == null) {
                continue;
            }
            try {
                List<DetectedFace> faces = analyzer.detectFaces(Paths.get(scene.getPosterPath()));
                sceneCatalog.addFaces(scene.getId(), faces);
                total += faces.size();
            } catch (RuntimeException e) {
                log.warn("Face detection failed for scene {}: {}", scene.getId(), e.getMessage());
            }
        }
        log.info("{}: {} face(s) detected", context.getFile().getFilename(), total);
    }
}
