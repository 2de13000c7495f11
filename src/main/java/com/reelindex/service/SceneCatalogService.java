package com.reelindex.service;

import com.reelindex.entity.EmbeddingEntity;
import com.reelindex.entity.FaceEntity;
import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.exception.NotFoundException;
import com.reelindex.repository.EmbeddingRepository;
import com.reelindex.repository.FaceRepository;
import com.reelindex.repository.SceneRepository;
import com.reelindex.repository.VideoFileRepository;
import com.reelindex.service.inference.DetectedFace;
import com.reelindex.service.inference.ModelInfo;
import com.reelindex.service.media.VideoMetadata;
import com.reelindex.util.EmbeddingUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Write side of enrichment. Stages call these between slow media and model
 * steps so no transaction is held open while ffmpeg or a model runs.
 */
@Service
@Transactional
public class SceneCatalogService {

    /** One scene as cut by the segmenter, before it has an id. */
    public record SceneDraft(int index, double startTc, double endTc, String posterPath) {
    }

    private final VideoFileRepository fileRepository;
    private final SceneRepository sceneRepository;
    private final FaceRepository faceRepository;
    private final EmbeddingRepository embeddingRepository;

    public SceneCatalogService(VideoFileRepository fileRepository,
            SceneRepository sceneRepository,
            FaceRepository faceRepository,
            EmbeddingRepository embeddingRepository) {
        this.fileRepository = fileRepository;
        this.sceneRepository = sceneRepository;
        this.faceRepository = faceRepository;
        this.embeddingRepository = embeddingRepository;
    }

    public VideoFileEntity applyMetadata(Long fileId, VideoMetadata meta) {
        VideoFileEntity file = loadFile(fileId);
        file.setDurationSeconds(meta.durationSeconds());
        file.setWidth(meta.width());
        file.setHeight(meta.height());
        file.setFps(meta.fps());
        file.setCodec(meta.codec());
        file.setPixelFormat(meta.pixelFormat());
        file.setColorSpace(meta.colorSpace());
        file.setColorTransfer(meta.colorTransfer());
        file.setColorPrimaries(meta.colorPrimaries());
        file.setAudioTracks(meta.audioTracks());
        return fileRepository.save(file);
    }

    @Transactional(readOnly = true)
    public List<SceneEntity> scenesForFile(Long fileId) {
        return sceneRepository.findByFileIdOrderBySceneIndexAsc(fileId);
    }

    /**
     * Deletes the file's scenes with their faces and embeddings, then inserts
     * {@code drafts} in order.
     */
    public List<SceneEntity> replaceScenes(Long fileId, List<SceneDraft> drafts) {
        faceRepository.deleteByFileId(fileId);
        embeddingRepository.deleteByFileId(fileId);
        sceneRepository.deleteByFileId(fileId);

        VideoFileEntity file = loadFile(fileId);
        List<SceneEntity> scenes = new ArrayList<>(drafts.size());
        for (SceneDraft draft : drafts) {
            SceneEntity scene = new SceneEntity(file, draft.index(), draft.startTc(), draft.endTc());
            scene.setPosterPath(draft.posterPath());
            scenes.add(scene);
        }
        return sceneRepository.saveAll(scenes);
    }

    public void saveTranscripts(Map<Long, String> transcriptsBySceneId) {
        transcriptsBySceneId.forEach((sceneId, text) ->
                sceneRepository.findById(sceneId).ifPresent(scene -> scene.setTranscript(text)));
    }

    /** Inserts or replaces the scene's vector for {@code model}. */
    public void upsertEmbedding(Long sceneId, ModelInfo model, float[] vector) {
        SceneEntity scene = sceneRepository.findById(sceneId)
                .orElseThrow(() -> NotFoundException.of("Scene", sceneId));
        EmbeddingEntity embedding = embeddingRepository.findBySceneIdAndModelName(sceneId, model.name())
                .orElseGet(EmbeddingEntity::new);
        embedding.setScene(scene);
        embedding.setModelName(model.name());
        embedding.setModelVersion(model.version());
        embedding.setDimension(vector.length);
        embedding.setVector(EmbeddingUtils.toBytes(vector));
        embedding.setCreatedAt(LocalDateTime.now());
        embeddingRepository.save(embedding);
    }

    public int deleteFacesForFile(Long fileId) {
        return faceRepository.deleteByFileId(fileId);
    }

    public void addFaces(Long sceneId, List<DetectedFace> faces) {
        if (faces.isEmpty()) {
            return;
        }
        SceneEntity scene = sceneRepository.findById(sceneId)
                .orElseThrow(() -> NotFoundException.of("Scene", sceneId));
        List<FaceEntity> rows = new ArrayList<>(faces.size());
        for (DetectedFace face : faces) {
            FaceEntity row = new FaceEntity();
            row.setScene(scene);
            row.setEmbedding(EmbeddingUtils.toBytes(face.embedding()));
            row.setBboxX(face.x());
            row.setBboxY(face.y());
            row.setBboxW(face.width());
            row.setBboxH(face.height());
            rows.add(row);
        }
        faceRepository.saveAll(rows);
    }

    private VideoFileEntity loadFile(Long fileId) {
        return fileRepository.findById(fileId).orElseThrow(() -> NotFoundException.of("File", fileId));
    }
}
