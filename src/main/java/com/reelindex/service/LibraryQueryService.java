package com.reelindex.service;

import com.reelindex.dto.FaceBox;
import com.reelindex.dto.SceneResult;
import com.reelindex.entity.EmbeddingEntity;
import com.reelindex.entity.EnrichmentJobEntity;
import com.reelindex.entity.FaceEntity;
import com.reelindex.entity.JobStatus;
import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.exception.NotFoundException;
import com.reelindex.repository.EmbeddingRepository;
import com.reelindex.repository.FaceRepository;
import com.reelindex.repository.OffsetPageRequest;
import com.reelindex.repository.SceneRepository;
import com.reelindex.repository.SceneSpecifications;
import com.reelindex.repository.VideoFileRepository;
import com.reelindex.service.inference.OnnxClipEmbedder;
import com.reelindex.service.inference.SidecarFaceAnalyzer;
import com.reelindex.service.inference.SidecarTranscriptEmbedder;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only views of the catalog for the browse, stats and queue endpoints.
 * Results are plain maps so nullable fields survive serialization.
 */
@Service
@Transactional(readOnly = true)
public class LibraryQueryService {

    private final VideoFileRepository fileRepository;
    private final SceneRepository sceneRepository;
    private final FaceRepository faceRepository;
    private final EmbeddingRepository embeddingRepository;
    private final EnrichmentJobService jobService;

    public LibraryQueryService(VideoFileRepository fileRepository,
            SceneRepository sceneRepository,
            FaceRepository faceRepository,
            EmbeddingRepository embeddingRepository,
            EnrichmentJobService jobService) {
        this.fileRepository = fileRepository;
        this.sceneRepository = sceneRepository;
        this.faceRepository = faceRepository;
        this.embeddingRepository = embeddingRepository;
        this.jobService = jobService;
    }

    // ───────────── scenes ─────────────

    /** Searchable scenes in base order, one page at a time. */
    public Map<String, Object> listScenes(int limit, int offset) {
        Page<SceneEntity> page = sceneRepository.findAll(SceneSpecifications.searchable(),
                new OffsetPageRequest(offset, limit, SceneSpecifications.BASE_ORDER));
        List<SceneResult> scenes = page.getContent().stream().map(SceneResult::from).toList();
        attachFaces(scenes);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scenes", scenes);
        body.put("total", page.getTotalElements());
        return body;
    }

    /** Scene with its file summary, faces and the models that embedded it. */
    public Map<String, Object> getScene(Long sceneId) {
        SceneEntity scene = loadScene(sceneId);
        if (scene.getFile().getDeletedAt() != null) {
            throw NotFoundException.of("Scene", sceneId);
        }
        SceneResult result = SceneResult.from(scene);
        List<FaceEntity> faces = faceRepository.findBySceneIdOrderByIdAsc(sceneId);
        result.setFaces(faces.stream().map(FaceBox::from).toList());

        List<Map<String, Object>> vectors = new ArrayList<>();
        for (EmbeddingEntity embedding : embeddingRepository.findBySceneIdOrderByModelNameAsc(sceneId)) {
            Map<String, Object> v = new LinkedHashMap<>();
            v.put("model", embedding.getModelName());
            v.put("version", embedding.getModelVersion());
            v.put("dimension", embedding.getDimension());
            vectors.add(v);
        }
        if (!faces.isEmpty()) {
            Map<String, Object> v = new LinkedHashMap<>();
            v.put("model", SidecarFaceAnalyzer.MODEL.name());
            v.put("version", SidecarFaceAnalyzer.MODEL.version());
            v.put("dimension", SidecarFaceAnalyzer.MODEL.dimension());
            v.put("count", faces.size());
            vectors.add(v);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scene", result);
        body.put("posterPath", scene.getPosterPath());
        body.put("clusterOrder", scene.getClusterOrder());
        body.put("vectors", vectors);
        return body;
    }

    /** Poster on disk for the scene, if one was extracted. */
    public String posterPath(Long sceneId) {
        String poster = loadScene(sceneId).getPosterPath();
        if (poster == null) {
            throw new NotFoundException("Scene " + sceneId + " has no poster");
        }
        return poster;
    }

    /** Members of an appearance cluster, most representative first. */
    public List<SceneResult> scenesInCluster(int clusterId) {
        List<SceneResult> scenes = sceneRepository.findByClusterIdOrderByClusterOrderAscIdAsc(clusterId).stream()
                .filter(s -> s.getFile().getDeletedAt() == null)
                .map(SceneResult::from)
                .toList();
        attachFaces(scenes);
        return scenes;
    }

    // ───────────── files ─────────────

    public List<Map<String, Object>> listFiles(boolean completedOnly, int limit, int offset) {
        List<VideoFileEntity> files = completedOnly
                ? fileRepository.findCompleted()
                : fileRepository.findByDeletedAtIsNullOrderByFilenameAsc();
        return files.stream().skip(offset).limit(limit).map(LibraryQueryService::fileSummary).toList();
    }

    public Map<String, Object> getFile(Long fileId) {
        VideoFileEntity file = loadLiveFile(fileId);
        Map<String, Object> body = fileSummary(file);
        body.put("pixelFormat", file.getPixelFormat());
        body.put("colorSpace", file.getColorSpace());
        body.put("colorTransfer", file.getColorTransfer());
        body.put("colorPrimaries", file.getColorPrimaries());
        List<Map<String, Object>> scenes = new ArrayList<>();
        for (SceneEntity scene : sceneRepository.findByFileIdOrderBySceneIndexAsc(fileId)) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("id", scene.getId());
            s.put("sceneIndex", scene.getSceneIndex());
            s.put("startTc", scene.getStartTc());
            s.put("endTc", scene.getEndTc());
            s.put("hasPoster", scene.getPosterPath() != null);
            s.put("transcript", scene.getTranscript());
            scenes.add(s);
        }
        body.put("scenes", scenes);
        return body;
    }

    /** Path of a live file, for streaming. */
    public String videoPath(Long fileId) {
        return loadLiveFile(fileId).getPath();
    }

    // ───────────── faces ─────────────

    public List<Map<String, Object>> listFaces(int limit) {
        return faceRepository.findTop200ByOrderByIdDesc().stream()
                .limit(limit)
                .map(LibraryQueryService::faceSummary)
                .toList();
    }

    public Map<String, Object> getFace(Long faceId) {
        FaceEntity face = faceRepository.findById(faceId).orElseThrow(() -> NotFoundException.of("Face", faceId));
        Map<String, Object> body = faceSummary(face);
        SceneEntity scene = face.getScene();
        body.put("bbox", List.of(face.getBboxX(), face.getBboxY(), face.getBboxW(), face.getBboxH()));
        body.put("startTc", scene.getStartTc());
        body.put("endTc", scene.getEndTc());
        body.put("fileId", scene.getFile().getId());
        body.put("path", scene.getFile().getPath());
        return body;
    }

    /** Identity clusters with their size and most representative face. */
    public List<Map<String, Object>> faceClusters() {
        List<Map<String, Object>> clusters = new ArrayList<>();
        for (Object[] row : faceRepository.countByCluster()) {
            Integer clusterId = ((Number) row[0]).intValue();
            List<FaceEntity> members = faceRepository.findByClusterIdOrderByClusterOrderAscIdAsc(clusterId);
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("clusterId", clusterId);
            c.put("size", ((Number) row[1]).longValue());
            c.put("representativeFaceId", members.isEmpty() ? null : members.get(0).getId());
            c.put("representativeSceneId", members.isEmpty() ? null : members.get(0).getScene().getId());
            clusters.add(c);
        }
        return clusters;
    }

    public List<Map<String, Object>> facesInCluster(int clusterId) {
        return faceRepository.findByClusterIdOrderByClusterOrderAscIdAsc(clusterId).stream()
                .map(face -> {
                    Map<String, Object> f = faceSummary(face);
                    f.put("clusterOrder", face.getClusterOrder());
                    return f;
                })
                .toList();
    }

    // ───────────── stats / queue ─────────────

    public Map<String, Object> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("files", fileRepository.countByDeletedAtIsNull());
        body.put("filesIndexed", fileRepository.countByDeletedAtIsNullAndIndexedAtIsNotNull());
        body.put("totalDuration", fileRepository.sumDurationSeconds());
        body.put("scenes", sceneRepository.count());
        body.put("faces", faceRepository.count());
        body.put("scenesWithFaces", faceRepository.countScenesWithFaces());
        return body;
    }

    /** Per-model embedding coverage over all scenes. */
    public Map<String, Object> vectorStats() {
        long totalScenes = sceneRepository.count();
        long scanned = sceneRepository.countOfIndexedFiles();
        List<Map<String, Object>> models = new ArrayList<>();
        for (Object[] row : embeddingRepository.summarizeByModel()) {
            String model = (String) row[0];
            long count = ((Number) row[3]).longValue();
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", displayName(model));
            m.put("model", model);
            m.put("version", row[1]);
            m.put("dimension", row[2]);
            m.put("scanned", scanned);
            m.put("found", count);
            m.put("coverage", coverage(count, totalScenes));
            m.put("partialExpected", SidecarTranscriptEmbedder.MODEL.name().equals(model));
            m.put("lastUpdated", row[4]);
            models.add(m);
        }
        long scenesWithFaces = faceRepository.countScenesWithFaces();
        Map<String, Object> faces = new LinkedHashMap<>();
        faces.put("name", "Faces");
        faces.put("model", SidecarFaceAnalyzer.MODEL.name());
        faces.put("version", SidecarFaceAnalyzer.MODEL.version());
        faces.put("dimension", SidecarFaceAnalyzer.MODEL.dimension());
        faces.put("scanned", scanned);
        faces.put("found", scenesWithFaces);
        faces.put("coverage", coverage(scenesWithFaces, totalScenes));
        faces.put("partialExpected", true);
        faces.put("totalDetected", faceRepository.count());
        models.add(faces);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("totalScenes", totalScenes);
        body.put("models", models);
        return body;
    }

    public Map<String, Object> queue() {
        Map<String, Object> body = new LinkedHashMap<>();
        for (JobStatus status : JobStatus.values()) {
            body.put(status.name().toLowerCase(Locale.ROOT), jobService.countByStatus(status));
        }
        body.put("current", jobService.currentlyProcessing().map(LibraryQueryService::jobSummary).orElse(null));
        return body;
    }

    // ───────────── helpers ─────────────

    private void attachFaces(List<SceneResult> scenes) {
        if (scenes.isEmpty()) {
            return;
        }
        Map<Long, List<FaceBox>> bySceneId = new LinkedHashMap<>();
        List<Long> ids = scenes.stream().map(SceneResult::getId).toList();
        for (FaceEntity face : faceRepository.findBySceneIds(ids)) {
            bySceneId.computeIfAbsent(face.getScene().getId(), k -> new ArrayList<>()).add(FaceBox.from(face));
        }
        scenes.forEach(s -> s.setFaces(bySceneId.getOrDefault(s.getId(), new ArrayList<>())));
    }

    private SceneEntity loadScene(Long sceneId) {
        return sceneRepository.findById(sceneId).orElseThrow(() -> NotFoundException.of("Scene", sceneId));
    }

    private VideoFileEntity loadLiveFile(Long fileId) {
        return fileRepository.findById(fileId)
                .filter(f -> f.getDeletedAt() == null)
                .orElseThrow(() -> NotFoundException.of("File", fileId));
    }

    private static Map<String, Object> fileSummary(VideoFileEntity file) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("id", file.getId());
        f.put("path", file.getPath());
        f.put("filename", file.getFilename());
        f.put("parentFolder", file.getParentFolder());
        f.put("sizeBytes", file.getSizeBytes());
        f.put("durationSeconds", file.getDurationSeconds());
        f.put("width", file.getWidth());
        f.put("height", file.getHeight());
        f.put("fps", file.getFps());
        f.put("codec", file.getCodec());
        f.put("audioTracks", file.getAudioTracks());
        f.put("createdAt", file.getCreatedAt());
        f.put("modifiedAt", file.getModifiedAt());
        f.put("indexedAt", file.getIndexedAt());
        return f;
    }

    private static Map<String, Object> faceSummary(FaceEntity face) {
        SceneEntity scene = face.getScene();
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("id", face.getId());
        f.put("sceneId", scene.getId());
        f.put("sceneIndex", scene.getSceneIndex());
        f.put("filename", scene.getFile().getFilename());
        f.put("clusterId", face.getClusterId());
        return f;
    }

    private static Map<String, Object> jobSummary(EnrichmentJobEntity job) {
        Map<String, Object> j = new LinkedHashMap<>();
        j.put("id", job.getId());
        j.put("currentStage", job.getCurrentStage());
        j.put("currentStageNum", job.getCurrentStageNum());
        j.put("totalStages", job.getTotalStages());
        j.put("startedAt", job.getStartedAt());
        j.put("filename", job.getFile().getFilename());
        j.put("path", job.getFile().getPath());
        j.put("durationSeconds", job.getFile().getDurationSeconds());
        return j;
    }

    private static String displayName(String model) {
        if (OnnxClipEmbedder.MODEL.name().equals(model)) {
            return "Visual";
        }
        if (SidecarTranscriptEmbedder.MODEL.name().equals(model)) {
            return "Transcript";
        }
        return model;
    }

    private static double coverage(long found, long total) {
        return total > 0 ? Math.round(found * 1000.0 / total) / 10.0 : 0.0;
    }
}
