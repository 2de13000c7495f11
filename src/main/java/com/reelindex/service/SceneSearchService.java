package com.reelindex.service;

import com.reelindex.config.AppConfig;
import com.reelindex.dto.FaceBox;
import com.reelindex.dto.SceneQuery;
import com.reelindex.dto.SceneResult;
import com.reelindex.entity.EmbeddingEntity;
import com.reelindex.entity.FaceEntity;
import com.reelindex.entity.SceneEntity;
import com.reelindex.exception.NotFoundException;
import com.reelindex.repository.EmbeddingRepository;
import com.reelindex.repository.FaceRepository;
import com.reelindex.repository.SceneRepository;
import com.reelindex.repository.SceneSpecifications;
import com.reelindex.service.inference.OnnxClipEmbedder;
import com.reelindex.service.inference.SidecarTranscriptEmbedder;
import com.reelindex.service.inference.TranscriptEmbedder;
import com.reelindex.service.inference.VisualEmbedder;
import com.reelindex.util.EmbeddingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * Cascading scene search. Metadata predicates select the candidate base in
 * file name / scene index order; then each requested similarity filter, in
 * the order visual text, visual match, face, transcript, keeps only the
 * candidates at or above its threshold. Visual text, visual match and
 * transcript filters re-sort by their own score, so the last of them to run
 * decides the final order. The face filter never re-sorts.
 *
 * All vectors are unit length; similarity is a plain dot product.
 */
@Service
@Transactional(readOnly = true)
public class SceneSearchService {

    private static final Logger log = LoggerFactory.getLogger(SceneSearchService.class);

    private static final int ID_CHUNK = 1000;

    private final SceneRepository sceneRepository;
    private final EmbeddingRepository embeddingRepository;
    private final FaceRepository faceRepository;
    private final VisualEmbedder visualEmbedder;
    private final TranscriptEmbedder transcriptEmbedder;
    private final IndexerSettings settings;
    private final AppConfig appConfig;

    public SceneSearchService(SceneRepository sceneRepository,
            EmbeddingRepository embeddingRepository,
            FaceRepository faceRepository,
            VisualEmbedder visualEmbedder,
            TranscriptEmbedder transcriptEmbedder,
            IndexerSettings settings,
            AppConfig appConfig) {
        this.sceneRepository = sceneRepository;
        this.embeddingRepository = embeddingRepository;
        this.faceRepository = faceRepository;
        this.visualEmbedder = visualEmbedder;
        this.transcriptEmbedder = transcriptEmbedder;
        this.settings = settings;
        this.appConfig = appConfig;
    }

    public List<SceneResult> search(SceneQuery query) {
        List<SceneEntity> base = sceneRepository.findAll(SceneSpecifications.matching(query),
                SceneSpecifications.BASE_ORDER);
        List<SceneResult> candidates = base.stream().map(SceneResult::from).collect(Collectors.toList());

        if (query.hasVisualText() && !candidates.isEmpty()) {
            candidates = filterByVisualText(candidates, query.getVisualText(),
                    threshold(query.getVisualThreshold(), settings.getVisualThreshold()));
        }
        if (query.getMatchSceneId() != null && !candidates.isEmpty()) {
            candidates = filterByVisualMatch(candidates, query.getMatchSceneId(),
                    threshold(query.getVisualMatchThreshold(), settings.getVisualMatchThreshold()));
        }
        if (query.getFaceId() != null && !candidates.isEmpty()) {
            candidates = filterByFace(candidates, query.getFaceId(),
                    threshold(query.getFaceThreshold(), settings.getFaceThreshold()));
        }
        if (query.hasTranscriptQuery() && !candidates.isEmpty()) {
            candidates = filterByTranscript(candidates, query.getTranscriptQuery(),
                    threshold(query.getTranscriptThreshold(), settings.getTranscriptThreshold()));
        }

        List<SceneResult> results = candidates.size() > effectiveLimit(query.getLimit())
                ? new ArrayList<>(candidates.subList(0, effectiveLimit(query.getLimit())))
                : candidates;
        attachFaces(results);
        return results;
    }

    int effectiveLimit(Integer requested) {
        if (requested == null || requested <= 0) {
            return appConfig.getSearchDefaultLimit();
        }
        return Math.min(requested, appConfig.getSearchMaxLimit());
    }

    private List<SceneResult> filterByVisualText(List<SceneResult> candidates, String text, double threshold) {
        float[] queryVector;
        try {
            if (!visualEmbedder.isAvailable()) {
                log.warn("Visual text filter skipped: embedding model not available");
                return candidates;
            }
            queryVector = visualEmbedder.embedText(text);
        } catch (RuntimeException e) {
            log.warn("Visual text filter skipped: {}", e.getMessage());
            return candidates;
        }
        Map<Long, float[]> vectors = loadVectors(OnnxClipEmbedder.MODEL.name(), ids(candidates));
        return keepAndSort(candidates, vectors, queryVector, threshold, SceneResult::setSimilarity);
    }

    /** A reference scene without a visual embedding leaves the candidates untouched. */
    private List<SceneResult> filterByVisualMatch(List<SceneResult> candidates, Long sceneId, double threshold) {
        if (!sceneRepository.existsById(sceneId)) {
            throw NotFoundException.of("Scene", sceneId);
        }
        Optional<EmbeddingEntity> reference =
                embeddingRepository.findBySceneIdAndModelName(sceneId, OnnxClipEmbedder.MODEL.name());
        if (reference.isEmpty()) {
            log.warn("Visual match filter skipped: scene {} has no visual embedding", sceneId);
            return candidates;
        }
        float[] referenceVector = EmbeddingUtils.fromBytes(reference.get().getVector());
        Map<Long, float[]> vectors = loadVectors(OnnxClipEmbedder.MODEL.name(), ids(candidates));
        return keepAndSort(candidates, vectors, referenceVector, threshold, SceneResult::setSimilarity);
    }

    /** Best face in each scene against the reference face; order is preserved. */
    private List<SceneResult> filterByFace(List<SceneResult> candidates, Long faceId, double threshold) {
        FaceEntity reference = faceRepository.findById(faceId)
                .orElseThrow(() -> NotFoundException.of("Face", faceId));
        float[] referenceVector = EmbeddingUtils.fromBytes(reference.getEmbedding());

        Map<Long, Double> best = new HashMap<>();
        for (List<Long> chunk : chunks(ids(candidates))) {
            for (FaceEntity face : faceRepository.findBySceneIds(chunk)) {
                double score = EmbeddingUtils.dot(referenceVector, EmbeddingUtils.fromBytes(face.getEmbedding()));
                best.merge(face.getScene().getId(), score, Math::max);
            }
        }

        List<SceneResult> kept = new ArrayList<>();
        for (SceneResult candidate : candidates) {
            Double score = best.get(candidate.getId());
            if (score != null && score >= threshold) {
                candidate.setFaceSimilarity(score);
                kept.add(candidate);
            }
        }
        return kept;
    }

    private List<SceneResult> filterByTranscript(List<SceneResult> candidates, String text, double threshold) {
        float[] queryVector;
        try {
            if (!transcriptEmbedder.isAvailable()) {
                log.warn("Transcript filter skipped: embedding service not available");
                return candidates;
            }
            queryVector = transcriptEmbedder.embed(text);
        } catch (RuntimeException e) {
            log.warn("Transcript filter skipped: {}", e.getMessage());
            return candidates;
        }
        Map<Long, float[]> vectors = loadVectors(SidecarTranscriptEmbedder.MODEL.name(), ids(candidates));
        return keepAndSort(candidates, vectors, queryVector, threshold, SceneResult::setTranscriptSimilarity);
    }

    /**
     * Keeps candidates whose stored vector scores at least {@code threshold}
     * against {@code reference}, sorted by score descending. The sort is
     * stable, so ties keep the previous order.
     */
    private static List<SceneResult> keepAndSort(List<SceneResult> candidates, Map<Long, float[]> vectors,
            float[] reference, double threshold, BiConsumer<SceneResult, Double> scoreSetter) {
        List<SceneResult> kept = new ArrayList<>();
        Map<Long, Double> scores = new HashMap<>();
        for (SceneResult candidate : candidates) {
            float[] vector = vectors.get(candidate.getId());
            if (vector == null || vector.length != reference.length) {
                continue;
            }
            double score = EmbeddingUtils.dot(reference, vector);
            if (score >= threshold) {
                scoreSetter.accept(candidate, score);
                scores.put(candidate.getId(), score);
                kept.add(candidate);
            }
        }
        kept.sort(Comparator.comparingDouble((SceneResult r) -> scores.get(r.getId())).reversed());
        return kept;
    }

    private Map<Long, float[]> loadVectors(String model, List<Long> sceneIds) {
        Map<Long, float[]> vectors = new HashMap<>();
        for (List<Long> chunk : chunks(sceneIds)) {
            for (EmbeddingEntity embedding : embeddingRepository.findByModelAndSceneIds(model, chunk)) {
                vectors.put(embedding.getScene().getId(), EmbeddingUtils.fromBytes(embedding.getVector()));
            }
        }
        return vectors;
    }

    private void attachFaces(List<SceneResult> results) {
        if (results.isEmpty()) {
            return;
        }
        Map<Long, List<FaceBox>> bySceneId = new HashMap<>();
        for (List<Long> chunk : chunks(ids(results))) {
            for (FaceEntity face : faceRepository.findBySceneIds(chunk)) {
                bySceneId.computeIfAbsent(face.getScene().getId(), k -> new ArrayList<>()).add(FaceBox.from(face));
            }
        }
        for (SceneResult result : results) {
            result.setFaces(bySceneId.getOrDefault(result.getId(), new ArrayList<>()));
        }
    }

    private static double threshold(Double requested, double stored) {
        return requested != null ? requested : stored;
    }

    private static List<Long> ids(Collection<SceneResult> results) {
        return results.stream().map(SceneResult::getId).collect(Collectors.toList());
    }

    private static List<List<Long>> chunks(List<Long> ids) {
        List<List<Long>> chunks = new ArrayList<>();
        for (int i = 0; i < ids.size(); i += ID_CHUNK) {
            chunks.add(ids.subList(i, Math.min(ids.size(), i + ID_CHUNK)));
        }
        return chunks;
    }
}
