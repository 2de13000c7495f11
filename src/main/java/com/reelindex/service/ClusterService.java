package com.reelindex.service;

import com.reelindex.entity.EmbeddingEntity;
import com.reelindex.entity.FaceEntity;
import com.reelindex.entity.SceneEntity;
import com.reelindex.repository.EmbeddingRepository;
import com.reelindex.repository.FaceRepository;
import com.reelindex.service.inference.OnnxClipEmbedder;
import com.reelindex.util.ClusterRanking;
import com.reelindex.util.ClusterRanking.Assignment;
import com.reelindex.util.EmbeddingUtils;
import com.reelindex.util.Hdbscan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Full re-clustering of face identities and scene appearance. Inputs are read
 * in id order so an unchanged vector set yields the same labels every run.
 */
@Service
public class ClusterService {

    private static final Logger log = LoggerFactory.getLogger(ClusterService.class);

    static final int MIN_CLUSTER_SIZE = 2;
    static final int MIN_SAMPLES = 1;

    private final FaceRepository faceRepository;
    private final EmbeddingRepository embeddingRepository;

    public ClusterService(FaceRepository faceRepository, EmbeddingRepository embeddingRepository) {
        this.faceRepository = faceRepository;
        this.embeddingRepository = embeddingRepository;
    }

    /** @return number of clusters found */
    @Transactional
    public int clusterFaces() {
        List<FaceEntity> faces = faceRepository.findAllByOrderByIdAsc();
        if (faces.isEmpty()) {
            return 0;
        }
        List<float[]> vectors = new ArrayList<>(faces.size());
        for (FaceEntity face : faces) {
            vectors.add(EmbeddingUtils.fromBytes(face.getEmbedding()));
        }
        List<Assignment> assignments = assign(vectors);
        for (int i = 0; i < faces.size(); i++) {
            faces.get(i).setClusterId(assignments.get(i).clusterId());
            faces.get(i).setClusterOrder(assignments.get(i).order());
        }
        int clusters = countClusters(assignments);
        log.info("Face clustering: {} face(s) in {} cluster(s)", faces.size(), clusters);
        return clusters;
    }

    /** Groups scenes of live files by their visual embedding. */
    @Transactional
    public int clusterScenes() {
        List<SceneEntity> scenes = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        for (EmbeddingEntity embedding : embeddingRepository.findByModel(OnnxClipEmbedder.MODEL.name())) {
            SceneEntity scene = embedding.getScene();
            if (scene.getFile().getDeletedAt() != null) {
                continue;
            }
            scenes.add(scene);
            vectors.add(EmbeddingUtils.fromBytes(embedding.getVector()));
        }
        if (scenes.isEmpty()) {
            return 0;
        }
        List<Assignment> assignments = assign(vectors);
        for (int i = 0; i < scenes.size(); i++) {
            scenes.get(i).setClusterId(assignments.get(i).clusterId());
            scenes.get(i).setClusterOrder(assignments.get(i).order());
        }
        int clusters = countClusters(assignments);
        log.info("Scene clustering: {} scene(s) in {} cluster(s)", scenes.size(), clusters);
        return clusters;
    }

    static List<Assignment> assign(List<float[]> vectors) {
        int[] labels = new Hdbscan(MIN_CLUSTER_SIZE, MIN_SAMPLES).cluster(vectors);
        return ClusterRanking.rank(vectors, labels);
    }

    private static int countClusters(List<Assignment> assignments) {
        return (int) assignments.stream()
                .mapToInt(Assignment::clusterId)
                .filter(id -> id != Hdbscan.NOISE)
                .distinct()
                .count();
    }
}
