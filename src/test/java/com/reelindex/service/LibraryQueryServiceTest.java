package com.reelindex.service;

import com.reelindex.dto.SceneResult;
import com.reelindex.entity.EmbeddingEntity;
import com.reelindex.entity.EnrichmentJobEntity;
import com.reelindex.entity.JobStatus;
import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.exception.NotFoundException;
import com.reelindex.repository.EmbeddingRepository;
import com.reelindex.repository.EnrichmentJobRepository;
import com.reelindex.repository.SceneRepository;
import com.reelindex.repository.VideoFileRepository;
import com.reelindex.service.inference.OnnxClipEmbedder;
import com.reelindex.util.EmbeddingUtils;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({LibraryQueryService.class, EnrichmentJobService.class})
class LibraryQueryServiceTest {

    @Autowired
    private LibraryQueryService queryService;

    @Autowired
    private VideoFileRepository fileRepository;

    @Autowired
    private SceneRepository sceneRepository;

    @Autowired
    private EmbeddingRepository embeddingRepository;

    @Autowired
    private EnrichmentJobRepository jobRepository;

    private List<SceneEntity> fileWithScenes(String name, JobStatus status, int sceneCount) {
        VideoFileEntity file = new VideoFileEntity();
        file.setPath("/archive/" + name);
        file.setFilename(name);
        file.setSizeBytes(1L);
        if (status == JobStatus.COMPLETE) {
            file.setIndexedAt(LocalDateTime.now());
        }
        file = fileRepository.save(file);
        EnrichmentJobEntity job = new EnrichmentJobEntity(file, LocalDateTime.now());
        job.setStatus(status);
        jobRepository.save(job);
        List<SceneEntity> scenes = new ArrayList<>();
        for (int i = 0; i < sceneCount; i++) {
            scenes.add(sceneRepository.save(new SceneEntity(file, i, i * 4.0, i * 4.0 + 4.0)));
        }
        return scenes;
    }

    @Test
    @SuppressWarnings("unchecked")
    void listsSearchableScenesByOffset() {
        List<SceneEntity> done = fileWithScenes("a.mp4", JobStatus.COMPLETE, 3);
        fileWithScenes("b.mp4", JobStatus.PENDING, 2);

        Map<String, Object> page = queryService.listScenes(2, 1);

        List<SceneResult> scenes = (List<SceneResult>) page.get("scenes");
        assertThat(scenes).extracting(SceneResult::getId).containsExactly(done.get(1).getId(), done.get(2).getId());
        assertThat(page.get("total")).isEqualTo(3L);
    }

    @Test
    void sceneOfDeletedFileIsNotFound() {
        SceneEntity scene = fileWithScenes("gone.mp4", JobStatus.COMPLETE, 1).get(0);
        scene.getFile().setDeletedAt(LocalDateTime.now());

        assertThatThrownBy(() -> queryService.getScene(scene.getId())).isInstanceOf(NotFoundException.class);
    }

    @Test
    void queueCountsEveryStatus() {
        fileWithScenes("a.mp4", JobStatus.COMPLETE, 0);
        fileWithScenes("b.mp4", JobStatus.PENDING, 0);
        fileWithScenes("c.mp4", JobStatus.PENDING, 0);

        Map<String, Object> queue = queryService.queue();

        assertThat(queue).containsEntry("pending", 2L)
                .containsEntry("processing", 0L)
                .containsEntry("complete", 1L)
                .containsEntry("failed", 0L);
        assertThat(queue.get("current")).isNull();
    }

    @Test
    @SuppressWarnings("unchecked")
    void vectorStatsReportCoveragePerModel() {
        List<SceneEntity> scenes = fileWithScenes("a.mp4", JobStatus.COMPLETE, 3);
        EmbeddingEntity embedding = new EmbeddingEntity();
        embedding.setScene(scenes.get(0));
        embedding.setModelName(OnnxClipEmbedder.MODEL.name());
        embedding.setModelVersion(OnnxClipEmbedder.MODEL.version());
        embedding.setDimension(2);
        embedding.setVector(EmbeddingUtils.toBytes(new float[]{1f, 0f}));
        embedding.setCreatedAt(LocalDateTime.now());
        embeddingRepository.save(embedding);

        Map<String, Object> stats = queryService.vectorStats();

        assertThat(stats.get("totalScenes")).isEqualTo(3L);
        List<Map<String, Object>> models = (List<Map<String, Object>>) stats.get("models");
        assertThat(models).hasSize(2);
        assertThat(models.get(0)).containsEntry("name", "Visual")
                .containsEntry("found", 1L)
                .containsEntry("scanned", 3L)
                .containsEntry("coverage", 33.3);
        assertThat(models.get(1)).containsEntry("name", "Faces").containsEntry("found", 0L);
    }
}
