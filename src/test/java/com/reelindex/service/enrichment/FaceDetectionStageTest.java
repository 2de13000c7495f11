package com.reelindex.service.enrichment;

import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.service.SceneCatalogService;
import com.reelindex.service.inference.DetectedFace;
import com.reelindex.service.inference.FaceAnalyzer;
import com.reelindex.service.inference.InferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FaceDetectionStageTest {

    @Mock
    private FaceAnalyzer analyzer;

    @Mock
    private SceneCatalogService catalog;

    private FaceDetectionStage stage;
    private EnrichmentContext context;

    @BeforeEach
    void setUp() {
        stage = new FaceDetectionStage(analyzer, catalog);
        VideoFileEntity file = new VideoFileEntity();
        file.setId(10L);
        file.setFilename("interview.mp4");
        context = new EnrichmentContext(file, Path.of("/media/interview.mp4"));
    }

    private static SceneEntity scene(long id, String poster) {
        SceneEntity scene = new SceneEntity();
        scene.setId(id);
        scene.setPosterPath(poster);
        return scene;
    }

    @Test
    void failedPosterDoesNotStopDetectionOnTheOthers() {
        List<DetectedFace> faces = List.of(new DetectedFace(new float[] {0f, 1f}, 12, 20, 64, 64));
        context.setScenes(List.of(scene(1, "/posters/1.jpg"), scene(2, "/posters/2.jpg")));
        when(analyzer.isAvailable()).thenReturn(true);
        when(analyzer.detectFaces(Path.of("/posters/1.jpg"))).thenThrow(new InferenceException("sidecar returned 500"));
        when(analyzer.detectFaces(Path.of("/posters/2.jpg"))).thenReturn(faces);

        stage.run(context);

        InOrder order = inOrder(catalog);
        order.verify(catalog).deleteFacesForFile(10L);
        order.verify(catalog).addFaces(2L, faces);
        verify(catalog, never()).addFaces(eq(1L), anyList());
    }

    @Test
    void scenesWithoutPosterAreNotAnalyzed() {
        context.setScenes(List.of(scene(1, null)));
        when(analyzer.isAvailable()).thenReturn(true);

        stage.run(context);

        verify(catalog).deleteFacesForFile(10L);
        verify(catalog, never()).addFaces(eq(1L), anyList());
    }
}
