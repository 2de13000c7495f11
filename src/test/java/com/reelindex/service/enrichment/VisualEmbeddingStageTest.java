package com.reelindex.service.enrichment;

import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.service.SceneCatalogService;
import com.reelindex.service.inference.InferenceException;
import com.reelindex.service.inference.ModelInfo;
import com.reelindex.service.inference.VisualEmbedder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VisualEmbeddingStageTest {

    private static final ModelInfo CLIP = new ModelInfo("clip", "clip-vit-base-patch32", 512);

    @Mock
    private VisualEmbedder embedder;

    @Mock
    private SceneCatalogService catalog;

    private VisualEmbeddingStage stage;
    private EnrichmentContext context;

    @BeforeEach
    void setUp() {
        stage = new VisualEmbeddingStage(embedder, catalog);
        VideoFileEntity file = new VideoFileEntity();
        file.setId(10L);
        file.setFilename("reel.mov");
        context = new EnrichmentContext(file, Path.of("/media/reel.mov"));
    }

    private static SceneEntity scene(long id, String poster) {
        SceneEntity scene = new SceneEntity();
        scene.setId(id);
        scene.setPosterPath(poster);
        return scene;
    }

    @Test
    void unreadablePosterIsSkippedAndTheRestAreEmbedded() {
        float[] vector = {1f, 0f};
        context.setScenes(List.of(
                scene(1, "/posters/1.jpg"),
                scene(2, "/posters/2.jpg"),
                scene(3, null)));
        when(embedder.isAvailable()).thenReturn(true);
        when(embedder.modelInfo()).thenReturn(CLIP);
        when(embedder.embedImage(Path.of("/posters/1.jpg"))).thenThrow(new InferenceException("corrupt JPEG"));
        when(embedder.embedImage(Path.of("/posters/2.jpg"))).thenReturn(vector);

        stage.run(context);

        verify(catalog).upsertEmbedding(2L, CLIP, vector);
        verify(catalog, never()).upsertEmbedding(eq(1L), any(), any());
        verify(catalog, never()).upsertEmbedding(eq(3L), any(), any());
    }

    @Test
    void modelLostMidRunFailsTheStage() {
        context.setScenes(List.of(scene(1, "/posters/1.jpg")));
        when(embedder.isAvailable()).thenReturn(false);

        assertThatThrownBy(() -> stage.run(context)).isInstanceOf(InferenceException.class);

        verify(catalog, never()).upsertEmbedding(anyLong(), any(), any());
    }
}
