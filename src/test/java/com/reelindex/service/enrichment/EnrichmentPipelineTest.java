package com.reelindex.service.enrichment;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnrichmentPipelineTest {

    private final MetadataProbeStage metadata = mock(MetadataProbeStage.class);
    private final SceneSegmentationStage segmentation = mock(SceneSegmentationStage.class);

    private static ModalityStage stage(Modality modality) {
        ModalityStage stage = mock(ModalityStage.class);
        when(stage.modality()).thenReturn(modality);
        when(stage.isAvailable()).thenReturn(true);
        return stage;
    }

    @Test
    void modalityStagesFollowDeclarationOrder() {
        ModalityStage faces = stage(Modality.FACES);
        ModalityStage visual = stage(Modality.VISUAL);
        ModalityStage transcription = stage(Modality.TRANSCRIPTION);
        EnrichmentPipeline pipeline = new EnrichmentPipeline(metadata, segmentation,
                List.of(faces, visual, transcription));

        assertThat(pipeline.stagesFor(EnumSet.allOf(Modality.class)))
                .containsExactly(metadata, segmentation, visual, transcription, faces);
    }

    @Test
    void disabledModalitiesAreSkipped() {
        ModalityStage faces = stage(Modality.FACES);
        ModalityStage visual = stage(Modality.VISUAL);
        EnrichmentPipeline pipeline = new EnrichmentPipeline(metadata, segmentation, List.of(faces, visual));

        assertThat(pipeline.stagesFor(EnumSet.of(Modality.FACES))).containsExactly(metadata, segmentation, faces);
        assertThat(pipeline.stagesFor(EnumSet.noneOf(Modality.class))).containsExactly(metadata, segmentation);
    }

    @Test
    void enabledButUnavailableModalityIsLeftOutUntilItsModelAppears() {
        ModalityStage visual = stage(Modality.VISUAL);
        ModalityStage transcription = stage(Modality.TRANSCRIPTION);
        when(transcription.isAvailable()).thenReturn(false);
        EnrichmentPipeline pipeline = new EnrichmentPipeline(metadata, segmentation, List.of(visual, transcription));

        assertThat(pipeline.stagesFor(EnumSet.allOf(Modality.class)))
                .containsExactly(metadata, segmentation, visual);

        when(transcription.isAvailable()).thenReturn(true);

        assertThat(pipeline.stagesFor(EnumSet.allOf(Modality.class)))
                .containsExactly(metadata, segmentation, visual, transcription);
    }
}
