package com.reelindex.service.enrichment;

import com.reelindex.config.AppConfig;
import com.reelindex.entity.EnrichmentJobEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.service.EnrichmentJobService;
import com.reelindex.service.IndexerSettings;
import com.reelindex.service.SceneCatalogService;
import com.reelindex.service.inference.FaceAnalyzer;
import com.reelindex.service.inference.SpeechTranscriber;
import com.reelindex.service.inference.TranscriptEmbedder;
import com.reelindex.service.inference.VisualEmbedder;
import com.reelindex.service.media.AudioExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnrichmentServiceTest {

    @Mock
    private EnrichmentJobService jobService;

    @Mock
    private EnrichmentPipeline pipeline;

    @Mock
    private IndexerSettings settings;

    @TempDir
    Path watchFolder;

    private EnrichmentService service;

    @BeforeEach
    void setUp() {
        service = new EnrichmentService(jobService, pipeline, settings, new AppConfig());
    }

    private static EnrichmentJobEntity job(long id, Path path) {
        VideoFileEntity file = new VideoFileEntity();
        file.setId(id * 10);
        file.setPath(path.toString());
        file.setFilename(path.getFileName().toString());
        EnrichmentJobEntity job = new EnrichmentJobEntity(file, LocalDateTime.now());
        job.setId(id);
        return job;
    }

    private static EnrichmentStage stage(String name) {
        EnrichmentStage stage = mock(EnrichmentStage.class);
        when(stage.name()).thenReturn(name);
        return stage;
    }

    @Test
    void runsStagesInOrderAndCompletesJob() throws Exception {
        Path video = Files.createFile(watchFolder.resolve("a.mp4"));
        EnrichmentStage first = stage("metadata");
        EnrichmentStage second = stage("scene_detection");
        when(jobService.nextPendingBatch(10)).thenReturn(List.of(job(1, video)));
        when(settings.getWatchFolders()).thenReturn(List.of(watchFolder.toString()));
        when(settings.getEnabledModalities()).thenReturn(EnumSet.noneOf(Modality.class));
        when(pipeline.stagesFor(any())).thenReturn(List.of(first, second));

        assertThat(service.processBatch()).isEqualTo(1);

        InOrder order = inOrder(jobService, first, second);
        order.verify(jobService).markProcessing(1L, 2);
        order.verify(jobService).updateStage(1L, "metadata", 1);
        order.verify(first).run(any(EnrichmentContext.class));
        order.verify(jobService).updateStage(1L, "scene_detection", 2);
        order.verify(second).run(any(EnrichmentContext.class));
        order.verify(jobService).markComplete(1L);
        verify(jobService, never()).markFailed(anyLong(), anyString());
    }

    @Test
    void stageFailureMarksJobFailedWithMessage() throws Exception {
        Path video = Files.createFile(watchFolder.resolve("b.mp4"));
        EnrichmentStage probe = stage("metadata");
        EnrichmentStage skipped = mock(EnrichmentStage.class);
        doThrow(new IOException("FFprobe failed - file may be corrupted or unsupported format"))
                .when(probe).run(any(EnrichmentContext.class));
        when(jobService.nextPendingBatch(10)).thenReturn(List.of(job(2, video)));
        when(settings.getWatchFolders()).thenReturn(List.of(watchFolder.toString()));
        when(settings.getEnabledModalities()).thenReturn(EnumSet.allOf(Modality.class));
        when(pipeline.stagesFor(any())).thenReturn(List.of(probe, skipped));

        assertThat(service.processBatch()).isEqualTo(1);

        verify(jobService).markFailed(2L, "FFprobe failed - file may be corrupted or unsupported format");
        verify(jobService, never()).markComplete(anyLong());
        verify(skipped, never()).run(any(EnrichmentContext.class));
    }

    @Test
    void exceptionWithoutMessageIsRecordedByType() throws Exception {
        Path video = Files.createFile(watchFolder.resolve("c.mp4"));
        EnrichmentStage stage = stage("face_detection");
        doThrow(new IllegalStateException()).when(stage).run(any(EnrichmentContext.class));
        when(settings.getEnabledModalities()).thenReturn(EnumSet.allOf(Modality.class));
        when(pipeline.stagesFor(any())).thenReturn(List.of(stage));

        VideoFileEntity file = job(3, video).getFile();
        assertThat(service.runJob(3L, file, video)).isTrue();

        verify(jobService).markFailed(3L, "IllegalStateException");
    }

    @Test
    void jobCompletesWhenNoModelIsConfigured() throws Exception {
        Path video = Files.createFile(watchFolder.resolve("e.mp4"));
        SceneCatalogService catalog = mock(SceneCatalogService.class);
        MetadataProbeStage metadata = mock(MetadataProbeStage.class);
        SceneSegmentationStage segmentation = mock(SceneSegmentationStage.class);
        EnrichmentPipeline unconfigured = new EnrichmentPipeline(metadata, segmentation, List.of(
                new VisualEmbeddingStage(mock(VisualEmbedder.class), catalog),
                new TranscriptionStage(mock(AudioExtractor.class), mock(SpeechTranscriber.class), catalog),
                new TranscriptEmbeddingStage(mock(TranscriptEmbedder.class), catalog),
                new FaceDetectionStage(mock(FaceAnalyzer.class), catalog)));
        EnrichmentService defaults = new EnrichmentService(jobService, unconfigured, settings, new AppConfig());
        when(settings.getEnabledModalities()).thenReturn(EnumSet.allOf(Modality.class));

        VideoFileEntity file = job(6, video).getFile();
        assertThat(defaults.runJob(6L, file, video)).isTrue();

        verify(jobService).markProcessing(6L, 2);
        verify(metadata).run(any(EnrichmentContext.class));
        verify(segmentation).run(any(EnrichmentContext.class));
        verify(jobService).markComplete(6L);
        verify(jobService, never()).markFailed(anyLong(), anyString());
    }

    @Test
    void missingFileUnderReachableFolderFails() {
        Path video = watchFolder.resolve("gone.mp4");
        when(jobService.nextPendingBatch(10)).thenReturn(List.of(job(4, video)));
        when(settings.getWatchFolders()).thenReturn(List.of(watchFolder.toString()));

        assertThat(service.processBatch()).isEqualTo(1);

        verify(jobService).markFailed(4L, EnrichmentService.FILE_NOT_FOUND);
        verify(jobService, never()).markProcessing(anyLong(), anyInt());
    }

    @Test
    void fileUnderOfflineFolderStaysPending() {
        Path offline = Path.of("/nonexistent/reelindex-volume");
        when(jobService.nextPendingBatch(10)).thenReturn(List.of(job(5, offline.resolve("d.mp4"))));
        when(settings.getWatchFolders()).thenReturn(List.of(watchFolder.toString(), offline.toString()));

        assertThat(service.processBatch()).isZero();

        verify(jobService, never()).markFailed(anyLong(), anyString());
        verify(jobService, never()).markProcessing(anyLong(), anyInt());
    }

    @Test
    void emptyQueueDoesNothing() {
        when(jobService.nextPendingBatch(10)).thenReturn(List.of());

        assertThat(service.processBatch()).isZero();

        verify(pipeline, never()).stagesFor(any());
    }
}
