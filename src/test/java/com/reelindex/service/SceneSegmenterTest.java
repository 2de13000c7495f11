package com.reelindex.service;

import com.reelindex.config.AppConfig;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.service.SceneCatalogService.SceneDraft;
import com.reelindex.service.SceneSegmenter.Interval;
import com.reelindex.service.media.FrameExtractor;
import com.reelindex.service.media.ShotDetector;
import com.reelindex.service.media.StillFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SceneSegmenterTest {

    @Mock
    private ShotDetector shotDetector;

    @Mock
    private FrameExtractor frameExtractor;

    @Mock
    private SceneCatalogService sceneCatalog;

    @Mock
    private IndexerSettings settings;

    @TempDir
    Path posterDir;

    private SceneSegmenter segmenter;

    @BeforeEach
    void setUp() {
        AppConfig appConfig = new AppConfig();
        appConfig.setPosterDir(posterDir.toString());
        segmenter = new SceneSegmenter(shotDetector, frameExtractor, sceneCatalog, settings, appConfig);
    }

    @Test
    void cutsSplitTheFileIntoConsecutiveIntervals() {
        assertThat(SceneSegmenter.toIntervals(List.of(2.0, 5.0), 8.0)).containsExactly(
                new Interval(0.0, 2.0), new Interval(2.0, 5.0), new Interval(5.0, 8.0));
    }

    @Test
    void noCutsMeansOneSceneCoveringTheFile() {
        assertThat(SceneSegmenter.toIntervals(List.of(), 8.0)).containsExactly(new Interval(0.0, 8.0));
        assertThat(SceneSegmenter.toIntervals(List.of(), null)).containsExactly(new Interval(0.0, 0.0));
    }

    @Test
    void cutsOutsideTheFileOrOutOfOrderAreIgnored() {
        assertThat(SceneSegmenter.toIntervals(List.of(0.0, 3.0, 3.0, 2.0, 9.0), 8.0)).containsExactly(
                new Interval(0.0, 3.0), new Interval(3.0, 8.0));
    }

    @Test
    void unknownDurationEndsAtLastCut() {
        assertThat(SceneSegmenter.toIntervals(List.of(1.5, 4.0), null)).containsExactly(
                new Interval(0.0, 1.5), new Interval(1.5, 4.0), new Interval(4.0, 4.0));
    }

    @Test
    void posterIsOneFrameBeforeMidpoint() {
        assertThat(SceneSegmenter.posterTimestamp(new Interval(0.0, 2.0), 1.0 / 24))
                .isCloseTo(1.0 - 1.0 / 24, within(1e-9));
        assertThat(SceneSegmenter.posterTimestamp(new Interval(5.0, 5.02), 1.0 / 24)).isEqualTo(5.0);
    }

    @Test
    void posterFileNameIsZeroPaddedWithFormatExtension() {
        assertThat(SceneSegmenter.posterFileName(12L, 3, new StillFormat(1280, "jpeg", 80))).isEqualTo("12_0003.jpg");
        assertThat(SceneSegmenter.posterFileName(7L, 41, new StillFormat(1280, "webp", 80))).isEqualTo("7_0041.webp");
    }

    @Test
    @SuppressWarnings("unchecked")
    void segmentStoresOneDraftPerSceneAndToleratesFailedStills() throws Exception {
        VideoFileEntity file = new VideoFileEntity();
        file.setId(4L);
        file.setFilename("interview.mov");
        file.setDurationSeconds(10.0);
        file.setFps(25.0);
        Path video = Path.of("/media/interview.mov");

        when(shotDetector.detectCuts(video, 0.3)).thenReturn(List.of(4.0));
        when(settings.getPosterWidth()).thenReturn(640);
        when(settings.getPosterFormat()).thenReturn("jpg");
        when(settings.getPosterQuality()).thenReturn(80);
        when(sceneCatalog.scenesForFile(4L)).thenReturn(List.of());
        when(frameExtractor.extractStill(eq(video), anyDouble(), any(Path.class), any(StillFormat.class)))
                .thenReturn(true, false);

        segmenter.segment(file, video);

        ArgumentCaptor<List<SceneDraft>> drafts = ArgumentCaptor.forClass(List.class);
        verify(sceneCatalog).replaceScenes(eq(4L), drafts.capture());
        assertThat(drafts.getValue()).hasSize(2);

        SceneDraft first = drafts.getValue().get(0);
        assertThat(first.index()).isZero();
        assertThat(first.startTc()).isEqualTo(0.0);
        assertThat(first.endTc()).isEqualTo(4.0);
        assertThat(first.posterPath()).isEqualTo(posterDir.resolve("4_0000.jpg").toString());

        SceneDraft second = drafts.getValue().get(1);
        assertThat(second.index()).isEqualTo(1);
        assertThat(second.endTc()).isEqualTo(10.0);
        assertThat(second.posterPath()).isNull();

        verify(frameExtractor).extractStill(eq(video), eq(2.0 - 1.0 / 25), any(Path.class), any(StillFormat.class));
    }
}
