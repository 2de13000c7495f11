package com.reelindex.service;

import com.reelindex.config.AppConfig;
import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.service.SceneCatalogService.SceneDraft;
import com.reelindex.service.media.FrameExtractor;
import com.reelindex.service.media.ShotDetector;
import com.reelindex.service.media.StillFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a file into scenes at detected shot boundaries and extracts one
 * poster still per scene. Re-running replaces the file's scenes.
 */
@Service
public class SceneSegmenter {

    private static final Logger log = LoggerFactory.getLogger(SceneSegmenter.class);

    static final double DEFAULT_FPS = 24.0;

    /** A half-open time span in seconds. */
    record Interval(double start, double end) {
    }

    private final ShotDetector shotDetector;
    private final FrameExtractor frameExtractor;
    private final SceneCatalogService sceneCatalog;
    private final IndexerSettings settings;
    private final AppConfig appConfig;

    public SceneSegmenter(ShotDetector shotDetector,
            FrameExtractor frameExtractor,
            SceneCatalogService sceneCatalog,
            IndexerSettings settings,
            AppConfig appConfig) {
        this.shotDetector = shotDetector;
        this.frameExtractor = frameExtractor;
        this.sceneCatalog = sceneCatalog;
        this.settings = settings;
        this.appConfig = appConfig;
    }

    /**
     * @return the stored scenes in index order
     * @throws IOException if shot detection fails or the poster directory cannot be created
     */
    public List<SceneEntity> segment(VideoFileEntity file, Path video) throws IOException {
        List<Double> cuts = shotDetector.detectCuts(video, appConfig.getSceneThreshold());
        List<Interval> intervals = toIntervals(cuts, file.getDurationSeconds());
        log.info("{}: {} cut(s), {} scene(s)", file.getFilename(), cuts.size(), intervals.size());

        Path posterDir = Paths.get(appConfig.getPosterDir());
        Files.createDirectories(posterDir);
        removeOldPosters(file.getId());

        StillFormat format = new StillFormat(settings.getPosterWidth(), settings.getPosterFormat(),
                settings.getPosterQuality());
        double frameDuration = 1.0 / (file.getFps() != null && file.getFps() > 0 ? file.getFps() : DEFAULT_FPS);

        List<SceneDraft> drafts = new ArrayList<>(intervals.size());
        int extracted = 0;
        for (int i = 0; i < intervals.size(); i++) {
            Interval interval = intervals.get(i);
            Path target = posterDir.resolve(posterFileName(file.getId(), i, format));
            double timestamp = posterTimestamp(interval, frameDuration);
            String posterPath = null;
            if (frameExtractor.extractStill(video, timestamp, target, format)) {
                posterPath = target.toString();
                extracted++;
            } else {
                log.warn("No poster for scene {} of {} at {}s", i, file.getFilename(), timestamp);
            }
            drafts.add(new SceneDraft(i, interval.start(), interval.end(), posterPath));
        }
        log.debug("{}: {} of {} poster(s) extracted", file.getFilename(), extracted, intervals.size());
        return sceneCatalog.replaceScenes(file.getId(), drafts);
    }

    /**
     * Consecutive spans between cuts, from 0 to the file duration. With no cut
     * the whole file is one scene; an unknown duration ends the last span at
     * the last cut.
     */
    static List<Interval> toIntervals(List<Double> cuts, Double duration) {
        double end = duration != null ? duration : 0.0;
        List<Double> bounds = new ArrayList<>();
        for (Double cut : cuts) {
            if (cut > 0 && (duration == null || cut < duration)
                    && (bounds.isEmpty() || cut > bounds.get(bounds.size() - 1))) {
                bounds.add(cut);
            }
        }
        if (duration == null && !bounds.isEmpty()) {
            end = bounds.get(bounds.size() - 1);
        }
        List<Interval> intervals = new ArrayList<>(bounds.size() + 1);
        double start = 0.0;
        for (Double cut : bounds) {
            intervals.add(new Interval(start, cut));
            start = cut;
        }
        intervals.add(new Interval(start, Math.max(start, end)));
        return intervals;
    }

    /** One frame before the midpoint, never before the scene start. */
    static double posterTimestamp(Interval interval, double frameDuration) {
        double mid = (interval.start() + interval.end()) / 2.0;
        return Math.max(interval.start(), mid - frameDuration);
    }

    static String posterFileName(Long fileId, int sceneIndex, StillFormat format) {
        return String.format("%d_%04d.%s", fileId, sceneIndex, format.extension());
    }

    private void removeOldPosters(Long fileId) {
        for (SceneEntity old : sceneCatalog.scenesForFile(fileId)) {
            if (old.getPosterPath() == null) {
                continue;
            }
            try {
                Files.deleteIfExists(Paths.get(old.getPosterPath()));
            } catch (IOException e) {
                log.warn("Could not delete old poster {}: {}", old.getPosterPath(), e.getMessage());
            }
        }
    }
}
