package com.reelindex.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * Static process configuration bound from {@code app.*} properties.
 * Operator settings that may change while the worker runs live in the
 * settings table instead (see {@link com.reelindex.service.IndexerSettings}).
 */
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {

    /** Base data directory */
    private String dataDir = "./data";

    /** Directory where representative scene stills are written */
    private String posterDir = "./data/posters";

    /** Directory where downscaled grid thumbnails are cached */
    private String thumbDir = "./data/thumbs";

    /** Directory holding the CLIP ONNX models and tokenizer.json */
    private String modelDir = "./data/models";

    private String ffmpegPath = "ffmpeg";

    private String ffprobePath = "ffprobe";

    /** Starts the background scan/enrich/cluster loop on application ready */
    private boolean workerEnabled = true;

    /** Comma-separated watch folders merged into the settings store at startup */
    private String watchFolders = "";

    /** Jobs stuck in processing longer than this are reset to pending on startup */
    private int stuckJobTimeoutMinutes = 30;

    /** Maximum pending jobs drained per worker cycle */
    private int batchSize = 10;

    /** Granularity of the pause/resume check while sleeping between cycles */
    private int statePollSeconds = 10;

    private int pausedPollSeconds = 30;

    /** Disables destructive admin endpoints */
    private boolean demoMode = false;

    private int searchDefaultLimit = 200;

    private int searchMaxLimit = 500;

    /** ffmpeg scene-change score (0..1) above which a frame starts a new shot */
    private double sceneThreshold = 0.3;

    /** Grid thumbnail bounding box in pixels */
    private int thumbSize = 400;

    /** Upper bound for a single ffmpeg/ffprobe invocation */
    private long processTimeoutSeconds = 1800;

    private final Inference inference = new Inference();

    /** HTTP inference sidecar for speech, transcript embedding and faces. */
    public static class Inference {

        /** Blank disables the sidecar-backed collaborators */
        private String baseUrl = "";

        private int timeoutSeconds = 300;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean isEnabled() {
            return baseUrl != null && !baseUrl.isBlank();
        }
    }

    // ───────────── getters / setters ─────────────

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getPosterDir() {
        return posterDir;
    }

    public void setPosterDir(String posterDir) {
        this.posterDir = posterDir;
    }

    public String getThumbDir() {
        return thumbDir;
    }

    public void setThumbDir(String thumbDir) {
        this.thumbDir = thumbDir;
    }

    public String getModelDir() {
        return modelDir;
    }

    public void setModelDir(String modelDir) {
        this.modelDir = modelDir;
    }

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public String getFfprobePath() {
        return ffprobePath;
    }

    public void setFfprobePath(String ffprobePath) {
        this.ffprobePath = ffprobePath;
    }

    public boolean isWorkerEnabled() {
        return workerEnabled;
    }

    public void setWorkerEnabled(boolean workerEnabled) {
        this.workerEnabled = workerEnabled;
    }

    public String getWatchFolders() {
        return watchFolders;
    }

    public void setWatchFolders(String watchFolders) {
        this.watchFolders = watchFolders;
    }

    /** Returns the seed watch folders split by comma */
    public List<String> getWatchFolderList() {
        if (watchFolders == null) {
            return List.of();
        }
        return Arrays.stream(watchFolders.split(","))
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toList();
    }

    public int getStuckJobTimeoutMinutes() {
        return stuckJobTimeoutMinutes;
    }

    public void setStuckJobTimeoutMinutes(int stuckJobTimeoutMinutes) {
        this.stuckJobTimeoutMinutes = stuckJobTimeoutMinutes;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getStatePollSeconds() {
        return statePollSeconds;
    }

    public void setStatePollSeconds(int statePollSeconds) {
        this.statePollSeconds = statePollSeconds;
    }

    public int getPausedPollSeconds() {
        return pausedPollSeconds;
    }

    public void setPausedPollSeconds(int pausedPollSeconds) {
        this.pausedPollSeconds = pausedPollSeconds;
    }

    public boolean isDemoMode() {
        return demoMode;
    }

    public void setDemoMode(boolean demoMode) {
        this.demoMode = demoMode;
    }

    public int getSearchDefaultLimit() {
        return searchDefaultLimit;
    }

    public void setSearchDefaultLimit(int searchDefaultLimit) {
        this.searchDefaultLimit = searchDefaultLimit;
    }

    public int getSearchMaxLimit() {
        return searchMaxLimit;
    }

    public void setSearchMaxLimit(int searchMaxLimit) {
        this.searchMaxLimit = searchMaxLimit;
    }

    public double getSceneThreshold() {
        return sceneThreshold;
    }

    public void setSceneThreshold(double sceneThreshold) {
        this.sceneThreshold = sceneThreshold;
    }

    public int getThumbSize() {
        return thumbSize;
    }

    public void setThumbSize(int thumbSize) {
        this.thumbSize = thumbSize;
    }

    public long getProcessTimeoutSeconds() {
        return processTimeoutSeconds;
    }

    public void setProcessTimeoutSeconds(long processTimeoutSeconds) {
        this.processTimeoutSeconds = processTimeoutSeconds;
    }

    public Inference getInference() {
        return inference;
    }
}
