package com.reelindex.service.enrichment;

import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * State passed from stage to stage while one file is enriched. The entities
 * are detached snapshots; writes go through the catalog services.
 */
public class EnrichmentContext {

    private final Path path;
    private VideoFileEntity file;
    private List<SceneEntity> scenes = new ArrayList<>();

    public EnrichmentContext(VideoFileEntity file, Path path) {
        this.file = file;
        this.path = path;
    }

    public Long fileId() {
        return file.getId();
    }

    public Path getPath() {
        return path;
    }

    public VideoFileEntity getFile() {
        return file;
    }

    public void setFile(VideoFileEntity file) {
        this.file = file;
    }

    public List<SceneEntity> getScenes() {
        return scenes;
    }

    public void setScenes(List<SceneEntity> scenes) {
        this.scenes = new ArrayList<>(scenes);
    }
}
