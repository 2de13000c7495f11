package com.reelindex.entity;

import jakarta.persistence.*;

/**
 * One shot within a video file. Scenes of a file are always replaced as a
 * whole when the file is re-enriched.
 */
@Entity
@Table(name = "scenes", indexes = {
        @Index(name = "idx_scenes_file", columnList = "file_id, scene_index", unique = true),
        @Index(name = "idx_scenes_cluster", columnList = "cluster_id")
})
public class SceneEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "file_id", nullable = false)
    private VideoFileEntity file;

    @Column(name = "scene_index", nullable = false)
    private int sceneIndex;

    @Column(name = "start_tc", nullable = false)
    private double startTc;

    @Column(name = "end_tc", nullable = false)
    private double endTc;

    @Column(name = "poster_path", length = 4096)
    private String posterPath;

    @Column(name = "transcript", length = 100000)
    private String transcript;

    @Column(name = "cluster_id")
    private Integer clusterId;

    @Column(name = "cluster_order")
    private Double clusterOrder;

    public SceneEntity() {
    }

    public SceneEntity(VideoFileEntity file, int sceneIndex, double startTc, double endTc) {
        this.file = file;
        this.sceneIndex = sceneIndex;
        this.startTc = startTc;
        this.endTc = endTc;
    }

    // ───────────── getters / setters ─────────────

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public VideoFileEntity getFile() {
        return file;
    }

    public void setFile(VideoFileEntity file) {
        this.file = file;
    }

    public int getSceneIndex() {
        return sceneIndex;
    }

    public void setSceneIndex(int sceneIndex) {
        this.sceneIndex = sceneIndex;
    }

    public double getStartTc() {
        return startTc;
    }

    public void setStartTc(double startTc) {
        this.startTc = startTc;
    }

    public double getEndTc() {
        return endTc;
    }

    public void setEndTc(double endTc) {
        this.endTc = endTc;
    }

    public String getPosterPath() {
        return posterPath;
    }

    public void setPosterPath(String posterPath) {
        this.posterPath = posterPath;
    }

    public String getTranscript() {
        return transcript;
    }

    public void setTranscript(String transcript) {
        this.transcript = transcript;
    }

    public Integer getClusterId() {
        return clusterId;
    }

    public void setClusterId(Integer clusterId) {
        this.clusterId = clusterId;
    }

    public Double getClusterOrder() {
        return clusterOrder;
    }

    public void setClusterOrder(Double clusterOrder) {
        this.clusterOrder = clusterOrder;
    }
}
