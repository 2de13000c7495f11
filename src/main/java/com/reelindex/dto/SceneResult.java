package com.reelindex.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;

import java.util.ArrayList;
import java.util.List;

/**
 * A scene row in search and browse responses. Similarity fields are only
 * present when the corresponding filter ran.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SceneResult {

    private Long id;
    private Long fileId;
    private int sceneIndex;
    private double startTc;
    private double endTc;
    private String transcript;
    private Integer clusterId;
    private boolean hasPoster;

    private String filename;
    private String path;
    private Double duration;
    private Integer width;
    private Integer height;
    private Double fps;
    private String codec;

    private Double similarity;
    private Double faceSimilarity;
    private Double transcriptSimilarity;

    private List<FaceBox> faces = new ArrayList<>();

    public SceneResult() {
    }

    public static SceneResult from(SceneEntity scene) {
        SceneResult r = new SceneResult();
        r.id = scene.getId();
        r.sceneIndex = scene.getSceneIndex();
        r.startTc = scene.getStartTc();
        r.endTc = scene.getEndTc();
        r.transcript = scene.getTranscript();
        r.clusterId = scene.getClusterId();
        r.hasPoster = scene.getPosterPath() != null;

        VideoFileEntity file = scene.getFile();
        r.fileId = file.getId();
        r.filename = file.getFilename();
        r.path = file.getPath();
        r.duration = file.getDurationSeconds();
        r.width = file.getWidth();
        r.height = file.getHeight();
        r.fps = file.getFps();
        r.codec = file.getCodec();
        return r;
    }

    // ───────────── getters / setters ─────────────

    public Long getId() {
        return id;
    }

    public Long getFileId() {
        return fileId;
    }

    public int getSceneIndex() {
        return sceneIndex;
    }

    public double getStartTc() {
        return startTc;
    }

    public double getEndTc() {
        return endTc;
    }

    public String getTranscript() {
        return transcript;
    }

    public Integer getClusterId() {
        return clusterId;
    }

    public boolean isHasPoster() {
        return hasPoster;
    }

    public String getFilename() {
        return filename;
    }

    public String getPath() {
        return path;
    }

    public Double getDuration() {
        return duration;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public Double getFps() {
        return fps;
    }

    public String getCodec() {
        return codec;
    }

    public Double getSimilarity() {
        return similarity;
    }

    public void setSimilarity(Double similarity) {
        this.similarity = similarity;
    }

    public Double getFaceSimilarity() {
        return faceSimilarity;
    }

    public void setFaceSimilarity(Double faceSimilarity) {
        this.faceSimilarity = faceSimilarity;
    }

    public Double getTranscriptSimilarity() {
        return transcriptSimilarity;
    }

    public void setTranscriptSimilarity(Double transcriptSimilarity) {
        this.transcriptSimilarity = transcriptSimilarity;
    }

    public List<FaceBox> getFaces() {
        return faces;
    }

    public void setFaces(List<FaceBox> faces) {
        this.faces = faces;
    }
}
