package com.reelindex.dto;

/**
 * Structured scene search: optional metadata predicates plus up to four
 * similarity requests. Null means "not requested"; a null threshold falls
 * back to the stored per-modality default.
 */
public class SceneQuery {

    // similarity requests
    private String visualText;
    private Double visualThreshold;
    private Long matchSceneId;
    private Double visualMatchThreshold;
    private Long faceId;
    private Double faceThreshold;
    private String transcriptQuery;
    private Double transcriptThreshold;

    // metadata predicates
    private Double tcMin;
    private Double tcMax;
    private String transcriptContains;
    private String pathContains;
    private Double durationMin;
    private Double durationMax;
    private Integer widthMin;
    private Integer widthMax;
    private Integer heightMin;
    private Integer heightMax;
    private Double fpsMin;
    private Double fpsMax;
    private String codec;

    private Integer limit;

    public SceneQuery() {
    }

    public boolean hasVisualText() {
        return visualText != null && !visualText.isBlank();
    }

    public boolean hasTranscriptQuery() {
        return transcriptQuery != null && !transcriptQuery.isBlank();
    }

    // ───────────── getters / setters ─────────────

    public String getVisualText() {
        return visualText;
    }

    public void setVisualText(String visualText) {
        this.visualText = visualText;
    }

    public Double getVisualThreshold() {
        return visualThreshold;
    }

    public void setVisualThreshold(Double visualThreshold) {
        this.visualThreshold = visualThreshold;
    }

    public Long getMatchSceneId() {
        return matchSceneId;
    }

    public void setMatchSceneId(Long matchSceneId) {
        this.matchSceneId = matchSceneId;
    }

    public Double getVisualMatchThreshold() {
        return visualMatchThreshold;
    }

    public void setVisualMatchThreshold(Double visualMatchThreshold) {
        this.visualMatchThreshold = visualMatchThreshold;
    }

    public Long getFaceId() {
        return faceId;
    }

    public void setFaceId(Long faceId) {
        this.faceId = faceId;
    }

    public Double getFaceThreshold() {
        return faceThreshold;
    }

    public void setFaceThreshold(Double faceThreshold) {
        this.faceThreshold = faceThreshold;
    }

    public String getTranscriptQuery() {
        return transcriptQuery;
    }

    public void setTranscriptQuery(String transcriptQuery) {
        this.transcriptQuery = transcriptQuery;
    }

    public Double getTranscriptThreshold() {
        return transcriptThreshold;
    }

    public void setTranscriptThreshold(Double transcriptThreshold) {
        this.transcriptThreshold = transcriptThreshold;
    }

    public Double getTcMin() {
        return tcMin;
    }

    public void setTcMin(Double tcMin) {
        this.tcMin = tcMin;
    }

    public Double getTcMax() {
        return tcMax;
    }

    public void setTcMax(Double tcMax) {
        this.tcMax = tcMax;
    }

    public String getTranscriptContains() {
        return transcriptContains;
    }

    public void setTranscriptContains(String transcriptContains) {
        this.transcriptContains = transcriptContains;
    }

    public String getPathContains() {
        return pathContains;
    }

    public void setPathContains(String pathContains) {
        this.pathContains = pathContains;
    }

    public Double getDurationMin() {
        return durationMin;
    }

    public void setDurationMin(Double durationMin) {
        this.durationMin = durationMin;
    }

    public Double getDurationMax() {
        return durationMax;
    }

    public void setDurationMax(Double durationMax) {
        this.durationMax = durationMax;
    }

    public Integer getWidthMin() {
        return widthMin;
    }

    public void setWidthMin(Integer widthMin) {
        this.widthMin = widthMin;
    }

    public Integer getWidthMax() {
        return widthMax;
    }

    public void setWidthMax(Integer widthMax) {
        this.widthMax = widthMax;
    }

    public Integer getHeightMin() {
        return heightMin;
    }

    public void setHeightMin(Integer heightMin) {
        this.heightMin = heightMin;
    }

    public Integer getHeightMax() {
        return heightMax;
    }

    public void setHeightMax(Integer heightMax) {
        this.heightMax = heightMax;
    }

    public Double getFpsMin() {
        return fpsMin;
    }

    public void setFpsMin(Double fpsMin) {
        this.fpsMin = fpsMin;
    }

    public Double getFpsMax() {
        return fpsMax;
    }

    public void setFpsMax(Double fpsMax) {
        this.fpsMax = fpsMax;
    }

    public String getCodec() {
        return codec;
    }

    public void setCodec(String codec) {
        this.codec = codec;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }
}
