package com.reelindex.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * One video file seen by the scanner. Media attributes stay null until the
 * metadata probe stage runs; {@code indexedAt} is set only once the whole
 * enrichment pipeline succeeded.
 */
@Entity
@Table(name = "files", indexes = {
        @Index(name = "idx_files_path", columnList = "path", unique = true),
        @Index(name = "idx_files_deleted_at", columnList = "deleted_at")
})
public class VideoFileEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "path", nullable = false, length = 4096)
    private String path;

    @Column(name = "filename", nullable = false, length = 1024)
    private String filename;

    @Column(name = "parent_folder", length = 4096)
    private String parentFolder;

    @Column(name = "size_bytes")
    private Long sizeBytes;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "modified_at")
    private LocalDateTime modifiedAt;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    @Column(name = "width")
    private Integer width;

    @Column(name = "height")
    private Integer height;

    @Column(name = "fps")
    private Double fps;

    @Column(name = "codec", length = 64)
    private String codec;

    @Column(name = "pixel_format", length = 64)
    private String pixelFormat;

    @Column(name = "color_space", length = 64)
    private String colorSpace;

    @Column(name = "color_transfer", length = 64)
    private String colorTransfer;

    @Column(name = "color_primaries", length = 64)
    private String colorPrimaries;

    @Column(name = "audio_tracks")
    private Integer audioTracks;

    @Column(name = "indexed_at")
    private LocalDateTime indexedAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    // ───────────── constructors ─────────────

    public VideoFileEntity() {
    }

    /** Nulls everything the probe and pipeline produced so the file is enriched from scratch. */
    public void clearMediaAttributes() {
        this.durationSeconds = null;
        this.width = null;
        this.height = null;
        this.fps = null;
        this.codec = null;
        this.pixelFormat = null;
        this.colorSpace = null;
        this.colorTransfer = null;
        this.colorPrimaries = null;
        this.audioTracks = null;
        this.indexedAt = null;
    }

    // ───────────── getters / setters ─────────────

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getParentFolder() {
        return parentFolder;
    }

    public void setParentFolder(String parentFolder) {
        this.parentFolder = parentFolder;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(Long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getModifiedAt() {
        return modifiedAt;
    }

    public void setModifiedAt(LocalDateTime modifiedAt) {
        this.modifiedAt = modifiedAt;
    }

    public Double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(Double durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public Integer getWidth() {
        return width;
    }

    public void setWidth(Integer width) {
        this.width = width;
    }

    public Integer getHeight() {
        return height;
    }

    public void setHeight(Integer height) {
        this.height = height;
    }

    public Double getFps() {
        return fps;
    }

    public void setFps(Double fps) {
        this.fps = fps;
    }

    public String getCodec() {
        return codec;
    }

    public void setCodec(String codec) {
        this.codec = codec;
    }

    public String getPixelFormat() {
        return pixelFormat;
    }

    public void setPixelFormat(String pixelFormat) {
        this.pixelFormat = pixelFormat;
    }

    public String getColorSpace() {
        return colorSpace;
    }

    public void setColorSpace(String colorSpace) {
        this.colorSpace = colorSpace;
    }

    public String getColorTransfer() {
        return colorTransfer;
    }

    public void setColorTransfer(String colorTransfer) {
        this.colorTransfer = colorTransfer;
    }

    public String getColorPrimaries() {
        return colorPrimaries;
    }

    public void setColorPrimaries(String colorPrimaries) {
        this.colorPrimaries = colorPrimaries;
    }

    public Integer getAudioTracks() {
        return audioTracks;
    }

    public void setAudioTracks(Integer audioTracks) {
        this.audioTracks = audioTracks;
    }

    public LocalDateTime getIndexedAt() {
        return indexedAt;
    }

    public void setIndexedAt(LocalDateTime indexedAt) {
        this.indexedAt = indexedAt;
    }

    public LocalDateTime getDeletedAt() {
        return deletedAt;
    }

    public void setDeletedAt(LocalDateTime deletedAt) {
        this.deletedAt = deletedAt;
    }
}
