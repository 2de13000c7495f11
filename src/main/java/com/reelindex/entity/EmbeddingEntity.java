package com.reelindex.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * A scene-level vector for one model. At most one row exists per
 * (scene, model); recomputation overwrites the vector in place.
 */
@Entity
@Table(name = "embeddings", uniqueConstraints = {
        @UniqueConstraint(name = "uq_embeddings_scene_model", columnNames = { "scene_id", "model_name" })
}, indexes = {
        @Index(name = "idx_embeddings_model", columnList = "model_name")
})
public class EmbeddingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "scene_id", nullable = false)
    private SceneEntity scene;

    @Column(name = "model_name", nullable = false, length = 64)
    private String modelName;

    @Column(name = "model_version", length = 128)
    private String modelVersion;

    @Column(name = "dimension", nullable = false)
    private int dimension;

    @Lob
    @Column(name = "vector", columnDefinition = "BLOB", nullable = false)
    private byte[] vector;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    public EmbeddingEntity() {
    }

    // ───────────── getters / setters ─────────────

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public SceneEntity getScene() {
        return scene;
    }

    public void setScene(SceneEntity scene) {
        this.scene = scene;
    }

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public String getModelVersion() {
        return modelVersion;
    }

    public void setModelVersion(String modelVersion) {
        this.modelVersion = modelVersion;
    }

    public int getDimension() {
        return dimension;
    }

    public void setDimension(int dimension) {
        this.dimension = dimension;
    }

    public byte[] getVector() {
        return vector;
    }

    public void setVector(byte[] vector) {
        this.vector = vector;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
