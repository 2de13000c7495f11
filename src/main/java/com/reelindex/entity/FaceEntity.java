package com.reelindex.entity;

import jakarta.persistence.*;

/**
 * A face detected on a scene's representative still. The embedding is a
 * unit-normalized float32 vector stored as raw little-endian bytes; use
 * EmbeddingUtils to convert.
 */
@Entity
@Table(name = "faces", indexes = {
        @Index(name = "idx_faces_scene", columnList = "scene_id"),
        @Index(name = "idx_faces_cluster", columnList = "cluster_id")
})
public class FaceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "scene_id", nullable = false)
    private SceneEntity scene;

    @Lob
    @Column(name = "embedding", columnDefinition = "BLOB", nullable = false)
    private byte[] embedding;

    @Column(name = "bbox_x")
    private int bboxX;

    @Column(name = "bbox_y")
    private int bboxY;

    @Column(name = "bbox_w")
    private int bboxW;

    @Column(name = "bbox_h")
    private int bboxH;

    @Column(name = "cluster_id")
    private Integer clusterId;

    @Column(name = "cluster_order")
    private Double clusterOrder;

    public FaceEntity() {
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

    public byte[] getEmbedding() {
        return embedding;
    }

    public void setEmbedding(byte[] embedding) {
        this.embedding = embedding;
    }

    public int getBboxX() {
        return bboxX;
    }

    public void setBboxX(int bboxX) {
        this.bboxX = bboxX;
    }

    public int getBboxY() {
        return bboxY;
    }

    public void setBboxY(int bboxY) {
        this.bboxY = bboxY;
    }

    public int getBboxW() {
        return bboxW;
    }

    public void setBboxW(int bboxW) {
        this.bboxW = bboxW;
    }

    public int getBboxH() {
        return bboxH;
    }

    public void setBboxH(int bboxH) {
        this.bboxH = bboxH;
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
