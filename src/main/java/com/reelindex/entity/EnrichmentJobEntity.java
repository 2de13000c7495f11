package com.reelindex.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Durable enrichment queue entry for one file.
 */
@Entity
@Table(name = "enrichment_queue", indexes = {
        @Index(name = "idx_queue_status_queued", columnList = "status, queued_at"),
        @Index(name = "idx_queue_file", columnList = "file_id")
})
public class EnrichmentJobEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "file_id", nullable = false)
    private VideoFileEntity file;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "queued_at", nullable = false)
    private LocalDateTime queuedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "current_stage", length = 64)
    private String currentStage;

    @Column(name = "current_stage_num")
    private Integer currentStageNum;

    @Column(name = "total_stages")
    private Integer totalStages;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    public EnrichmentJobEntity() {
    }

    public EnrichmentJobEntity(VideoFileEntity file, LocalDateTime queuedAt) {
        this.file = file;
        this.queuedAt = queuedAt;
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

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public LocalDateTime getQueuedAt() {
        return queuedAt;
    }

    public void setQueuedAt(LocalDateTime queuedAt) {
        this.queuedAt = queuedAt;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(LocalDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(LocalDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public String getCurrentStage() {
        return currentStage;
    }

    public void setCurrentStage(String currentStage) {
        this.currentStage = currentStage;
    }

    public Integer getCurrentStageNum() {
        return currentStageNum;
    }

    public void setCurrentStageNum(Integer currentStageNum) {
        this.currentStageNum = currentStageNum;
    }

    public Integer getTotalStages() {
        return totalStages;
    }

    public void setTotalStages(Integer totalStages) {
        this.totalStages = totalStages;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }
}
