package com.reelindex.service;

import com.reelindex.entity.EnrichmentJobEntity;
import com.reelindex.entity.JobStatus;
import com.reelindex.exception.NotFoundException;
import com.reelindex.repository.EnrichmentJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Job queue state transitions. Each method is its own short transaction so
 * progress written by the worker is visible to API readers immediately.
 *
 * Selection followed by {@link #markProcessing} is not atomic: two workers
 * polling the same store could both pick a job. The indexer assumes a single
 * worker process.
 */
@Service
public class EnrichmentJobService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentJobService.class);

    private static final int MAX_ERROR_LENGTH = 4000;

    private final EnrichmentJobRepository jobRepository;

    public EnrichmentJobService(EnrichmentJobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    /**
     * Returns to pending every job that has been processing for longer than
     * {@code timeout}, clearing its start time. Run once at worker startup.
     */
    @Transactional
    public int recoverStuckJobs(Duration timeout) {
        LocalDateTime cutoff = LocalDateTime.now().minus(timeout);
        int recovered = jobRepository.resetStartedBefore(JobStatus.PROCESSING, JobStatus.PENDING, cutoff);
        if (recovered > 0) {
            log.info("Recovered {} stuck job(s) processing since before {}", recovered, cutoff);
        }
        return recovered;
    }

    /** Oldest pending jobs first, with their files loaded. */
    @Transactional(readOnly = true)
    public List<EnrichmentJobEntity> nextPendingBatch(int limit) {
        return jobRepository.findBatch(JobStatus.PENDING, PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional
    public void markProcessing(Long jobId, int totalStages) {
        EnrichmentJobEntity job = load(jobId);
        job.setStatus(JobStatus.PROCESSING);
        job.setStartedAt(LocalDateTime.now());
        job.setCompletedAt(null);
        job.setCurrentStage("starting");
        job.setCurrentStageNum(0);
        job.setTotalStages(totalStages);
        job.setErrorMessage(null);
    }

    @Transactional
    public void updateStage(Long jobId, String stage, int stageNum) {
        EnrichmentJobEntity job = load(jobId);
        job.setCurrentStage(stage);
        job.setCurrentStageNum(stageNum);
    }

    /** Completes the job and stamps the file as indexed. */
    @Transactional
    public void markComplete(Long jobId) {
        EnrichmentJobEntity job = load(jobId);
        LocalDateTime now = LocalDateTime.now();
        job.setStatus(JobStatus.COMPLETE);
        job.setCompletedAt(now);
        job.setCurrentStage("complete");
        job.getFile().setIndexedAt(now);
    }

    @Transactional
    public void markFailed(Long jobId, String error) {
        EnrichmentJobEntity job = load(jobId);
        job.setStatus(JobStatus.FAILED);
        job.setErrorMessage(truncate(error));
        job.setRetryCount(job.getRetryCount() + 1);
    }

    @Transactional(readOnly = true)
    public long countByStatus(JobStatus status) {
        return jobRepository.countByStatus(status);
    }

    /** The most recently started job still in processing, if any. */
    @Transactional(readOnly = true)
    public Optional<EnrichmentJobEntity> currentlyProcessing() {
        return jobRepository.findWithFileByStatus(JobStatus.PROCESSING, PageRequest.of(0, 1)).stream().findFirst();
    }

    private EnrichmentJobEntity load(Long jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> NotFoundException.of("Job", jobId));
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
