package com.reelindex.service.enrichment;

import com.reelindex.config.AppConfig;
import com.reelindex.entity.EnrichmentJobEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.service.EnrichmentJobService;
import com.reelindex.service.FileCatalogService;
import com.reelindex.service.IndexerSettings;
import com.reelindex.service.LibraryScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Drains pending jobs in FIFO batches and drives each one through the
 * pipeline, recording progress on the job row as it goes.
 */
@Service
public class EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    static final String FILE_NOT_FOUND = "File not found";

    private final EnrichmentJobService jobService;
    private final EnrichmentPipeline pipeline;
    private final IndexerSettings settings;
    private final AppConfig appConfig;

    public EnrichmentService(EnrichmentJobService jobService,
            EnrichmentPipeline pipeline,
            IndexerSettings settings,
            AppConfig appConfig) {
        this.jobService = jobService;
        this.pipeline = pipeline;
        this.settings = settings;
        this.appConfig = appConfig;
    }

    /**
     * Processes up to one batch of pending jobs. Jobs whose file sits under a
     * watch folder that is currently unreachable are left pending.
     *
     * @return number of jobs that ran to completion or failure
     */
    public int processBatch() {
        List<EnrichmentJobEntity> jobs = jobService.nextPendingBatch(appConfig.getBatchSize());
        if (jobs.isEmpty()) {
            return 0;
        }
        List<Path> accessibleRoots = accessibleRoots();
        int processed = 0;
        for (EnrichmentJobEntity job : jobs) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            VideoFileEntity file = job.getFile();
            Path path = Paths.get(file.getPath());
            if (!FileCatalogService.isUnderAny(path, accessibleRoots)) {
                log.debug("Watch folder offline, deferring job {} for {}", job.getId(), path);
                continue;
            }
            if (!Files.exists(path)) {
                log.warn("Job {} failed: file not found: {}", job.getId(), path);
                jobService.markFailed(job.getId(), FILE_NOT_FOUND);
                processed++;
                continue;
            }
            if (runJob(job.getId(), file, path)) {
                processed++;
            }
        }
        return processed;
    }

    /**
     * @return false when the thread was interrupted mid-job; the job then stays
     *         processing until stuck-job recovery returns it to the queue
     */
    boolean runJob(Long jobId, VideoFileEntity file, Path path) {
        List<EnrichmentStage> stages = pipeline.stagesFor(settings.getEnabledModalities());
        jobService.markProcessing(jobId, stages.size());
        EnrichmentContext context = new EnrichmentContext(file, path);
        long started = System.currentTimeMillis();
        EnrichmentStage current = null;
        try {
            for (int i = 0; i < stages.size(); i++) {
                current = stages.get(i);
                jobService.updateStage(jobId, current.name(), i + 1);
                current.run(context);
            }
            jobService.markComplete(jobId);
            log.info("Enriched {} ({} scene(s)) in {} ms", file.getFilename(), context.getScenes().size(),
                    System.currentTimeMillis() - started);
            return true;
        } catch (Exception e) {
            if (e instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while enriching {}, leaving job {} in processing", path, jobId);
                return false;
            }
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Enrichment of {} failed at stage {}: {}", path,
                    current != null ? current.name() : "start", message, e);
            jobService.markFailed(jobId, message);
            return true;
        }
    }

    private List<Path> accessibleRoots() {
        List<Path> roots = new ArrayList<>();
        for (String folder : settings.getWatchFolders()) {
            try {
                Path root = Paths.get(folder).toAbsolutePath().normalize();
                if (LibraryScanner.isAccessible(root)) {
                    roots.add(root);
                }
            } catch (InvalidPathException e) {
                log.warn("Ignoring invalid watch folder '{}'", folder);
            }
        }
        return roots;
    }
}
