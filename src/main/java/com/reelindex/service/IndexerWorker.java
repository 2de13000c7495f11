package com.reelindex.service;

import com.reelindex.config.AppConfig;
import com.reelindex.entity.JobStatus;
import com.reelindex.service.enrichment.EnrichmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Future;

/**
 * The long-running indexer: scan, drain pending jobs, re-cluster, sleep.
 * Polling replaces filesystem notifications, which network mounts do not
 * deliver reliably.
 *
 * The sleep between cycles wakes every {@code app.state-poll-seconds} to
 * re-read {@code indexer_state} and returns early when it changes.
 */
@Service
public class IndexerWorker {

    private static final Logger log = LoggerFactory.getLogger(IndexerWorker.class);

    private static final long ERROR_BACKOFF_SECONDS = 60;

    private final LibraryScanner scanner;
    private final EnrichmentService enrichmentService;
    private final EnrichmentJobService jobService;
    private final ClusterService clusterService;
    private final IndexerSettings settings;
    private final AppConfig appConfig;
    private final ThreadPoolTaskExecutor executor;

    private volatile boolean running = false;
    private Future<?> loop;

    public IndexerWorker(LibraryScanner scanner,
            EnrichmentService enrichmentService,
            EnrichmentJobService jobService,
            ClusterService clusterService,
            IndexerSettings settings,
            AppConfig appConfig,
            @Qualifier("indexingExecutor") ThreadPoolTaskExecutor executor) {
        this.scanner = scanner;
        this.enrichmentService = enrichmentService;
        this.jobService = jobService;
        this.clusterService = clusterService;
        this.settings = settings;
        this.appConfig = appConfig;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!appConfig.isWorkerEnabled()) {
            log.info("Indexer worker disabled (app.worker-enabled=false)");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        syncSeedWatchFolders();
        jobService.recoverStuckJobs(Duration.ofMinutes(appConfig.getStuckJobTimeoutMinutes()));
        running = true;
        loop = executor.submit(this::runLoop);
        log.info("Indexer worker started");
    }

    @PreDestroy
    public synchronized void stop() {
        running = false;
        if (loop != null) {
            loop.cancel(true);
            loop = null;
            log.info("Indexer worker stopped");
        }
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                runCycle();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("Indexer cycle failed: {}", e.getMessage(), e);
                try {
                    Thread.sleep(ERROR_BACKOFF_SECONDS * 1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /** One pass of the loop. Package-private for tests. */
    void runCycle() throws InterruptedException {
        String state = settings.getIndexerState();
        if (settings.isPaused()) {
            log.debug("Indexer paused");
            Thread.sleep(appConfig.getPausedPollSeconds() * 1000L);
            return;
        }

        scanner.scan();

        long pending = jobService.countByStatus(JobStatus.PENDING);
        if (pending > 0) {
            log.info("Processing {} pending file(s)", pending);
            int processed = drainQueue();
            log.info("Enrichment pass complete, {} job(s) finished", processed);
            clusterService.clusterFaces();
            clusterService.clusterScenes();
        }

        int pollSeconds = settings.getPollIntervalSeconds();
        log.info("Next scan in {} s", pollSeconds);
        sleepUntilNextCycle(pollSeconds, state);
    }

    /** Runs batches until the queue is empty, nothing moves, or the indexer is paused. */
    private int drainQueue() {
        int total = 0;
        while (running && !Thread.currentThread().isInterrupted() && !settings.isPaused()) {
            int processed = enrichmentService.processBatch();
            total += processed;
            if (processed == 0 || jobService.countByStatus(JobStatus.PENDING) == 0) {
                break;
            }
        }
        return total;
    }

    /** Sleeps up to {@code seconds}, returning early once {@code indexer_state} differs from the given one. */
    void sleepUntilNextCycle(int seconds, String stateAtStart) throws InterruptedException {
        long deadline = System.currentTimeMillis() + seconds * 1000L;
        long step = Math.max(1, appConfig.getStatePollSeconds()) * 1000L;
        while (running) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                return;
            }
            Thread.sleep(Math.min(step, remaining));
            String current = settings.getIndexerState();
            if (!current.equals(stateAtStart)) {
                log.info("Indexer state changed to {}", current);
                return;
            }
        }
    }

    /** Adds folders from {@code app.watch-folders} to the stored list. */
    void syncSeedWatchFolders() {
        List<String> seeds = appConfig.getWatchFolderList();
        if (seeds.isEmpty()) {
            return;
        }
        Set<String> merged = new LinkedHashSet<>(settings.getWatchFolders());
        if (merged.addAll(seeds)) {
            settings.setWatchFolders(new ArrayList<>(merged));
            log.info("Watch folders: {}", merged);
        }
    }
}
