package com.reelindex.service;

import com.reelindex.config.AppConfig;
import com.reelindex.entity.JobStatus;
import com.reelindex.service.enrichment.EnrichmentService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IndexerWorkerTest {

    @Mock
    private LibraryScanner scanner;

    @Mock
    private EnrichmentService enrichmentService;

    @Mock
    private EnrichmentJobService jobService;

    @Mock
    private ClusterService clusterService;

    @Mock
    private IndexerSettings settings;

    @Mock
    private ThreadPoolTaskExecutor executor;

    private AppConfig appConfig;
    private IndexerWorker worker;

    @BeforeEach
    void setUp() {
        appConfig = new AppConfig();
        appConfig.setStatePollSeconds(1);
        appConfig.setPausedPollSeconds(0);
        worker = new IndexerWorker(scanner, enrichmentService, jobService, clusterService, settings, appConfig,
                executor);
    }

    @AfterEach
    void tearDown() {
        worker.stop();
    }

    @Test
    void startMergesSeedFoldersAndRecoversBeforeTheLoopIsSubmitted() {
        appConfig.setWatchFolders("/mnt/a, /mnt/b");
        when(settings.getWatchFolders()).thenReturn(List.of("/mnt/b", "/mnt/c"));

        worker.start();

        InOrder order = inOrder(settings, jobService, executor);
        order.verify(settings).setWatchFolders(List.of("/mnt/b", "/mnt/c", "/mnt/a"));
        order.verify(jobService).recoverStuckJobs(Duration.ofMinutes(30));
        order.verify(executor).submit(any(Runnable.class));
        assertThat(worker.isRunning()).isTrue();
    }

    @Test
    void seedFoldersAlreadyStoredAreNotRewritten() {
        appConfig.setWatchFolders("/mnt/a");
        when(settings.getWatchFolders()).thenReturn(List.of("/mnt/a"));

        worker.syncSeedWatchFolders();

        verify(settings, never()).setWatchFolders(anyList());
    }

    @Test
    void pausedCycleNeitherScansNorProcesses() throws Exception {
        when(settings.isPaused()).thenReturn(true);

        worker.runCycle();

        verify(scanner, never()).scan();
        verify(enrichmentService, never()).processBatch();
        verify(clusterService, never()).clusterFaces();
    }

    @Test
    void runningCycleScansDrainsAndReclusters() throws Exception {
        worker.start();
        when(settings.getIndexerState()).thenReturn(IndexerSettings.STATE_RUNNING);
        when(settings.isPaused()).thenReturn(false);
        when(jobService.countByStatus(JobStatus.PENDING)).thenReturn(2L, 0L);
        when(enrichmentService.processBatch()).thenReturn(2);
        when(settings.getPollIntervalSeconds()).thenReturn(0);

        worker.runCycle();

        InOrder order = inOrder(scanner, enrichmentService, clusterService);
        order.verify(scanner).scan();
        order.verify(enrichmentService).processBatch();
        order.verify(clusterService).clusterFaces();
        order.verify(clusterService).clusterScenes();
    }

    @Test
    void emptyQueueSkipsClustering() throws Exception {
        worker.start();
        when(settings.getIndexerState()).thenReturn(IndexerSettings.STATE_RUNNING);
        when(settings.isPaused()).thenReturn(false);
        when(jobService.countByStatus(JobStatus.PENDING)).thenReturn(0L);
        when(settings.getPollIntervalSeconds()).thenReturn(0);

        worker.runCycle();

        verify(scanner).scan();
        verify(enrichmentService, never()).processBatch();
        verify(clusterService, never()).clusterFaces();
        verify(clusterService, never()).clusterScenes();
    }

    @Test
    void sleepEndsEarlyWhenIndexerStateChanges() throws Exception {
        worker.start();
        when(settings.getIndexerState()).thenReturn(IndexerSettings.STATE_PAUSED);
        long started = System.nanoTime();

        worker.sleepUntilNextCycle(60, IndexerSettings.STATE_RUNNING);

        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;
        assertThat(elapsedMillis).isLessThan(10_000);
        verify(settings, times(1)).getIndexerState();
    }

    @Test
    void sleepRunsItsCourseWhileStateIsUnchanged() throws Exception {
        worker.start();
        when(settings.getIndexerState()).thenReturn(IndexerSettings.STATE_RUNNING);
        long started = System.nanoTime();

        worker.sleepUntilNextCycle(2, IndexerSettings.STATE_RUNNING);

        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(1_900);
        verify(settings, atLeast(2)).getIndexerState();
    }
}
