package com.reelindex.controller;

import com.reelindex.dto.ScanProgress;
import com.reelindex.repository.SettingRepository;
import com.reelindex.service.IndexerSettings;
import com.reelindex.service.LibraryQueryService;
import com.reelindex.service.ScanProgressTracker;
import com.reelindex.service.inference.TranscriptEmbedder;
import com.reelindex.service.inference.VisualEmbedder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Readiness, health, statistics and pipeline progress.
 *
 * Endpoints:
 * GET /api/ready, GET /api/health
 * GET /api/stats, GET /api/stats/vectors
 * GET /api/queue - job counts per status plus the job in progress
 * GET /api/scan/progress - live counters of the running or last scan
 */
@RestController
@RequestMapping("/api")
public class StatusController {

    private static final Logger log = LoggerFactory.getLogger(StatusController.class);

    private final LibraryQueryService libraryQueryService;
    private final ScanProgressTracker scanProgress;
    private final IndexerSettings settings;
    private final VisualEmbedder visualEmbedder;
    private final TranscriptEmbedder transcriptEmbedder;
    private final SettingRepository settingRepository;

    public StatusController(LibraryQueryService libraryQueryService,
            ScanProgressTracker scanProgress,
            IndexerSettings settings,
            VisualEmbedder visualEmbedder,
            TranscriptEmbedder transcriptEmbedder,
            SettingRepository settingRepository) {
        this.libraryQueryService = libraryQueryService;
        this.scanProgress = scanProgress;
        this.settings = settings;
        this.visualEmbedder = visualEmbedder;
        this.transcriptEmbedder = transcriptEmbedder;
        this.settingRepository = settingRepository;
    }

    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        boolean visual = visualEmbedder.isAvailable();
        boolean transcript = transcriptEmbedder.isAvailable();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("modelsReady", visual && transcript);
        body.put("visualModelLoaded", visual);
        body.put("transcriptModelAvailable", transcript);
        body.put("indexerState", settings.getIndexerState());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        try {
            settingRepository.count();
            return ResponseEntity.ok(Map.of("status", "healthy", "database", "connected"));
        } catch (RuntimeException e) {
            log.warn("Health check failed: {}", e.getMessage());
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("status", "unhealthy", "database", reason));
        }
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>(libraryQueryService.stats());
        body.put("lastScanAt", settings.getLastScanAt().orElse(null));
        body.put("lastScanDurationMs", settings.getLastScanDurationMs().orElse(null));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/stats/vectors")
    public ResponseEntity<Map<String, Object>> vectorStats() {
        return ResponseEntity.ok(libraryQueryService.vectorStats());
    }

    @GetMapping("/queue")
    public ResponseEntity<Map<String, Object>> queue() {
        return ResponseEntity.ok(libraryQueryService.queue());
    }

    @GetMapping("/scan/progress")
    public ResponseEntity<ScanProgress> scanProgress() {
        return ResponseEntity.ok(scanProgress.snapshot());
    }
}
