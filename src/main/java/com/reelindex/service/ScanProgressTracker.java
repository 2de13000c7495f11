package com.reelindex.service;

import com.reelindex.dto.ScanProgress;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live counters of the current scan, readable from API threads while the
 * worker thread updates them.
 */
@Component
public class ScanProgressTracker {

    public static final String PHASE_IDLE = "idle";
    public static final String PHASE_DISCOVERING = "discovering";
    public static final String PHASE_PROCESSING = "processing";
    public static final String PHASE_CHECKING_MISSING = "checking_missing";
    public static final String PHASE_COMPLETE = "complete";

    private final AtomicReference<String> phase = new AtomicReference<>(PHASE_IDLE);
    private final AtomicReference<String> currentFolder = new AtomicReference<>("");
    private final AtomicInteger dirsScanned = new AtomicInteger();
    private final AtomicInteger filesFound = new AtomicInteger();
    private final AtomicInteger filesProcessed = new AtomicInteger();
    private final AtomicInteger filesNew = new AtomicInteger();
    private final AtomicInteger filesUpdated = new AtomicInteger();
    private final AtomicInteger filesSkipped = new AtomicInteger();
    private final AtomicReference<LocalDateTime> updatedAt = new AtomicReference<>(LocalDateTime.now());

    public void start() {
        dirsScanned.set(0);
        filesFound.set(0);
        filesProcessed.set(0);
        filesNew.set(0);
        filesUpdated.set(0);
        filesSkipped.set(0);
        currentFolder.set("");
        phase(PHASE_DISCOVERING);
    }

    public void phase(String newPhase) {
        phase.set(newPhase);
        touch();
    }

    public void directoryVisited(String folder) {
        currentFolder.set(folder);
        dirsScanned.incrementAndGet();
        touch();
    }

    public void fileFound() {
        filesFound.incrementAndGet();
    }

    public void fileProcessed(FileChange change) {
        filesProcessed.incrementAndGet();
        switch (change) {
            case NEW -> filesNew.incrementAndGet();
            case MODIFIED -> filesUpdated.incrementAndGet();
            case SKIPPED -> filesSkipped.incrementAndGet();
            default -> {
            }
        }
        touch();
    }

    public ScanProgress snapshot() {
        return new ScanProgress(phase.get(), currentFolder.get(), dirsScanned.get(), filesFound.get(),
                filesProcessed.get(), filesNew.get(), filesUpdated.get(), filesSkipped.get(), updatedAt.get());
    }

    private void touch() {
        updatedAt.set(LocalDateTime.now());
    }
}
