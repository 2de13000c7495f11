package com.reelindex.dto;

import java.time.LocalDateTime;

/**
 * Snapshot of a running (or the last finished) scan.
 */
public record ScanProgress(
        String phase,
        String currentFolder,
        int dirsScanned,
        int filesFound,
        int filesProcessed,
        int filesNew,
        int filesUpdated,
        int filesSkipped,
        LocalDateTime updatedAt) {
}
