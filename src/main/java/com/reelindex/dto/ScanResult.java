package com.reelindex.dto;

/**
 * Outcome of one scan pass over all watch roots.
 */
public record ScanResult(int found, int newFiles, int updated, int skipped, int missing) {

    public static ScanResult empty() {
        return new ScanResult(0, 0, 0, 0, 0);
    }
}
