package com.reelindex.service;

/**
 * How one scan classified a file found on disk.
 */
public enum FileChange {
    /** First sighting, or reappeared after being marked deleted */
    NEW,
    MODIFIED,
    UNCHANGED,
    /** Could not be stat-ed this cycle */
    SKIPPED
}
