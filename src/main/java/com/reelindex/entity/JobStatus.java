package com.reelindex.entity;

public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETE,
    FAILED;

    /** Pending and processing jobs; a file has at most one of these. */
    public boolean isLive() {
        return this == PENDING || this == PROCESSING;
    }
}
