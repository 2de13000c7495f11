package com.reelindex.exception;

/**
 * The metadata probe could not read the file. Fatal for the enrichment job.
 */
public class MediaProbeException extends Exception {

    public MediaProbeException(String message) {
        super(message);
    }

    public MediaProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
