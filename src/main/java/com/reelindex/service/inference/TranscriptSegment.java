package com.reelindex.service.inference;

/**
 * One timed piece of recognized speech, offsets in seconds from the start of
 * the file.
 */
public record TranscriptSegment(double start, double end, String text) {

    public boolean overlaps(double from, double to) {
        return start < to && end > from;
    }
}
