package com.reelindex.util;

import java.util.Locale;

/**
 * Builds a CMX3600 edit decision list. Events are laid back to back on the
 * record side starting at 00:00:00:00.
 */
public final class EdlWriter {

    public static final double DEFAULT_FPS = 29.97;

    private final StringBuilder out = new StringBuilder();
    private int eventNumber = 0;
    private double recordIn = 0.0;

    public EdlWriter(String title) {
        out.append("TITLE: ").append(title).append('\n');
        out.append("FCM: NON-DROP FRAME").append('\n');
        out.append('\n');
    }

    /**
     * Appends one video cut event.
     *
     * @param fps the source frame rate, or null to use {@link #DEFAULT_FPS}
     */
    public EdlWriter addEvent(String clipName, double sourceIn, double sourceOut, Double fps) {
        double rate = fps != null && fps > 0 ? fps : DEFAULT_FPS;
        double recordOut = recordIn + (sourceOut - sourceIn);
        eventNumber++;
        out.append(String.format(Locale.ROOT, "%03d  AX       V     C        %s %s %s %s",
                eventNumber,
                toSmpte(sourceIn, rate), toSmpte(sourceOut, rate),
                toSmpte(recordIn, rate), toSmpte(recordOut, rate))).append('\n');
        out.append("* FROM CLIP NAME: ").append(clipName).append('\n');
        out.append('\n');
        recordIn = recordOut;
        return this;
    }

    public int getEventCount() {
        return eventNumber;
    }

    public String build() {
        return out.toString();
    }

    /**
     * Seconds to non-drop-frame SMPTE timecode {@code HH:MM:SS:FF}, counting
     * frames at the nominal (rounded) rate.
     */
    public static String toSmpte(double seconds, double fps) {
        int nominal = (int) Math.round(fps);
        long totalFrames = Math.round(seconds * fps);
        long frames = totalFrames % nominal;
        long totalSeconds = totalFrames / nominal;
        long secs = totalSeconds % 60;
        long totalMinutes = totalSeconds / 60;
        long mins = totalMinutes % 60;
        long hours = totalMinutes / 60;
        return String.format(Locale.ROOT, "%02d:%02d:%02d:%02d", hours, mins, secs, frames);
    }
}
