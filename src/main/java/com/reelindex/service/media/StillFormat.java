package com.reelindex.service.media;

import java.util.Locale;

/**
 * Output settings for representative stills: target width (height follows
 * the aspect ratio, rounded to even), image format and lossy quality 1..100.
 */
public record StillFormat(int width, String format, int quality) {

    public String extension() {
        String f = format.toLowerCase(Locale.ROOT);
        return "jpeg".equals(f) ? "jpg" : f;
    }
}
