package com.reelindex.service.media;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Container formats the scanner treats as video. Only formats ffmpeg decodes
 * fully are listed; proprietary raw camera formats (R3D, BRAW, ARRIRAW) are
 * left out on purpose.
 */
public final class VideoFormats {

    private static final Set<String> EXTENSIONS = Set.of(
            "mp4", "mov", "m4v", "3gp", "3g2",
            "avi", "mkv", "webm", "mxf",
            "wmv", "asf", "flv",
            "ts", "m2ts", "mts",
            "mpg", "mpeg", "vob",
            "ogv", "rm", "rmvb", "wtv",
            "dv", "mj2", "bik", "bk2");

    private VideoFormats() {
    }

    public static boolean isVideo(Path path) {
        if (path == null || path.getFileName() == null) {
            return false;
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
