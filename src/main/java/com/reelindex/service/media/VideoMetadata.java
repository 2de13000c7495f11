package com.reelindex.service.media;

/**
 * Probed media attributes of one file. Any field except the audio track count
 * may be null when the container does not report it.
 */
public record VideoMetadata(
        Double durationSeconds,
        Integer width,
        Integer height,
        Double fps,
        String codec,
        String pixelFormat,
        String colorSpace,
        String colorTransfer,
        String colorPrimaries,
        int audioTracks) {

    public VideoMetadata withAudioTracks(int tracks) {
        return new VideoMetadata(durationSeconds, width, height, fps, codec, pixelFormat, colorSpace, colorTransfer,
                colorPrimaries, tracks);
    }
}
