package com.reelindex.service.media;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelindex.config.AppConfig;
import com.reelindex.exception.MediaProbeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link MediaProbe} backed by ffprobe's JSON output.
 */
@Component
public class FfprobeMediaProbe implements MediaProbe {

    private static final Logger log = LoggerFactory.getLogger(FfprobeMediaProbe.class);

    static final String UNREADABLE = "FFprobe failed - file may be corrupted or unsupported format";

    private final AppConfig appConfig;
    private final ProcessRunner processRunner;
    private final ObjectMapper mapper = new ObjectMapper();

    public FfprobeMediaProbe(AppConfig appConfig, ProcessRunner processRunner) {
        this.appConfig = appConfig;
        this.processRunner = processRunner;
    }

    @Override
    public VideoMetadata probe(Path video) throws MediaProbeException {
        ProcessRunner.Result streams;
        try {
            streams = processRunner.run(List.of(
                    appConfig.getFfprobePath(), "-v", "error",
                    "-select_streams", "v:0",
                    "-show_entries",
                    "stream=width,height,r_frame_rate,codec_name,pix_fmt,color_space,color_transfer,color_primaries",
                    "-show_entries", "format=duration",
                    "-of", "json",
                    video.toString()));
        } catch (IOException e) {
            throw new MediaProbeException(UNREADABLE, e);
        }
        if (!streams.succeeded()) {
            log.warn("ffprobe exited with {} for {}: {}", streams.exitCode(), video, streams.tail());
            throw new MediaProbeException(UNREADABLE);
        }

        VideoMetadata metadata = parseStreamInfo(streams.output());
        if (metadata.durationSeconds() == null) {
            throw new MediaProbeException(UNREADABLE);
        }
        return metadata.withAudioTracks(countAudioTracks(video));
    }

    private int countAudioTracks(Path video) {
        try {
            ProcessRunner.Result audio = processRunner.run(List.of(
                    appConfig.getFfprobePath(), "-v", "error",
                    "-select_streams", "a",
                    "-show_entries", "stream=index",
                    "-of", "csv=p=0",
                    video.toString()));
            return audio.succeeded() ? countNonBlank(audio.stdout()) : 0;
        } catch (IOException e) {
            log.warn("Could not count audio tracks of {}: {}", video, e.getMessage());
            return 0;
        }
    }

    /**
     * Parses ffprobe's {@code -of json} stream/format document. Audio tracks
     * are not part of it and come back as 0.
     */
    VideoMetadata parseStreamInfo(String json) throws MediaProbeException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (IOException e) {
            throw new MediaProbeException(UNREADABLE, e);
        }
        JsonNode stream = root.path("streams").path(0);
        JsonNode format = root.path("format");

        return new VideoMetadata(
                parseDouble(format.path("duration").asText(null)),
                stream.hasNonNull("width") ? stream.get("width").asInt() : null,
                stream.hasNonNull("height") ? stream.get("height").asInt() : null,
                parseFrameRate(stream.path("r_frame_rate").asText(null)),
                stream.path("codec_name").asText(null),
                stream.path("pix_fmt").asText(null),
                stream.path("color_space").asText(null),
                stream.path("color_transfer").asText(null),
                stream.path("color_primaries").asText(null),
                0);
    }

    /** "30000/1001" becomes 29.97; a zero denominator or garbage yields null. */
    static Double parseFrameRate(String fraction) {
        if (fraction == null || fraction.isBlank()) {
            return null;
        }
        try {
            String[] parts = fraction.split("/");
            double value = parts.length == 2
                    ? Double.parseDouble(parts[0]) / Double.parseDouble(parts[1])
                    : Double.parseDouble(parts[0]);
            if (Double.isNaN(value) || Double.isInfinite(value) || value <= 0) {
                return null;
            }
            return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String value) {
        if (value == null || value.isBlank() || "N/A".equals(value)) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int countNonBlank(List<String> lines) {
        int count = 0;
        for (String line : lines) {
            if (!line.isBlank()) {
                count++;
            }
        }
        return count;
    }
}
