package com.reelindex.service.media;

import com.reelindex.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ffmpeg-backed shot detection, still extraction and audio extraction.
 *
 * Shot detection uses ffmpeg's scene-change score ({@code select='gt(scene,T)'})
 * which compares consecutive decoded frames; {@code showinfo} then reports the
 * presentation time of every frame that crossed the threshold.
 */
@Component
public class FfmpegMediaTools implements ShotDetector, FrameExtractor, AudioExtractor {

    private static final Logger log = LoggerFactory.getLogger(FfmpegMediaTools.class);

    private static final Pattern SHOWINFO_PTS = Pattern.compile("Parsed_showinfo.*\\bpts_time:\\s*([0-9]+(?:\\.[0-9]+)?)");

    private final AppConfig appConfig;
    private final ProcessRunner processRunner;

    public FfmpegMediaTools(AppConfig appConfig, ProcessRunner processRunner) {
        this.appConfig = appConfig;
        this.processRunner = processRunner;
    }

    @Override
    public List<Double> detectCuts(Path video, double threshold) throws IOException {
        String filter = String.format(Locale.ROOT, "select='gt(scene,%.3f)',showinfo", threshold);
        ProcessRunner.Result result = processRunner.run(List.of(
                appConfig.getFfmpegPath(), "-hide_banner", "-nostats",
                "-i", video.toString(),
                "-an", "-filter:v", filter,
                "-f", "null", "-"));
        if (!result.succeeded()) {
            throw new IOException("Shot detection failed for " + video.getFileName() + ": " + result.tail());
        }
        return parseCutTimes(result.stderr());
    }

    /** Distinct positive cut times from showinfo output, ascending. */
    static List<Double> parseCutTimes(List<String> lines) {
        TreeSet<Double> cuts = new TreeSet<>();
        for (String line : lines) {
            Matcher m = SHOWINFO_PTS.matcher(line);
            if (m.find()) {
                double t = Double.parseDouble(m.group(1));
                if (t > 0) {
                    cuts.add(t);
                }
            }
        }
        return new ArrayList<>(cuts);
    }

    @Override
    public boolean extractStill(Path video, double timestampSeconds, Path target, StillFormat format) {
        List<String> command = new ArrayList<>(List.of(
                appConfig.getFfmpegPath(), "-y", "-hide_banner", "-loglevel", "error",
                "-ss", String.format(Locale.ROOT, "%.3f", Math.max(0.0, timestampSeconds)),
                "-i", video.toString(),
                "-frames:v", "1",
                "-vf", "scale=" + format.width() + ":-2"));
        command.addAll(qualityArgs(format));
        command.add(target.toString());
        try {
            Files.createDirectories(target.getParent());
            ProcessRunner.Result result = processRunner.run(command);
            if (result.succeeded() && Files.exists(target) && Files.size(target) > 0) {
                return true;
            }
            log.warn("Still extraction at {}s failed for {}: {}", timestampSeconds, video.getFileName(), result.tail());
        } catch (IOException e) {
            log.warn("Still extraction at {}s failed for {}: {}", timestampSeconds, video.getFileName(), e.getMessage());
        }
        return false;
    }

    /** ffmpeg arguments for the lossy quality of a still. */
    static List<String> qualityArgs(StillFormat format) {
        switch (format.extension()) {
            case "webp":
                return List.of("-quality", String.valueOf(format.quality()));
            case "jpg":
                // mjpeg qscale: 2 is best, 31 worst
                int q = 2 + Math.round((100 - format.quality()) * 29 / 100f);
                return List.of("-q:v", String.valueOf(Math.min(31, Math.max(2, q))));
            default:
                return List.of();
        }
    }

    @Override
    public void extractSpeechAudio(Path video, Path wavTarget) throws IOException {
        ProcessRunner.Result result = processRunner.run(List.of(
                appConfig.getFfmpegPath(), "-y", "-hide_banner", "-loglevel", "error",
                "-i", video.toString(),
                "-vn", "-acodec", "pcm_s16le", "-ar", "16000", "-ac", "1",
                wavTarget.toString()));
        if (!result.succeeded()) {
            throw new IOException("Audio extraction failed for " + video.getFileName() + ": " + result.tail());
        }
    }
}
