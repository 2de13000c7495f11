package com.reelindex.service;

import com.reelindex.config.AppConfig;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Grid-sized JPEG thumbnails of scene posters, made on first request and
 * cached in the thumb directory. A cached thumbnail older than its poster is
 * made again.
 */
@Service
public class ThumbnailService {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailService.class);

    private final AppConfig appConfig;

    public ThumbnailService(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    public void init() throws IOException {
        Files.createDirectories(Paths.get(appConfig.getThumbDir()));
    }

    /**
     * @return the thumbnail for {@code poster}, or empty when it cannot be made
     */
    public Optional<Path> thumbnailFor(Path poster) {
        if (poster == null || !Files.isRegularFile(poster)) {
            return Optional.empty();
        }
        Path thumb = Paths.get(appConfig.getThumbDir()).resolve(toThumbFilename(poster));
        try {
            if (Files.exists(thumb) && Files.size(thumb) > 0
                    && !Files.getLastModifiedTime(thumb).toInstant()
                            .isBefore(Files.getLastModifiedTime(poster).toInstant())) {
                return Optional.of(thumb);
            }
            Files.createDirectories(thumb.getParent());
            int size = appConfig.getThumbSize();
            Thumbnails.of(poster.toFile())
                    .size(size, size)
                    .keepAspectRatio(true)
                    .outputFormat("jpg")
                    .outputQuality(0.85)
                    .toFile(thumb.toFile());
            return Optional.of(thumb);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to create thumbnail for {}: {}", poster.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    public void deleteThumbnail(Path poster) {
        try {
            Files.deleteIfExists(Paths.get(appConfig.getThumbDir()).resolve(toThumbFilename(poster)));
        } catch (IOException e) {
            log.warn("Failed to delete thumbnail for {}: {}", poster, e.getMessage());
        }
    }

    /** Poster names are unique per file and scene index: {@code 12_0003.jpg} for {@code 12_0003.webp}. */
    static String toThumbFilename(Path poster) {
        String name = poster.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0 ? name.substring(0, dot) : name) + ".jpg";
    }
}
