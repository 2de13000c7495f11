package com.reelindex.service;

import com.reelindex.dto.ScanResult;
import com.reelindex.service.media.VideoFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Change detector: walks every watch folder, registers the video files it
 * finds and soft-deletes catalog entries that disappeared.
 *
 * Phases, as reported by {@link ScanProgressTracker}: discovering (directory
 * walk, filesystem metadata only), processing (classify each file),
 * checking_missing, complete.
 */
@Service
public class LibraryScanner {

    private static final Logger log = LoggerFactory.getLogger(LibraryScanner.class);

    private final IndexerSettings settings;
    private final FileCatalogService fileCatalog;
    private final ScanProgressTracker progress;

    public LibraryScanner(IndexerSettings settings,
            FileCatalogService fileCatalog,
            ScanProgressTracker progress) {
        this.settings = settings;
        this.fileCatalog = fileCatalog;
        this.progress = progress;
    }

    public ScanResult scan() {
        List<String> folders = settings.getWatchFolders();
        if (folders.isEmpty()) {
            log.info("No watch folders configured, nothing to scan");
            progress.phase(ScanProgressTracker.PHASE_IDLE);
            return ScanResult.empty();
        }

        long startMs = System.currentTimeMillis();
        progress.start();

        List<Path> accessibleRoots = new ArrayList<>();
        Set<Path> videos = new LinkedHashSet<>();
        for (String folder : folders) {
            Path root;
            try {
                root = Paths.get(folder).toAbsolutePath().normalize();
            } catch (InvalidPathException e) {
                log.warn("Ignoring invalid watch folder '{}': {}", folder, e.getMessage());
                continue;
            }
            if (!isAccessible(root)) {
                log.warn("Watch folder not accessible, skipping this cycle: {}", root);
                continue;
            }
            accessibleRoots.add(root);
            discover(root, videos);
        }

        progress.phase(ScanProgressTracker.PHASE_PROCESSING);
        int newFiles = 0;
        int updated = 0;
        int skipped = 0;
        for (Path video : videos) {
            FileChange change;
            try {
                change = fileCatalog.register(video);
            } catch (RuntimeException e) {
                log.warn("Failed to register {}: {}", video, e.getMessage());
                change = FileChange.SKIPPED;
            }
            switch (change) {
                case NEW -> newFiles++;
                case MODIFIED -> updated++;
                case SKIPPED -> skipped++;
                default -> {
                }
            }
            progress.fileProcessed(change);
        }

        progress.phase(ScanProgressTracker.PHASE_CHECKING_MISSING);
        int missing = fileCatalog.markMissing(accessibleRoots);

        long durationMs = System.currentTimeMillis() - startMs;
        settings.recordScan(LocalDateTime.now(), durationMs);
        progress.phase(ScanProgressTracker.PHASE_COMPLETE);

        log.info("Scan complete in {} ms: found={}, new={}, updated={}, skipped={}, missing={}",
                durationMs, videos.size(), newFiles, updated, skipped, missing);
        return new ScanResult(videos.size(), newFiles, updated, skipped, missing);
    }

    public static boolean isAccessible(Path root) {
        try {
            return Files.isDirectory(root) && Files.isReadable(root);
        } catch (SecurityException e) {
            return false;
        }
    }

    /**
     * Collects video files below {@code root}. Unreadable directories and
     * entries are logged and skipped; symbolic links are not followed.
     */
    private void discover(Path root, Set<Path> videos) {
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                            progress.directoryVisited(dir.toString());
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                            if (attrs.isRegularFile() && VideoFormats.isVideo(file)
                                    && videos.add(file.toAbsolutePath().normalize())) {
                                progress.fileFound();
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(Path file, IOException exc) {
                            log.warn("Skipping unreadable path {}: {}", file, exc.getMessage());
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                            if (exc != null) {
                                log.warn("Error while listing {}: {}", dir, exc.getMessage());
                            }
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException e) {
            log.error("Error walking watch folder {}: {}", root, e.getMessage());
        }
    }
}
