package com.reelindex.service;

import com.reelindex.entity.EnrichmentJobEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.repository.EmbeddingRepository;
import com.reelindex.repository.EnrichmentJobRepository;
import com.reelindex.repository.FaceRepository;
import com.reelindex.repository.SceneRepository;
import com.reelindex.repository.VideoFileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Persists what the scanner observes: one transaction per file so a failure
 * on one path never rolls back the rest of the scan.
 */
@Service
public class FileCatalogService {

    private static final Logger log = LoggerFactory.getLogger(FileCatalogService.class);

    /** Filesystems (SMB, FAT, some NFS exports) store coarse mtimes. */
    static final Duration MTIME_TOLERANCE = Duration.ofSeconds(1);

    private final VideoFileRepository fileRepository;
    private final SceneRepository sceneRepository;
    private final FaceRepository faceRepository;
    private final EmbeddingRepository embeddingRepository;
    private final EnrichmentJobRepository jobRepository;

    public FileCatalogService(VideoFileRepository fileRepository,
            SceneRepository sceneRepository,
            FaceRepository faceRepository,
            EmbeddingRepository embeddingRepository,
            EnrichmentJobRepository jobRepository) {
        this.fileRepository = fileRepository;
        this.sceneRepository = sceneRepository;
        this.faceRepository = faceRepository;
        this.embeddingRepository = embeddingRepository;
        this.jobRepository = jobRepository;
    }

    /**
     * Classifies {@code path} against the catalog and applies the side effects
     * for new, reappeared and modified files. Only filesystem attributes are
     * read; media probing waits for enrichment.
     */
    @Transactional
    public FileChange register(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(normalized, BasicFileAttributes.class);
        } catch (IOException | SecurityException e) {
            log.warn("Cannot stat {}: {}", normalized, e.getMessage());
            return FileChange.SKIPPED;
        }
        LocalDateTime modified = toLocal(attrs.lastModifiedTime());
        long size = attrs.size();

        Optional<VideoFileEntity> existing = fileRepository.findByPath(normalized.toString());
        if (existing.isEmpty()) {
            VideoFileEntity file = new VideoFileEntity();
            file.setPath(normalized.toString());
            file.setFilename(normalized.getFileName().toString());
            file.setParentFolder(normalized.getParent() != null ? normalized.getParent().toString() : null);
            file.setSizeBytes(size);
            file.setCreatedAt(toLocal(attrs.creationTime()));
            file.setModifiedAt(modified);
            file = fileRepository.save(file);
            enqueue(file);
            log.debug("New file {}", normalized);
            return FileChange.NEW;
        }

        VideoFileEntity file = existing.get();
        if (file.getDeletedAt() != null) {
            log.info("File reappeared, re-enriching: {}", normalized);
            resetForReenrichment(file, modified, size);
            return FileChange.NEW;
        }
        if (isModified(file, modified, size)) {
            log.info("File modified, re-enriching: {}", normalized);
            resetForReenrichment(file, modified, size);
            return FileChange.MODIFIED;
        }
        return FileChange.UNCHANGED;
    }

    static boolean isModified(VideoFileEntity file, LocalDateTime modified, long size) {
        if (file.getSizeBytes() == null || file.getSizeBytes() != size) {
            return true;
        }
        if (file.getModifiedAt() == null) {
            return true;
        }
        return Duration.between(file.getModifiedAt(), modified).compareTo(MTIME_TOLERANCE) > 0;
    }

    /**
     * Drops everything derived from the old content and queues a fresh job.
     * The stale job goes first so the file never has two live jobs.
     */
    private void resetForReenrichment(VideoFileEntity file, LocalDateTime modified, long size) {
        Long fileId = file.getId();
        faceRepository.deleteByFileId(fileId);
        embeddingRepository.deleteByFileId(fileId);
        sceneRepository.deleteByFileId(fileId);
        jobRepository.deleteByFileId(fileId);

        // bulk deletes cleared the persistence context; reattach via save
        file.clearMediaAttributes();
        file.setDeletedAt(null);
        file.setModifiedAt(modified);
        file.setSizeBytes(size);
        VideoFileEntity saved = fileRepository.save(file);
        enqueue(saved);
    }

    private void enqueue(VideoFileEntity file) {
        jobRepository.save(new EnrichmentJobEntity(file, LocalDateTime.now()));
    }

    /**
     * Soft-deletes catalog entries that vanished from disk. Only files under
     * one of {@code accessibleRoots} are judged, so an unmounted share never
     * marks its files as missing.
     *
     * @return number of files newly marked deleted
     */
    @Transactional
    public int markMissing(List<Path> accessibleRoots) {
        if (accessibleRoots.isEmpty()) {
            return 0;
        }
        LocalDateTime now = LocalDateTime.now();
        int missing = 0;
        for (VideoFileEntity file : fileRepository.findByDeletedAtIsNull()) {
            Path path = Paths.get(file.getPath());
            if (isUnderAny(path, accessibleRoots) && !Files.exists(path)) {
                file.setDeletedAt(now);
                missing++;
                log.info("File missing from disk, marked deleted: {}", path);
            }
        }
        return missing;
    }

    public static boolean isUnderAny(Path path, List<Path> roots) {
        for (Path root : roots) {
            if (path.startsWith(root)) {
                return true;
            }
        }
        return false;
    }

    private static LocalDateTime toLocal(FileTime time) {
        return LocalDateTime.ofInstant(time.toInstant(), ZoneId.systemDefault());
    }
}
