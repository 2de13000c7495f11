package com.reelindex.service;

import com.reelindex.config.AppConfig;
import com.reelindex.entity.JobStatus;
import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.exception.AdminActionForbiddenException;
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
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Destructive maintenance actions. Every mutating method refuses to run in
 * demo mode.
 */
@Service
public class AdminService {

    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    private final VideoFileRepository fileRepository;
    private final SceneRepository sceneRepository;
    private final FaceRepository faceRepository;
    private final EmbeddingRepository embeddingRepository;
    private final EnrichmentJobRepository jobRepository;
    private final IndexerSettings settings;
    private final ThumbnailService thumbnailService;
    private final AppConfig appConfig;

    public AdminService(VideoFileRepository fileRepository,
            SceneRepository sceneRepository,
            FaceRepository faceRepository,
            EmbeddingRepository embeddingRepository,
            EnrichmentJobRepository jobRepository,
            IndexerSettings settings,
            ThumbnailService thumbnailService,
            AppConfig appConfig) {
        this.fileRepository = fileRepository;
        this.sceneRepository = sceneRepository;
        this.faceRepository = faceRepository;
        this.embeddingRepository = embeddingRepository;
        this.jobRepository = jobRepository;
        this.settings = settings;
        this.thumbnailService = thumbnailService;
        this.appConfig = appConfig;
    }

    public boolean isDemoMode() {
        return appConfig.isDemoMode();
    }

    /** Failed jobs go back to pending; their retry count is kept. */
    @Transactional
    public int resetFailedJobs() {
        requireAdminEnabled();
        int count = jobRepository.resetAll(JobStatus.FAILED, JobStatus.PENDING);
        log.info("Admin: reset {} failed job(s) to pending", count);
        return count;
    }

    @Transactional
    public int resetProcessingJobs() {
        requireAdminEnabled();
        int count = jobRepository.resetAll(JobStatus.PROCESSING, JobStatus.PENDING);
        log.info("Admin: reset {} processing job(s) to pending", count);
        return count;
    }

    /** Permanently removes soft-deleted files with everything derived from them. */
    @Transactional
    public int purgeDeleted() {
        requireAdminEnabled();
        List<VideoFileEntity> deleted = fileRepository.findByDeletedAtIsNotNull();
        for (VideoFileEntity file : deleted) {
            purge(file.getId());
        }
        log.info("Admin: purged {} soft-deleted file(s)", deleted.size());
        return deleted.size();
    }

    /**
     * Removes files that lie outside every configured watch folder. With no
     * watch folder configured nothing is removed.
     */
    @Transactional
    public int purgeOrphans() {
        requireAdminEnabled();
        List<Path> roots = new ArrayList<>();
        for (String folder : settings.getWatchFolders()) {
            try {
                roots.add(Paths.get(folder).toAbsolutePath().normalize());
            } catch (InvalidPathException e) {
                log.warn("Ignoring invalid watch folder '{}'", folder);
            }
        }
        if (roots.isEmpty()) {
            return 0;
        }
        List<Long> orphans = new ArrayList<>();
        for (VideoFileEntity file : fileRepository.findAll()) {
            if (!FileCatalogService.isUnderAny(Paths.get(file.getPath()), roots)) {
                orphans.add(file.getId());
            }
        }
        orphans.forEach(this::purge);
        log.info("Admin: purged {} orphaned file(s)", orphans.size());
        return orphans.size();
    }

    /**
     * Deletes every file, scene, face, embedding and job. Settings are kept.
     *
     * @return row counts before the wipe
     */
    @Transactional
    public Map<String, Long> wipeDatabase() {
        requireAdminEnabled();
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("files", fileRepository.count());
        counts.put("scenes", sceneRepository.count());
        counts.put("faces", faceRepository.count());

        List<Path> posters = new ArrayList<>();
        for (SceneEntity scene : sceneRepository.findAll()) {
            if (scene.getPosterPath() != null) {
                posters.add(Paths.get(scene.getPosterPath()));
            }
        }
        faceRepository.deleteAllInBatch();
        embeddingRepository.deleteAllInBatch();
        sceneRepository.deleteAllInBatch();
        jobRepository.deleteAllInBatch();
        fileRepository.deleteAllInBatch();
        posters.forEach(this::deletePoster);

        log.warn("Admin: database wiped ({})", counts);
        return counts;
    }

    private void purge(Long fileId) {
        List<Path> posters = new ArrayList<>();
        for (SceneEntity scene : sceneRepository.findByFileIdOrderBySceneIndexAsc(fileId)) {
            if (scene.getPosterPath() != null) {
                posters.add(Paths.get(scene.getPosterPath()));
            }
        }
        faceRepository.deleteByFileId(fileId);
        embeddingRepository.deleteByFileId(fileId);
        sceneRepository.deleteByFileId(fileId);
        jobRepository.deleteByFileId(fileId);
        fileRepository.deleteById(fileId);
        posters.forEach(this::deletePoster);
    }

    private void deletePoster(Path poster) {
        thumbnailService.deleteThumbnail(poster);
        try {
            Files.deleteIfExists(poster);
        } catch (IOException e) {
            log.warn("Could not delete poster {}: {}", poster, e.getMessage());
        }
    }

    private void requireAdminEnabled() {
        if (appConfig.isDemoMode()) {
            throw new AdminActionForbiddenException();
        }
    }
}
