package com.reelindex.service;

import com.reelindex.config.AppConfig;
import com.reelindex.entity.EnrichmentJobEntity;
import com.reelindex.entity.JobStatus;
import com.reelindex.entity.SceneEntity;
import com.reelindex.entity.VideoFileEntity;
import com.reelindex.exception.AdminActionForbiddenException;
import com.reelindex.repository.EnrichmentJobRepository;
import com.reelindex.repository.SceneRepository;
import com.reelindex.repository.VideoFileRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({AdminService.class, IndexerSettings.class, SettingsService.class, AppConfig.class})
class AdminServiceTest {

    @Autowired
    private AdminService adminService;

    @Autowired
    private AppConfig appConfig;

    @Autowired
    private IndexerSettings settings;

    @Autowired
    private VideoFileRepository fileRepository;

    @Autowired
    private SceneRepository sceneRepository;

    @Autowired
    private EnrichmentJobRepository jobRepository;

    @MockitoBean
    private ThumbnailService thumbnailService;

    @AfterEach
    void leaveDemoMode() {
        appConfig.setDemoMode(false);
    }

    private VideoFileEntity file(String path, JobStatus status) {
        VideoFileEntity file = new VideoFileEntity();
        file.setPath(path);
        file.setFilename(path.substring(path.lastIndexOf('/') + 1));
        file.setSizeBytes(1L);
        file = fileRepository.save(file);
        sceneRepository.save(new SceneEntity(file, 0, 0.0, 5.0));
        EnrichmentJobEntity job = new EnrichmentJobEntity(file, LocalDateTime.now());
        job.setStatus(status);
        jobRepository.save(job);
        return file;
    }

    @Test
    void demoModeBlocksDestructiveActions() {
        appConfig.setDemoMode(true);

        assertThat(adminService.isDemoMode()).isTrue();
        assertThatThrownBy(() -> adminService.resetFailedJobs())
                .isInstanceOf(AdminActionForbiddenException.class)
                .hasMessage("Admin actions disabled in demo mode");
        assertThatThrownBy(() -> adminService.wipeDatabase()).isInstanceOf(AdminActionForbiddenException.class);
    }

    @Test
    void resetFailedJobsRequeuesAndKeepsRetryCount() {
        VideoFileEntity file = file("/archive/in/a.mp4", JobStatus.FAILED);
        EnrichmentJobEntity job = jobRepository.findByFileIdOrderByIdAsc(file.getId()).get(0);
        job.setRetryCount(2);
        job.setErrorMessage("boom");

        assertThat(adminService.resetFailedJobs()).isEqualTo(1);

        EnrichmentJobEntity reset = jobRepository.findById(job.getId()).orElseThrow();
        assertThat(reset.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(reset.getRetryCount()).isEqualTo(2);
        assertThat(reset.getErrorMessage()).isNull();
    }

    @Test
    void purgeOrphansRemovesFilesOutsideWatchFolders() {
        VideoFileEntity kept = file("/archive/in/a.mp4", JobStatus.COMPLETE);
        VideoFileEntity orphan = file("/archive/old/b.mp4", JobStatus.COMPLETE);
        settings.setWatchFolders(List.of("/archive/in"));

        assertThat(adminService.purgeOrphans()).isEqualTo(1);

        assertThat(fileRepository.findById(kept.getId())).isPresent();
        assertThat(fileRepository.findById(orphan.getId())).isEmpty();
        assertThat(sceneRepository.countByFileId(orphan.getId())).isZero();
        assertThat(jobRepository.findByFileIdOrderByIdAsc(orphan.getId())).isEmpty();
    }

    @Test
    void purgeOrphansWithoutWatchFoldersKeepsEverything() {
        file("/archive/in/a.mp4", JobStatus.COMPLETE);

        assertThat(adminService.purgeOrphans()).isZero();
        assertThat(fileRepository.count()).isEqualTo(1);
    }

    @Test
    void purgeDeletedOnlyTouchesSoftDeletedFiles() {
        VideoFileEntity live = file("/archive/in/a.mp4", JobStatus.COMPLETE);
        VideoFileEntity gone = file("/archive/in/b.mp4", JobStatus.COMPLETE);
        gone.setDeletedAt(LocalDateTime.now());

        assertThat(adminService.purgeDeleted()).isEqualTo(1);

        assertThat(fileRepository.findById(live.getId())).isPresent();
        assertThat(fileRepository.findById(gone.getId())).isEmpty();
    }

    @Test
    void wipeReportsCountsAndEmptiesCatalog() {
        file("/archive/in/a.mp4", JobStatus.COMPLETE);
        file("/archive/in/b.mp4", JobStatus.PENDING);
        settings.setWatchFolders(List.of("/archive/in"));

        Map<String, Long> counts = adminService.wipeDatabase();

        assertThat(counts).containsEntry("files", 2L).containsEntry("scenes", 2L).containsEntry("faces", 0L);
        assertThat(fileRepository.count()).isZero();
        assertThat(jobRepository.count()).isZero();
        assertThat(settings.getWatchFolders()).containsExactly("/archive/in");
    }
}
