package com.reelindex.repository;

import com.reelindex.entity.EnrichmentJobEntity;
import com.reelindex.entity.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface EnrichmentJobRepository extends JpaRepository<EnrichmentJobEntity, Long> {

    /** FIFO by enqueue time; id breaks ties between rows queued in the same instant. */
    @Query("SELECT j FROM EnrichmentJobEntity j JOIN FETCH j.file WHERE j.status = :status "
            + "ORDER BY j.queuedAt ASC, j.id ASC")
    List<EnrichmentJobEntity> findBatch(@Param("status") JobStatus status, Pageable pageable);

    List<EnrichmentJobEntity> findByFileIdOrderByIdAsc(Long fileId);

    long countByStatus(JobStatus status);

    boolean existsByFileIdAndStatus(Long fileId, JobStatus status);

    @Query("SELECT j FROM EnrichmentJobEntity j JOIN FETCH j.file WHERE j.status = :status "
            + "ORDER BY j.startedAt DESC, j.id DESC")
    List<EnrichmentJobEntity> findWithFileByStatus(@Param("status") JobStatus status, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM EnrichmentJobEntity j WHERE j.file.id = :fileId")
    int deleteByFileId(@Param("fileId") Long fileId);

    /** Moves every job in {@code from} whose start is older than {@code cutoff} back to {@code to}. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE EnrichmentJobEntity j SET j.status = :to, j.startedAt = NULL "
            + "WHERE j.status = :from AND j.startedAt < :cutoff")
    int resetStartedBefore(@Param("from") JobStatus from, @Param("to") JobStatus to,
            @Param("cutoff") LocalDateTime cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE EnrichmentJobEntity j SET j.status = :to, j.startedAt = NULL, j.errorMessage = NULL "
            + "WHERE j.status = :from")
    int resetAll(@Param("from") JobStatus from, @Param("to") JobStatus to);
}
