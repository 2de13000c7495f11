package com.reelindex.repository;

import com.reelindex.entity.VideoFileEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VideoFileRepository extends JpaRepository<VideoFileEntity, Long> {

    Optional<VideoFileEntity> findByPath(String path);

    List<VideoFileEntity> findByDeletedAtIsNull();

    List<VideoFileEntity> findByDeletedAtIsNotNull();

    List<VideoFileEntity> findByDeletedAtIsNullOrderByFilenameAsc();

    @Query("SELECT f FROM VideoFileEntity f WHERE f.deletedAt IS NULL AND f.indexedAt IS NOT NULL ORDER BY f.filename")
    List<VideoFileEntity> findCompleted();

    long countByDeletedAtIsNull();

    long countByDeletedAtIsNullAndIndexedAtIsNotNull();

    @Query("SELECT COALESCE(SUM(f.durationSeconds), 0.0) FROM VideoFileEntity f WHERE f.deletedAt IS NULL")
    double sumDurationSeconds();
}
