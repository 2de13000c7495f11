package com.reelindex.repository;

import com.reelindex.entity.SceneEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SceneRepository extends JpaRepository<SceneEntity, Long>, JpaSpecificationExecutor<SceneEntity> {

    List<SceneEntity> findByFileIdOrderBySceneIndexAsc(Long fileId);

    long countByFileId(Long fileId);

    @Query("SELECT COUNT(s) FROM SceneEntity s WHERE s.file.indexedAt IS NOT NULL")
    long countOfIndexedFiles();

    List<SceneEntity> findByClusterIdOrderByClusterOrderAscIdAsc(Integer clusterId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM SceneEntity s WHERE s.file.id = :fileId")
    int deleteByFileId(@Param("fileId") Long fileId);
}
