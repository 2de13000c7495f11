package com.reelindex.repository;

import com.reelindex.entity.EmbeddingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface EmbeddingRepository extends JpaRepository<EmbeddingEntity, Long> {

    Optional<EmbeddingEntity> findBySceneIdAndModelName(Long sceneId, String modelName);

    List<EmbeddingEntity> findBySceneIdOrderByModelNameAsc(Long sceneId);

    @Query("SELECT e FROM EmbeddingEntity e WHERE e.modelName = :model ORDER BY e.scene.id")
    List<EmbeddingEntity> findByModel(@Param("model") String model);

    @Query("SELECT e FROM EmbeddingEntity e WHERE e.modelName = :model AND e.scene.id IN :sceneIds")
    List<EmbeddingEntity> findByModelAndSceneIds(@Param("model") String model,
            @Param("sceneIds") Collection<Long> sceneIds);

    /** Returns rows of [modelName, modelVersion, dimension, count, lastCreatedAt]. */
    @Query("SELECT e.modelName, e.modelVersion, e.dimension, COUNT(e), MAX(e.createdAt) FROM EmbeddingEntity e "
            + "GROUP BY e.modelName, e.modelVersion, e.dimension ORDER BY e.modelName")
    List<Object[]> summarizeByModel();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM EmbeddingEntity e WHERE e.scene.id IN "
            + "(SELECT s.id FROM SceneEntity s WHERE s.file.id = :fileId)")
    int deleteByFileId(@Param("fileId") Long fileId);
}
