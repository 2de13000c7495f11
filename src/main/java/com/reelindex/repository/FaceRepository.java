package com.reelindex.repository;

import com.reelindex.entity.FaceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface FaceRepository extends JpaRepository<FaceEntity, Long> {

    List<FaceEntity> findBySceneIdOrderByIdAsc(Long sceneId);

    @Query("SELECT f FROM FaceEntity f WHERE f.scene.id IN :sceneIds ORDER BY f.id")
    List<FaceEntity> findBySceneIds(@Param("sceneIds") Collection<Long> sceneIds);

    List<FaceEntity> findAllByOrderByIdAsc();

    List<FaceEntity> findTop200ByOrderByIdDesc();

    @Query("SELECT COUNT(DISTINCT f.scene.id) FROM FaceEntity f")
    long countScenesWithFaces();

    List<FaceEntity> findByClusterIdOrderByClusterOrderAscIdAsc(Integer clusterId);

    /** Returns rows of [clusterId, memberCount] for real clusters, largest first. */
    @Query("SELECT f.clusterId, COUNT(f) FROM FaceEntity f WHERE f.clusterId >= 0 "
            + "GROUP BY f.clusterId ORDER BY COUNT(f) DESC, f.clusterId ASC")
    List<Object[]> countByCluster();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM FaceEntity f WHERE f.scene.id IN "
            + "(SELECT s.id FROM SceneEntity s WHERE s.file.id = :fileId)")
    int deleteByFileId(@Param("fileId") Long fileId);
}
