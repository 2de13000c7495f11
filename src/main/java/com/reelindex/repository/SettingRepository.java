package com.reelindex.repository;

import com.reelindex.entity.SettingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SettingRepository extends JpaRepository<SettingEntity, String> {

    Optional<SettingEntity> findByKey(String key);

    List<SettingEntity> findAllByOrderByKeyAsc();
}
