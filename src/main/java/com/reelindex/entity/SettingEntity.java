package com.reelindex.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Key-value row of the hot-reloadable settings store. Values are JSON
 * documents (numbers, strings, lists, objects).
 */
@Entity
@Table(name = "settings")
public class SettingEntity {

    @Id
    @Column(name = "setting_key", length = 128)
    private String key;

    @Lob
    @Column(name = "setting_value", columnDefinition = "CLOB")
    private String jsonValue;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public SettingEntity() {
    }

    public SettingEntity(String key, String jsonValue) {
        this.key = key;
        this.jsonValue = jsonValue;
        this.updatedAt = LocalDateTime.now();
    }

    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getJsonValue() {
        return jsonValue;
    }

    public void setJsonValue(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
