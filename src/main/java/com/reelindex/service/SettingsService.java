package com.reelindex.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelindex.entity.SettingEntity;
import com.reelindex.repository.SettingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Raw access to the settings table. Every value is stored as a JSON document
 * so lists and objects round-trip. Typed access lives in
 * {@link IndexerSettings}.
 */
@Service
@Transactional
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    private final SettingRepository settingRepository;
    private final ObjectMapper mapper = new ObjectMapper();

    public SettingsService(SettingRepository settingRepository) {
        this.settingRepository = settingRepository;
    }

    /**
     * Serializes {@code value} to JSON and stores it under {@code key}.
     */
    public void saveSetting(String key, Object value) {
        saveOrUpdate(key, mapper.valueToTree(value));
    }

    public void saveJson(String key, JsonNode value) {
        saveOrUpdate(key, value);
    }

    /**
     * Retrieves a setting as a JSON tree. Rows that do not parse are logged
     * and treated as absent.
     */
    @Transactional(readOnly = true)
    public Optional<JsonNode> getJson(String key) {
        return settingRepository.findByKey(key).map(entity -> parse(entity.getKey(), entity.getJsonValue()));
    }

    @Transactional(readOnly = true)
    public Map<String, JsonNode> getAll() {
        Map<String, JsonNode> all = new LinkedHashMap<>();
        for (SettingEntity entity : settingRepository.findAllByOrderByKeyAsc()) {
            all.put(entity.getKey(), parse(entity.getKey(), entity.getJsonValue()));
        }
        return all;
    }

    private JsonNode parse(String key, String json) {
        if (json == null) {
            return mapper.nullNode();
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Setting '{}' is not valid JSON, ignoring stored value", key);
            return mapper.nullNode();
        }
    }

    private void saveOrUpdate(String key, JsonNode value) {
        String json;
        try {
            json = mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Setting '" + key + "' cannot be serialized", e);
        }
        SettingEntity entity = settingRepository.findByKey(key)
                .orElse(new SettingEntity(key, json));
        entity.setJsonValue(json);
        entity.setUpdatedAt(LocalDateTime.now());
        settingRepository.save(entity);
    }
}
