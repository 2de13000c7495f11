package com.reelindex.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.reelindex.exception.NotFoundException;
import com.reelindex.service.IndexerSettings;
import com.reelindex.service.LibraryScanner;
import com.reelindex.service.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator settings. Values are JSON and take effect on the indexer's next
 * read; nothing needs a restart.
 *
 * Endpoints:
 * GET /api/config/{key} - { "value": ... }
 * PUT /api/config/{key} - body { "value": ... }
 * GET /api/watch-folders - configured folders with reachability
 */
@RestController
@RequestMapping("/api")
public class SettingsController {

    private static final Logger log = LoggerFactory.getLogger(SettingsController.class);

    private final SettingsService settingsService;
    private final IndexerSettings indexerSettings;

    public SettingsController(SettingsService settingsService, IndexerSettings indexerSettings) {
        this.settingsService = settingsService;
        this.indexerSettings = indexerSettings;
    }

    @GetMapping("/config/{key}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String key) {
        JsonNode value = settingsService.getJson(key)
                .orElseThrow(() -> new NotFoundException("Config key '" + key + "' not found"));
        return ResponseEntity.ok(Map.of("value", value));
    }

    @PutMapping("/config/{key}")
    public ResponseEntity<Map<String, Object>> put(@PathVariable String key, @RequestBody JsonNode body) {
        if (body == null || !body.has("value")) {
            throw new IllegalArgumentException("Body must be an object with a 'value' field");
        }
        JsonNode value = body.get("value");
        switch (key) {
            case IndexerSettings.KEY_INDEXER_STATE -> indexerSettings.setIndexerState(value.asText());
            case IndexerSettings.KEY_WATCH_FOLDERS -> indexerSettings.setWatchFolders(toFolderList(value));
            default -> settingsService.saveJson(key, value);
        }
        log.info("Setting '{}' updated", key);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("key", key);
        response.put("value", settingsService.getJson(key).orElse(value));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/watch-folders")
    public ResponseEntity<Map<String, Object>> watchFolders() {
        List<Map<String, Object>> folders = new ArrayList<>();
        for (String folder : indexerSettings.getWatchFolders()) {
            boolean accessible;
            try {
                accessible = LibraryScanner.isAccessible(Paths.get(folder));
            } catch (InvalidPathException e) {
                accessible = false;
            }
            folders.add(Map.of("path", folder, "accessible", accessible));
        }
        return ResponseEntity.ok(Map.of("folders", folders));
    }

    private static List<String> toFolderList(JsonNode value) {
        if (value == null || !value.isArray()) {
            throw new IllegalArgumentException("watch_folders must be a JSON array of paths");
        }
        List<String> folders = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new IllegalArgumentException("watch_folders entries must be non-empty strings");
            }
            folders.add(item.asText().trim());
        }
        return folders;
    }
}
