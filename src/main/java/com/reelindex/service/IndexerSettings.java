package com.reelindex.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.reelindex.service.enrichment.Modality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Typed view of the operator settings. Every getter reads the store again so
 * a change made through the API applies on the next call; nothing is cached
 * across a worker cycle.
 *
 * Defaults:
 * indexer_state=running, poll_interval_seconds=3600, watch_folders=[],
 * enrichment_models={visual, transcription, transcript_embedding, faces: true},
 * poster_width=1280, poster_format=jpg, poster_quality=80,
 * search_threshold_visual=0.10, search_threshold_visual_match=0.20,
 * search_threshold_face=0.25, search_threshold_transcript=0.35
 */
@Service
public class IndexerSettings {

    private static final Logger log = LoggerFactory.getLogger(IndexerSettings.class);

    public static final String KEY_INDEXER_STATE = "indexer_state";
    public static final String KEY_POLL_INTERVAL = "poll_interval_seconds";
    public static final String KEY_WATCH_FOLDERS = "watch_folders";
    public static final String KEY_ENRICHMENT_MODELS = "enrichment_models";
    public static final String KEY_POSTER_WIDTH = "poster_width";
    public static final String KEY_POSTER_FORMAT = "poster_format";
    public static final String KEY_POSTER_QUALITY = "poster_quality";
    public static final String KEY_THRESHOLD_VISUAL = "search_threshold_visual";
    public static final String KEY_THRESHOLD_VISUAL_MATCH = "search_threshold_visual_match";
    public static final String KEY_THRESHOLD_FACE = "search_threshold_face";
    public static final String KEY_THRESHOLD_TRANSCRIPT = "search_threshold_transcript";
    public static final String KEY_LAST_SCAN_AT = "last_scan_at";
    public static final String KEY_LAST_SCAN_DURATION_MS = "last_scan_duration_ms";

    public static final String STATE_RUNNING = "running";
    public static final String STATE_PAUSED = "paused";

    private final SettingsService settingsService;

    public IndexerSettings(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    public String getIndexerState() {
        return getText(KEY_INDEXER_STATE, STATE_RUNNING);
    }

    public boolean isPaused() {
        return STATE_PAUSED.equalsIgnoreCase(getIndexerState());
    }

    public void setIndexerState(String state) {
        String normalized = state == null ? "" : state.trim().toLowerCase(Locale.ROOT);
        if (!STATE_RUNNING.equals(normalized) && !STATE_PAUSED.equals(normalized)) {
            throw new IllegalArgumentException("Indexer state must be 'running' or 'paused'");
        }
        settingsService.saveSetting(KEY_INDEXER_STATE, normalized);
    }

    public int getPollIntervalSeconds() {
        return Math.max(1, (int) getNumber(KEY_POLL_INTERVAL, 3600));
    }

    public List<String> getWatchFolders() {
        List<String> folders = new ArrayList<>();
        settingsService.getJson(KEY_WATCH_FOLDERS).ifPresent(node -> {
            if (node.isArray()) {
                node.forEach(item -> {
                    if (item.isTextual() && !item.asText().isBlank()) {
                        folders.add(item.asText());
                    }
                });
            } else if (!node.isNull()) {
                log.warn("Setting '{}' should be a JSON array of paths", KEY_WATCH_FOLDERS);
            }
        });
        return folders;
    }

    public void setWatchFolders(List<String> folders) {
        settingsService.saveSetting(KEY_WATCH_FOLDERS, folders);
    }

    /**
     * Modalities switched on in {@code enrichment_models}. A modality missing
     * from the stored object counts as enabled.
     */
    public Set<Modality> getEnabledModalities() {
        Set<Modality> enabled = EnumSet.allOf(Modality.class);
        Optional<JsonNode> stored = settingsService.getJson(KEY_ENRICHMENT_MODELS);
        if (stored.isPresent() && stored.get().isObject()) {
            for (Modality modality : Modality.values()) {
                JsonNode flag = stored.get().get(modality.settingKey());
                if (flag != null && flag.isBoolean() && !flag.asBoolean()) {
                    enabled.remove(modality);
                }
            }
        }
        return enabled;
    }

    public int getPosterWidth() {
        return Math.max(16, (int) getNumber(KEY_POSTER_WIDTH, 1280));
    }

    public String getPosterFormat() {
        return getText(KEY_POSTER_FORMAT, "jpg").toLowerCase(Locale.ROOT);
    }

    /** Lossy quality on a 1..100 scale. */
    public int getPosterQuality() {
        int quality = (int) getNumber(KEY_POSTER_QUALITY, 80);
        return Math.min(100, Math.max(1, quality));
    }

    public double getVisualThreshold() {
        return getNumber(KEY_THRESHOLD_VISUAL, 0.10);
    }

    public double getVisualMatchThreshold() {
        return getNumber(KEY_THRESHOLD_VISUAL_MATCH, 0.20);
    }

    public double getFaceThreshold() {
        return getNumber(KEY_THRESHOLD_FACE, 0.25);
    }

    public double getTranscriptThreshold() {
        return getNumber(KEY_THRESHOLD_TRANSCRIPT, 0.35);
    }

    public void recordScan(LocalDateTime finishedAt, long durationMs) {
        settingsService.saveSetting(KEY_LAST_SCAN_AT, finishedAt.toString());
        settingsService.saveSetting(KEY_LAST_SCAN_DURATION_MS, durationMs);
    }

    public Optional<String> getLastScanAt() {
        return settingsService.getJson(KEY_LAST_SCAN_AT)
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText);
    }

    public Optional<Long> getLastScanDurationMs() {
        return settingsService.getJson(KEY_LAST_SCAN_DURATION_MS)
                .filter(JsonNode::isNumber)
                .map(JsonNode::asLong);
    }

    private String getText(String key, String defaultValue) {
        return settingsService.getJson(key)
                .filter(node -> node.isTextual() && !node.asText().isBlank())
                .map(JsonNode::asText)
                .orElse(defaultValue);
    }

    private double getNumber(String key, double defaultValue) {
        Optional<JsonNode> node = settingsService.getJson(key);
        if (node.isEmpty() || node.get().isNull()) {
            return defaultValue;
        }
        JsonNode value = node.get();
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                // fall through to default
            }
        }
        log.warn("Setting '{}' is not a number, using default {}", key, defaultValue);
        return defaultValue;
    }
}
