package com.reelindex.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelindex.service.enrichment.Modality;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({IndexerSettings.class, SettingsService.class})
class IndexerSettingsTest {

    @Autowired
    private IndexerSettings settings;

    @Autowired
    private SettingsService settingsService;

    @Test
    void defaultsApplyWhenNothingIsStored() {
        assertThat(settings.getIndexerState()).isEqualTo(IndexerSettings.STATE_RUNNING);
        assertThat(settings.getPollIntervalSeconds()).isEqualTo(3600);
        assertThat(settings.getWatchFolders()).isEmpty();
        assertThat(settings.getEnabledModalities()).containsExactlyInAnyOrder(Modality.values());
        assertThat(settings.getFaceThreshold()).isEqualTo(0.25);
        assertThat(settings.getPosterFormat()).isEqualTo("jpg");
    }

    @Test
    void modalitySwitchedOffIsExcluded() {
        settingsService.saveJson(IndexerSettings.KEY_ENRICHMENT_MODELS,
                new ObjectMapper().valueToTree(Map.of("faces", false, "visual", true)));

        assertThat(settings.getEnabledModalities())
                .contains(Modality.VISUAL, Modality.TRANSCRIPTION, Modality.TRANSCRIPT_EMBEDDING)
                .doesNotContain(Modality.FACES);
    }

    @Test
    void indexerStateIsNormalizedAndValidated() {
        settings.setIndexerState(" Paused ");

        assertThat(settings.isPaused()).isTrue();
        assertThatThrownBy(() -> settings.setIndexerState("stopped")).isInstanceOf(IllegalArgumentException.class);
        assertThat(settings.getIndexerState()).isEqualTo(IndexerSettings.STATE_PAUSED);
    }

    @Test
    void watchFoldersRoundTripAsJsonArray() {
        settings.setWatchFolders(List.of("/mnt/a", "/mnt/b"));

        assertThat(settings.getWatchFolders()).containsExactly("/mnt/a", "/mnt/b");
        assertThat(settingsService.getJson(IndexerSettings.KEY_WATCH_FOLDERS).orElseThrow().isArray()).isTrue();
    }

    @Test
    void posterQualityIsClamped() {
        settingsService.saveSetting(IndexerSettings.KEY_POSTER_QUALITY, 250);

        assertThat(settings.getPosterQuality()).isEqualTo(100);
    }
}
