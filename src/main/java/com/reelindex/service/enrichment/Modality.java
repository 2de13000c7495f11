package com.reelindex.service.enrichment;

import java.util.Locale;

/**
 * Optional enrichment modalities, toggled through the {@code enrichment_models}
 * setting. Metadata probing and scene segmentation always run.
 */
public enum Modality {
    VISUAL,
    TRANSCRIPTION,
    TRANSCRIPT_EMBEDDING,
    FACES;

    /** Key used inside the {@code enrichment_models} JSON object. */
    public String settingKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
