package com.reelindex.service.enrichment;

/** A stage that runs only while its modality is switched on and its model is reachable. */
public interface ModalityStage extends EnrichmentStage {

    Modality modality();

    /** Whether the model behind this stage is loaded or its service configured. */
    boolean isAvailable();
}
