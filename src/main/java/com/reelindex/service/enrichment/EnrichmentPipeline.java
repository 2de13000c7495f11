package com.reelindex.service.enrichment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Assembles the stage list for one job: metadata, scene detection, then each
 * enabled modality in declaration order of {@link Modality}.
 *
 * An enabled modality whose model is not available is left out, so files
 * still complete on an install without models. The warning is logged once
 * per modality until the model shows up.
 */
@Component
public class EnrichmentPipeline {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentPipeline.class);

    private final MetadataProbeStage metadataStage;
    private final SceneSegmentationStage segmentationStage;
    private final List<ModalityStage> modalityStages;
    private final Set<Modality> reportedUnavailable = ConcurrentHashMap.newKeySet();

    public EnrichmentPipeline(MetadataProbeStage metadataStage,
            SceneSegmentationStage segmentationStage,
            List<ModalityStage> modalityStages) {
        this.metadataStage = metadataStage;
        this.segmentationStage = segmentationStage;
        this.modalityStages = modalityStages.stream()
                .sorted(Comparator.comparing(ModalityStage::modality))
                .toList();
    }

    public List<EnrichmentStage> stagesFor(Set<Modality> enabled) {
        List<EnrichmentStage> stages = new ArrayList<>();
        stages.add(metadataStage);
        stages.add(segmentationStage);
        for (ModalityStage stage : modalityStages) {
            if (!enabled.contains(stage.modality())) {
                continue;
            }
            if (!stage.isAvailable()) {
                if (reportedUnavailable.add(stage.modality())) {
                    log.warn("{} is enabled but its model is not available; skipping {} until it is configured",
                            stage.modality(), stage.name());
                }
                continue;
            }
            if (reportedUnavailable.remove(stage.modality())) {
                log.info("{} model available again", stage.modality());
            }
            stages.add(stage);
        }
        return stages;
    }
}
