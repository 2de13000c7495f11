package com.reelindex.service.enrichment;

import com.reelindex.entity.VideoFileEntity;
import com.reelindex.service.SceneCatalogService;
import com.reelindex.service.media.MediaProbe;
import com.reelindex.service.media.VideoMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fills in duration, geometry, codec and color attributes. Files that already
 * carry a duration keep their stored metadata.
 */
@Component
public class MetadataProbeStage implements EnrichmentStage {

    private static final Logger log = LoggerFactory.getLogger(MetadataProbeStage.class);

    private final MediaProbe mediaProbe;
    private final SceneCatalogService sceneCatalog;

    public MetadataProbeStage(MediaProbe mediaProbe, SceneCatalogService sceneCatalog) {
        this.mediaProbe = mediaProbe;
        this.sceneCatalog = sceneCatalog;
    }

    @Override
    public String name() {
        return "metadata";
    }

    @Override
    public void run(EnrichmentContext context) throws Exception {
        if (context.getFile().getDurationSeconds() != null) {
            log.debug("Metadata already present for {}", context.getPath());
            return;
        }
        VideoMetadata meta = mediaProbe.probe(context.getPath());
        VideoFileEntity updated = sceneCatalog.applyMetadata(context.fileId(), meta);
        context.setFile(updated);
        log.debug("Probed {}: {}s {}x{} {}", context.getPath(), meta.durationSeconds(), meta.width(),
                meta.height(), meta.codec());
    }
}
