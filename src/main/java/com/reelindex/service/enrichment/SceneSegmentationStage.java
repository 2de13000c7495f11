package com.reelindex.service.enrichment;

import com.reelindex.service.SceneSegmenter;
import org.springframework.stereotype.Component;

@Component
public class SceneSegmentationStage implements EnrichmentStage {

    private final SceneSegmenter segmenter;

    public SceneSegmentationStage(SceneSegmenter segmenter) {
        this.segmenter = segmenter;
    }

    @Override
    public String name() {
        return "scene_detection";
    }

    @Override
    public void run(EnrichmentContext context) throws Exception {
        context.setScenes(segmenter.segment(context.getFile(), context.getPath()));
    }
}
