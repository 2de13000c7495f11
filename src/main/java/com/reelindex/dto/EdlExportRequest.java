package com.reelindex.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code POST /api/export/edl}. In/out points are optional per item
 * and default to the scene's own boundaries.
 */
public class EdlExportRequest {

    private String title = "ReelIndex Export";
    private List<Item> scenes = new ArrayList<>();

    public static class Item {
        private Long sceneId;
        private Double inTc;
        private Double outTc;

        public Item() {
        }

        public Item(Long sceneId, Double inTc, Double outTc) {
            this.sceneId = sceneId;
            this.inTc = inTc;
            this.outTc = outTc;
        }

        public Long getSceneId() {
            return sceneId;
        }

        public void setSceneId(Long sceneId) {
            this.sceneId = sceneId;
        }

        public Double getInTc() {
            return inTc;
        }

        public void setInTc(Double inTc) {
            this.inTc = inTc;
        }

        public Double getOutTc() {
            return outTc;
        }

        public void setOutTc(Double outTc) {
            this.outTc = outTc;
        }
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public List<Item> getScenes() {
        return scenes;
    }

    public void setScenes(List<Item> scenes) {
        this.scenes = scenes;
    }
}
