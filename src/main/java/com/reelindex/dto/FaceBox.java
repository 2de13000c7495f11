package com.reelindex.dto;

import com.reelindex.entity.FaceEntity;

/**
 * A detected face as exposed over the API: identity plus bounding box on the
 * scene's poster.
 */
public record FaceBox(Long id, int x, int y, int width, int height, Integer clusterId) {

    public static FaceBox from(FaceEntity face) {
        return new FaceBox(face.getId(), face.getBboxX(), face.getBboxY(), face.getBboxW(), face.getBboxH(),
                face.getClusterId());
    }
}
