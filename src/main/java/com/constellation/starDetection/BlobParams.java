package com.constellation.starDetection;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Shape filters for {@link BlobDetector}. Defaults come from {@link StarConfig}.
 */
@AllArgsConstructor
@Getter
@ToString
public class BlobParams {
    private final float minArea;
    private final float maxArea;
    private final float minCircularity;
    private final float minConvexity;
    private final float minInertiaRatio;

    public static BlobParams defaults() {
        return new BlobParams(StarConfig.BLOB_MIN_AREA, StarConfig.BLOB_MAX_AREA,
                StarConfig.BLOB_MIN_CIRCULARITY, StarConfig.BLOB_MIN_CONVEXITY, StarConfig.BLOB_MIN_INERTIA_RATIO);
    }
}
