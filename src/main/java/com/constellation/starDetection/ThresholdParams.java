package com.constellation.starDetection;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Binarization settings for {@link ThresholdDetector}.
 * {@code fixedThreshold == null} in fixed mode means Otsu picks the cutoff.
 */
@AllArgsConstructor
@Getter
@ToString
public class ThresholdParams {
    private final boolean adaptive;
    private final Integer fixedThreshold;
    private final double minArea;

    public static ThresholdParams defaults() {
        return new ThresholdParams(true, null, StarConfig.THRESHOLD_MIN_AREA);
    }

    public static ThresholdParams fixed(int threshold) {
        return new ThresholdParams(false, threshold, StarConfig.THRESHOLD_MIN_AREA);
    }

    public static ThresholdParams otsu() {
        return new ThresholdParams(false, null, StarConfig.THRESHOLD_MIN_AREA);
    }
}
