package com.constellation.starDetection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point of star detection: blob detection, threshold fallback and merge.
 * Pure function of the field and the parameters, so repeated calls return the same list.
 */
public class StarDetector {
    private static final Logger log = LoggerFactory.getLogger(StarDetector.class);

    public List<Star> detect(IntensityField field) {
        return detect(field, DetectionParams.defaults());
    }

    public List<Star> detect(IntensityField field, DetectionParams params) {
        if (field == null) throw new InvalidFieldException("Intensity field is absent");

        CandidateMerger merger = new CandidateMerger(
                new BlobDetector(params.getBlob()),
                new ThresholdDetector(params.getThreshold()));
        List<Star> stars = merger.detect(field);
        log.info("Detected {} stars on {}x{} field", stars.size(), field.width(), field.height());
        return stars;
    }

    /**
     * Same as {@link #detect(IntensityField, DetectionParams)} but substitutes
     * {@link DefaultPattern} when nothing was found.
     */
    public List<Star> detectOrDefault(IntensityField field, DetectionParams params) {
        List<Star> stars = detect(field, params);
        if (stars.isEmpty()) {
            log.warn("No stars detected, using the default {}-star pattern", DefaultPattern.STARS.size());
            return DefaultPattern.STARS;
        }
        return stars;
    }
}
