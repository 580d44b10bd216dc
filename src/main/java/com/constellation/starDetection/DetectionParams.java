package com.constellation.starDetection;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor
@Getter
@ToString
public class DetectionParams {
    private final BlobParams blob;
    private final ThresholdParams threshold;

    public static DetectionParams defaults() {
        return new DetectionParams(BlobParams.defaults(), ThresholdParams.defaults());
    }
}
