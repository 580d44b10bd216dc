package com.constellation.scoring;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Mô tả định tính của chòm sao (do dịch vụ phân tích văn bản bên ngoài cung cấp).
 */
@Getter
@EqualsAndHashCode
@ToString
public class FeatureDescriptor {

    public enum Shape {REGULAR, IRREGULAR, ANIMAL, OBJECT}

    public enum Brightness {LOW, MEDIUM, HIGH}

    public enum Pattern {SCATTERED, LINEAR, DENSE}

    private final Shape shape;
    private final int starCount;
    private final Brightness brightness;
    private final Pattern pattern;

    public FeatureDescriptor(Shape shape, int starCount, Brightness brightness, Pattern pattern) {
        if (starCount < 1) throw new IllegalArgumentException("starCount must be positive: " + starCount);
        if (shape == null || brightness == null || pattern == null) {
            throw new IllegalArgumentException("Feature fields must not be null");
        }
        this.shape = shape;
        this.starCount = starCount;
        this.brightness = brightness;
        this.pattern = pattern;
    }

    public static FeatureDescriptor defaults() {
        return new FeatureDescriptor(Shape.IRREGULAR, 5, Brightness.HIGH, Pattern.SCATTERED);
    }
}
