package com.constellation.clustering;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class ClusterParams {
    public static final double DEFAULT_MAX_DISTANCE = 50.0;
    public static final int DEFAULT_MIN_STARS = 3;
    public static final int DEFAULT_MAX_STARS = 12;

    private final double maxDistance; // Cùng đơn vị với toạ độ (px)
    private final int minStars;
    private final int maxStars;

    public ClusterParams(double maxDistance, int minStars, int maxStars) {
        if (!(maxDistance > 0)) {
            throw new IllegalArgumentException("maxDistance must be positive: " + maxDistance);
        }
        if (minStars < 1 || maxStars < 1) {
            throw new IllegalArgumentException("Star bounds must be positive: min=" + minStars + " max=" + maxStars);
        }
        if (minStars > maxStars) {
            throw new IllegalArgumentException("minStars " + minStars + " exceeds maxStars " + maxStars);
        }
        this.maxDistance = maxDistance;
        this.minStars = minStars;
        this.maxStars = maxStars;
    }

    public static ClusterParams defaults() {
        return new ClusterParams(DEFAULT_MAX_DISTANCE, DEFAULT_MIN_STARS, DEFAULT_MAX_STARS);
    }

    /**
     * Ngưỡng tối thiểu thích nghi: ảnh có ít sao thì nới lỏng, để 4 sao vẫn tạo được cụm 2.
     */
    public int adaptiveMinimum(int totalStars) {
        return Math.min(minStars, Math.max(2, totalStars / 2));
    }
}
