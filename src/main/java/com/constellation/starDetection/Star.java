package com.constellation.starDetection;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Một ngôi sao đã phát hiện trên ảnh.
 * x là chiều width, y là chiều height (gốc toạ độ ở góc trên-trái).
 */
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class Star {
    public final int x, y;
    public final double brightness; // Độ sáng trung bình 5x5 quanh tâm (0-255)
    public final double area;       // Diện tích vùng nguồn (px^2)

    public double distanceTo(Star that) {
        double dx = this.x - that.x;
        double dy = this.y - that.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public boolean samePosition(Star that) {
        return that != null && this.x == that.x && this.y == that.y;
    }
}
