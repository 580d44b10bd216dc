package com.constellation.clustering;

import com.constellation.starDetection.Star;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Một nhóm sao ứng viên cho một chòm sao. Danh sách bất biến.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Cluster {

    public enum Origin {
        GROWN,           // Lớn lên từ hạt giống sáng nhất
        FALLBACK,        // Không cụm nào đạt ngưỡng -> lấy các sao sáng nhất còn lại
        DEFAULT_PATTERN  // Đầu vào rỗng
    }

    private final List<Star> stars;
    private final Origin origin;

    public Cluster(List<Star> stars, Origin origin) {
        this.stars = List.copyOf(stars);
        this.origin = origin;
    }

    public int size() {
        return stars.size();
    }

    public Star get(int i) {
        return stars.get(i);
    }

    public double meanBrightness() {
        if (stars.isEmpty()) return 0;
        double sum = 0;
        for (Star s : stars) sum += s.brightness;
        return sum / stars.size();
    }
}
