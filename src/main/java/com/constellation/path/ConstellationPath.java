package com.constellation.path;

import com.constellation.starDetection.Star;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Thứ tự nối các sao của một cụm khi vẽ. Mỗi cặp liên tiếp là một đoạn thẳng.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ConstellationPath {
    private final List<Star> stars;

    public ConstellationPath(List<Star> stars) {
        this.stars = List.copyOf(stars);
    }

    @Getter
    @EqualsAndHashCode
    @ToString
    public static class Segment {
        private final Star from;
        private final Star to;

        public Segment(Star from, Star to) {
            this.from = from;
            this.to = to;
        }

        public double length() {
            return from.distanceTo(to);
        }
    }

    public List<Segment> segments() {
        List<Segment> segments = new ArrayList<>();
        for (int i = 0; i + 1 < stars.size(); i++) {
            segments.add(new Segment(stars.get(i), stars.get(i + 1)));
        }
        return segments;
    }

    public double totalLength() {
        return totalLength(stars);
    }

    public static double totalLength(List<Star> order) {
        double sum = 0;
        for (int i = 0; i + 1 < order.size(); i++) {
            sum += order.get(i).distanceTo(order.get(i + 1));
        }
        return sum;
    }
}
