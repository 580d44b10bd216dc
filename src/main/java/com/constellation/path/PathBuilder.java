package com.constellation.path;

import com.constellation.clustering.Cluster;
import com.constellation.starDetection.Star;

import java.util.ArrayList;
import java.util.List;

/**
 * Nối các sao trong cụm thành một đường mở bằng heuristic láng giềng gần nhất:
 * bắt đầu từ thành viên đầu tiên, mỗi bước nối tới điểm còn lại gần điểm cuối nhất.
 * Không phải đường ngắn nhất toàn cục; hoà thì lấy điểm đứng trước trong cụm.
 */
public class PathBuilder {
    public static final int MIN_PATH_POINTS = 3;

    /**
     * True when the cluster has enough distinct points to be drawn as a path.
     */
    public static boolean isRenderable(Cluster cluster) {
        return cluster != null && distinctPoints(cluster.getStars()).size() >= MIN_PATH_POINTS;
    }

    public ConstellationPath buildPath(Cluster cluster) {
        if (cluster == null) throw new IllegalArgumentException("Cluster is absent");

        List<Star> remaining = distinctPoints(cluster.getStars());
        if (remaining.size() < MIN_PATH_POINTS) {
            throw new IllegalArgumentException("A path needs at least " + MIN_PATH_POINTS
                    + " distinct points, cluster has " + remaining.size());
        }

        List<Star> connected = new ArrayList<>(remaining.size());
        connected.add(remaining.remove(0));

        while (!remaining.isEmpty()) {
            Star last = connected.get(connected.size() - 1);
            int closestIdx = 0;
            double minDistance = Double.POSITIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                double d = last.distanceTo(remaining.get(i));
                if (d < minDistance) {
                    minDistance = d;
                    closestIdx = i;
                }
            }
            connected.add(remaining.remove(closestIdx));
        }
        return new ConstellationPath(connected);
    }

    // Bỏ các điểm trùng toạ độ, giữ điểm xuất hiện trước
    static List<Star> distinctPoints(List<Star> stars) {
        List<Star> result = new ArrayList<>();
        for (Star s : stars) {
            boolean duplicate = false;
            for (Star kept : result) {
                if (kept.samePosition(s)) {
                    duplicate = true;
                    break;
                }
            }
            if (!duplicate) result.add(s);
        }
        return result;
    }
}
