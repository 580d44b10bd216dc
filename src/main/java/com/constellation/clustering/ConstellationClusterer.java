package com.constellation.clustering;

import com.constellation.starDetection.CandidateMerger;
import com.constellation.starDetection.DefaultPattern;
import com.constellation.starDetection.Star;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Gom sao thành các cụm bằng cách "gieo hạt rồi lớn dần" (greedy nearest-neighbour).
 *
 * <ol>
 *     <li>Sắp sao theo độ sáng giảm dần (ổn định); thứ tự này quyết định cả hạt giống lẫn tie-break.</li>
 *     <li>Mỗi sao chưa thuộc cụm nào, theo thứ tự đó, làm hạt giống đúng một lần.</li>
 *     <li>Cụm lớn lên bằng sao chưa gán gần nhất với bất kỳ thành viên nào, miễn là khoảng cách
 *     không vượt maxDistance và cụm chưa đủ maxStars.</li>
 *     <li>Cụm chỉ được nhận nếu đạt {@link ClusterParams#adaptiveMinimum(int)}; cụm bị loại trả sao về lại.</li>
 *     <li>Không nhận được cụm nào thì lập một cụm FALLBACK từ các sao sáng nhất.</li>
 * </ol>
 * Đầu vào rỗng trả về đúng một cụm từ {@link DefaultPattern}. Không bao giờ trả về danh sách rỗng.
 */
public class ConstellationClusterer {
    private static final Logger log = LoggerFactory.getLogger(ConstellationClusterer.class);

    public List<Cluster> cluster(List<Star> stars) {
        return cluster(stars, ClusterParams.defaults());
    }

    public List<Cluster> cluster(List<Star> stars, ClusterParams params) {
        if (stars == null || stars.isEmpty()) {
            log.warn("No stars to cluster, returning the default pattern");
            return List.of(new Cluster(DefaultPattern.STARS, Cluster.Origin.DEFAULT_PATTERN));
        }

        List<Star> sorted = new ArrayList<>(stars);
        sorted.sort(CandidateMerger.BRIGHTEST_FIRST);
        int n = sorted.size();
        int minSize = params.adaptiveMinimum(n);

        boolean[] assigned = new boolean[n];
        List<Cluster> clusters = new ArrayList<>();
        int rejected = 0;

        for (int seed = 0; seed < n; seed++) {
            if (assigned[seed]) continue;

            List<Integer> members = grow(sorted, assigned, seed, params);
            if (members.size() >= minSize) {
                clusters.add(toCluster(sorted, members, Cluster.Origin.GROWN));
            } else {
                // Cụm quá nhỏ: bỏ đi, trả sao về cho các cụm sau
                for (int idx : members) assigned[idx] = false;
                rejected++;
            }
        }

        if (clusters.isEmpty()) {
            int take = Math.min(n, params.getMaxStars());
            List<Integer> brightest = new ArrayList<>();
            for (int i = 0; i < take; i++) brightest.add(i);
            log.warn("No cluster reached the minimum of {} stars, using the {} brightest as a fallback cluster",
                    minSize, take);
            clusters.add(toCluster(sorted, brightest, Cluster.Origin.FALLBACK));
        }

        log.debug("{} stars -> {} clusters ({} rejected, adaptive minimum {})",
                n, clusters.size(), rejected, minSize);
        return clusters;
    }

    /**
     * Grows one cluster from {@code seed}. {@code minDist[j]} keeps the distance from star j to
     * its closest member so each step is O(n); ties go to the lowest index, i.e. the brighter star.
     */
    private List<Integer> grow(List<Star> sorted, boolean[] assigned, int seed, ClusterParams params) {
        int n = sorted.size();
        double[] minDist = new double[n];
        Arrays.fill(minDist, Double.POSITIVE_INFINITY);

        List<Integer> members = new ArrayList<>();
        members.add(seed);
        assigned[seed] = true;
        relax(sorted, assigned, minDist, seed);

        while (members.size() < params.getMaxStars()) {
            int best = -1;
            double bestDist = Double.POSITIVE_INFINITY;
            for (int j = 0; j < n; j++) {
                if (assigned[j]) continue;
                if (minDist[j] <= params.getMaxDistance() && minDist[j] < bestDist) {
                    bestDist = minDist[j];
                    best = j;
                }
            }
            if (best < 0) break;

            members.add(best);
            assigned[best] = true;
            relax(sorted, assigned, minDist, best);
        }
        return members;
    }

    private void relax(List<Star> sorted, boolean[] assigned, double[] minDist, int added) {
        Star a = sorted.get(added);
        for (int j = 0; j < sorted.size(); j++) {
            if (assigned[j]) continue;
            double d = a.distanceTo(sorted.get(j));
            if (d < minDist[j]) minDist[j] = d;
        }
    }

    // Chuẩn hoá: thành viên theo độ sáng giảm dần (chỉ số trong 'sorted' tăng dần)
    private Cluster toCluster(List<Star> sorted, List<Integer> members, Cluster.Origin origin) {
        List<Integer> ordered = new ArrayList<>(members);
        Collections.sort(ordered);
        List<Star> result = new ArrayList<>(ordered.size());
        for (int idx : ordered) result.add(sorted.get(idx));
        return new Cluster(result, origin);
    }
}
