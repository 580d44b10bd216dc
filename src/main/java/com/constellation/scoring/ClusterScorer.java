package com.constellation.scoring;

import com.constellation.clustering.Cluster;
import com.constellation.starDetection.Star;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Chấm điểm mức khớp giữa một cụm và {@link FeatureDescriptor}, trong khoảng [0, 1].
 * <ul>
 *     <li>Số sao (0.3): min(n/c, c/n).</li>
 *     <li>Độ sáng (0.2): trọn điểm nếu độ sáng trung bình rơi vào dải của mô tả.</li>
 *     <li>Kiểu phân bố (0.2): scattered / linear / dense.</li>
 * </ul>
 * Hình dạng (shape) chưa được chấm.
 */
public class ClusterScorer {
    private static final Logger log = LoggerFactory.getLogger(ClusterScorer.class);

    public static final double COUNT_WEIGHT = 0.3;
    public static final double BRIGHTNESS_WEIGHT = 0.2;
    public static final double PATTERN_WEIGHT = 0.2;

    static final double HIGH_BRIGHTNESS = 200;
    static final double LOW_BRIGHTNESS = 100;
    static final double SCATTERED_MIN_STD = 50;
    static final double DENSE_MAX_STD = 30;
    static final double LINEAR_MIN_R2 = 0.7;
    static final double LINEAR_MAX_CHORD_DISTANCE = 20;

    public double score(FeatureDescriptor features, Cluster cluster) {
        if (features == null || cluster == null || cluster.size() == 0) return 0;

        double score = 0;
        int n = cluster.size();
        int c = features.getStarCount();
        score += COUNT_WEIGHT * Math.min((double) n / c, (double) c / n);

        if (brightnessMatches(features.getBrightness(), cluster.meanBrightness())) {
            score += BRIGHTNESS_WEIGHT;
        }
        if (patternMatches(features.getPattern(), cluster.getStars())) {
            score += PATTERN_WEIGHT;
        }
        return Math.min(1.0, score);
    }

    /**
     * Index of the best scoring cluster, first one on ties, 0 when there are no clusters.
     */
    public int selectBest(FeatureDescriptor features, List<Cluster> clusters) {
        if (clusters == null || clusters.isEmpty()) {
            log.warn("No clusters to score, selecting index 0");
            return 0;
        }
        int best = 0;
        double bestScore = -1;
        for (int i = 0; i < clusters.size(); i++) {
            double s = score(features, clusters.get(i));
            if (s > bestScore) {
                bestScore = s;
                best = i;
            }
        }
        log.debug("Selected cluster {} of {} with score {}", best, clusters.size(), bestScore);
        return best;
    }

    boolean brightnessMatches(FeatureDescriptor.Brightness band, double mean) {
        switch (band) {
            case HIGH:
                return mean > HIGH_BRIGHTNESS;
            case MEDIUM:
                return mean >= LOW_BRIGHTNESS && mean <= HIGH_BRIGHTNESS;
            case LOW:
                return mean < LOW_BRIGHTNESS;
            default:
                return false;
        }
    }

    boolean patternMatches(FeatureDescriptor.Pattern pattern, List<Star> stars) {
        int n = stars.size();
        switch (pattern) {
            case SCATTERED:
                return n >= 5 && stdX(stars) > SCATTERED_MIN_STD && stdY(stars) > SCATTERED_MIN_STD;
            case DENSE:
                return n >= 5 && stdX(stars) < DENSE_MAX_STD && stdY(stars) < DENSE_MAX_STD;
            case LINEAR:
                return n >= 3 && isLinear(stars);
            default:
                return false;
        }
    }

    boolean isLinear(List<Star> stars) {
        SimpleRegression regression = new SimpleRegression();
        for (Star s : stars) regression.addData(s.x, s.y);
        double r2 = regression.getRSquare();
        if (!Double.isNaN(r2)) {
            return r2 > LINEAR_MIN_R2;
        }
        // Không fit được (ví dụ mọi x trùng nhau): đo khoảng cách tới dây cung đầu-cuối
        return meanChordDistance(stars) < LINEAR_MAX_CHORD_DISTANCE;
    }

    static double meanChordDistance(List<Star> stars) {
        Star first = stars.get(0);
        Star last = stars.get(stars.size() - 1);
        double dx = last.x - first.x;
        double dy = last.y - first.y;
        double len = Math.sqrt(dx * dx + dy * dy);

        double sum = 0;
        for (Star s : stars) {
            if (len == 0) {
                sum += s.distanceTo(first);
            } else {
                sum += Math.abs(dy * (s.x - first.x) - dx * (s.y - first.y)) / len;
            }
        }
        return sum / stars.size();
    }

    private static double stdX(List<Star> stars) {
        double[] xs = new double[stars.size()];
        for (int i = 0; i < xs.length; i++) xs[i] = stars.get(i).x;
        return new StandardDeviation(false).evaluate(xs);
    }

    private static double stdY(List<Star> stars) {
        double[] ys = new double[stars.size()];
        for (int i = 0; i < ys.length; i++) ys[i] = stars.get(i).y;
        return new StandardDeviation(false).evaluate(ys);
    }
}
