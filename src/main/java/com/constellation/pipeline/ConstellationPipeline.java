package com.constellation.pipeline;

import com.constellation.clustering.Cluster;
import com.constellation.clustering.ClusterParams;
import com.constellation.clustering.ConstellationClusterer;
import com.constellation.path.ConstellationPath;
import com.constellation.path.PathBuilder;
import com.constellation.scoring.ClusterScorer;
import com.constellation.scoring.FeatureDescriptor;
import com.constellation.starDetection.DetectionParams;
import com.constellation.starDetection.IntensityField;
import com.constellation.starDetection.Star;
import com.constellation.starDetection.StarDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Dò sao -> gom cụm -> chấm điểm theo đặc trưng -> dựng đường nối.
 * Không giữ trạng thái giữa các lần gọi; cùng đầu vào cho cùng kết quả.
 */
public class ConstellationPipeline {
    private static final Logger log = LoggerFactory.getLogger(ConstellationPipeline.class);

    private final StarDetector detector;
    private final ConstellationClusterer clusterer;
    private final ClusterScorer scorer;
    private final PathBuilder pathBuilder;
    private final DetectionParams detectionParams;
    private final ClusterParams clusterParams;

    public ConstellationPipeline(StarDetector detector, ConstellationClusterer clusterer, ClusterScorer scorer,
                                 PathBuilder pathBuilder, DetectionParams detectionParams, ClusterParams clusterParams) {
        this.detector = detector;
        this.clusterer = clusterer;
        this.scorer = scorer;
        this.pathBuilder = pathBuilder;
        this.detectionParams = detectionParams;
        this.clusterParams = clusterParams;
    }

    public PipelineResult run(IntensityField field, FeatureDescriptor features) {
        log.info("[Step 1] Detecting stars...");
        List<Star> stars = detector.detectOrDefault(field, detectionParams);

        log.info("[Step 2] Clustering {} stars...", stars.size());
        List<Cluster> clusters = clusterer.cluster(stars, clusterParams);

        log.info("[Step 3] Scoring {} clusters against {}", clusters.size(), features);
        int selected = scorer.selectBest(features, clusters);
        double score = scorer.score(features, clusters.get(selected));

        log.info("[Step 4] Building paths...");
        List<ConstellationPath> paths = new ArrayList<>();
        int selectedPathIndex = -1;
        for (int i = 0; i < clusters.size(); i++) {
            Cluster c = clusters.get(i);
            if (!PathBuilder.isRenderable(c)) {
                log.debug("Skipping cluster {} with {} stars, too small to draw", i, c.size());
                continue;
            }
            if (i == selected) selectedPathIndex = paths.size();
            paths.add(pathBuilder.buildPath(c));
        }
        if (selectedPathIndex < 0) {
            log.warn("Selected cluster {} has too few distinct stars to draw", selected);
        }
        log.info(">>> DONE: {} stars, {} clusters, {} paths, selected #{} (score {})",
                stars.size(), clusters.size(), paths.size(), selected, String.format("%.2f", score));
        return new PipelineResult(stars, clusters, selected, score, paths, selectedPathIndex);
    }
}
