package com.constellation.pipeline;

import com.constellation.clustering.Cluster;
import com.constellation.path.ConstellationPath;
import com.constellation.starDetection.Star;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@AllArgsConstructor
@Getter
public class PipelineResult {
    private final List<Star> stars;
    private final List<Cluster> clusters;
    private final int selectedIndex;
    private final double selectedScore;
    private final List<ConstellationPath> paths; // Chỉ các cụm đủ điểm để vẽ, theo thứ tự cụm
    private final int selectedPathIndex; // Chỉ số trong paths, -1 nếu cụm được chọn quá nhỏ để vẽ

    public Cluster getSelectedCluster() {
        return clusters.get(selectedIndex);
    }

    /**
     * Path drawn for the selected cluster, or null when that cluster was too small to draw.
     */
    public ConstellationPath getSelectedPath() {
        return selectedPathIndex < 0 ? null : paths.get(selectedPathIndex);
    }
}
