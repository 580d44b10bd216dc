package com.constellation.pipeline;

import com.constellation.clustering.ClusterParams;
import com.constellation.clustering.ConstellationClusterer;
import com.constellation.imageOperator.ConstellationRenderer;
import com.constellation.imageOperator.ImageLoader;
import com.constellation.imageOperator.ImageOptimizer;
import com.constellation.path.PathBuilder;
import com.constellation.scoring.ClusterScorer;
import com.constellation.scoring.FeatureTextParser;
import com.constellation.starDetection.DetectionParams;
import com.constellation.starDetection.StarDetector;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

    @Bean
    public ClusterParams clusterParams(
            @Value("${constellation.cluster.max-distance:50}") double maxDistance,
            @Value("${constellation.cluster.min-stars:3}") int minStars,
            @Value("${constellation.cluster.max-stars:12}") int maxStars) {
        return new ClusterParams(maxDistance, minStars, maxStars);
    }

    @Bean
    public ConstellationPipeline constellationPipeline(ClusterParams clusterParams) {
        return new ConstellationPipeline(new StarDetector(), new ConstellationClusterer(), new ClusterScorer(),
                new PathBuilder(), DetectionParams.defaults(), clusterParams);
    }

    @Bean
    public ImageLoader imageLoader() {
        return new ImageLoader();
    }

    @Bean
    public ImageOptimizer imageOptimizer(
            @Value("${constellation.image.width:800}") int width,
            @Value("${constellation.image.height:600}") int height) {
        return new ImageOptimizer(width, height);
    }

    @Bean
    public ConstellationRenderer constellationRenderer() {
        return new ConstellationRenderer();
    }

    @Bean
    public FeatureTextParser featureTextParser() {
        return new FeatureTextParser();
    }

    // Bản offline; client của dịch vụ sinh văn bản sẽ thay bean này
    @Bean
    public ConstellationStoryteller constellationStoryteller() {
        return new OfflineStoryteller();
    }
}
