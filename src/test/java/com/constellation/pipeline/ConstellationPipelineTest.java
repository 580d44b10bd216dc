package com.constellation.pipeline;

import com.constellation.clustering.Cluster;
import com.constellation.clustering.ClusterParams;
import com.constellation.clustering.ConstellationClusterer;
import com.constellation.path.PathBuilder;
import com.constellation.scoring.ClusterScorer;
import com.constellation.scoring.FeatureDescriptor;
import com.constellation.starDetection.DefaultPattern;
import com.constellation.starDetection.DetectionParams;
import com.constellation.starDetection.IntensityField;
import com.constellation.starDetection.SkyFixtures;
import com.constellation.starDetection.Star;
import com.constellation.starDetection.StarDetector;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstellationPipelineTest {

    private final ConstellationPipeline pipeline = new ConstellationPipeline(new StarDetector(),
            new ConstellationClusterer(), new ClusterScorer(), new PathBuilder(),
            DetectionParams.defaults(), ClusterParams.defaults());

    @Test
    void rowOfStars_becomesOneDrawnConstellation() {
        int[][] sky = SkyFixtures.blank(200, 200);
        for (int i = 0; i < 5; i++) SkyFixtures.disc(sky, 40 + i * 30, 100, 5, 255);
        FeatureDescriptor features = new FeatureDescriptor(FeatureDescriptor.Shape.OBJECT, 5,
                FeatureDescriptor.Brightness.HIGH, FeatureDescriptor.Pattern.LINEAR);

        PipelineResult result = pipeline.run(IntensityField.fromArray(sky), features);

        assertEquals(5, result.getStars().size(), "Got: " + result.getStars());
        assertEquals(1, result.getClusters().size());
        assertEquals(0, result.getSelectedIndex());
        assertEquals(Cluster.Origin.GROWN, result.getSelectedCluster().getOrigin());
        assertNotNull(result.getSelectedPath());
        assertEquals(4, result.getSelectedPath().segments().size());
        // số sao và độ sáng khớp
        assertTrue(result.getSelectedScore() >= 0.5, "Score " + result.getSelectedScore());
    }

    @Test
    void blackSky_drawsDefaultPattern() {
        PipelineResult result = pipeline.run(IntensityField.fromArray(SkyFixtures.blank(120, 90)),
                FeatureDescriptor.defaults());

        assertEquals(DefaultPattern.STARS, result.getStars());
        assertEquals(1, result.getClusters().size());
        assertEquals(5, result.getSelectedCluster().size());
        assertNotNull(result.getSelectedPath());
        assertEquals(1, result.getPaths().size());
    }

    @Test
    void sameInput_sameResult() {
        IntensityField field = SkyFixtures.threeStars();
        FeatureDescriptor features = FeatureDescriptor.defaults();

        PipelineResult first = pipeline.run(field, features);
        PipelineResult second = pipeline.run(field, features);

        assertEquals(first.getClusters(), second.getClusters());
        assertEquals(first.getPaths(), second.getPaths());
        assertEquals(first.getSelectedIndex(), second.getSelectedIndex());
    }

    @Test
    void selectedCluster_mapsToItsDrawnPath() {
        // Cặp sáng đứng trước nhưng chỉ có 2 điểm, không vẽ được
        List<Star> stars = List.of(
                new Star(0, 0, 250, 5), new Star(10, 0, 240, 5),
                new Star(100, 400, 220, 5), new Star(130, 400, 220, 5), new Star(160, 400, 220, 5),
                new Star(190, 400, 220, 5), new Star(220, 400, 220, 5));
        StarDetector fixed = new StarDetector() {
            @Override
            public List<Star> detectOrDefault(IntensityField field, DetectionParams params) {
                return stars;
            }
        };
        ConstellationPipeline withPair = new ConstellationPipeline(fixed, new ConstellationClusterer(),
                new ClusterScorer(), new PathBuilder(), DetectionParams.defaults(), new ClusterParams(50, 2, 12));
        FeatureDescriptor features = new FeatureDescriptor(FeatureDescriptor.Shape.OBJECT, 5,
                FeatureDescriptor.Brightness.HIGH, FeatureDescriptor.Pattern.LINEAR);

        PipelineResult result = withPair.run(IntensityField.fromArray(SkyFixtures.blank(10, 10)), features);

        assertEquals(2, result.getClusters().size());
        assertEquals(1, result.getSelectedIndex());
        assertEquals(1, result.getPaths().size());
        assertEquals(0, result.getSelectedPathIndex());
        assertSame(result.getPaths().get(0), result.getSelectedPath());
        assertEquals(5, result.getSelectedPath().getStars().size());
    }

    @Test
    void undrawableSelection_hasNoSelectedPath() {
        Star a = new Star(0, 0, 250, 5);
        Star b = new Star(10, 0, 240, 5);
        StarDetector fixed = new StarDetector() {
            @Override
            public List<Star> detectOrDefault(IntensityField field, DetectionParams params) {
                return List.of(a, b);
            }
        };
        ConstellationPipeline pairOnly = new ConstellationPipeline(fixed, new ConstellationClusterer(),
                new ClusterScorer(), new PathBuilder(), DetectionParams.defaults(), ClusterParams.defaults());

        PipelineResult result = pairOnly.run(IntensityField.fromArray(SkyFixtures.blank(10, 10)),
                FeatureDescriptor.defaults());

        assertTrue(result.getPaths().isEmpty());
        assertEquals(-1, result.getSelectedPathIndex());
        assertNull(result.getSelectedPath());
    }
}
