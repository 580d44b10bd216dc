package com.constellation.API;

import com.constellation.clustering.ClusterParams;
import com.constellation.clustering.ConstellationClusterer;
import com.constellation.imageOperator.ConstellationRenderer;
import com.constellation.imageOperator.ImageLoader;
import com.constellation.imageOperator.ImageOptimizer;
import com.constellation.imageOperator.ImageProcessingException;
import com.constellation.path.ConstellationPath;
import com.constellation.path.PathBuilder;
import com.constellation.pipeline.ConstellationPipeline;
import com.constellation.pipeline.ConstellationStoryteller;
import com.constellation.pipeline.OfflineStoryteller;
import com.constellation.scoring.ClusterScorer;
import com.constellation.scoring.FeatureTextParser;
import com.constellation.starDetection.DetectionParams;
import com.constellation.starDetection.IntensityField;
import com.constellation.starDetection.Star;
import com.constellation.starDetection.StarDetector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstellationServiceTest {

    @TempDir
    Path tmp;

    private ConstellationService service(ConstellationStoryteller storyteller, ImageStorageService storage) {
        return service(new StarDetector(), ClusterParams.defaults(), new ImageOptimizer(),
                new ConstellationRenderer(), storyteller, storage);
    }

    private ConstellationService service(StarDetector detector, ClusterParams clusterParams, ImageOptimizer optimizer,
                                         ConstellationRenderer renderer, ConstellationStoryteller storyteller,
                                         ImageStorageService storage) {
        ConstellationPipeline pipeline = new ConstellationPipeline(detector, new ConstellationClusterer(),
                new ClusterScorer(), new PathBuilder(), DetectionParams.defaults(), clusterParams);
        return new ConstellationService(new ImageLoader(), optimizer, pipeline,
                renderer, storyteller, new FeatureTextParser(), storage);
    }

    /** Luôn trả về cùng một danh sách sao, bỏ qua ảnh. */
    static class FixedStars extends StarDetector {
        private final List<Star> stars;

        FixedStars(List<Star> stars) {
            this.stars = stars;
        }

        @Override
        public List<Star> detectOrDefault(IntensityField field, DetectionParams params) {
            return stars;
        }
    }

    /** Mô tả cố định: 5 sao, sáng, thẳng hàng. */
    static class LinearStoryteller extends OfflineStoryteller {
        @Override
        public String describeFeatures(String name, String story) {
            return "shape: object, star_count: 5, brightness: high, pattern: linear";
        }
    }

    @Test
    void undecodableImage_stillProducesDefaultConstellation() {
        ImageStorageService storage = new ImageStorageService(tmp.resolve("out").toString());
        byte[] garbage = "this is not an image at all".getBytes(StandardCharsets.UTF_8);

        ConstellationResponse response = service(new OfflineStoryteller(), storage).generate(garbage, "owl");

        assertEquals("The Owl Constellation", response.getConstellationName());
        assertEquals(5, response.getStars().size());
        assertEquals(4, response.getConstellationLines().size());
        assertEquals(0, response.getSelectedCluster());
        assertEquals(response.getConstellationLines(), response.getSelectedLines());
        assertTrue(response.getImagePath().startsWith("/constellations/"));
        String filename = response.getImagePath().substring("/constellations/".length());
        assertTrue(Files.isRegularFile(storage.getOutputPath().resolve(filename)));
    }

    @Test
    void failingStoryteller_fallsBackToDefaults() {
        ImageStorageService storage = new ImageStorageService(tmp.resolve("out").toString());
        ConstellationStoryteller broken = new ConstellationStoryteller() {
            @Override
            public String name(String keyword) {
                throw new IllegalStateException("service unavailable");
            }

            @Override
            public String story(String name, String keyword) {
                throw new IllegalStateException("service unavailable");
            }

            @Override
            public String describeFeatures(String name, String story) {
                throw new IllegalStateException("service unavailable");
            }
        };

        ConstellationResponse response = service(broken, storage).generate(new byte[0], "owl");

        assertEquals(ConstellationService.UNKNOWN_NAME, response.getConstellationName());
        assertEquals(ConstellationService.UNKNOWN_STORY, response.getStory());
        assertFalse(response.getConstellationLines().isEmpty());
    }

    @Test
    void selectedConstellation_isReportedAmongDrawnPaths() {
        ImageStorageService storage = new ImageStorageService(tmp.resolve("out").toString());
        // Cặp sáng nhất thành cụm đầu tiên nhưng không đủ 3 điểm để vẽ; hàng 5 sao khớp mô tả hơn
        List<Star> stars = List.of(
                new Star(0, 0, 250, 5), new Star(10, 0, 240, 5),
                new Star(100, 400, 220, 5), new Star(130, 400, 220, 5), new Star(160, 400, 220, 5),
                new Star(190, 400, 220, 5), new Star(220, 400, 220, 5));
        ConstellationService service = service(new FixedStars(stars), new ClusterParams(50, 2, 12),
                new ImageOptimizer(), new ConstellationRenderer(), new LinearStoryteller(), storage);

        ConstellationResponse response = service.generate(new byte[0], "river");

        assertEquals(0, response.getSelectedCluster());
        assertEquals(5, response.getSelectedStars().size());
        assertEquals(4, response.getSelectedLines().size());
        for (ConstellationResponse.StarPoint p : response.getSelectedStars()) {
            assertEquals(400, p.getY());
        }
        assertEquals(0.7, response.getScore(), 1e-9);
    }

    @Test
    void renderFailure_stillReleasesCanvas() {
        ImageStorageService storage = new ImageStorageService(tmp.resolve("out").toString());
        Mat[] canvas = new Mat[1];
        ImageOptimizer optimizer = new ImageOptimizer() {
            @Override
            public OptimizedImage optimize(Mat bgr) {
                OptimizedImage real = super.optimize(bgr);
                canvas[0] = real.getCanvas();
                return real;
            }
        };
        ConstellationRenderer failing = new ConstellationRenderer() {
            @Override
            public Mat render(Mat c, List<ConstellationPath> paths) {
                throw new ImageProcessingException("draw failed");
            }
        };
        ConstellationService service = service(new StarDetector(), ClusterParams.defaults(), optimizer, failing,
                new OfflineStoryteller(), storage);

        assertThrows(ImageProcessingException.class, () -> service.generate(new byte[0], "owl"));
        assertTrue(canvas[0].empty());
        assertFalse(Files.exists(storage.getOutputPath()));
    }
}
