package com.constellation.API;

import com.constellation.imageOperator.ConstellationRenderer;
import com.constellation.imageOperator.ImageLoader;
import com.constellation.imageOperator.ImageOptimizer;
import com.constellation.path.ConstellationPath;
import com.constellation.pipeline.ConstellationPipeline;
import com.constellation.pipeline.ConstellationStoryteller;
import com.constellation.pipeline.PipelineResult;
import com.constellation.scoring.FeatureDescriptor;
import com.constellation.scoring.FeatureTextParser;
import com.constellation.starDetection.Star;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class ConstellationService {
    private static final Logger log = LoggerFactory.getLogger(ConstellationService.class);

    static final String UNKNOWN_NAME = "Unknown Constellation";
    static final String UNKNOWN_STORY = "This constellation's legend has been told since ancient times, "
            + "but its details have been lost to the passage of time.";

    private final ImageLoader imageLoader;
    private final ImageOptimizer imageOptimizer;
    private final ConstellationPipeline pipeline;
    private final ConstellationRenderer renderer;
    private final ConstellationStoryteller storyteller;
    private final FeatureTextParser featureParser;
    private final ImageStorageService storage;

    public ConstellationService(ImageLoader imageLoader, ImageOptimizer imageOptimizer, ConstellationPipeline pipeline,
                                ConstellationRenderer renderer, ConstellationStoryteller storyteller,
                                FeatureTextParser featureParser, ImageStorageService storage) {
        this.imageLoader = imageLoader;
        this.imageOptimizer = imageOptimizer;
        this.pipeline = pipeline;
        this.renderer = renderer;
        this.storyteller = storyteller;
        this.featureParser = featureParser;
        this.storage = storage;
    }

    public ConstellationResponse generate(byte[] imageContent, String keyword) {
        log.info("Generating constellation for keyword '{}' ({} bytes)", keyword, imageContent.length);

        // Tên và câu chuyện; dịch vụ lỗi thì dùng giá trị mặc định
        String name;
        String story;
        try {
            name = storyteller.name(keyword);
            story = storyteller.story(name, keyword);
        } catch (RuntimeException e) {
            log.warn("Storyteller failed, using the default name and story: {}", e.getMessage());
            name = UNKNOWN_NAME;
            story = UNKNOWN_STORY;
        }
        FeatureDescriptor features = extractFeatures(name, story);

        Mat raw = imageLoader.load(imageContent);
        ImageOptimizer.OptimizedImage optimized = imageOptimizer.optimize(raw);
        raw.release();

        PipelineResult result;
        String filename;
        try {
            result = pipeline.run(optimized.getField(), features);
            Mat drawn = renderer.render(optimized.getCanvas(), result.getPaths());
            try {
                filename = storage.saveResult(drawn);
            } finally {
                drawn.release();
            }
        } finally {
            optimized.getCanvas().release();
        }

        ConstellationPath selected = result.getSelectedPath();
        List<ConstellationPath> selectedOnly = selected == null ? List.of() : List.of(selected);
        return new ConstellationResponse(name, story, "/constellations/" + filename,
                toStarPoints(result.getPaths()), toLines(result.getPaths()),
                result.getSelectedPathIndex(), toStarPoints(selectedOnly), toLines(selectedOnly),
                result.getSelectedScore());
    }

    private FeatureDescriptor extractFeatures(String name, String story) {
        try {
            return featureParser.parse(storyteller.describeFeatures(name, story));
        } catch (RuntimeException e) {
            log.warn("Feature extraction failed, using default features: {}", e.getMessage());
            return FeatureDescriptor.defaults();
        }
    }

    static List<ConstellationResponse.StarPoint> toStarPoints(List<ConstellationPath> paths) {
        List<ConstellationResponse.StarPoint> points = new ArrayList<>();
        for (ConstellationPath path : paths) {
            for (Star s : path.getStars()) {
                points.add(new ConstellationResponse.StarPoint(s.x, s.y, s.brightness));
            }
        }
        return points;
    }

    static List<ConstellationResponse.Line> toLines(List<ConstellationPath> paths) {
        List<ConstellationResponse.Line> lines = new ArrayList<>();
        for (ConstellationPath path : paths) {
            for (ConstellationPath.Segment seg : path.segments()) {
                lines.add(new ConstellationResponse.Line(seg.getFrom().x, seg.getFrom().y,
                        seg.getTo().x, seg.getTo().y));
            }
        }
        return lines;
    }
}
