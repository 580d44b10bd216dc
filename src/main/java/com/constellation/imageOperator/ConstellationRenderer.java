package com.constellation.imageOperator;

import com.constellation.path.ConstellationPath;
import com.constellation.starDetection.Star;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Point;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Vẽ đường nối (vàng) và điểm sao (trắng) lên bản sao của canvas.
 * Mọi điểm có cùng bán kính, không phụ thuộc độ sáng hay diện tích gốc.
 */
public class ConstellationRenderer {
    private static final Logger log = LoggerFactory.getLogger(ConstellationRenderer.class);

    public static final int MARKER_RADIUS = 3;
    public static final int LINE_THICKNESS = 2;
    // OpenCV dùng BGR: RGB(255, 215, 0)
    private static final Scalar LINE_COLOR = new Scalar(0, 215, 255, 0);
    private static final Scalar MARKER_COLOR = new Scalar(255, 255, 255, 0);

    public Mat render(Mat canvas, List<ConstellationPath> paths) {
        if (canvas == null || canvas.empty()) {
            throw new ImageProcessingException("Cannot render on an empty canvas");
        }
        Mat out = canvas.clone();
        int segments = 0;
        for (ConstellationPath path : paths) {
            for (ConstellationPath.Segment seg : path.segments()) {
                line(out, toPoint(seg.getFrom()), toPoint(seg.getTo()), LINE_COLOR, LINE_THICKNESS, LINE_AA, 0);
                segments++;
            }
            // Vẽ điểm sau cùng để không bị đường đè lên
            for (Star s : path.getStars()) {
                circle(out, toPoint(s), MARKER_RADIUS, MARKER_COLOR, -1, LINE_8, 0); // -1 = tô kín
            }
        }
        log.debug("Rendered {} paths, {} segments", paths.size(), segments);
        return out;
    }

    private static Point toPoint(Star s) {
        return new Point(s.x, s.y);
    }
}
