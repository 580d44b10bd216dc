package com.constellation.starDetection;

import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Moments;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.CLAHE;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Phát hiện vùng sáng bằng ngưỡng (thích nghi hoặc cố định) + contour.
 * Ưu tiên độ phủ, dùng làm phương án dự phòng khi blob detection ra quá ít sao.
 */
public class ThresholdDetector {
    private static final Logger log = LoggerFactory.getLogger(ThresholdDetector.class);

    private final ThresholdParams params;

    public ThresholdDetector() {
        this(ThresholdParams.defaults());
    }

    public ThresholdDetector(ThresholdParams params) {
        this.params = params;
    }

    public List<Star> detect(IntensityField field) {
        if (field == null) throw new InvalidFieldException("Intensity field is absent");

        Mat gray = field.toMat();
        Mat equalized = new Mat();
        Mat binary = new Mat();
        Mat hierarchy = new Mat();
        MatVector contours = new MatVector();
        CLAHE clahe = createCLAHE(StarConfig.CLAHE_CLIP_LIMIT,
                new Size(StarConfig.CLAHE_TILE_GRID, StarConfig.CLAHE_TILE_GRID));
        try {
            // 1. Cân bằng histogram cục bộ để bù ánh sáng không đều
            clahe.apply(gray, equalized);

            // 2. Nhị phân hoá
            binarize(equalized, binary);

            // 3. Contour ngoài của các vùng sáng
            findContours(binary, contours, hierarchy, RETR_EXTERNAL, CHAIN_APPROX_SIMPLE);

            List<Star> stars = new ArrayList<>();
            for (long i = 0; i < contours.size(); i++) {
                Mat contour = contours.get(i);
                double area = contourArea(contour);
                if (area < params.getMinArea()) continue; // Quá nhỏ -> nhiễu

                Moments m = moments(contour);
                if (m.m00() == 0) continue;
                int cx = (int) (m.m10() / m.m00());
                int cy = (int) (m.m01() / m.m00());
                double brightness = field.meanAround(cx, cy, StarConfig.BRIGHTNESS_RADIUS);
                stars.add(new Star(cx, cy, brightness, area));
            }
            log.debug("Threshold detection ({}) found {} stars from {} contours",
                    params.isAdaptive() ? "adaptive" : "fixed", stars.size(), contours.size());
            return stars;
        } finally {
            clahe.close();
            contours.close();
            hierarchy.release();
            binary.release();
            equalized.release();
            gray.release();
        }
    }

    private void binarize(Mat src, Mat dst) {
        if (params.isAdaptive()) {
            // Mỗi vùng ảnh có ngưỡng riêng
            adaptiveThreshold(src, dst, 255, ADAPTIVE_THRESH_GAUSSIAN_C, THRESH_BINARY,
                    StarConfig.ADAPTIVE_BLOCK_SIZE, StarConfig.ADAPTIVE_OFFSET);
        } else if (params.getFixedThreshold() != null) {
            threshold(src, dst, params.getFixedThreshold(), 255, THRESH_BINARY);
        } else {
            double otsu = threshold(src, dst, 0, 255, THRESH_BINARY | THRESH_OTSU);
            log.debug("Otsu threshold = {}", otsu);
        }
    }
}
