package com.constellation.starDetection;

import org.bytedeco.opencv.opencv_core.KeyPoint;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.SimpleBlobDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tìm các đốm sáng nhỏ, gần tròn bằng SimpleBlobDetector của OpenCV.
 * Lọc theo màu, diện tích, độ tròn, độ lồi và tỉ lệ quán tính để loại vệt loá dài và nhiễu cảm biến.
 * Ưu tiên độ chính xác hơn độ phủ.
 */
public class BlobDetector {
    private static final Logger log = LoggerFactory.getLogger(BlobDetector.class);

    private final BlobParams params;

    public BlobDetector() {
        this(BlobParams.defaults());
    }

    public BlobDetector(BlobParams params) {
        this.params = params;
    }

    public List<Star> detect(IntensityField field) {
        if (field == null) throw new InvalidFieldException("Intensity field is absent");

        Mat gray = field.toMat();
        KeyPointVector keyPoints = new KeyPointVector();
        SimpleBlobDetector detector = SimpleBlobDetector.create(buildParams());
        try {
            detector.detect(gray, keyPoints);

            List<Star> stars = new ArrayList<>();
            for (long i = 0; i < keyPoints.size(); i++) {
                KeyPoint kp = keyPoints.get(i);
                int cx = (int) Math.round(kp.pt().x());
                int cy = (int) Math.round(kp.pt().y());
                double brightness = field.meanAround(cx, cy, StarConfig.BRIGHTNESS_RADIUS);
                // size là đường kính -> diện tích hình tròn tương đương
                double area = Math.PI * kp.size() * kp.size() / 4.0;
                stars.add(new Star(cx, cy, brightness, area));
            }
            log.debug("Blob detection found {} stars", stars.size());
            return stars;
        } finally {
            detector.close();
            keyPoints.close();
            gray.release();
        }
    }

    private SimpleBlobDetector.Params buildParams() {
        SimpleBlobDetector.Params p = new SimpleBlobDetector.Params();
        // Chỉ lấy đốm sáng trên nền tối
        p.filterByColor(true);
        p.blobColor((byte) 255);

        p.filterByArea(true);
        p.minArea(params.getMinArea());
        p.maxArea(params.getMaxArea());

        p.filterByCircularity(true);
        p.minCircularity(params.getMinCircularity());

        p.filterByConvexity(true);
        p.minConvexity(params.getMinConvexity());

        p.filterByInertia(true);
        p.minInertiaRatio(params.getMinInertiaRatio());
        return p;
    }
}
