package com.constellation.imageOperator;

import com.constellation.starDetection.IntensityField;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Chuẩn hoá ảnh trước khi dò sao: đổi kích thước về 800x600 rồi cân bằng histogram kênh xám.
 * Trả về cả field để dò sao lẫn canvas BGR để vẽ chòm sao.
 */
public class ImageOptimizer {
    private static final Logger log = LoggerFactory.getLogger(ImageOptimizer.class);

    private final int targetWidth;
    private final int targetHeight;

    public ImageOptimizer() {
        this(ImageLoader.FALLBACK_WIDTH, ImageLoader.FALLBACK_HEIGHT);
    }

    public ImageOptimizer(int targetWidth, int targetHeight) {
        this.targetWidth = targetWidth;
        this.targetHeight = targetHeight;
    }

    @AllArgsConstructor
    @Getter
    public static class OptimizedImage {
        private final IntensityField field;
        private final Mat canvas; // BGR, cùng kích thước với field
    }

    public OptimizedImage optimize(Mat bgr) {
        if (bgr == null || bgr.empty()) {
            throw new ImageProcessingException("Cannot optimize an empty image");
        }
        Mat resized = new Mat();
        Mat gray = new Mat();
        Mat equalized = new Mat();
        try {
            resize(bgr, resized, new Size(targetWidth, targetHeight));
            if (resized.channels() == 3) {
                cvtColor(resized, gray, COLOR_BGR2GRAY);
            } else {
                resized.copyTo(gray);
            }
            equalizeHist(gray, equalized);

            Mat canvas = new Mat();
            cvtColor(equalized, canvas, COLOR_GRAY2BGR);
            log.debug("Optimized {}x{} image to {}x{}", bgr.cols(), bgr.rows(), targetWidth, targetHeight);
            return new OptimizedImage(IntensityField.fromMat(equalized), canvas);
        } finally {
            resized.release();
            gray.release();
            equalized.release();
        }
    }
}
