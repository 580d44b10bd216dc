package com.constellation.starDetection;

import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2GRAY;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;

/**
 * Ma trận cường độ xám (0-255), lưu theo hàng (row-major).
 * Bản sao bất biến: mọi bộ phát hiện đọc từ đây, không ai ghi vào.
 */
public class IntensityField {
    private final int width;
    private final int height;
    private final byte[] pixels;

    public IntensityField(int width, int height, byte[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new InvalidFieldException("Intensity field has no pixels: " + width + "x" + height);
        }
        if (pixels == null || pixels.length != width * height) {
            throw new InvalidFieldException("Pixel buffer does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels.clone();
    }

    /**
     * Build a field from {@code values[y][x]}; values are clamped to 0-255.
     */
    public static IntensityField fromArray(int[][] values) {
        if (values == null || values.length == 0 || values[0].length == 0) {
            throw new InvalidFieldException("Intensity field has no pixels");
        }
        int h = values.length;
        int w = values[0].length;
        byte[] buf = new byte[w * h];
        for (int y = 0; y < h; y++) {
            if (values[y].length != w) {
                throw new InvalidFieldException("Ragged intensity rows at y=" + y);
            }
            for (int x = 0; x < w; x++) {
                int v = Math.max(0, Math.min(255, values[y][x]));
                buf[y * w + x] = (byte) v;
            }
        }
        return new IntensityField(w, h, buf);
    }

    /**
     * Copy an 8-bit OpenCV image into a field. BGR images are converted to gray first.
     */
    public static IntensityField fromMat(Mat src) {
        if (src == null || src.empty()) {
            throw new InvalidFieldException("Intensity field is empty");
        }
        Mat gray = src;
        boolean converted = false;
        if (src.channels() == 3) {
            gray = new Mat();
            cvtColor(src, gray, COLOR_BGR2GRAY);
            converted = true;
        }
        if (gray.type() != CV_8UC1) {
            throw new InvalidFieldException("Expected an 8-bit single channel image, got type " + gray.type());
        }
        Mat continuous = gray.isContinuous() ? gray : gray.clone();
        byte[] buf = new byte[continuous.cols() * continuous.rows()];
        continuous.data().get(buf);
        IntensityField field = new IntensityField(continuous.cols(), continuous.rows(), buf);
        if (continuous != gray) continuous.release();
        if (converted) gray.release();
        return field;
    }

    /**
     * New CV_8UC1 Mat holding a copy of the pixels. Caller releases it.
     */
    public Mat toMat() {
        Mat mat = new Mat(height, width, CV_8UC1);
        mat.data().put(pixels);
        return mat;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int at(int x, int y) {
        return pixels[y * width + x] & 0xFF;
    }

    /**
     * Mean intensity of the (2r+1)x(2r+1) window centred on (cx, cy), clamped to the image.
     */
    public double meanAround(int cx, int cy, int radius) {
        int x0 = Math.max(0, cx - radius), x1 = Math.min(width - 1, cx + radius);
        int y0 = Math.max(0, cy - radius), y1 = Math.min(height - 1, cy + radius);
        if (x0 > x1 || y0 > y1) return 0;

        long sum = 0;
        int count = 0;
        for (int y = y0; y <= y1; y++) {
            for (int x = x0; x <= x1; x++) {
                sum += at(x, y);
                count++;
            }
        }
        return (double) sum / count;
    }
}
