package com.constellation.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC3;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_COLOR;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imdecode;

/**
 * Giải mã ảnh tải lên thành Mat BGR.
 * Thứ tự thử: OpenCV imdecode -> ImageIO -> ảnh đen 800x600. Không bao giờ ném lỗi vì nội dung hỏng.
 */
public class ImageLoader {
    private static final Logger log = LoggerFactory.getLogger(ImageLoader.class);

    public static final int FALLBACK_WIDTH = 800;
    public static final int FALLBACK_HEIGHT = 600;

    public Mat load(byte[] content) {
        if (content == null || content.length < 10) {
            log.warn("Image content is empty or too small ({} bytes), using a black image",
                    content == null ? 0 : content.length);
            return blackImage();
        }

        Mat decoded = decodeWithOpenCV(content);
        if (decoded != null) return decoded;

        decoded = decodeWithImageIO(content);
        if (decoded != null) return decoded;

        log.warn("All decoders failed for {} bytes, using a black image", content.length);
        return blackImage();
    }

    private Mat decodeWithOpenCV(byte[] content) {
        Mat buf = new Mat(content);
        try {
            Mat img = imdecode(buf, IMREAD_COLOR);
            if (img != null && !img.empty()) {
                log.debug("Decoded {}x{} image with OpenCV", img.cols(), img.rows());
                return img;
            }
            log.info("OpenCV could not decode the image, trying ImageIO");
            return null;
        } finally {
            buf.release();
        }
    }

    private Mat decodeWithImageIO(byte[] content) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(content));
        } catch (IOException e) {
            log.warn("ImageIO failed to read the image: {}", e.getMessage());
            return null;
        }
        if (image == null) {
            log.info("ImageIO does not recognise the image format");
            return null;
        }
        log.debug("Decoded {}x{} image with ImageIO", image.getWidth(), image.getHeight());
        return toMat(image);
    }

    /**
     * Copy a BufferedImage into a new BGR Mat.
     */
    public static Mat toMat(BufferedImage image) {
        BufferedImage bgr = image;
        if (image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            bgr = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics2D g = bgr.createGraphics();
            try {
                g.drawImage(image, 0, 0, null);
            } finally {
                g.dispose();
            }
        }
        byte[] data = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(bgr.getHeight(), bgr.getWidth(), CV_8UC3);
        mat.data().put(data);
        return mat;
    }

    public static Mat blackImage() {
        return Mat.zeros(new Size(FALLBACK_WIDTH, FALLBACK_HEIGHT), CV_8UC3).asMat();
    }
}
