package com.constellation.API;

import com.constellation.imageOperator.ImageProcessingException;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;

@Service
public class ImageStorageService {
	private static final Logger log = LoggerFactory.getLogger(ImageStorageService.class);

	// Thư mục lưu ảnh chòm sao đã vẽ
	private final Path outputPath;

	public ImageStorageService(@Value("${constellation.storage.output:constellations}") String output) {
		this.outputPath = Paths.get(output);
	}

	/**
	 * Ghi ảnh chòm sao ra thư mục output, trả về tên file
	 */
	public String saveResult(Mat image) {
		try {
			Files.createDirectories(outputPath);
		} catch (IOException e) {
			throw new ImageProcessingException("Cannot create output directory " + outputPath, e);
		}
		String filename = UUID.randomUUID() + "_constellation.jpg";
		Path target = outputPath.resolve(filename);
		if (!imwrite(target.toString(), image)) {
			throw new ImageProcessingException("Cannot write constellation image " + target);
		}
		log.info("Saved constellation image {}", target);
		return filename;
	}

	/**
	 * Kiểm tra xem file upload có phải ảnh không
	 */
	public boolean isValidImageFile(MultipartFile file) {
		if (file == null || file.isEmpty()) return false;

		String contentType = file.getContentType();
		if (contentType == null || !contentType.startsWith("image/")) {
			return false;
		}

		String originalFilename = file.getOriginalFilename();
		return originalFilename != null &&
				originalFilename.matches("(?i).+\\.(jpg|jpeg|png|gif|bmp|webp|avif|heic|tif|tiff)$");
	}

	public Path getOutputPath() {
		return outputPath;
	}
}
