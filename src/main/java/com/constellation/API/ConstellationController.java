package com.constellation.API;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ConstellationController {
    private static final Logger log = LoggerFactory.getLogger(ConstellationController.class);

    private final ConstellationService constellationService;
    private final ImageStorageService imageStorageService;

    public ConstellationController(ConstellationService constellationService, ImageStorageService imageStorageService) {
        this.constellationService = constellationService;
        this.imageStorageService = imageStorageService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        Map<String, String> status = new HashMap<>();
        status.put("status", "healthy");
        return status;
    }

    @PostMapping(value = "/generate-constellation", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> generateConstellation(
            @RequestParam("image") MultipartFile image,
            @RequestParam("keyword") String keyword) {
        try {
            if (keyword == null || keyword.isBlank()) {
                return error(ResponseEntity.badRequest(), "Please enter a keyword.");
            }

            // Kiểm tra file có phải là ảnh hợp lệ
            if (!imageStorageService.isValidImageFile(image)) {
                return error(ResponseEntity.badRequest(), "Invalid image file: " + image.getOriginalFilename());
            }

            // Xử lý trực tiếp từ bộ nhớ, không ghi file upload ra đĩa
            ConstellationResponse response = constellationService.generate(image.getBytes(), keyword.trim());
            return ResponseEntity.ok().body(response);

        } catch (Exception e) {
            log.error("Constellation generation failed", e);
            return error(ResponseEntity.internalServerError(), "Error: " + e.getMessage());
        }
    }

    private static ResponseEntity<Map<String, String>> error(ResponseEntity.BodyBuilder builder, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        return builder.body(error);
    }
}
