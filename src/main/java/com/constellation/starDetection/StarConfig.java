package com.constellation.starDetection;

public class StarConfig {
    // Blob detection
    public static final float BLOB_MIN_AREA = 3f;
    public static final float BLOB_MAX_AREA = 300f;
    public static final float BLOB_MIN_CIRCULARITY = 0.5f;
    public static final float BLOB_MIN_CONVEXITY = 0.5f;
    public static final float BLOB_MIN_INERTIA_RATIO = 0.3f;

    // Threshold detection
    public static final double CLAHE_CLIP_LIMIT = 2.0;
    public static final int CLAHE_TILE_GRID = 8;
    public static final int ADAPTIVE_BLOCK_SIZE = 11;
    public static final double ADAPTIVE_OFFSET = -2.0;
    public static final double THRESHOLD_MIN_AREA = 5.0;

    // Độ sáng lấy trung bình trên cửa sổ 5x5 quanh tâm
    public static final int BRIGHTNESS_RADIUS = 2;

    // Gộp ứng viên
    public static final int MIN_BLOB_YIELD = 10;     // Ít hơn số này thì chạy thêm threshold
    public static final double MERGE_RADIUS = 10.0;  // px
    public static final int MAX_STARS = 200;

    private StarConfig() {
    }
}
