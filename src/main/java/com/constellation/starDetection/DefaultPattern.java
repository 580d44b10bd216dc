package com.constellation.starDetection;

import java.util.List;

/**
 * Mẫu 5 sao cố định dùng khi ảnh không có ngôi sao nào.
 * Toạ độ nằm giữa khung 800x600; độ sáng giảm dần theo thứ tự trong danh sách.
 */
public final class DefaultPattern {

    public static final List<Star> STARS = List.of(
            new Star(360, 260, 255.0, 12.0),
            new Star(400, 280, 230.0, 10.0),
            new Star(440, 260, 210.0, 10.0),
            new Star(420, 310, 190.0, 8.0),
            new Star(380, 310, 170.0, 8.0)
    );

    private DefaultPattern() {
    }
}
