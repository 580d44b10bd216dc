package com.constellation.pipeline;

import java.util.Locale;

/**
 * Storyteller chạy không cần dịch vụ ngoài. Kết quả chỉ phụ thuộc vào từ khoá.
 */
public class OfflineStoryteller implements ConstellationStoryteller {

    private static final String[] SHAPES = {"irregular", "regular", "animal", "object"};
    private static final String[] PATTERNS = {"scattered", "linear", "dense"};
    private static final String[] BRIGHTNESS = {"high", "medium", "low"};

    @Override
    public String name(String keyword) {
        String k = clean(keyword);
        return "The " + Character.toUpperCase(k.charAt(0)) + k.substring(1) + " Constellation";
    }

    @Override
    public String story(String name, String keyword) {
        return "Long ago, " + name + " was placed among the stars so that every night would remember "
                + clean(keyword) + ". Travellers still look for it when they have lost their way.";
    }

    @Override
    public String describeFeatures(String name, String story) {
        int h = (name + story).hashCode() & 0x7fffffff;
        // Mỗi đặc trưng lấy từ một nhóm bit riêng của h
        int starCount = 5 + (h & 0x7);
        String shape = SHAPES[(h >>> 3) % SHAPES.length];
        String brightness = BRIGHTNESS[(h >>> 8) % BRIGHTNESS.length];
        String pattern = PATTERNS[(h >>> 16) % PATTERNS.length];
        return String.format(Locale.ROOT, "shape: %s, star_count: %d, brightness: %s, pattern: %s",
                shape, starCount, brightness, pattern);
    }

    private static String clean(String keyword) {
        if (keyword == null || keyword.isBlank()) return "night";
        return keyword.trim();
    }
}
