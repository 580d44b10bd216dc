package com.constellation.API;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

@AllArgsConstructor
@Getter
public class ConstellationResponse {
    @JsonProperty("constellation_name")
    private final String constellationName;
    private final String story;
    @JsonProperty("image_path")
    private final String imagePath;
    private final List<StarPoint> stars;
    @JsonProperty("constellation_lines")
    private final List<Line> constellationLines;
    // Chỉ số của đường nối được chọn trong danh sách đã vẽ, -1 nếu cụm được chọn không vẽ được
    @JsonProperty("selected_cluster")
    private final int selectedCluster;
    @JsonProperty("selected_stars")
    private final List<StarPoint> selectedStars;
    @JsonProperty("selected_lines")
    private final List<Line> selectedLines;
    private final double score;

    @AllArgsConstructor
    @Getter
    @EqualsAndHashCode
    public static class StarPoint {
        private final int x;
        private final int y;
        private final double brightness;
    }

    @AllArgsConstructor
    @Getter
    @EqualsAndHashCode
    public static class Line {
        private final int x1;
        private final int y1;
        private final int x2;
        private final int y2;
    }
}
