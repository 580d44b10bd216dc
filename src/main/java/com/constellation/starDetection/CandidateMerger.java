package com.constellation.starDetection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Gộp kết quả của {@link BlobDetector} và {@link ThresholdDetector} thành một danh sách sao.
 *
 * <p>Blob chạy trước. Nếu ra ít hơn {@link StarConfig#MIN_BLOB_YIELD} sao thì chạy thêm threshold
 * và chỉ nhận những ứng viên không có sao nào trong bán kính {@link StarConfig#MERGE_RADIUS}.
 * Kết quả sắp theo độ sáng giảm dần và cắt ở {@link StarConfig#MAX_STARS}.
 *
 * <p>Danh sách rỗng được trả nguyên cho nơi gọi; nơi gọi tự thay bằng mẫu mặc định.
 */
public class CandidateMerger {
    private static final Logger log = LoggerFactory.getLogger(CandidateMerger.class);

    public static final Comparator<Star> BRIGHTEST_FIRST =
            Comparator.comparingDouble((Star s) -> s.brightness).reversed();

    private final BlobDetector blobDetector;
    private final ThresholdDetector thresholdDetector;

    public CandidateMerger(BlobDetector blobDetector, ThresholdDetector thresholdDetector) {
        this.blobDetector = blobDetector;
        this.thresholdDetector = thresholdDetector;
    }

    public List<Star> detect(IntensityField field) {
        if (field == null) throw new InvalidFieldException("Intensity field is absent");

        List<Star> stars = new ArrayList<>(blobDetector.detect(field));
        if (stars.size() < StarConfig.MIN_BLOB_YIELD) {
            List<Star> extra = thresholdDetector.detect(field);
            int before = stars.size();
            merge(stars, extra, StarConfig.MERGE_RADIUS);
            log.debug("Blob detection under-yielded ({}), threshold detection added {} of {} candidates",
                    before, stars.size() - before, extra.size());
        }
        return rankAndCap(stars, StarConfig.MAX_STARS);
    }

    /**
     * Appends every candidate that has no star within {@code radius} of it, checked against
     * the stars already in {@code target} including those appended earlier in this call.
     */
    static void merge(List<Star> target, List<Star> candidates, double radius) {
        for (Star candidate : candidates) {
            boolean represented = false;
            for (Star existing : target) {
                if (existing.distanceTo(candidate) <= radius) {
                    represented = true;
                    break;
                }
            }
            if (!represented) target.add(candidate);
        }
    }

    // Sắp xếp ổn định: cùng độ sáng thì giữ thứ tự phát hiện
    static List<Star> rankAndCap(List<Star> stars, int cap) {
        List<Star> ranked = new ArrayList<>(stars);
        ranked.sort(BRIGHTEST_FIRST);
        if (ranked.size() > cap) {
            log.debug("Dropping {} dimmest stars beyond cap {}", ranked.size() - cap, cap);
            ranked = new ArrayList<>(ranked.subList(0, cap));
        }
        return ranked;
    }
}
