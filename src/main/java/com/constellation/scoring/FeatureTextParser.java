package com.constellation.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Đọc đặc trưng chòm sao từ văn bản tự do (câu trả lời của dịch vụ sinh văn bản).
 * Thiếu thông tin nào thì giữ giá trị của {@link FeatureDescriptor#defaults()}.
 */
public class FeatureTextParser {
    private static final Logger log = LoggerFactory.getLogger(FeatureTextParser.class);

    private static final Pattern NUMBER = Pattern.compile("\\d+");
    static final int MIN_PLAUSIBLE_COUNT = 3;
    static final int MAX_PLAUSIBLE_COUNT = 20;

    public FeatureDescriptor parse(String text) {
        FeatureDescriptor defaults = FeatureDescriptor.defaults();
        if (text == null || text.isBlank()) {
            log.warn("Empty feature text, using default features");
            return defaults;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        FeatureDescriptor.Shape shape = defaults.getShape();
        if (lower.contains("irregular")) {
            shape = FeatureDescriptor.Shape.IRREGULAR;
        } else if (lower.contains("regular")) {
            shape = FeatureDescriptor.Shape.REGULAR;
        } else if (lower.contains("animal")) {
            shape = FeatureDescriptor.Shape.ANIMAL;
        } else if (lower.contains("object")) {
            shape = FeatureDescriptor.Shape.OBJECT;
        }

        FeatureDescriptor.Pattern pattern = defaults.getPattern();
        if (lower.contains("linear")) {
            pattern = FeatureDescriptor.Pattern.LINEAR;
        } else if (lower.contains("dense")) {
            pattern = FeatureDescriptor.Pattern.DENSE;
        }

        FeatureDescriptor.Brightness brightness = defaults.getBrightness();
        if (lower.contains("低い") || lower.contains("low")) {
            brightness = FeatureDescriptor.Brightness.LOW;
        } else if (lower.contains("中程度") || lower.contains("medium")) {
            brightness = FeatureDescriptor.Brightness.MEDIUM;
        }

        int starCount = defaults.getStarCount();
        Matcher m = NUMBER.matcher(lower);
        while (m.find()) {
            int value;
            try {
                value = Integer.parseInt(m.group());
            } catch (NumberFormatException e) {
                continue; // Số quá dài, không phải số sao
            }
            if (value >= MIN_PLAUSIBLE_COUNT && value <= MAX_PLAUSIBLE_COUNT) {
                starCount = value;
                break;
            }
        }

        FeatureDescriptor features = new FeatureDescriptor(shape, starCount, brightness, pattern);
        log.debug("Parsed features {}", features);
        return features;
    }
}
