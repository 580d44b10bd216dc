package com.constellation.starDetection;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StarDetectorTest {

    private final StarDetector detector = new StarDetector();

    @Test
    void detect_isRepeatable() {
        IntensityField field = SkyFixtures.threeStars();

        List<Star> first = detector.detect(field);
        List<Star> second = detector.detect(field);

        assertFalse(first.isEmpty());
        assertEquals(first, second, "Same field and params must give the same stars in the same order");
    }

    @Test
    void detect_mergesBothStrategiesWithoutDuplicates() {
        List<Star> stars = detector.detect(SkyFixtures.threeStars());

        // Blob detection under-yields (3 < 10) so threshold detection runs, but every disc
        // it finds is within the merge radius of a blob star.
        assertEquals(3, stars.size(), "Got: " + stars);
        for (int i = 1; i < stars.size(); i++) {
            assertTrue(stars.get(i - 1).brightness >= stars.get(i).brightness);
        }
    }

    @Test
    void blackSky_substitutesDefaultPattern() {
        IntensityField black = IntensityField.fromArray(SkyFixtures.blank(160, 120));

        assertTrue(detector.detect(black).isEmpty());
        assertEquals(DefaultPattern.STARS, detector.detectOrDefault(black, DetectionParams.defaults()));
    }

    @Test
    void absentField_isHardError() {
        assertThrows(InvalidFieldException.class, () -> detector.detect(null));
    }
}
