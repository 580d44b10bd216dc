package com.constellation.path;

import com.constellation.clustering.Cluster;
import com.constellation.starDetection.Star;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PathBuilderTest {

    private final PathBuilder builder = new PathBuilder();

    private static Star at(int x, int y) {
        return new Star(x, y, 200, 5);
    }

    private static Cluster cluster(Star... stars) {
        return new Cluster(List.of(stars), Cluster.Origin.GROWN);
    }

    @Test
    void shuffledCollinearPoints_areConnectedInOrder() {
        Cluster c = cluster(at(0, 0), at(40, 0), at(10, 0), at(30, 0), at(20, 0));

        ConstellationPath path = builder.buildPath(c);

        assertEquals(List.of(at(0, 0), at(10, 0), at(20, 0), at(30, 0), at(40, 0)), path.getStars());
        assertEquals(4, path.segments().size());
        assertEquals(40.0, path.totalLength(), 1e-9);
        assertTrue(path.totalLength() <= ConstellationPath.totalLength(c.getStars()));
    }

    @Test
    void path_startsAtFirstClusterMember() {
        Cluster c = cluster(at(20, 0), at(0, 0), at(40, 0));

        ConstellationPath path = builder.buildPath(c);

        assertEquals(at(20, 0), path.getStars().get(0));
        // Hoà khoảng cách: điểm đứng trước trong cụm thắng
        assertEquals(List.of(at(20, 0), at(0, 0), at(40, 0)), path.getStars());
    }

    @Test
    void segments_joinConsecutivePoints() {
        ConstellationPath path = builder.buildPath(cluster(at(0, 0), at(3, 4), at(3, 10)));

        List<ConstellationPath.Segment> segments = path.segments();
        assertEquals(2, segments.size());
        assertEquals(at(0, 0), segments.get(0).getFrom());
        assertEquals(at(3, 4), segments.get(0).getTo());
        assertEquals(5.0, segments.get(0).length(), 1e-9);
        assertEquals(6.0, segments.get(1).length(), 1e-9);
    }

    @Test
    void duplicatePositions_areVisitedOnce() {
        Star brighter = new Star(10, 10, 250, 5);
        Star copy = new Star(10, 10, 120, 7);
        Cluster c = cluster(at(0, 0), brighter, copy, at(20, 20));

        ConstellationPath path = builder.buildPath(c);

        assertEquals(3, path.getStars().size());
        assertTrue(path.getStars().contains(brighter));
        assertFalse(path.getStars().contains(copy));
    }

    @Test
    void tooFewDistinctPoints_areNotRenderable() {
        Cluster pair = cluster(at(0, 0), at(5, 5));
        Cluster pairWithDuplicate = cluster(at(0, 0), at(5, 5), at(5, 5));

        assertFalse(PathBuilder.isRenderable(pair));
        assertFalse(PathBuilder.isRenderable(pairWithDuplicate));
        assertTrue(PathBuilder.isRenderable(cluster(at(0, 0), at(5, 5), at(9, 9))));
        assertThrows(IllegalArgumentException.class, () -> builder.buildPath(pair));
        assertThrows(IllegalArgumentException.class, () -> builder.buildPath(pairWithDuplicate));
    }

    @Test
    void buildPath_doesNotChangeCluster() {
        Cluster c = cluster(at(0, 0), at(40, 0), at(10, 0));
        List<Star> before = List.copyOf(c.getStars());

        builder.buildPath(c);

        assertEquals(before, c.getStars());
    }
}
