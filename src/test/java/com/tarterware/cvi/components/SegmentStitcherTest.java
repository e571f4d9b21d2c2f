package com.tarterware.cvi.components;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.tarterware.cvi.exceptions.EmptyInputException;
import com.tarterware.cvi.geometry.LineSegment;
import com.tarterware.cvi.geometry.Polyline;

class SegmentStitcherTest
{
    private SegmentStitcher segmentStitcher;

    @BeforeEach
    void setup()
    {
        segmentStitcher = new SegmentStitcher();
    }

    @Test
    void testSingleSegmentIsUnchanged()
    {
        LineSegment segment = LineSegment.of(new Coordinate(0, 0), new Coordinate(1, 1), new Coordinate(2, 0));

        Polyline polyline = segmentStitcher.stitch(Collections.singletonList(segment));

        assertArrayEquals(new Coordinate[] { new Coordinate(0, 0), new Coordinate(1, 1), new Coordinate(2, 0) },
                polyline.getCoordinates());
    }

    @Test
    void testReversedSegmentIsFlippedWithoutDuplicateJoint()
    {
        LineSegment east = LineSegment.of(new Coordinate(20, 0), new Coordinate(15, 0), new Coordinate(10, 0));
        LineSegment west = LineSegment.of(new Coordinate(0, 0), new Coordinate(5, 0), new Coordinate(10, 0));

        Polyline polyline = segmentStitcher.stitch(Arrays.asList(east, west));

        assertArrayEquals(new Coordinate[] { new Coordinate(0, 0), new Coordinate(5, 0), new Coordinate(10, 0),
                new Coordinate(15, 0), new Coordinate(20, 0) }, polyline.getCoordinates());
        assertEquals(20.0, polyline.getLength(), 0.0001);
    }

    @Test
    void testGreedyNearestNeighborOrdering()
    {
        LineSegment last = LineSegment.of(new Coordinate(2, 0), new Coordinate(3, 0));
        LineSegment middleReversed = LineSegment.of(new Coordinate(2, 0), new Coordinate(1, 0));
        LineSegment first = LineSegment.of(new Coordinate(0, 0), new Coordinate(1, 0));

        Polyline polyline = segmentStitcher.stitch(Arrays.asList(last, middleReversed, first));

        assertArrayEquals(new Coordinate[] { new Coordinate(0, 0), new Coordinate(1, 0), new Coordinate(2, 0),
                new Coordinate(3, 0) }, polyline.getCoordinates());
    }

    @Test
    void testTieGoesToFirstCandidate()
    {
        LineSegment seed = LineSegment.of(new Coordinate(-5, 0), new Coordinate(0, 0));
        LineSegment north = LineSegment.of(new Coordinate(0, 0), new Coordinate(0, 5));
        LineSegment south = LineSegment.of(new Coordinate(0, 0), new Coordinate(0, -5));

        Polyline polyline = segmentStitcher.stitch(Arrays.asList(seed, north, south));

        // Both candidates touch the seed's end; the one listed first is joined first.
        assertArrayEquals(new Coordinate[] { new Coordinate(-5, 0), new Coordinate(0, 0), new Coordinate(0, 5),
                new Coordinate(0, -5) }, polyline.getCoordinates());
    }

    @Test
    void testSeedIsWesternmostStart()
    {
        LineSegment a = LineSegment.of(new Coordinate(50, 0), new Coordinate(60, 0));
        LineSegment b = LineSegment.of(new Coordinate(-10, 3), new Coordinate(40, 0));

        Polyline polyline = segmentStitcher.stitch(Arrays.asList(a, b));

        assertEquals(new Coordinate(-10, 3), polyline.getCoordinates()[0]);
        assertEquals(new Coordinate(60, 0), polyline.getCoordinates()[polyline.getNumPoints() - 1]);
    }

    @Test
    void testZeroLengthSegment()
    {
        LineSegment seed = LineSegment.of(new Coordinate(0, 0), new Coordinate(1, 0));
        LineSegment degenerate = LineSegment.of(new Coordinate(3, 0), new Coordinate(3, 0));

        Polyline polyline = segmentStitcher.stitch(Arrays.asList(degenerate, seed));

        assertArrayEquals(new Coordinate[] { new Coordinate(0, 0), new Coordinate(1, 0), new Coordinate(3, 0) },
                polyline.getCoordinates());
    }

    @Test
    void testPointCountBounds()
    {
        List<LineSegment> segments = new ArrayList<>();
        segments.add(LineSegment.of(new Coordinate(100, 5), new Coordinate(110, 7), new Coordinate(120, 4)));
        segments.add(LineSegment.of(new Coordinate(0, 0), new Coordinate(10, 1)));
        segments.add(LineSegment.of(new Coordinate(55, 2), new Coordinate(45, 3), new Coordinate(35, 1),
                new Coordinate(25, 0)));
        segments.add(LineSegment.of(new Coordinate(60, 2), new Coordinate(80, 3)));

        int total = 0;
        int largest = 0;
        for (LineSegment segment : segments)
        {
            total += segment.size();
            largest = Math.max(largest, segment.size());
        }

        Polyline polyline = segmentStitcher.stitch(segments);

        assertTrue(polyline.getNumPoints() <= total);
        assertTrue(polyline.getNumPoints() >= largest);
        // One leading coordinate is dropped per joined segment.
        assertEquals(total - (segments.size() - 1), polyline.getNumPoints());
    }

    @Test
    void testEmptyInput()
    {
        assertThrows(EmptyInputException.class, () -> segmentStitcher.stitch(Collections.emptyList()));
        assertThrows(EmptyInputException.class, () -> segmentStitcher.stitch(null));
    }

    @Test
    void testDeterministic()
    {
        List<LineSegment> segments = Arrays.asList(LineSegment.of(new Coordinate(9, 9), new Coordinate(5, 5)),
                LineSegment.of(new Coordinate(0, 0), new Coordinate(4, 4)),
                LineSegment.of(new Coordinate(12, 12), new Coordinate(10, 10)));

        assertArrayEquals(segmentStitcher.stitch(segments).getCoordinates(),
                segmentStitcher.stitch(segments).getCoordinates());
    }
}
