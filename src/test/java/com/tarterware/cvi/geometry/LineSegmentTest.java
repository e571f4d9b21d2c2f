package com.tarterware.cvi.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

class LineSegmentTest
{
    @Test
    void testReversed()
    {
        LineSegment segment = LineSegment.of(new Coordinate(0, 0), new Coordinate(1, 0), new Coordinate(2, 5));
        LineSegment reversed = segment.reversed();

        assertEquals(new Coordinate(2, 5), reversed.getFirst());
        assertEquals(new Coordinate(0, 0), reversed.getLast());
        assertEquals(3, reversed.size());

        // The original is untouched.
        assertEquals(new Coordinate(0, 0), segment.getFirst());
    }

    @Test
    void testCoordinatesAreCopied()
    {
        List<Coordinate> source = new ArrayList<>(Arrays.asList(new Coordinate(0, 0), new Coordinate(1, 1)));
        LineSegment segment = new LineSegment(source);

        source.get(0).x = 99.0;
        source.add(new Coordinate(2, 2));

        assertEquals(0.0, segment.getFirst().x, 0.0);
        assertEquals(2, segment.size());
        assertThrows(UnsupportedOperationException.class, () -> segment.getCoordinates().add(new Coordinate()));
    }

    @Test
    void testTooFewCoordinates()
    {
        assertThrows(IllegalArgumentException.class, () -> LineSegment.of(new Coordinate(0, 0)));
        assertThrows(IllegalArgumentException.class, () -> new LineSegment(null));
    }
}
