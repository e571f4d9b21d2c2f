package com.tarterware.cvi.geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * An immutable, ordered run of at least two planar coordinates, as delivered by
 * the coastline source. Segments arrive unordered and in arbitrary orientation;
 * {@link com.tarterware.cvi.components.SegmentStitcher} puts them in order.
 */
@ToString
@EqualsAndHashCode
public final class LineSegment
{
    private final List<Coordinate> coordinates;

    /**
     * Creates a segment from the given coordinates. The coordinates are copied.
     *
     * @param coordinates Ordered coordinates; at least two are required.
     * @throws IllegalArgumentException if fewer than two coordinates are given.
     */
    public LineSegment(List<Coordinate> coordinates)
    {
        if (coordinates == null || coordinates.size() < 2)
        {
            throw new IllegalArgumentException("A LineSegment needs at least 2 coordinates!");
        }

        List<Coordinate> copy = new ArrayList<>(coordinates.size());
        for (Coordinate c : coordinates)
        {
            copy.add(new Coordinate(c.x, c.y));
        }
        this.coordinates = Collections.unmodifiableList(copy);
    }

    public static LineSegment of(Coordinate... coordinates)
    {
        return new LineSegment(Arrays.asList(coordinates));
    }

    public List<Coordinate> getCoordinates()
    {
        return coordinates;
    }

    public Coordinate getFirst()
    {
        return coordinates.get(0);
    }

    public Coordinate getLast()
    {
        return coordinates.get(coordinates.size() - 1);
    }

    public int size()
    {
        return coordinates.size();
    }

    /**
     * @return a new segment with the coordinates in the opposite order.
     */
    public LineSegment reversed()
    {
        List<Coordinate> reversed = new ArrayList<>(coordinates);
        Collections.reverse(reversed);
        return new LineSegment(reversed);
    }
}
