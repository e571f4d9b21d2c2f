package com.tarterware.cvi.geometry;

import org.locationtech.jts.geom.Coordinate;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A short cross-shore line sampled perpendicular to the coastline.
 *
 * <p>
 * The {@code label} is the only key used to join externally computed scores
 * back onto the transect, and is unique for the lifetime of one pipeline run.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public class Transect
{
    // Join key, e.g. "T1".
    private final String label;

    // Zero-based creation order.
    private final int index;

    // Distance along the sampled coastline where the transect is centered.
    private final double metersOffset;

    // Landward/seaward endpoints.
    private final Coordinate start;
    private final Coordinate end;

    public Transect(String label, int index, double metersOffset, Coordinate start, Coordinate end)
    {
        if (label == null || label.isBlank())
        {
            throw new IllegalArgumentException("Transect label cannot be blank!");
        }
        this.label = label;
        this.index = index;
        this.metersOffset = metersOffset;
        this.start = new Coordinate(start.x, start.y);
        this.end = new Coordinate(end.x, end.y);
    }

    public double getLength()
    {
        return start.distance(end);
    }

    public Coordinate getCenter()
    {
        return new Coordinate((start.x + end.x) / 2.0, (start.y + end.y) / 2.0);
    }
}
