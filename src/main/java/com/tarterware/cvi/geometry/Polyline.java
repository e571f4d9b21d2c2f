package com.tarterware.cvi.geometry;

import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.linearref.LengthIndexedLine;

import com.tarterware.cvi.utilities.TopologyUtilities;

/**
 * A continuous path through planar coordinates, indexed by arc length.
 *
 * <p>
 * The path is backed by a JTS {@link LineString} wrapped in a
 * {@link LengthIndexedLine}, so that positions along it can be resolved by the
 * distance travelled from its first coordinate:
 * <ul>
 * <li>{@link #getLength()} is the cumulative distance along all vertices.</li>
 * <li>{@link #pointAt(double)} linearly interpolates the coordinate at a given
 * distance, clamped to the ends of the path.</li>
 * </ul>
 * </p>
 *
 * <p>
 * Distances are in the linear unit of the coordinate frame, meters for the UTM
 * frames used by this service.
 * </p>
 *
 * @see LengthIndexedLine
 */
public class Polyline
{
    // The path geometry.
    private final LineString lineString;

    // The path geometry, indexed by length for interpolation.
    private final LengthIndexedLine lengthIndexedLine;

    /**
     * Creates a polyline through the given coordinates.
     *
     * @param coordinates Ordered coordinates; at least two are required.
     */
    public Polyline(List<Coordinate> coordinates)
    {
        if (coordinates == null || coordinates.size() < 2)
        {
            throw new IllegalArgumentException("A Polyline needs at least 2 coordinates!");
        }

        this.lineString = TopologyUtilities.getGeometryFactory()
                .createLineString(coordinates.toArray(new Coordinate[0]));
        this.lengthIndexedLine = new LengthIndexedLine(lineString);
    }

    /**
     * @return Total arc length of the path.
     */
    public double getLength()
    {
        return lengthIndexedLine.getEndIndex() - lengthIndexedLine.getStartIndex();
    }

    /**
     * Get the coordinate at the given distance along the path.
     *
     * @param meters Distance from the start of the path. Values outside
     *               {@code [0, length]} are clamped to the nearest end.
     * @return The interpolated coordinate.
     */
    public Coordinate pointAt(double meters)
    {
        double index = lengthIndexedLine.clampIndex(meters);
        return lengthIndexedLine.extractPoint(index);
    }

    public int getNumPoints()
    {
        return lineString.getNumPoints();
    }

    public Coordinate[] getCoordinates()
    {
        return lineString.getCoordinates();
    }
}
