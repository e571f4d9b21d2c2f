package com.tarterware.cvi.utilities;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;

public class TopologyUtilities
{
    public static double METERS_PER_KILOMETER = 1000.0;

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    /**
     * Get the shared factory used to build planar JTS geometries.
     * @return A GeometryFactory with the default precision model.
     */
    static public GeometryFactory getGeometryFactory()
    {
        return GEOMETRY_FACTORY;
    }

    /**
     * Get a WGS84 coordinate system that uses geodetic coordinates (latitude, longitude, and elevation).
     * @return A WGS84 geodetic coordinate system.
     */
    static public CoordinateReferenceSystem getWgs84CoordinateSystem()
    {
        CRSFactory crsFactory = new CRSFactory();
        CoordinateReferenceSystem wgs1984;

        wgs1984 = crsFactory.createFromParameters(null, "+proj=longlat +ellps=WGS84 +datum=WGS84 +no_defs");

        return wgs1984;
    }

    /**
     * Return the UTM zone number for the given longitude.
     * @param longitude Location in degrees longitude.
     * @return UTM zone, 1 through 60.
     */
    static public int getUtmZone(double longitude)
    {
        if( Math.abs(longitude) > 180.0)
        {
            throw new IllegalArgumentException("Not a valid longitude: " + longitude);
        }

        int zone = (int) Math.ceil((longitude + 180.0) / 6.0);

        // -180 exactly lands on zone 0.
        return Math.max(zone, 1);
    }

    /**
     * Return a UTM coordinate system appropriate for the given geodetic coordinate.
     * @param latitude Location in degrees latitude.
     * @param longitude Location in degrees longitude.
     * @return A UTM coordinate system.
     */
    static public CoordinateReferenceSystem getUtmCoordinateSystem(double latitude, double longitude)
    {
        if( Math.abs(latitude) > 90.0)
        {
            throw new IllegalArgumentException("Not a valid latitude: " + latitude);
        }

        boolean zoneIsSouth = latitude < 0.0;
        int zone = getUtmZone(longitude);

        StringBuilder sb = new StringBuilder();
        sb.append("+proj=utm +zone=");
        sb.append(zone);
        if(zoneIsSouth)
        {
            sb.append(" +south");
        }
        sb.append(" +datum=WGS84 +units=m +no_defs");

        CRSFactory crsFactory = new CRSFactory();
        CoordinateReferenceSystem crs = crsFactory.createFromParameters(null, sb.toString());
        return crs;
    }

    /**
     * Determines if two longitudes fall into different UTM zones. Coastlines that
     * straddle a zone boundary are still processed in the zone of their first
     * coordinate, with growing distortion past the boundary.
     *
     * @param oldLongitude The longitude of the reference location in degrees.
     * @param newLongitude The longitude of the other location in degrees.
     * @return {@code true} if the UTM zone differs; {@code false} otherwise.
     * @throws IllegalArgumentException if either longitude is not within the range [-180, 180].
     */
    public static boolean isNewTransformerNeeded(double oldLongitude, double newLongitude)
    {
        return getUtmZone(oldLongitude) != getUtmZone(newLongitude);
    }

    /**
     * Get a coordinate transformer that converts coordinates from geodetic to UTM.
     * @param latitude Representative latitude coordinate.
     * @param longitude Representative longitude coordinate.
     * @return A Geodetic to UTM coordinate transform.
     */
    static public CoordinateTransform getWgs84ToUtmCoordinateTransformer(double latitude, double longitude)
    {
        CoordinateTransformFactory ctFactory = new CoordinateTransformFactory();
        CoordinateReferenceSystem wgsCoordSys = getWgs84CoordinateSystem();
        CoordinateReferenceSystem utmCoordinateSystem = getUtmCoordinateSystem(latitude, longitude);

        return ctFactory.createTransform(wgsCoordSys, utmCoordinateSystem);
    }

    /**
     * Get a coordinate transformer that converts coordinates from geodetic to UTM.
     * @param coord Representative coordinate, x = longitude and y = latitude.
     * @return  A Geodetic to UTM coordinate transform.
     */
    static public CoordinateTransform getWgs84ToUtmCoordinateTransformer(Coordinate coord)
    {
        return getWgs84ToUtmCoordinateTransformer(coord.getY(), coord.getX());
    }

    /**
     * Get a coordinate transformer that converts coordinates from UTM to geodetic.
     * @param latitude Representative latitude coordinate.
     * @param longitude Representative longitude coordinate.
     * @return A UTM to Geodetic coordinate transform.
     */
    static public CoordinateTransform getUtmToWgs84CoordinateTransformer(double latitude, double longitude)
    {
        CoordinateTransformFactory ctFactory = new CoordinateTransformFactory();
        CoordinateReferenceSystem wgsCoordSys = getWgs84CoordinateSystem();
        CoordinateReferenceSystem utmCoordinateSystem = getUtmCoordinateSystem(latitude, longitude);

        return ctFactory.createTransform(utmCoordinateSystem, wgsCoordSys);
    }

    /**
     * Get a coordinate transformer that converts coordinates from UTM to geodetic
     * @param coord Representative coordinate, x = longitude and y = latitude.
     * @return A UTM to Geodetic coordinate transform.
     */
    static public CoordinateTransform getUtmToWgs84CoordinateTransformer(Coordinate coord)
    {
        return getUtmToWgs84CoordinateTransformer(coord.getY(), coord.getX());
    }

    /**
     * Transform a single coordinate with the given transformer.
     * @param transform Transformer to apply.
     * @param c Source coordinate.
     * @return Transformed coordinate.
     */
    static public Coordinate transform(CoordinateTransform transform, Coordinate c)
    {
        ProjCoordinate target = new ProjCoordinate();
        transform.transform(coordToProjCoord(c), target);
        return projCoordToCoord(target);
    }

    /**
     * Transform a list of [x, y] positions, as found in GeoJSON geometries.
     * @param transform Transformer to apply.
     * @param positions Positions to transform; extra ordinates are ignored.
     * @return Transformed coordinates, in the same order.
     */
    static public List<Coordinate> transformPositions(CoordinateTransform transform, List<List<Double>> positions)
    {
        List<Coordinate> coordinates = new ArrayList<>(positions.size());
        ProjCoordinate target = new ProjCoordinate();
        for (List<Double> position : positions)
        {
            if (position == null || position.size() < 2)
            {
                throw new IllegalArgumentException("Position needs at least 2 ordinates: " + position);
            }
            transform.transform(new ProjCoordinate(position.get(0), position.get(1)), target);
            coordinates.add(new Coordinate(target.x, target.y));
        }
        return coordinates;
    }

    /**
     * Convert distance in meters to kilometers.
     * @param meters Distance in meters.
     * @return Distance in kilometers.
     */
    static public double convertMetersToKilometers(double meters)
    {
        return meters / METERS_PER_KILOMETER;
    }

    /**
     * Create a Coordinate that has the same properties as the given ProjCoordinate.
     * @param p ProjCoordinate to base new Coordinate on.
     * @return Coordinate with same location values as given ProjCoordinate.
     */
    static public Coordinate projCoordToCoord(ProjCoordinate p)
    {
        return new Coordinate(p.x, p.y, p.z);
    }

    /**
     * Create a ProjCoordinate that has the same properties as the given Coordinate.
     * @param c Coordinate to base new ProjCoordinate on.
     * @return ProjCoordinate with same location as given Coordinate.
     */
    static public ProjCoordinate coordToProjCoord(Coordinate c)
    {
        return new ProjCoordinate(c.x, c.y, c.z);
    }
}
