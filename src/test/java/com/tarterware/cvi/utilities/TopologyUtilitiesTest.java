package com.tarterware.cvi.utilities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.proj4j.CoordinateTransform;

class TopologyUtilitiesTest
{
    @Test
    void testUtmZone()
    {
        assertEquals(1, TopologyUtilities.getUtmZone(-180.0));
        assertEquals(1, TopologyUtilities.getUtmZone(-177.0));
        assertEquals(30, TopologyUtilities.getUtmZone(-0.5));
        assertEquals(31, TopologyUtilities.getUtmZone(0.5));
        assertEquals(29, TopologyUtilities.getUtmZone(-9.0));
        assertEquals(60, TopologyUtilities.getUtmZone(179.9));

        assertThrows(IllegalArgumentException.class, () -> TopologyUtilities.getUtmZone(180.5));
    }

    @Test
    void testIsNewTransformerNeeded()
    {
        assertTrue(TopologyUtilities.isNewTransformerNeeded(-0.5, 0.5));
        assertFalse(TopologyUtilities.isNewTransformerNeeded(-9.0, -8.5));
    }

    @Test
    void testUtmRoundTrip()
    {
        Coordinate lisbon = new Coordinate(-9.1393, 38.7223);
        CoordinateTransform toUtm = TopologyUtilities.getWgs84ToUtmCoordinateTransformer(lisbon);
        CoordinateTransform toWgs84 = TopologyUtilities.getUtmToWgs84CoordinateTransformer(lisbon);

        Coordinate utm = TopologyUtilities.transform(toUtm, lisbon);

        // Zone 29 north: easting within the zone's false-easting band, northing in meters from the equator.
        assertTrue(utm.x > 400000.0 && utm.x < 600000.0);
        assertEquals(4286000.0, utm.y, 5000.0);

        Coordinate back = TopologyUtilities.transform(toWgs84, utm);
        assertEquals(lisbon.x, back.x, 0.000001);
        assertEquals(lisbon.y, back.y, 0.000001);
    }

    @Test
    void testTransformPositionsRejectsShortPosition()
    {
        CoordinateTransform toUtm = TopologyUtilities.getWgs84ToUtmCoordinateTransformer(38.7, -9.0);
        List<List<Double>> positions = Arrays.asList(Arrays.asList(-9.0, 38.7), Arrays.asList(-9.0));

        assertThrows(IllegalArgumentException.class, () -> TopologyUtilities.transformPositions(toUtm, positions));
    }

    @Test
    void testConvertMetersToKilometers()
    {
        assertEquals(15.0, TopologyUtilities.convertMetersToKilometers(15000.0), 0.0001);
    }
}
