package com.tarterware.cvi.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.tarterware.cvi.geometry.Transect;

class TransectSetTest
{
    private static Transect transect(String label, int index)
    {
        return new Transect(label, index, index * 50.0, new Coordinate(index * 50.0, -200.0),
                new Coordinate(index * 50.0, 200.0));
    }

    @Test
    void testAttachScoresIgnoresUnknownLabels()
    {
        TransectSet transectSet = new TransectSet(Arrays.asList(transect("T1", 0), transect("T2", 1)));

        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("T1", 4.0);
        scores.put("T9", 5.0);

        assertEquals(1, transectSet.attachScores("slope", scores));
        assertEquals(2, transectSet.size());
        assertFalse(transectSet.contains("T9"));
        assertEquals(4.0, transectSet.getScoreRecord("T1").getScore("slope").getAsDouble(), 0.0);
        assertFalse(transectSet.getScoreRecord("T2").getScore("slope").isPresent());
    }

    @Test
    void testNullAndNaNScoresAreAbsent()
    {
        TransectSet transectSet = new TransectSet(Arrays.asList(transect("T1", 0), transect("T2", 1)));

        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("T1", Double.NaN);
        scores.put("T2", null);
        transectSet.attachScores("elevation", scores);

        assertFalse(transectSet.getScoreRecord("T1").getScore("elevation").isPresent());
        assertFalse(transectSet.getScoreRecord("T2").getScore("elevation").isPresent());
        assertTrue(transectSet.getScoreRecord("T1").getScores().isEmpty());
    }

    @Test
    void testLaterAttachmentReplacesScore()
    {
        TransectSet transectSet = new TransectSet(Arrays.asList(transect("T1", 0)));

        transectSet.attachScores("erosion", Map.of("T1", 1.0));
        transectSet.attachScores("erosion", Map.of("T1", 5.0));

        assertEquals(5.0, transectSet.getScoreRecord("T1").getScore("erosion").getAsDouble(), 0.0);
    }

    @Test
    void testDuplicateLabel()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new TransectSet(Arrays.asList(transect("T1", 0), transect("T1", 1))));
    }

    @Test
    void testOrderIsPreserved()
    {
        TransectSet transectSet = new TransectSet(
                Arrays.asList(transect("T3", 2), transect("T1", 0), transect("T2", 1)));

        assertEquals("T3", transectSet.getTransects().get(0).getLabel());
        assertEquals("T2", transectSet.getScoreRecords().get(2).getLabel());
        assertEquals(50.0, transectSet.getTransect("T2").getMetersOffset(), 0.0);
    }
}
