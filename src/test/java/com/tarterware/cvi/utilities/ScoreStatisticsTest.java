package com.tarterware.cvi.utilities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.OptionalDouble;

import org.junit.jupiter.api.Test;

class ScoreStatisticsTest
{

    @Test
    void testInitialState()
    {
        // When no measurement has been recorded, statistics should be zero (or default)
        ScoreStatistics statistics = new ScoreStatistics();
        assertEquals(0, statistics.getCount());
        assertEquals(0, statistics.getAbsentCount());
        assertEquals(0.0, statistics.getMin(), 0.0001);
        assertEquals(0.0, statistics.getMax(), 0.0001);
    }

    @Test
    void testMultipleMeasurements()
    {
        ScoreStatistics statistics = new ScoreStatistics();
        statistics.recordMeasurement(20.0);
        statistics.recordMeasurement(10.0);
        statistics.recordMeasurement(30.0);
        assertEquals(3, statistics.getCount());
        assertEquals(10.0, statistics.getMin(), 0.0001);
        assertEquals(30.0, statistics.getMax(), 0.0001);
    }

    @Test
    void testAbsentAndNaNAreSkipped()
    {
        ScoreStatistics statistics = new ScoreStatistics();
        statistics.recordMeasurement(2.0);
        statistics.recordMeasurement(Double.NaN);
        statistics.recordMeasurement(OptionalDouble.empty());
        statistics.recordMeasurement(OptionalDouble.of(4.0));

        assertEquals(2, statistics.getCount());
        assertEquals(2, statistics.getAbsentCount());
        assertEquals(2.0, statistics.getMin(), 0.0001);
        assertEquals(4.0, statistics.getMax(), 0.0001);
    }

    @Test
    void testInfiniteValuesAreSkipped()
    {
        ScoreStatistics statistics = new ScoreStatistics();
        statistics.recordMeasurement(1.0);
        statistics.recordMeasurement(Double.POSITIVE_INFINITY);
        statistics.recordMeasurement(OptionalDouble.of(Double.NEGATIVE_INFINITY));
        statistics.recordMeasurement(3.0);

        assertEquals(2, statistics.getCount());
        assertEquals(2, statistics.getAbsentCount());
        assertEquals(1.0, statistics.getMin(), 0.0001);
        assertEquals(3.0, statistics.getMax(), 0.0001);
        assertFalse(statistics.normalize(OptionalDouble.of(Double.POSITIVE_INFINITY)).isPresent());
    }

    @Test
    void testNormalize()
    {
        ScoreStatistics statistics = new ScoreStatistics();
        statistics.recordMeasurement(1.0);
        statistics.recordMeasurement(3.0);
        statistics.recordMeasurement(2.0);

        assertEquals(0.0, statistics.normalize(OptionalDouble.of(1.0)).getAsDouble(), 0.0001);
        assertEquals(0.5, statistics.normalize(OptionalDouble.of(2.0)).getAsDouble(), 0.0001);
        assertEquals(1.0, statistics.normalize(OptionalDouble.of(3.0)).getAsDouble(), 0.0001);
        assertFalse(statistics.normalize(OptionalDouble.empty()).isPresent());
    }

    @Test
    void testNormalizeDegenerateRange()
    {
        ScoreStatistics statistics = new ScoreStatistics();
        statistics.recordMeasurement(2.5);
        statistics.recordMeasurement(2.5);

        assertEquals(0.0, statistics.normalize(OptionalDouble.of(2.5)).getAsDouble(), 0.0);
    }

    @Test
    void testNormalizeWithNothingRecorded()
    {
        ScoreStatistics statistics = new ScoreStatistics();
        statistics.recordMeasurement(OptionalDouble.empty());

        assertFalse(statistics.normalize(OptionalDouble.of(1.0)).isPresent());
    }
}
