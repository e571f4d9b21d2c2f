package com.tarterware.cvi.utilities;

import java.util.OptionalDouble;

/**
 * A utility class for collecting the range (min and max) of a dataset of
 * scores where some values may be absent, and for min-max normalizing against
 * that range. Absent and non-finite values are counted separately and never
 * contaminate the range.
 */
public class ScoreStatistics
{
    // Number of present measurements
    private int count = 0;

    // Number of absent or non-finite measurements that were skipped
    private int absentCount = 0;

    // Minimum and maximum measurements observed
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    /**
     * Records a new measurement. NaN and infinite values are treated as absent.
     *
     * @param value the measurement
     */
    public void recordMeasurement(double value)
    {
        if (!Double.isFinite(value))
        {
            absentCount++;
            return;
        }

        count++;
        if (value < min)
        {
            min = value;
        }
        if (value > max)
        {
            max = value;
        }
    }

    /**
     * Records a measurement that may be absent.
     *
     * @param value the measurement
     */
    public void recordMeasurement(OptionalDouble value)
    {
        if (value.isPresent())
        {
            recordMeasurement(value.getAsDouble());
        }
        else
        {
            absentCount++;
        }
    }

    /**
     * Min-max normalizes a value against the recorded range. When every present
     * measurement is equal the range is degenerate and the result is 0.
     *
     * @param value the value to normalize
     * @return the normalized value, or empty if the value is absent or not
     *         finite, or nothing has been recorded
     */
    public OptionalDouble normalize(OptionalDouble value)
    {
        if (!value.isPresent() || !Double.isFinite(value.getAsDouble()) || count == 0)
        {
            return OptionalDouble.empty();
        }

        double range = max - min;
        if (range == 0.0)
        {
            return OptionalDouble.of(0.0);
        }

        return OptionalDouble.of((value.getAsDouble() - min) / range);
    }

    /**
     * Returns the minimum recorded measurement.
     *
     * @return the minimum value, or 0 if no measurements are recorded
     */
    public double getMin()
    {
        return count > 0 ? min : 0.0;
    }

    /**
     * Returns the maximum recorded measurement.
     *
     * @return the maximum value, or 0 if no measurements are recorded
     */
    public double getMax()
    {
        return count > 0 ? max : 0.0;
    }

    /**
     * Returns the number of present measurements.
     *
     * @return the number of values that contributed to the range
     */
    public int getCount()
    {
        return count;
    }

    /**
     * Returns the number of absent measurements that were skipped.
     */
    public int getAbsentCount()
    {
        return absentCount;
    }
}
