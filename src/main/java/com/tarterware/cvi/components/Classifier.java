package com.tarterware.cvi.components;

import java.util.OptionalDouble;

import com.tarterware.cvi.models.Classification;
import com.tarterware.cvi.models.ThresholdBin;
import com.tarterware.cvi.models.ThresholdTable;

/**
 * Maps values to {@link Classification}s using a {@link ThresholdTable}.
 *
 * <p>
 * Three matching modes are supported:
 * <ul>
 * <li>{@link #classify(OptionalDouble, ThresholdTable)}: interval containment,
 * {@code min <= value < max}, for continuous measurements such as slope or
 * elevation.</li>
 * <li>{@link #classifyExact(OptionalDouble, ThresholdTable)}: equality with a
 * bin's rank, for values that are already discrete ranks.</li>
 * <li>{@link #classifyCode(Integer, ThresholdTable)}: membership in a bin's
 * category codes, for categorical rasters such as land cover.</li>
 * </ul>
 * Bins are scanned in table order and the first match wins. Absent values, NaN
 * and values matching no bin classify as {@link Classification#NO_DATA}; a miss
 * is never an error.
 * </p>
 */
public final class Classifier
{
    private Classifier()
    {
    }

    public static Classification classify(OptionalDouble value, ThresholdTable table)
    {
        if (!value.isPresent())
        {
            return Classification.NO_DATA;
        }
        return classify(value.getAsDouble(), table);
    }

    public static Classification classify(double value, ThresholdTable table)
    {
        if (Double.isNaN(value))
        {
            return Classification.NO_DATA;
        }

        for (ThresholdBin bin : table.getBins())
        {
            if (bin.contains(value))
            {
                return bin.toClassification();
            }
        }

        return Classification.NO_DATA;
    }

    public static Classification classifyExact(OptionalDouble value, ThresholdTable table)
    {
        if (!value.isPresent() || Double.isNaN(value.getAsDouble()))
        {
            return Classification.NO_DATA;
        }

        double v = value.getAsDouble();
        for (ThresholdBin bin : table.getBins())
        {
            if (v == bin.getRank())
            {
                return bin.toClassification();
            }
        }

        return Classification.NO_DATA;
    }

    /**
     * Classify a raw measurement in whichever mode the table is built for: a
     * table with a rescale map converts the value and matches the result
     * exactly, a table with category codes matches the value as a code, and any
     * other table matches by interval.
     *
     * @param value Raw measurement from an external source.
     * @param table Threshold table of the measurement's dimension.
     * @return The classification; its rank is the dimension score.
     */
    public static Classification classifyRaw(OptionalDouble value, ThresholdTable table)
    {
        if (!table.getRescale().isEmpty())
        {
            return classifyExact(table.rescale(value), table);
        }

        boolean categorical = table.getBins().stream().anyMatch(bin -> !bin.getCodes().isEmpty());
        if (categorical)
        {
            if (!value.isPresent() || value.getAsDouble() != Math.rint(value.getAsDouble()))
            {
                return Classification.NO_DATA;
            }
            return classifyCode((int) value.getAsDouble(), table);
        }

        return classify(value, table);
    }

    public static Classification classifyCode(Integer code, ThresholdTable table)
    {
        if (code == null)
        {
            return Classification.NO_DATA;
        }

        for (ThresholdBin bin : table.getBins())
        {
            if (bin.getCodes().contains(code))
            {
                return bin.toClassification();
            }
        }

        return Classification.NO_DATA;
    }
}
