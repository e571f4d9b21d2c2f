package com.tarterware.cvi.models;

import java.util.OptionalInt;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Result of classifying a value against a {@link ThresholdTable}. Values that
 * are absent or fall outside every bin classify as {@link #NO_DATA}.
 */
@ToString
@EqualsAndHashCode
public final class Classification
{
    public static final String NO_DATA_LABEL = "No Data";

    public static final String NO_DATA_COLOR = "gray";

    public static final Classification NO_DATA = new Classification(null, NO_DATA_LABEL, NO_DATA_COLOR);

    // Null for no data.
    private final Integer rank;

    private final String label;

    private final String color;

    private Classification(Integer rank, String label, String color)
    {
        this.rank = rank;
        this.label = label;
        this.color = color;
    }

    public static Classification of(int rank, String label, String color)
    {
        return new Classification(rank, label, color);
    }

    public OptionalInt getRank()
    {
        return rank == null ? OptionalInt.empty() : OptionalInt.of(rank);
    }

    public String getLabel()
    {
        return label;
    }

    public String getColor()
    {
        return color;
    }

    public boolean isNoData()
    {
        return rank == null;
    }
}
